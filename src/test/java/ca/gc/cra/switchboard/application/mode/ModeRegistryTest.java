package ca.gc.cra.switchboard.application.mode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ModeRegistryTest {

  @Test
  void childWiringEntryReplacesInheritedListOutright() {
    ModeRegistry registry = new ModeRegistry();
    registry.define(ModeDefinition.named("base")
        .nodes("Dispenser", "Scoreboard", "Ticker")
        .wire("Dispenser", "Scoreboard", "Ticker")
        .wire("Scoreboard", "Ticker")
        .build());
    registry.define(ModeDefinition.named("tutorial").base("base")
        .wire("Dispenser", "Ticker")
        .build());

    Map<String, List<String>> wiring = registry.resolveWiring("tutorial");

    assertEquals(List.of("Ticker"), wiring.get("Dispenser"));
    assertEquals(List.of("Ticker"), wiring.get("Scoreboard"));
    assertEquals(List.of("Scoreboard", "Ticker"), registry.resolveWiring("base").get("Dispenser"));
  }

  @Test
  void emptyTargetListSilencesInheritedSource() {
    ModeRegistry registry = new ModeRegistry();
    registry.define(ModeDefinition.named("base").wire("Dropper", "Counter").build());
    registry.define(ModeDefinition.named("paused").base("base").wire("Dropper").build());

    assertEquals(List.of(), registry.resolveWiring("paused").get("Dropper"));
  }

  @Test
  void lineageAndNodesFollowBaseChain() {
    ModeRegistry registry = new ModeRegistry();
    registry.define(ModeDefinition.named("base").nodes("A", "B").build());
    registry.define(ModeDefinition.named("play").base("base").nodes("C").build());
    registry.define(ModeDefinition.named("boss").base("play").nodes("A", "D").build());

    assertEquals(List.of("boss", "play", "base"), registry.lineage("boss"));
    assertEquals(Set.of("A", "B", "C", "D"), registry.resolveNodes("boss"));
    assertEquals(List.of("base", "play", "boss"), registry.modeNames());
  }

  @Test
  void unknownModeAndUnknownBaseAreRejected() {
    ModeRegistry registry = new ModeRegistry();
    registry.define(ModeDefinition.named("orphan").base("missing").build());

    UnknownModeException unknown = assertThrows(UnknownModeException.class, () -> registry.resolveWiring("nope"));
    assertEquals("nope", unknown.mode());
    UnknownModeException base = assertThrows(UnknownModeException.class, () -> registry.lineage("orphan"));
    assertEquals("missing", base.mode());
  }

  @Test
  void baseCycleIsAConfigurationError() {
    ModeRegistry registry = new ModeRegistry();
    registry.define(ModeDefinition.named("a").base("b").build());
    registry.define(ModeDefinition.named("b").base("a").build());

    ModeConfigurationException ex = assertThrows(ModeConfigurationException.class, () -> registry.lineage("a"));
    assertTrue(ex.getMessage().contains("a"));
  }

  @Test
  void redefiningModeReplacesIt() {
    ModeRegistry registry = new ModeRegistry();
    registry.define(ModeDefinition.named("base").wire("A", "B").build());
    registry.define(ModeDefinition.named("base").wire("A", "C").build());

    assertEquals(List.of("C"), registry.resolveWiring("base").get("A"));
    assertTrue(registry.isDefined("base"));
  }
}
