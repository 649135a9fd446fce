package ca.gc.cra.switchboard.application.bus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.switchboard.application.mode.ModeConfigurationException;
import ca.gc.cra.switchboard.application.mode.ModeDefinition;
import ca.gc.cra.switchboard.application.mode.UnknownModeException;
import ca.gc.cra.switchboard.application.node.HandlerNotFoundException;
import ca.gc.cra.switchboard.application.node.NodeClass;
import ca.gc.cra.switchboard.application.node.SignalHandler;
import ca.gc.cra.switchboard.domain.node.Channel;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ModeSwitcherTest {
  private SignalBus bus;
  private List<String> log;

  @BeforeEach
  void setUp() {
    bus = SignalBus.builder().build();
    log = new ArrayList<>();
  }

  @AfterEach
  void tearDown() {
    bus.close();
  }

  @Test
  void switchAppliesAttributeOverridesOfTargetMode() {
    bus.register(NodeClass.define("Mixer").build());
    bus.register(NodeClass.define("Monitor").build());
    bus.defineMode(ModeDefinition.named("base")
        .attribute("Mixer", "gain", 1)
        .attribute("Monitor", "muted", true)
        .build());
    bus.defineMode(ModeDefinition.named("live").base("base").attribute("Mixer", "gain", 3).build());
    NodeInstance mixer = bus.instantiate("Mixer", "mixer", Map.of("gain", 0, "channel", "A")).orElseThrow();
    NodeInstance monitor = bus.instantiate("Monitor", "monitor", Map.of()).orElseThrow();

    bus.switchMode("base");
    assertEquals(1, mixer.getAttribute("gain").orElseThrow());
    assertEquals(true, monitor.getAttribute("muted").orElseThrow());

    bus.switchMode("live");
    assertEquals(3, mixer.getAttribute("gain").orElseThrow());
    assertEquals("A", mixer.getAttribute("channel").orElseThrow());
    assertEquals("live", bus.activeMode().orElseThrow());
  }

  @Test
  void attributesOfBaseModeAreNotReappliedOnSwitchToChild() {
    bus.register(NodeClass.define("Monitor").build());
    bus.defineMode(ModeDefinition.named("base").attribute("Monitor", "muted", true).build());
    bus.defineMode(ModeDefinition.named("live").base("base").build());
    NodeInstance monitor = bus.instantiate("Monitor", "monitor", Map.of()).orElseThrow();

    bus.switchMode("live");

    assertTrue(monitor.getAttribute("muted").isEmpty());
  }

  @Test
  void modeChangeIsBroadcastWithOldAndNewMode() {
    bus.register(NodeClass.define("Ticker")
        .onSystem("onModeChange", (node, message) ->
            log.add(message.get("oldMode") + "->" + message.get("newMode")))
        .build());
    bus.defineMode(ModeDefinition.named("lobby").build());
    bus.defineMode(ModeDefinition.named("round").build());
    bus.instantiate("Ticker", "ticker", Map.of());

    bus.switchMode("lobby");
    bus.switchMode("round");

    assertEquals(List.of("null->lobby", "lobby->round"), log);
  }

  @Test
  void unknownModeLeavesActiveModeUntouched() {
    bus.defineMode(ModeDefinition.named("lobby").build());
    bus.switchMode("lobby");

    assertThrows(UnknownModeException.class, () -> bus.switchMode("missing"));

    assertEquals("lobby", bus.activeMode().orElseThrow());
  }

  @Test
  void modeOverrideReplacesHandlerAndIsInheritedByChildModes() {
    bus.register(NodeClass.define("Source").build());
    bus.register(NodeClass.define("Camper")
        .onInput("onRoast", (node, message) -> log.add("normal"))
        .modeHandler("night", Channel.INPUT, "onRoast", (node, message) -> log.add("night"))
        .build());
    bus.defineMode(ModeDefinition.named("day").wire("Source", "Camper").build());
    bus.defineMode(ModeDefinition.named("night").base("day").build());
    bus.defineMode(ModeDefinition.named("storm").base("night").build());
    bus.instantiate("Source", "source", Map.of());
    bus.instantiate("Camper", "camper", Map.of());
    bus.init();
    bus.start();

    bus.switchMode("day");
    bus.send("source", "roast", Map.of());
    bus.switchMode("night");
    bus.send("source", "roast", Map.of());
    bus.switchMode("storm");
    bus.send("source", "roast", Map.of());

    assertEquals(List.of("normal", "night", "night"), log);
  }

  @Test
  void wiringReplacedByChildModeStopsReachingOldTargets() {
    bus.register(NodeClass.define("Dispenser").build());
    bus.register(NodeClass.define("Scoreboard").onInput("onGive", (node, message) -> log.add("board")).build());
    bus.register(NodeClass.define("Ticker").onInput("onGive", (node, message) -> log.add("ticker")).build());
    bus.defineMode(ModeDefinition.named("base").wire("Dispenser", "Scoreboard", "Ticker").build());
    bus.defineMode(ModeDefinition.named("quiet").base("base").wire("Dispenser", "Ticker").build());
    bus.instantiate("Dispenser", "dispenser", Map.of());
    bus.instantiate("Scoreboard", "board", Map.of());
    bus.instantiate("Ticker", "ticker", Map.of());
    bus.init();
    bus.start();
    bus.switchMode("quiet");

    bus.send("dispenser", "give", Map.of());

    assertEquals(List.of("ticker"), log);
    assertEquals(Map.of("Dispenser", List.of("Ticker")), bus.resolveWiring("quiet"));
  }

  @Test
  void redefiningModeOnActiveLineageRewiresImmediately() {
    bus.register(NodeClass.define("Dispenser").build());
    bus.register(NodeClass.define("Scoreboard").onInput("onGive", (node, message) -> log.add("board")).build());
    bus.register(NodeClass.define("Ticker").onInput("onGive", (node, message) -> log.add("ticker")).build());
    bus.register(NodeClass.define("Ledger")
        .onInput("onGive", (node, message) -> log.add("ledger"))
        .onSystem("onModeChange", (node, message) -> log.add("modeChange"))
        .build());
    bus.defineMode(ModeDefinition.named("base").wire("Dispenser", "Scoreboard").build());
    bus.defineMode(ModeDefinition.named("round").base("base").build());
    bus.defineMode(ModeDefinition.named("bonus").wire("Dispenser", "Ledger").build());
    bus.instantiate("Dispenser", "dispenser", Map.of());
    bus.instantiate("Scoreboard", "board", Map.of());
    bus.instantiate("Ticker", "ticker", Map.of());
    bus.instantiate("Ledger", "ledger", Map.of());
    bus.init();
    bus.start();
    bus.switchMode("round");
    log.clear();

    bus.defineMode(ModeDefinition.named("base").wire("Dispenser", "Ticker").build());
    bus.defineMode(ModeDefinition.named("bonus").wire("Dispenser", "Scoreboard", "Ledger").build());
    bus.send("dispenser", "give", Map.of());

    assertEquals(List.of("ticker"), log);
    assertEquals("round", bus.activeMode().orElseThrow());
  }

  @Test
  void redefinitionThatBreaksActiveLineageIsRolledBack() {
    bus.register(NodeClass.define("Dispenser").build());
    bus.register(NodeClass.define("Scoreboard").onInput("onGive", (node, message) -> log.add("board")).build());
    bus.defineMode(ModeDefinition.named("base").wire("Dispenser", "Scoreboard").build());
    bus.defineMode(ModeDefinition.named("round").base("base").build());
    bus.instantiate("Dispenser", "dispenser", Map.of());
    bus.instantiate("Scoreboard", "board", Map.of());
    bus.init();
    bus.start();
    bus.switchMode("round");

    assertThrows(ModeConfigurationException.class,
        () -> bus.defineMode(ModeDefinition.named("base").base("round").build()));
    bus.send("dispenser", "give", Map.of());

    assertEquals(List.of("board"), log);
    assertTrue(bus.modes().definition("base").orElseThrow().baseMode().isEmpty());
  }

  @Test
  void resolveHandlerFollowsActiveModeLineage() {
    SignalHandler normal = (node, message) -> {};
    SignalHandler night = (node, message) -> {};
    bus.register(NodeClass.define("Camper")
        .onInput("onRoast", normal)
        .modeHandler("night", Channel.INPUT, "onRoast", night)
        .build());
    bus.defineMode(ModeDefinition.named("day").build());
    bus.defineMode(ModeDefinition.named("night").base("day").build());
    bus.instantiate("Camper", "camper", Map.of());

    bus.switchMode("day");
    assertSame(normal, bus.resolveHandler("camper", Channel.INPUT, "onRoast"));
    bus.switchMode("night");
    assertSame(night, bus.resolveHandler("camper", Channel.INPUT, "onRoast"));
    assertThrows(HandlerNotFoundException.class, () -> bus.resolveHandler("camper", Channel.INPUT, "onBurn"));
    assertThrows(IllegalArgumentException.class, () -> bus.resolveHandler("nobody", Channel.INPUT, "onRoast"));
  }
}
