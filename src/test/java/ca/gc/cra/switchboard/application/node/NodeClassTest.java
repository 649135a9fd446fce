package ca.gc.cra.switchboard.application.node;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.switchboard.domain.node.Channel;
import ca.gc.cra.switchboard.domain.node.Domain;
import java.util.List;
import org.junit.jupiter.api.Test;

class NodeClassTest {

  @Test
  void rootRequiresLifecycleHooksWithNoOpDefaults() {
    NodeClass root = NodeClass.root();

    assertTrue(root.isRoot());
    assertEquals(Domain.SHARED, root.domain());
    assertEquals(
        List.of("Sys.onInit", "Sys.onStart", "Sys.onStop"),
        root.requiredHandlers().stream().map(RequiredHandler::qualifiedName).toList());
    assertSame(SignalHandler.NO_OP, root.handler(Channel.SYSTEM, "onModeChange").orElseThrow());
  }

  @Test
  void childInheritsDomainAndOverridesHandlers() {
    SignalHandler parentHandler = (node, message) -> {};
    SignalHandler childHandler = (node, message) -> {};
    NodeClass parent = NodeClass.define("Ticker")
        .domain(Domain.CLIENT)
        .onInput("onTick", parentHandler)
        .outputs("tick")
        .build();
    NodeClass child = parent.extend("MessageTicker").onInput("onTick", childHandler).build();

    assertEquals(Domain.CLIENT, child.domain());
    assertEquals(List.of("tick"), child.outputs());
    assertSame(childHandler, child.handler(Channel.INPUT, "onTick").orElseThrow());
    assertSame(parentHandler, parent.handler(Channel.INPUT, "onTick").orElseThrow());
  }

  @Test
  void signalsMapToHandlersByNamingRuleAndExplicitRoutes() {
    NodeClass board = NodeClass.define("LeaderBoard")
        .onInput("onScoreChanged", (node, message) -> {})
        .onInput("onRefresh", (node, message) -> {})
        .route("reset", "onRefresh")
        .build();

    assertEquals("onScoreChanged", board.handlerForSignal("scoreChanged"));
    assertEquals("onScoreChanged", board.handlerForSignal("ScoreChanged"));
    assertEquals("onRefresh", board.handlerForSignal("reset"));
    assertEquals("onUnknown", board.handlerForSignal("unknown"));
  }

  @Test
  void routeToUndefinedHandlerFailsAtBuild() {
    NodeClass.Builder builder = NodeClass.define("Broken").route("go", "onMissing");

    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  void modeHandlersAreScopedByModeName() {
    SignalHandler playing = (node, message) -> {};
    NodeClass camper = NodeClass.define("Camper")
        .onInput("onRoast", (node, message) -> {})
        .modeHandler("night", Channel.INPUT, "onRoast", playing)
        .build();

    assertSame(playing, camper.modeHandler("night", Channel.INPUT, "onRoast").orElseThrow());
    assertTrue(camper.modeHandler("day", Channel.INPUT, "onRoast").isEmpty());
  }
}
