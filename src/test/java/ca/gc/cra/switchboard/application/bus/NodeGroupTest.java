package ca.gc.cra.switchboard.application.bus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.switchboard.application.node.NodeClass;
import ca.gc.cra.switchboard.domain.node.Domain;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NodeGroupTest {
  private SignalBus bus;
  private List<String> log;

  @BeforeEach
  void setUp() {
    bus = SignalBus.builder().build();
    log = new ArrayList<>();
    bus.register(NodeClass.define("Producer")
        .onSystem("onStart", (node, message) -> node.out().fire("hello", Map.of("from", node.id())))
        .onSystem("onDespawning", (node, message) -> log.add("bye:" + node.id()))
        .build());
    bus.register(NodeClass.define("Consumer")
        .onInput("onHello", (node, message) -> log.add("hello:" + node.id() + "<-" + message.get("from")))
        .onInput("onGreeting", (node, message) -> log.add("greeting:" + node.id()))
        .onInput("onOther", (node, message) -> log.add("other:" + node.id()))
        .onSystem("onDespawning", (node, message) -> log.add("bye:" + node.id()))
        .build());
    bus.init();
    bus.start();
  }

  @AfterEach
  void tearDown() {
    bus.close();
  }

  @Test
  void wiresExistBeforeFirstChildStarts() {
    List<NodeInstance> created = bus.assemble(NodeGroup.named("pair")
        .child("producer", "Producer")
        .child("consumer", "Consumer")
        .wire("producer", "hello", "consumer")
        .build());

    assertEquals(2, created.size());
    assertEquals(List.of("hello:consumer<-producer"), log);
  }

  @Test
  void wireCanNameTheReceivingHandler() {
    bus.assemble(NodeGroup.named("pair")
        .child("producer", "Producer")
        .child("consumer", "Consumer")
        .wire("producer", "hello", "consumer", "onGreeting")
        .build());

    assertEquals(List.of("greeting:consumer"), log);
  }

  @Test
  void wildcardWireCarriesEverySignal() {
    bus.assemble(NodeGroup.named("pair")
        .child("producer", "Producer")
        .child("consumer", "Consumer")
        .wire("producer", GroupWire.ANY_SIGNAL, "consumer")
        .build());
    log.clear();

    bus.send("producer", "other", Map.of());

    assertEquals(List.of("other:consumer"), log);
  }

  @Test
  void wireMayTargetExistingInstance() {
    bus.instantiate("Consumer", "listener", Map.of());

    bus.assemble(NodeGroup.named("solo")
        .child("producer", "Producer")
        .wire("producer", "hello", "listener")
        .build());

    assertEquals(List.of("hello:listener<-producer"), log);
  }

  @Test
  void disassembleRemovesChildrenInReverseOrderAndDropsWires() {
    bus.instantiate("Consumer", "listener", Map.of());
    bus.assemble(NodeGroup.named("pair")
        .child("producer", "Producer")
        .child("consumer", "Consumer")
        .wire("producer", "hello", "listener")
        .build());
    log.clear();

    assertTrue(bus.disassemble("pair"));

    assertEquals(List.of("bye:consumer", "bye:producer"), log);
    assertTrue(bus.instance("producer").isEmpty());
    assertTrue(bus.instance("listener").isPresent());
    assertFalse(bus.disassemble("pair"));
  }

  @Test
  void invalidGroupsAreRejectedBeforeAnythingIsCreated() {
    assertThrows(IllegalArgumentException.class, () -> bus.assemble(NodeGroup.named("broken")
        .child("producer", "Producer")
        .wire("producer", "hello", "nowhere")
        .build()));
    assertEquals(0, bus.instanceCount());

    assertThrows(IllegalArgumentException.class, () -> NodeGroup.named("twice")
        .child("a", "Consumer")
        .child("a", "Consumer")
        .build());

    bus.assemble(NodeGroup.named("pair").child("consumer", "Consumer").build());
    assertThrows(IllegalArgumentException.class,
        () -> bus.assemble(NodeGroup.named("pair").child("other", "Consumer").build()));
    assertThrows(DuplicateInstanceException.class,
        () -> bus.assemble(NodeGroup.named("again").child("consumer", "Consumer").build()));
  }

  @Test
  void childrenOfOtherContextAreSkipped() {
    bus.register(NodeClass.define("Hud").domain(Domain.CLIENT).build());

    List<NodeInstance> created = bus.assemble(NodeGroup.named("mixed")
        .child("producer", "Producer")
        .child("hud", "Hud")
        .wire("producer", "hello", "hud")
        .build());

    assertEquals(1, created.size());
    assertTrue(bus.instance("hud").isEmpty());
  }
}
