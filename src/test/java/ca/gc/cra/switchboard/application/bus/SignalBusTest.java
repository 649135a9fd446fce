package ca.gc.cra.switchboard.application.bus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.switchboard.application.node.NodeClass;
import ca.gc.cra.switchboard.application.port.ErrorTelemetryPort;
import ca.gc.cra.switchboard.domain.error.ErrorEvent;
import ca.gc.cra.switchboard.domain.node.Domain;
import ca.gc.cra.switchboard.domain.node.LifecycleState;
import ca.gc.cra.switchboard.infrastructure.store.InMemoryAttributeStore;
import ca.gc.cra.switchboard.infrastructure.telemetry.InMemoryErrorTelemetry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class SignalBusTest {
  @Test
  void builderRejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> SignalBus.builder().context(Domain.SHARED));
    assertThrows(IllegalArgumentException.class, () -> SignalBus.builder().lockTimeout(Duration.ZERO));
    assertThrows(NullPointerException.class, () -> SignalBus.builder().metrics(null));
  }

  @Test
  void busesAreIndependent() {
    try (SignalBus first = SignalBus.builder().build(); SignalBus second = SignalBus.builder().build()) {
      first.register(NodeClass.define("Dispenser").build());

      assertTrue(first.registry().isRegistered("Dispenser"));
      assertTrue(!second.registry().isRegistered("Dispenser"));
    }
  }

  @Test
  void closeStopsRunningBusAndClosesTelemetry() {
    AtomicBoolean telemetryClosed = new AtomicBoolean();
    ErrorTelemetryPort telemetry = new ErrorTelemetryPort() {
      @Override
      public void publish(ErrorEvent event) {}

      @Override
      public void close() {
        telemetryClosed.set(true);
      }
    };
    SignalBus bus = SignalBus.builder().telemetry(telemetry).build();
    bus.init();
    bus.start();

    bus.close();

    assertEquals(LifecycleState.STOPPED, bus.state());
    assertTrue(telemetryClosed.get());
  }

  @Test
  void closeBeforeStartReleasesResourcesOwnedDuringInit() {
    AtomicBoolean released = new AtomicBoolean();
    AtomicBoolean stopHookRan = new AtomicBoolean();
    SignalBus bus = SignalBus.builder().build();
    bus.register(NodeClass.define("Lantern")
        .onSystem("onInit", (node, message) -> node.own(() -> released.set(true)))
        .onSystem("onStop", (node, message) -> stopHookRan.set(true))
        .build());
    bus.instantiate("Lantern", "lantern", Map.of());
    bus.init();

    bus.close();

    assertTrue(released.get());
    assertFalse(stopHookRan.get());
    assertEquals(LifecycleState.STOPPED, bus.state());
    assertEquals(LifecycleState.STOPPED, bus.instance("lantern").orElseThrow().state());
  }

  @Test
  void errorPinReportsAnomaliesAndFailures() {
    InMemoryErrorTelemetry telemetry = new InMemoryErrorTelemetry();
    try (SignalBus bus = SignalBus.builder().telemetry(telemetry).build()) {
      bus.register(NodeClass.define("Dispenser")
          .onSystem("onStart", (node, message) -> {
            node.err().fire("empty hopper", Map.of("slot", 2));
            node.err().fire(new IllegalStateException("motor stalled"), Map.of());
          })
          .build());
      bus.instantiate("Dispenser", "dispenser", Map.of());
      bus.init();
      bus.start();

      List<ErrorEvent> events = telemetry.snapshot();
      assertEquals(2, events.size());
      assertEquals("empty hopper", events.get(0).error());
      assertEquals("Err.fire", events.get(0).handler());
      assertEquals(Map.of("slot", 2), events.get(0).payload());
      assertEquals("IllegalStateException: motor stalled", events.get(1).error());
      assertEquals(2L, bus.errors().collectedCount());
    }
  }

  @Test
  void nodesReachConfiguredAttributeStore() {
    InMemoryAttributeStore store = new InMemoryAttributeStore();
    try (SignalBus bus = SignalBus.builder().store(store).build()) {
      bus.register(NodeClass.define("Scoreboard")
          .onSystem("onStop", (node, message) -> node.store().save(node.id(), "round", node.attributes()))
          .build());
      bus.instantiate("Scoreboard", "board", Map.of("score", 12));
      bus.init();
      bus.start();
      bus.stop();

      assertEquals(Map.of("score", 12), store.load("board", "round").orElseThrow());
      assertSame(store, bus.instance("board").orElseThrow().store());
    }
  }

  @Test
  void messageIdsIncrease() {
    try (SignalBus bus = SignalBus.builder().build()) {
      long first = bus.nextMessageId();
      assertTrue(bus.nextMessageId() > first);
    }
  }
}
