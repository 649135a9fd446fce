package ca.gc.cra.switchboard.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.switchboard.application.port.BoundaryTransport;
import ca.gc.cra.switchboard.domain.node.Domain;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryBoundaryLinkTest {
  @Test
  void endpointDeliversToReceiverOnOtherSide() {
    InMemoryBoundaryLink link = new InMemoryBoundaryLink();
    List<String> received = new ArrayList<>();
    link.endpoint(Domain.CLIENT).connect((sourceClass, signal, payload) ->
        received.add(sourceClass + ":" + signal + ":" + payload.get("wave")));

    link.endpoint(Domain.SERVER).sendAcrossBoundary("WaveController", "waveStarted", Map.of("wave", 2), Domain.CLIENT);

    assertEquals(List.of("WaveController:waveStarted:2"), received);
  }

  @Test
  void payloadIsCopiedAcrossTheBoundary() {
    InMemoryBoundaryLink link = new InMemoryBoundaryLink();
    List<Map<String, Object>> received = new ArrayList<>();
    link.endpoint(Domain.SERVER).connect((sourceClass, signal, payload) -> received.add(payload));
    Map<String, Object> payload = new HashMap<>();
    payload.put("score", 1);

    link.endpoint(Domain.CLIENT).sendAcrossBoundary("Scoreboard", "scored", payload, Domain.SERVER);
    payload.put("score", 2);

    assertEquals(1, received.get(0).get("score"));
    assertThrows(UnsupportedOperationException.class, () -> received.get(0).put("score", 3));
  }

  @Test
  void sendingWithoutPeerDropsAndSendingToSelfFails() {
    InMemoryBoundaryLink link = new InMemoryBoundaryLink();
    BoundaryTransport server = link.endpoint(Domain.SERVER);

    server.sendAcrossBoundary("WaveController", "waveStarted", Map.of(), Domain.CLIENT);

    assertThrows(IllegalArgumentException.class,
        () -> server.sendAcrossBoundary("WaveController", "waveStarted", Map.of(), Domain.SERVER));
    assertThrows(IllegalArgumentException.class, () -> link.endpoint(Domain.SHARED));
    assertTrue(link.endpoint(Domain.CLIENT) != server);
  }
}
