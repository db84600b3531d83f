package civicgap.processor;

import civicgap.model.CitizenRef;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InteractionRequestTest {

  @Test
  void metadataHoldsTheTypesAJsonColumnReadsBack() {
    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("lat", -7.115f);
    nested.put("tags", List.of("bairro", "creche"));

    InteractionRequest request = new InteractionRequest(CitizenRef.id(1), "view", null, null, null,
        Map.of("count", 5L, "big", 5_000_000_000L, "score", 0.5, "where", nested),
        Instant.parse("2025-03-01T12:00:00Z"));

    Map<String, Object> metadata = request.metadata();
    assertEquals(Integer.valueOf(5), metadata.get("count"));
    assertEquals(Long.valueOf(5_000_000_000L), metadata.get("big"));
    assertEquals(Double.valueOf(0.5), metadata.get("score"));
    Map<?, ?> where = assertInstanceOf(Map.class, metadata.get("where"));
    assertInstanceOf(Double.class, where.get("lat"));
    assertEquals(List.of("bairro", "creche"), where.get("tags"));
    assertThrows(UnsupportedOperationException.class, () -> metadata.put("x", 1));
  }

  @Test
  void occurredAtIsKeptToMicroseconds() {
    InteractionRequest interaction = new InteractionRequest(CitizenRef.id(1), "view", null, null, null, null,
        Instant.parse("2025-03-09T10:15:30.123456789Z"));
    ProposalRequest proposal = new ProposalRequest(CitizenRef.id(1), "texto", "text", "Recife", null, null,
        null, null, null, Instant.parse("2025-03-09T10:15:30.123456789Z"));

    assertEquals(Instant.parse("2025-03-09T10:15:30.123456Z"), interaction.occurredAt());
    assertEquals(Instant.parse("2025-03-09T10:15:30.123456Z"), proposal.occurredAt());
    assertEquals(Map.of(), interaction.metadata());
  }
}
