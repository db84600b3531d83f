package civicgap.processor;

import civicgap.error.ValidationException;
import civicgap.model.CitizenRef;
import civicgap.model.Classification;
import civicgap.util.Json;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts submissions to and from fallback queue payloads.
 *
 * <p>Payload shape: {@code {"type":"interaction"|"proposal","data":{...}}}. The
 * {@code citizen} field is a JSON number for an id and a string for a token.
 */
public final class SubmissionCodec {
  public static final String TYPE_INTERACTION = "interaction";
  public static final String TYPE_PROPOSAL = "proposal";

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public SubmissionCodec() {
    this(Json.mapper());
  }

  public SubmissionCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public ObjectNode encode(InteractionRequest request) {
    ObjectNode data = mapper.createObjectNode();
    putCitizen(data, request.citizen());
    data.put("kind", request.kind());
    putIfPresent(data, "opinion", request.opinion());
    if (request.billId() != null) {
      data.put("bill_id", request.billId());
    }
    putIfPresent(data, "content", request.content());
    if (!request.metadata().isEmpty()) {
      data.set("metadata", mapper.valueToTree(request.metadata()));
    }
    putInstant(data, "occurred_at", request.occurredAt());
    return wrap(TYPE_INTERACTION, data);
  }

  public ObjectNode encode(ProposalRequest request) {
    ObjectNode data = mapper.createObjectNode();
    putCitizen(data, request.citizen());
    data.put("content", request.content());
    data.put("content_kind", request.contentKind());
    data.put("city", request.city());
    putIfPresent(data, "inclusion_group", request.inclusionGroup());
    putIfPresent(data, "audio_url", request.audioUrl());
    Classification classification = request.classification();
    if (classification != null) {
      data.put("primary_theme", classification.primaryTheme());
      ArrayNode secondary = data.putArray("secondary_themes");
      classification.secondaryThemes().forEach(secondary::add);
      data.put("confidence", classification.confidence());
    }
    putIfPresent(data, "status", request.status());
    if (request.duplicateGroupId() != null) {
      data.put("duplicate_group_id", request.duplicateGroupId());
    }
    putInstant(data, "occurred_at", request.occurredAt());
    return wrap(TYPE_PROPOSAL, data);
  }

  /**
   * Payload type, validated.
   *
   * @throws ValidationException if the payload has no known {@code type}
   */
  public String typeOf(JsonNode payload) {
    String type = payload == null ? null : payload.path("type").asText(null);
    if (!TYPE_INTERACTION.equals(type) && !TYPE_PROPOSAL.equals(type)) {
      throw new ValidationException("type", "Unknown payload type: " + type);
    }
    return type;
  }

  public InteractionRequest decodeInteraction(JsonNode payload) {
    JsonNode data = data(payload);
    Map<String, Object> metadata = data.hasNonNull("metadata")
        ? mapper.convertValue(data.get("metadata"), MAP_TYPE) : Map.of();
    return new InteractionRequest(
        citizen(data),
        text(data, "kind"),
        text(data, "opinion"),
        number(data, "bill_id"),
        text(data, "content"),
        metadata,
        instant(data, "occurred_at"));
  }

  public ProposalRequest decodeProposal(JsonNode payload) {
    JsonNode data = data(payload);
    Classification classification = null;
    if (data.hasNonNull("primary_theme")) {
      List<String> secondary = new ArrayList<>();
      data.path("secondary_themes").forEach(n -> secondary.add(n.asText()));
      try {
        classification = new Classification(
            data.get("primary_theme").asText(), secondary, data.path("confidence").asDouble(0.0));
      } catch (IllegalArgumentException e) {
        throw new ValidationException("classification", e.getMessage());
      }
    }
    return new ProposalRequest(
        citizen(data),
        text(data, "content"),
        text(data, "content_kind"),
        text(data, "city"),
        text(data, "inclusion_group"),
        text(data, "audio_url"),
        classification,
        text(data, "status"),
        number(data, "duplicate_group_id"),
        instant(data, "occurred_at"));
  }

  private ObjectNode wrap(String type, ObjectNode data) {
    ObjectNode payload = mapper.createObjectNode();
    payload.put("type", type);
    payload.set("data", data);
    return payload;
  }

  private static void putCitizen(ObjectNode data, CitizenRef citizen) {
    if (citizen instanceof CitizenRef.ById byId) {
      data.put("citizen", byId.id());
    } else if (citizen instanceof CitizenRef.ByToken byToken) {
      data.put("citizen", byToken.token());
    }
  }

  private static void putIfPresent(ObjectNode data, String field, String value) {
    if (value != null) {
      data.put(field, value);
    }
  }

  private static void putInstant(ObjectNode data, String field, Instant value) {
    if (value != null) {
      data.put(field, value.toString());
    }
  }

  private static JsonNode data(JsonNode payload) {
    JsonNode data = payload == null ? null : payload.get("data");
    if (data == null || !data.isObject()) {
      throw new ValidationException("data", "Payload has no data object");
    }
    return data;
  }

  private static CitizenRef citizen(JsonNode data) {
    JsonNode citizen = data.get("citizen");
    if (citizen == null || citizen.isNull()) {
      return null;
    }
    if (citizen.isIntegralNumber()) {
      return CitizenRef.id(citizen.asLong());
    }
    if (citizen.isTextual()) {
      return CitizenRef.token(citizen.asText());
    }
    throw new ValidationException("citizen", "citizen must be a number or a string");
  }

  private static String text(JsonNode data, String field) {
    JsonNode node = data.get(field);
    return node == null || node.isNull() ? null : node.asText();
  }

  private static Long number(JsonNode data, String field) {
    JsonNode node = data.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isIntegralNumber()) {
      throw new ValidationException(field, field + " must be an integer");
    }
    return node.asLong();
  }

  private static Instant instant(JsonNode data, String field) {
    String text = text(data, field);
    if (text == null) {
      return null;
    }
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException e) {
      throw new ValidationException(field, "Invalid timestamp: " + text);
    }
  }
}
