package civicgap.processor;

import civicgap.error.ValidationException;
import civicgap.model.CitizenRef;
import civicgap.model.ContentKind;
import civicgap.model.InteractionKind;
import civicgap.model.Opinion;
import civicgap.model.ProposalStatus;
import civicgap.util.Json;

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Field-level checks run before any storage access.
 */
public final class SubmissionValidator {

  private SubmissionValidator() {}

  /**
   * @throws ValidationException naming the first offending field
   */
  public static void validateInteraction(InteractionRequest request) {
    if (request == null) {
      throw new ValidationException("request", "Interaction is required");
    }
    validateCitizen(request.citizen());
    if (request.kind() == null) {
      throw new ValidationException("kind", "Missing required field: kind");
    }
    InteractionKind kind = InteractionKind.fromCode(request.kind())
        .orElseThrow(() -> new ValidationException("kind", "Invalid kind: " + request.kind()
            + ". Must be one of: " + codes(InteractionKind.values(), InteractionKind::code)));
    if (request.occurredAt() == null) {
      throw new ValidationException("occurredAt", "Missing required field: occurredAt");
    }
    try {
      Json.writeMap(request.metadata());
    } catch (IllegalArgumentException e) {
      throw new ValidationException("metadata", "Metadata must be JSON-serialisable: " + e.getMessage());
    }
    if (kind == InteractionKind.OPINION) {
      if (request.opinion() == null) {
        throw new ValidationException("opinion", "Field 'opinion' is required when kind is 'opinion'");
      }
      if (Opinion.fromCode(request.opinion()).isEmpty()) {
        throw new ValidationException("opinion", "Invalid opinion: " + request.opinion()
            + ". Must be one of: " + codes(Opinion.values(), Opinion::code));
      }
    } else if (request.opinion() != null && Opinion.fromCode(request.opinion()).isEmpty()) {
      throw new ValidationException("opinion", "Invalid opinion: " + request.opinion());
    }
  }

  /**
   * @throws ValidationException naming the first offending field
   */
  public static void validateProposal(ProposalRequest request) {
    if (request == null) {
      throw new ValidationException("request", "Proposal is required");
    }
    validateCitizen(request.citizen());
    if (request.content() == null || request.content().isBlank()) {
      throw new ValidationException("content", "Field 'content' cannot be empty");
    }
    if (request.contentKind() == null) {
      throw new ValidationException("contentKind", "Missing required field: contentKind");
    }
    if (ContentKind.fromCode(request.contentKind()).isEmpty()) {
      throw new ValidationException("contentKind", "Invalid contentKind: " + request.contentKind()
          + ". Must be one of: " + codes(ContentKind.values(), ContentKind::code));
    }
    if (request.city() == null || request.city().isBlank()) {
      throw new ValidationException("city", "Missing required field: city");
    }
    if (request.occurredAt() == null) {
      throw new ValidationException("occurredAt", "Missing required field: occurredAt");
    }
    if (request.status() != null && ProposalStatus.fromCode(request.status()).isEmpty()) {
      throw new ValidationException("status", "Invalid status: " + request.status()
          + ". Must be one of: " + codes(ProposalStatus.values(), ProposalStatus::code));
    }
  }

  private static void validateCitizen(CitizenRef citizen) {
    if (citizen == null) {
      throw new ValidationException("citizen", "Missing required field: citizen");
    }
    if (citizen instanceof CitizenRef.ByToken byToken && byToken.token().isBlank()) {
      throw new ValidationException("citizen", "Citizen token must not be blank");
    }
  }

  private static <E extends Enum<E>> String codes(E[] values, Function<E, String> code) {
    return Arrays.stream(values).map(code).collect(Collectors.joining(", "));
  }
}
