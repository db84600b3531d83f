package civicgap.processor;

import civicgap.error.ErrorKind;
import civicgap.error.ErrorReport;
import civicgap.error.StorageException;
import civicgap.error.StorageIntegrityException;
import civicgap.error.TransientStorageException;
import civicgap.error.ValidationException;
import civicgap.model.Classification;
import civicgap.model.Interaction;
import civicgap.model.Proposal;
import civicgap.model.ProposalStatus;
import civicgap.queue.FallbackQueue;
import civicgap.retry.ErrorHandler;
import civicgap.retry.RetryExecutor;
import civicgap.retry.RetryableOperation;
import civicgap.retry.StorageOutcome;
import civicgap.spi.MetricsExporter;
import civicgap.spi.ThemeClassifier;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for submissions: runs the {@link SubmissionProcessor} under retry and maps
 * every outcome onto a {@link SubmissionResult}.
 *
 * <p>Failure policy:
 * <ul>
 *   <li>validation and integrity errors are rejected immediately, never retried or queued;</li>
 *   <li>transient storage errors are retried and, once exhausted, queued;</li>
 *   <li>other storage errors are queued without retry;</li>
 *   <li>without a queue, or if queueing fails, the result is {@link SubmissionResult.Failed}.</li>
 * </ul>
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class SubmissionService {
  private static final Logger logger = Logger.getLogger(SubmissionService.class.getName());

  private static final Set<Class<? extends Throwable>> RETRY_ON = Set.of(TransientStorageException.class);

  private final SubmissionProcessor processor;
  private final RetryExecutor retryExecutor;
  private final ErrorHandler errorHandler;
  private final FallbackQueue queue;
  private final ThemeClassifier classifier;
  private final double reviewThreshold;
  private final SubmissionCodec codec;
  private final MetricsExporter metrics;

  private SubmissionService(Builder builder) {
    this.processor = Objects.requireNonNull(builder.processor, "processor");
    this.retryExecutor = Objects.requireNonNull(builder.retryExecutor, "retryExecutor");
    if (builder.reviewThreshold < 0.0 || builder.reviewThreshold > 1.0) {
      throw new IllegalArgumentException("reviewThreshold must be in [0, 1]");
    }
    this.errorHandler = builder.errorHandler != null ? builder.errorHandler : new ErrorHandler();
    this.queue = builder.queue;
    this.classifier = builder.classifier;
    this.reviewThreshold = builder.reviewThreshold;
    this.codec = builder.codec != null ? builder.codec : new SubmissionCodec();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public SubmissionResult<Interaction> submitInteraction(InteractionRequest request) {
    return submit(SubmissionCodec.TYPE_INTERACTION,
        () -> request == null ? null : codec.encode(request),
        context(SubmissionCodec.TYPE_INTERACTION, request == null ? null : request.citizen()),
        () -> processor.persistInteraction(request));
  }

  /**
   * Submits a proposal whose classification, if any, was attached by the caller.
   * Without an explicit status, a classification below the review threshold yields
   * {@code needs_review} and anything else {@code pending}.
   */
  public SubmissionResult<Proposal> submitProposal(ProposalRequest request) {
    ProposalRequest effective = request == null || request.status() != null || request.classification() == null
        ? request : request.withStatus(statusFor(request.classification()).code());
    return submit(SubmissionCodec.TYPE_PROPOSAL,
        () -> effective == null ? null : codec.encode(effective),
        context(SubmissionCodec.TYPE_PROPOSAL, effective == null ? null : effective.citizen()),
        () -> processor.persistProposal(effective));
  }

  /**
   * Classifies the draft's content and submits it. A classifier failure degrades to
   * {@link Classification#fallback()} and the proposal is flagged for review.
   */
  public SubmissionResult<Proposal> classifyAndSubmit(ProposalDraft draft) {
    Objects.requireNonNull(draft, "draft");
    Classification classification = draft.content() == null || draft.content().isBlank()
        ? Classification.fallback() : classify(draft.content());
    return submitProposal(draft.toRequest(classification, statusFor(classification).code()));
  }

  /**
   * Calls the classifier, falling back to the default theme with zero confidence when it is
   * missing or fails.
   */
  public Classification classify(String content) {
    if (classifier == null) {
      logger.log(Level.WARNING, "No classifier configured, using default theme");
      return Classification.fallback();
    }
    try {
      Classification result = classifier.classify(content);
      return result != null ? result : Classification.fallback();
    } catch (RuntimeException e) {
      errorHandler.logError(e, "classifier", "classify",
          Map.of("contentLength", content == null ? 0 : content.length()));
      return Classification.fallback();
    }
  }

  /**
   * Persists a queued payload directly, without retry or re-queueing. Failures propagate
   * so the queue can count the attempt.
   */
  public void replay(JsonNode payload) {
    String type = codec.typeOf(payload);
    if (SubmissionCodec.TYPE_INTERACTION.equals(type)) {
      processor.persistInteraction(codec.decodeInteraction(payload));
    } else {
      processor.persistProposal(codec.decodeProposal(payload));
    }
  }

  private ProposalStatus statusFor(Classification classification) {
    return classification.needsReview(reviewThreshold) ? ProposalStatus.NEEDS_REVIEW : ProposalStatus.PENDING;
  }

  private <T> SubmissionResult<T> submit(String type, Supplier<JsonNode> payload,
      Map<String, Object> context, RetryableOperation<T, RuntimeException> operation) {
    try {
      T saved = retryExecutor.execute(operation, RETRY_ON, "persist " + type);
      metrics.incrementAccepted();
      return new SubmissionResult.Accepted<>(saved);
    } catch (ValidationException e) {
      metrics.incrementRejected();
      return new SubmissionResult.Rejected<>(errorHandler.handleValidationError(e, context));
    } catch (StorageIntegrityException e) {
      metrics.incrementRejected();
      logger.log(Level.WARNING, "Rejected {0}: {1}", new Object[]{type, e.getMessage()});
      return new SubmissionResult.Rejected<>(ErrorReport.of(ErrorKind.STORAGE_INTEGRITY, e, context));
    } catch (StorageException e) {
      StorageOutcome outcome = errorHandler.handleStorageError(e, encodeQuietly(payload), queue);
      if (outcome.queued()) {
        metrics.incrementQueued();
        return new SubmissionResult.Queued<>(outcome.report());
      }
      metrics.incrementFailed();
      return new SubmissionResult.Failed<>(outcome.report());
    }
  }

  private JsonNode encodeQuietly(Supplier<JsonNode> payload) {
    try {
      return payload.get();
    } catch (IllegalArgumentException e) {
      logger.log(Level.SEVERE, "Payload cannot be encoded for the fallback queue", e);
      return null;
    }
  }

  private static Map<String, Object> context(String type, Object citizen) {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("type", type);
    context.put("citizen", citizen == null ? null : citizen.toString());
    return context;
  }

  /**
   * Builder for {@link SubmissionService}.
   */
  public static final class Builder {
    private SubmissionProcessor processor;
    private RetryExecutor retryExecutor;
    private ErrorHandler errorHandler;
    private FallbackQueue queue;
    private ThemeClassifier classifier;
    private double reviewThreshold = Classification.REVIEW_THRESHOLD;
    private SubmissionCodec codec;
    private MetricsExporter metrics;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder processor(SubmissionProcessor processor) {
      this.processor = processor;
      return this;
    }

    /** <b>Required.</b> */
    public Builder retryExecutor(RetryExecutor retryExecutor) {
      this.retryExecutor = retryExecutor;
      return this;
    }

    public Builder errorHandler(ErrorHandler errorHandler) {
      this.errorHandler = errorHandler;
      return this;
    }

    /**
     * Fallback queue for payloads that could not be stored. Optional; without one such
     * submissions end as {@link SubmissionResult.Failed}.
     */
    public Builder queue(FallbackQueue queue) {
      this.queue = queue;
      return this;
    }

    /** Optional. Without a classifier every draft gets the default theme. */
    public Builder classifier(ThemeClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /** Confidence below which proposals need review. Optional. Defaults to 0.6. */
    public Builder reviewThreshold(double reviewThreshold) {
      this.reviewThreshold = reviewThreshold;
      return this;
    }

    public Builder codec(SubmissionCodec codec) {
      this.codec = codec;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public SubmissionService build() {
      return new SubmissionService(this);
    }
  }
}
