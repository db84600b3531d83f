package civicgap.spi;

import civicgap.error.ClassifierException;
import civicgap.model.Classification;

/**
 * External text classifier that assigns themes to proposal content.
 *
 * <p>Implementations typically call a remote model; callers treat every failure as
 * recoverable and fall back to {@link Classification#fallback()}.
 */
@FunctionalInterface
public interface ThemeClassifier {

  /**
   * @param content proposal text
   * @return themes and confidence
   * @throws ClassifierException if the service fails or returns an unusable answer
   */
  Classification classify(String content);
}
