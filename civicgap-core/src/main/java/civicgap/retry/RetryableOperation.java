package civicgap.retry;

/**
 * Blocking operation run by {@link RetryExecutor}.
 *
 * @param <T> result type
 * @param <E> checked exception the operation may throw
 */
@FunctionalInterface
public interface RetryableOperation<T, E extends Exception> {
  T run() throws E;
}
