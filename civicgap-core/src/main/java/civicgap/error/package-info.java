/**
 * Error taxonomy: {@link civicgap.error.ErrorKind}, the unchecked
 * {@link civicgap.error.CivicGapException} hierarchy, and SQLState translation.
 *
 * @see civicgap.error.SqlErrors
 * @see civicgap.retry.ErrorHandler
 */
package civicgap.error;
