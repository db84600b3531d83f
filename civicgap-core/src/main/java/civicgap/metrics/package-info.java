/**
 * Legislative gap metric: how much citizen demand is not matched by bills in progress.
 */
package civicgap.metrics;
