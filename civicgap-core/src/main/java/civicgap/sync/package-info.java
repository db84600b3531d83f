/**
 * Dashboard read side: a TTL cache in front of summary, trend, proposal and gap queries.
 */
package civicgap.sync;
