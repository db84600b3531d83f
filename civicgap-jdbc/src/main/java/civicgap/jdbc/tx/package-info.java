/** Explicit JDBC transaction boundaries. */
package civicgap.jdbc.tx;
