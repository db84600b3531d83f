/** Internal helpers: thread naming and the shared Jackson mapper. */
package civicgap.util;
