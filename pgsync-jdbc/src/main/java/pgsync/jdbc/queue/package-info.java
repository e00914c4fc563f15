/**
 * JDBC implementations of the change queue, one per supported database.
 */
package pgsync.jdbc.queue;
