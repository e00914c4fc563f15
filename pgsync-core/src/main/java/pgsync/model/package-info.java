/**
 * Change queue data model: {@link pgsync.model.QueueEntry} rows, their
 * {@link pgsync.model.OperationType}, and the {@link pgsync.model.QueueStatus} snapshot.
 */
package pgsync.model;
