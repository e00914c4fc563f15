/**
 * Micrometer bridge for sync engine metrics.
 */
package pgsync.micrometer;
