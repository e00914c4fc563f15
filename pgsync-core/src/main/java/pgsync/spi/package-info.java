/**
 * Service provider interfaces: change queue access, row fetching, the target index
 * and metrics.
 */
package pgsync.spi;
