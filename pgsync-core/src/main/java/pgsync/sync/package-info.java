/**
 * The batch consumer that applies queued changes to the search index.
 */
package pgsync.sync;
