/**
 * Typesense implementation of the index client.
 */
package pgsync.typesense;
