/**
 * Row to document conversion: transformer, aliasing, pruning and type normalization.
 */
package pgsync.transform;
