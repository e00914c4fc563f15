/**
 * Table mapping registry: which source tables are tracked, the collection each feeds,
 * its field schema with column aliases, and the optional named row transformer.
 *
 * @see pgsync.mapping.TableMappingRegistry
 * @see pgsync.mapping.TransformerRegistry
 */
package pgsync.mapping;
