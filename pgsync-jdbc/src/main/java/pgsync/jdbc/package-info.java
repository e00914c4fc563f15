/**
 * JDBC support: row fetching, database setup, backfill and connection plumbing.
 */
package pgsync.jdbc;
