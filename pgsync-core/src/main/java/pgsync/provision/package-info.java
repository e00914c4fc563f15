/**
 * Creation and validation of target collections.
 */
package pgsync.provision;
