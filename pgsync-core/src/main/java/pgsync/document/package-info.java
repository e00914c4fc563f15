/**
 * Index-ready document representation: {@link pgsync.document.Document} holding
 * {@link pgsync.document.DocValue} variants.
 */
package pgsync.document;
