/**
 * Relational storage, one row per category document.
 */
package works.stratum.sql;
