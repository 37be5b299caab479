/**
 * Logback-specific logging utilities.
 */
package works.stratum.logback;
