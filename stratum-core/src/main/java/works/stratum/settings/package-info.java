/**
 * In-process caches for individual settings, for code that reads the same
 * setting far more often than it changes.
 */
package works.stratum.settings;
