/**
 * Choosing a backend by name, from code or from environment variables.
 */
package works.stratum.backend;
