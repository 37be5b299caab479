/**
 * A driver that stores nothing locally and forwards every operation to a remote configuration service.
 */
package works.stratum.api;
