/**
 * Redis storage, one hash per owner namespace.
 */
package works.stratum.redis;
