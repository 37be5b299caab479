/**
 * Building blocks for {@link works.stratum.StorageDriver} implementations,
 * plus the drivers that need nothing beyond the core module.
 */
package works.stratum.drivers;
