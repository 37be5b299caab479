/**
 * Exceptions that can reach the user of a {@link works.stratum.StorageDriver}.
 * <p>
 * {@link works.stratum.exceptions.NotFoundException} is checked, because callers
 * are expected to recover from it by supplying a default.
 * The others are unchecked and propagate to whoever can deal with them.
 */
package works.stratum.exceptions;
