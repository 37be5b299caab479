/**
 * JSON encoding, and the driver that stores JSON files on local disk.
 */
package works.stratum.jackson;
