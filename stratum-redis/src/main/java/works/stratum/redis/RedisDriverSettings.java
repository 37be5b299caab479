package works.stratum.redis;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import works.stratum.jackson.JsonCodec;
import works.stratum.jackson.JsonCodecs;

@Value
@Builder(toBuilder = true)
public class RedisDriverSettings {
	@Default String host = "localhost";
	@Default int port = 6379;
	@Nullable String password;
	@Default int database = 0;

	/**
	 * Each owner namespace is stored in the hash {@code <keyPrefix>:<owner>}.
	 */
	@Default String keyPrefix = "stratum";

	@Default int timeoutMillis = 2_000;

	/**
	 * How many times a read-modify-write cycle is attempted before giving up
	 * when other clients keep changing the same hash.
	 */
	@Default int maxOptimisticRetries = 100;

	@Default JsonCodec codec = JsonCodecs.preferred();
}
