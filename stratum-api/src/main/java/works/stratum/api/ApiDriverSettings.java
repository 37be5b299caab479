package works.stratum.api;

import java.time.Duration;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import works.stratum.backend.StorageDetails;
import works.stratum.jackson.JsonCodec;
import works.stratum.jackson.JsonCodecs;

@Value
@Builder(toBuilder = true)
public class ApiDriverSettings {
	public static final String DEFAULT_BASE_URL = "http://localhost:8000";

	@Default String baseUrl = DEFAULT_BASE_URL;

	/**
	 * Sent verbatim as the {@code Authorization} header. Null means no header.
	 */
	@Nullable String token;

	@Default Duration connectTimeout = Duration.ofSeconds(10);
	@Default Duration requestTimeout = Duration.ofSeconds(30);
	@Default JsonCodec codec = JsonCodecs.preferred();

	/**
	 * The host is the base URL; the password is the token.
	 */
	public static ApiDriverSettings fromStorageDetails(StorageDetails details) {
		ApiDriverSettingsBuilder builder = builder();
		if (details.getHost() != null && !details.getHost().isBlank()) {
			builder.baseUrl(details.getHost().trim());
		}
		return builder
			.token(StorageDetails.normalizePassword(details.getPassword()))
			.build();
	}

	/**
	 * Omits the token.
	 */
	@Override
	public String toString() {
		return "ApiDriverSettings{" +
			"baseUrl=" + baseUrl +
			", token=" + ((token == null)? "none" : "***") +
			", connectTimeout=" + connectTimeout +
			", requestTimeout=" + requestTimeout +
			", codec=" + codec.name() +
			'}';
	}
}
