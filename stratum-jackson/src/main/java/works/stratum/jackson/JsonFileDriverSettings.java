package works.stratum.jackson;

import java.nio.file.Path;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class JsonFileDriverSettings {
	/**
	 * Each owner namespace gets a subdirectory here.
	 */
	Path baseDirectory;

	@Default String fileName = "settings.json";

	/**
	 * Indent the files for human readers. Costs space and time.
	 */
	@Default boolean prettyPrint = false;
}
