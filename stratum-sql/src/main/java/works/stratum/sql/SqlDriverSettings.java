package works.stratum.sql;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import org.jooq.SQLDialect;
import works.stratum.jackson.JsonCodec;
import works.stratum.jackson.JsonCodecs;

@Value
@Builder(toBuilder = true)
public class SqlDriverSettings {
	/**
	 * If null, jOOQ works it out from each connection.
	 */
	@Nullable SQLDialect dialect;

	@Default String tableName = "stratum_config";

	/**
	 * Encodes the {@code json_data} column.
	 */
	@Default JsonCodec codec = JsonCodecs.preferred();
}
