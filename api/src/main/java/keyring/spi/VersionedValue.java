package keyring.spi;

import java.util.Objects;

/**
 * A configuration value together with the version stamp it was read at.
 *
 * @param value   the stored value
 * @param version opaque version stamp (ETag-like); changes on every write
 */
public record VersionedValue(String value, String version) {

    public VersionedValue {
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(version, "version is required");
    }
}
