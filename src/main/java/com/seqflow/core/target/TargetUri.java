package com.seqflow.core.target;

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed storage location of a {@link Target}.
 *
 * <p>Local paths use the {@code file} scheme with a {@code null} bucket and the
 * absolute, normalized path as key. Remote objects are {@code scheme://bucket/key}.
 *
 * @param scheme lower-case scheme, {@code file} for local paths
 * @param bucket bucket name; {@code null} for local paths
 * @param key    object key, or the absolute path for local paths
 */
public record TargetUri(String scheme, String bucket, String key) {

    public static final String FILE_SCHEME = "file";

    private static final Pattern SCHEME_PATTERN = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*)://(.*)$");

    public static TargetUri parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidTargetException("Target location must not be blank");
        }
        String trimmed = value.trim();
        Matcher matcher = SCHEME_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            return local(Path.of(trimmed));
        }
        String scheme = matcher.group(1).toLowerCase(Locale.ROOT);
        String rest = matcher.group(2);
        if (FILE_SCHEME.equals(scheme)) {
            return local(Path.of(rest));
        }
        int slash = rest.indexOf('/');
        if (slash <= 0 || slash == rest.length() - 1) {
            throw new InvalidTargetException("Remote target must look like " + scheme + "://bucket/key: " + value);
        }
        return new TargetUri(scheme, rest.substring(0, slash), rest.substring(slash + 1));
    }

    public static TargetUri local(Path path) {
        return new TargetUri(FILE_SCHEME, null, path.toAbsolutePath().normalize().toString());
    }

    public boolean isLocal() {
        return FILE_SCHEME.equals(scheme);
    }

    public Path localPath() {
        if (!isLocal()) {
            throw new IllegalStateException("Not a local target: " + this);
        }
        return Path.of(key);
    }

    /** Last path segment of the key. */
    public String fileName() {
        String trimmed = key.endsWith("/") ? key.substring(0, key.length() - 1) : key;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    @Override
    public String toString() {
        return isLocal() ? key : scheme + "://" + bucket + "/" + key;
    }
}
