package com.seqflow.core.target;

/**
 * Pure helpers for composing output locations.
 * Pipelines call these once while building their configuration.
 */
public final class PathNormalizer {

    private PathNormalizer() {
        // utility class
    }

    /**
     * Returns the folder with exactly one trailing slash.
     */
    public static String folder(String folder) {
        if (folder == null || folder.isBlank()) {
            throw new InvalidTargetException("Folder must not be blank");
        }
        String trimmed = folder.trim();
        int end = trimmed.length();
        while (end > 0 && trimmed.charAt(end - 1) == '/') {
            end--;
        }
        if (end == 0) {
            return "/";
        }
        String body = trimmed.substring(0, end);
        if (body.endsWith(":")) {
            // "s3://" with no bucket
            throw new InvalidTargetException("Folder has no bucket or path: " + folder);
        }
        return body + "/";
    }

    /**
     * Joins a folder and path segments with single slashes.
     */
    public static String join(String folder, String... segments) {
        var sb = new StringBuilder(folder(folder));
        for (int i = 0; i < segments.length; i++) {
            String segment = stripSlashes(segments[i]);
            if (segment.isEmpty()) {
                continue;
            }
            if (sb.charAt(sb.length() - 1) != '/') {
                sb.append('/');
            }
            sb.append(segment);
        }
        return sb.toString();
    }

    /**
     * Replaces every character outside {@code [A-Za-z0-9_-]} with an underscore.
     */
    public static String sanitizeName(String value) {
        return value.replaceAll("[^a-zA-Z0-9\\-_]", "_");
    }

    private static String stripSlashes(String segment) {
        int start = 0;
        int end = segment.length();
        while (start < end && segment.charAt(start) == '/') start++;
        while (end > start && segment.charAt(end - 1) == '/') end--;
        return segment.substring(start, end);
    }
}
