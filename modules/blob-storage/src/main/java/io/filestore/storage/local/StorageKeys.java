package io.filestore.storage.local;

import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * The one place where client supplied file names are turned into something that is safe
 * to use as a file name on disk.
 */
public final class StorageKeys {
    static final String FALLBACK_NAME = "file";
    static final int MAX_NAME_LENGTH = 200;

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^a-zA-Z0-9.\\-]");
    private static final Pattern ONLY_DOTS = Pattern.compile("\\.*");

    private StorageKeys() {
    }

    /**
     * Replaces every character outside {@code [a-zA-Z0-9.-]} with an underscore. Path
     * separators never survive, so the result is always a single path segment.
     */
    public static String sanitize(String originalName) {
        if (originalName == null) {
            return FALLBACK_NAME;
        }
        String sanitized = UNSAFE_CHARS.matcher(originalName).replaceAll("_");
        if (ONLY_DOTS.matcher(sanitized).matches()) {
            // "", "." and ".." are not usable as file names
            return FALLBACK_NAME;
        }
        if (sanitized.length() > MAX_NAME_LENGTH) {
            // keep the tail so the extension survives
            sanitized = sanitized.substring(sanitized.length() - MAX_NAME_LENGTH);
        }
        return sanitized;
    }

    /**
     * Builds a new storage key: {@code <epochMillis>-<random>-<sanitized name>}.
     */
    public static String newKey(String originalName) {
        long random = ThreadLocalRandom.current().nextLong(1_000_000_000L);
        return System.currentTimeMillis() + "-" + random + "-" + sanitize(originalName);
    }
}
