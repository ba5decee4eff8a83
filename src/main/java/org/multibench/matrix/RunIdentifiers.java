package org.multibench.matrix;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic run-instance identifiers: {@code <bench>__<axis>=<value>,...__r<rerun>}.
 *
 * <p>Characters unsafe in a directory name are replaced by {@code _}; whenever that happens a short SHA-256 digest
 * of the raw combination is appended so that identifiers stay unique.
 */
public final class RunIdentifiers {
    static final String NO_AXES_SEGMENT = "base";
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._+-]");

    private RunIdentifiers() {}

    public static String of(String benchName, Map<String, String> axisValues, int rerunIndex) {
        Objects.requireNonNull(benchName, "benchName");
        Objects.requireNonNull(axisValues, "axisValues");
        if (rerunIndex < 0) {
            throw new IllegalArgumentException("rerunIndex must be >= 0");
        }
        return groupSegment(benchName, axisValues) + "__r" + rerunIndex;
    }

    /**
     * Identifier prefix shared by every rerun of one combination.
     */
    public static String groupSegment(String benchName, Map<String, String> axisValues) {
        StringBuilder safe = new StringBuilder();
        StringBuilder raw = new StringBuilder();
        boolean replaced = false;
        for (Map.Entry<String, String> entry : axisValues.entrySet()) {
            if (safe.length() > 0) {
                safe.append(',');
            }
            String safeName = sanitize(entry.getKey());
            String safeValue = sanitize(entry.getValue());
            replaced |= !safeName.equals(entry.getKey()) || !safeValue.equals(entry.getValue());
            safe.append(safeName).append('=').append(safeValue);
            // length-prefixed so that the digest input is unambiguous
            raw.append(entry.getKey().length()).append(':').append(entry.getKey())
                .append(entry.getValue().length()).append(':').append(entry.getValue());
        }
        String segment = benchName + "__" + (safe.length() == 0 ? NO_AXES_SEGMENT : safe.toString());
        if (replaced) {
            segment = segment + "~" + shortDigest(benchName + "|" + raw);
        }
        return segment;
    }

    private static String sanitize(String token) {
        return UNSAFE.matcher(token).replaceAll("_");
    }

    private static String shortDigest(String value) {
        byte[] hash = sha256().digest(value.getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder(8);
        for (int i = 0; i < 4; i++) {
            sb.append(String.format(Locale.ROOT, "%02x", hash[i]));
        }
        return sb.toString();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException exception) {
            throw new IllegalStateException("SHA-256 is not available", exception);
        }
    }
}
