package com.explify.sidecar.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_LENGTH = 256;

    private LogSanitizer() {
    }

    /**
     * Strips control characters from request-derived values before they are logged, so a crafted
     * path or header cannot forge extra log lines.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        return cleaned.length() > MAX_LENGTH ? cleaned.substring(0, MAX_LENGTH) + "..." : cleaned;
    }
}
