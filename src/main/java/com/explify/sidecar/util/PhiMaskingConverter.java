package com.explify.sidecar.util;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.regex.Pattern;

/**
 * Best-effort PHI scrubbing for application log output ({@code %maskedMsg}).
 *
 * Only common high-risk tokens are targeted. Report text must still never be logged.
 */
public class PhiMaskingConverter extends ClassicConverter {
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b");
    private static final Pattern EMAIL = Pattern.compile(
        "\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern MRN = Pattern.compile("\\b(MRN|Medical Record(?: Number)?)\\s*[:#]?\\s*[A-Z0-9-]{4,}", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOB = Pattern.compile("\\b(DOB|Date of Birth)\\s*[:#]?\\s*\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}", Pattern.CASE_INSENSITIVE);
    private static final Pattern PHONE = Pattern.compile("\\b(?:\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]\\d{3}[-.\\s]\\d{4}\\b");

    @Override
    public String convert(ILoggingEvent event) {
        return mask(event.getFormattedMessage());
    }

    public static String mask(String msg) {
        if (msg == null || msg.isEmpty()) {
            return "";
        }
        String sanitized = msg;
        sanitized = MRN.matcher(sanitized).replaceAll("$1 [MRN-REDACTED]");
        sanitized = DOB.matcher(sanitized).replaceAll("$1 [DOB-REDACTED]");
        sanitized = SSN.matcher(sanitized).replaceAll("[SSN-REDACTED]");
        sanitized = EMAIL.matcher(sanitized).replaceAll("[EMAIL-REDACTED]");
        sanitized = PHONE.matcher(sanitized).replaceAll("[PHONE-REDACTED]");
        return sanitized;
    }
}
