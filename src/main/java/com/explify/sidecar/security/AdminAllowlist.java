package com.explify.sidecar.security;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lower-cased admin e-mail addresses, loaded once from {@code app.admin.emails}.
 */
public final class AdminAllowlist {
    private final Set<String> emails;

    private AdminAllowlist(Set<String> emails) {
        this.emails = Set.copyOf(emails);
    }

    public static AdminAllowlist parse(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return new AdminAllowlist(Set.of());
        }
        Set<String> parsed = Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return new AdminAllowlist(parsed);
    }

    public boolean isEmpty() {
        return this.emails.isEmpty();
    }

    public int size() {
        return this.emails.size();
    }

    public boolean contains(String email) {
        if (email == null) {
            return false;
        }
        return this.emails.contains(email.trim().toLowerCase(Locale.ROOT));
    }
}
