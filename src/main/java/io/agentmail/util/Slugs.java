package io.agentmail.util;

import java.util.Locale;

/**
 * Project slug derivation from a human key (usually an absolute repository path).
 */
public final class Slugs {
    public static final int MAX_LENGTH = 255;

    private Slugs() {
    }

    public static String slugify(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("slug source must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        while (value.startsWith("-") || value.startsWith(".")) {
            value = value.substring(1);
        }
        while (value.endsWith("-")) {
            value = value.substring(0, value.length() - 1);
        }
        if (value.isBlank()) {
            throw new IllegalArgumentException("slug source has no usable characters: " + raw);
        }
        if (value.length() > MAX_LENGTH) {
            value = value.substring(0, MAX_LENGTH);
        }
        return value;
    }
}
