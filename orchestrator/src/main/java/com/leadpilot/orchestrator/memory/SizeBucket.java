package com.leadpilot.orchestrator.memory;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coarse company-size bucket used to group pattern statistics.
 *
 * Derived from whatever size hint discovery produced: a word ("enterprise",
 * "small") or a head count ("5,000 employees", "10k+").
 */
public enum SizeBucket {
    SMALL("small companies"),
    MEDIUM("mid-size companies"),
    LARGE("large companies"),
    ENTERPRISE("enterprises with >10k employees"),
    UNKNOWN("companies of unknown size");

    private static final Pattern HEADCOUNT = Pattern.compile("(\\d[\\d,.]*)\\s*(k)?");

    private final String label;

    SizeBucket(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SizeBucket fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return UNKNOWN;
        }
        String h = hint.toLowerCase(Locale.ROOT);

        Matcher m = HEADCOUNT.matcher(h);
        if (m.find()) {
            try {
                double n = Double.parseDouble(m.group(1).replace(",", ""));
                if (m.group(2) != null) {
                    n *= 1000;
                }
                if (n >= 10_000) return ENTERPRISE;
                if (n >= 1_000)  return LARGE;
                if (n >= 100)    return MEDIUM;
                return SMALL;
            } catch (NumberFormatException e) {
                // "1.2.3" and similar: fall through to the keywords
            }
        }

        if (h.contains("enterprise")) return ENTERPRISE;
        if (h.contains("large"))      return LARGE;
        if (h.contains("medium") || h.contains("mid")) return MEDIUM;
        if (h.contains("small") || h.contains("startup")) return SMALL;
        return UNKNOWN;
    }
}
