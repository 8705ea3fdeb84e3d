package com.kotsin.portfolio.provider;

import lombok.extern.slf4j.Slf4j;

/**
 * Parses amounts the provider formats for a European locale:
 * {@code "240.937,98"}, {@code "+70.864,27"}, {@code "-1.615,47"}, {@code "41,71%"}.
 */
@Slf4j
public final class EuropeanNumbers {

    private EuropeanNumbers() {
    }

    /**
     * Blank and unparseable input yields 0 (logged at WARN for the latter).
     */
    public static double parse(String value) {
        if (value == null || value.isBlank()) {
            return 0.0;
        }
        String cleaned = value.replace("%", "").replace("€", "").replace(" ", "")
                .replace(" ", "").trim();
        boolean negative = cleaned.startsWith("-");
        while (cleaned.startsWith("+") || cleaned.startsWith("-")) {
            cleaned = cleaned.substring(1);
        }
        cleaned = cleaned.replace(".", "").replace(",", ".");
        try {
            double parsed = Double.parseDouble(cleaned);
            return negative ? -parsed : parsed;
        } catch (NumberFormatException e) {
            log.warn("Could not parse number: {}", value);
            return 0.0;
        }
    }
}
