package com.kotsin.portfolio.entity;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Turns a display name into the slug used inside entity and notification ids.
 * {@code "John's Crypto"} becomes {@code "johns_crypto"}, {@code "Acción Única"}
 * becomes {@code "accion_unica"}.
 */
public final class PortfolioNames {

    private PortfolioNames() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String stripped = Normalizer.normalize(name, Normalizer.Form.NFD)
                .replaceAll("\\p{Mn}", "");
        String lowered = stripped.toLowerCase(Locale.ROOT).replace(' ', '_');
        StringBuilder out = new StringBuilder(lowered.length());
        for (int i = 0; i < lowered.length(); i++) {
            char c = lowered.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_') {
                out.append(c);
            }
        }
        return out.toString();
    }
}
