package com.shlawgathon.pulse.backend.service;

final class TextUtils {

    static final String ELLIPSIS = "...";

    private TextUtils() {
    }

    /**
     * Cut {@code text} to {@code maxLength} characters, appending an ellipsis when cut.
     */
    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + ELLIPSIS;
    }

    /**
     * Like {@link #truncate} but the ellipsis counts towards {@code maxLength}.
     */
    static String abbreviate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - ELLIPSIS.length())) + ELLIPSIS;
    }
}
