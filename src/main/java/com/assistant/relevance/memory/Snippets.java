package com.assistant.relevance.memory;

/**
 * Length limiting helpers for memory text.
 */
public final class Snippets {

    static final String BLOCK_MARKER = "\n\n[...truncated]";
    static final String INLINE_MARKER = " [...truncated]";

    private Snippets() {
    }

    /**
     * Cuts {@code text} to at most {@code maxChars} characters, ending with a block marker
     * when something was removed. When the marker itself does not fit, the plain prefix
     * is returned.
     */
    public static String truncateWithMarker(String text, int maxChars) {
        if (maxChars <= 0) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }
        int usable = maxChars - BLOCK_MARKER.length();
        if (usable <= 0) {
            return text.substring(0, maxChars);
        }
        return text.substring(0, usable) + BLOCK_MARKER;
    }

    /**
     * Single-line variant of {@link #truncateWithMarker(String, int)}.
     */
    public static String truncateInline(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        int usable = Math.max(0, maxChars - INLINE_MARKER.length());
        return text.substring(0, usable) + INLINE_MARKER;
    }

    /**
     * Collapses whitespace runs into single spaces and trims.
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }
}
