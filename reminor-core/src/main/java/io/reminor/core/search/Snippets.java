package io.reminor.core.search;

public final class Snippets {
    public static final String ELLIPSIS = "...";

    private Snippets() {
    }

    public static String prefix(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + ELLIPSIS;
    }

    /**
     * Cuts {@code window} characters around {@code index}, keeping {@code lead} characters
     * before it, and marks truncated sides with an ellipsis.
     */
    public static String around(String text, int index, int lead, int window) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int anchor = Math.max(0, Math.min(index, text.length()));
        int start = Math.max(0, anchor - Math.max(0, lead));
        int end = Math.min(text.length(), start + Math.max(1, window));
        String snippet = text.substring(start, end);
        if (snippet.isBlank()) {
            return prefix(text, window);
        }
        if (start > 0) {
            snippet = ELLIPSIS + snippet;
        }
        if (end < text.length()) {
            snippet = snippet + ELLIPSIS;
        }
        return snippet;
    }
}
