package com.hsbc.randomize.parameters;

/**
 * A forward-only position in the text being parsed.
 */
final class TextCursor {

    private final String text;
    private int position;

    TextCursor(String text) {
        this.text = text;
    }

    boolean atEnd() {
        return position >= text.length();
    }

    int position() {
        return position;
    }

    /** Consumes {@code expected} if the text continues with it. */
    boolean consume(char expected) {
        if (!atEnd() && text.charAt(position) == expected) {
            position++;
            return true;
        }
        return false;
    }

    void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
    }

    /**
     * Reads up to, but not including, the next {@code stop}.
     *
     * @return the text read, or {@code null} if {@code stop} does not occur; the cursor does not
     *         move in that case
     */
    String readUntil(char stop) {
        int end = text.indexOf(stop, position);
        if (end < 0) {
            return null;
        }
        String field = text.substring(position, end);
        position = end;
        return field;
    }

    String readRemaining() {
        String rest = text.substring(position);
        position = text.length();
        return rest;
    }
}
