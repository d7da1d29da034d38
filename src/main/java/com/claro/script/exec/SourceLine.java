package com.claro.script.exec;

import java.util.Locale;

/** One trimmed statement line with its original 1-based line number. */
public final class SourceLine {
    private final String text;
    private final int lineNumber;
    private final String keyword;
    private final String argument;

    public SourceLine(String text, int lineNumber) {
        this.text = text.trim();
        this.lineNumber = lineNumber;

        int split = indexOfWhitespace(this.text);
        if (split < 0) {
            this.keyword = this.text.toUpperCase(Locale.ROOT);
            this.argument = "";
        } else {
            this.keyword = this.text.substring(0, split).toUpperCase(Locale.ROOT);
            this.argument = this.text.substring(split).trim();
        }
    }

    public String text() { return text; }

    public int lineNumber() { return lineNumber; }

    /** Upper-cased first token. */
    public String keyword() { return keyword; }

    /** Everything after the keyword, trimmed; empty when absent. */
    public String argument() { return argument; }

    public boolean hasArgument() { return !argument.isEmpty(); }

    /** Kind of this line, or null when the keyword is unknown. */
    public StatementKind kind() {
        return StatementKind.lookup(keyword);
    }

    static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }

    @Override
    public String toString() {
        return lineNumber + ": " + text;
    }
}
