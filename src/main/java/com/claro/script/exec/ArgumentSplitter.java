package com.claro.script.exec;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits CALL arguments into separate expressions.
 *
 * When the text has a comma outside quotes and brackets, commas are the only separators
 * ("n - 1, [1, 2]" gives two arguments). Otherwise whitespace separates ("3 4" gives two,
 * "(n - 1) 4" gives two).
 */
final class ArgumentSplitter {

    private ArgumentSplitter() {}

    static List<String> split(String text) {
        boolean commas = hasTopLevelComma(text);
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    current.append(text.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            boolean separator = commas ? c == ',' : Character.isWhitespace(c);
            if (c == '"' || c == '\'') {
                quote = c;
                current.append(c);
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
                current.append(c);
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                current.append(c);
            } else if (depth <= 0 && separator) {
                flush(current, out);
            } else {
                current.append(c);
            }
        }
        flush(current, out);
        return out;
    }

    private static boolean hasTopLevelComma(String text) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth <= 0) {
                return true;
            }
        }
        return false;
    }

    private static void flush(StringBuilder current, List<String> out) {
        String arg = current.toString().trim();
        if (!arg.isEmpty()) out.add(arg);
        current.setLength(0);
    }
}
