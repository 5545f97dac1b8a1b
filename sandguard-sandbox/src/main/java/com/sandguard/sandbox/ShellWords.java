package com.sandguard.sandbox;

import java.util.ArrayList;
import java.util.List;

/**
 * POSIX-style word splitting for building argument vectors.
 * <p>
 * Handles single quotes (literal), double quotes (backslash escapes
 * {@code " \ $ `}) and bare backslash escapes. An unterminated quote runs to
 * the end of the input rather than failing.
 */
public final class ShellWords {

    private ShellWords() {
    }

    public static List<String> split(String command) {
        List<String> words = new ArrayList<>();
        if (command == null) {
            return words;
        }
        StringBuilder cur = new StringBuilder();
        boolean inWord = false;
        char quote = 0;

        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            if (quote == '\'') {
                if (c == '\'') {
                    quote = 0;
                } else {
                    cur.append(c);
                }
            } else if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else if (c == '\\' && i + 1 < command.length() && "\"\\$`".indexOf(command.charAt(i + 1)) >= 0) {
                    cur.append(command.charAt(++i));
                } else {
                    cur.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inWord = true;
            } else if (c == '\\' && i + 1 < command.length()) {
                cur.append(command.charAt(++i));
                inWord = true;
            } else if (Character.isWhitespace(c)) {
                if (inWord) {
                    words.add(cur.toString());
                    cur.setLength(0);
                    inWord = false;
                }
            } else {
                cur.append(c);
                inWord = true;
            }
        }
        if (inWord) {
            words.add(cur.toString());
        }
        return words;
    }
}
