package com.di.importgate.external;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a configured command string into arguments. Single and double quotes
 * group words; there is no escape syntax.
 */
public final class CommandLines {

    private CommandLines() {
    }

    public static List<String> split(String command) {
        List<String> args = new ArrayList<>();
        if (command == null) {
            return args;
        }
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean inToken = false;
        for (char c : command.toCharArray()) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    args.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("Unbalanced quote in command: " + command);
        }
        if (inToken) {
            args.add(current.toString());
        }
        return args;
    }
}
