package com.vcinsidedigital.sql_migrator.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits a SQL script into individual statements on {@code ;}.
 * <p>
 * Semicolons are not treated as terminators inside:
 * <ul>
 *   <li>single-quoted strings ({@code ''} escapes a quote; so does {@code \'} in MySQL scripts
 *       and in PostgreSQL {@code E'...'} literals)</li>
 *   <li>double-quoted and back-quoted identifiers</li>
 *   <li>PostgreSQL dollar-quoted bodies ({@code $$ ... $$}, {@code $fn$ ... $fn$})</li>
 *   <li>the {@code BEGIN ... END} block of a {@code CREATE TRIGGER} statement</li>
 * </ul>
 * Line and block comments are removed. Statements that are blank once comments are gone are dropped.
 */
public final class SqlScriptParser {
    private static final Set<String> CREATE_MODIFIERS = Set.of("OR", "REPLACE", "TEMP", "TEMPORARY");

    private SqlScriptParser() {}

    public static List<String> split(String script) {
        return split(script, false);
    }

    /**
     * @param backslashEscapes whether a backslash escapes the next character in every
     *                         single-quoted string, as MySQL does by default
     */
    public static List<String> split(String script, boolean backslashEscapes) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean firstWord = true;
        boolean createPrefix = false;
        boolean trigger = false;
        int blockDepth = 0;

        int length = script.length();
        int i = 0;
        while (i < length) {
            char c = script.charAt(i);
            char next = i + 1 < length ? script.charAt(i + 1) : '\0';

            if (c == '-' && next == '-') {
                int end = script.indexOf('\n', i);
                i = end < 0 ? length : end;
                current.append('\n');
                continue;
            }

            if (c == '/' && next == '*') {
                int end = script.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
                current.append(' ');
                continue;
            }

            if (c == '\'' || c == '"' || c == '`') {
                boolean escapes = c == '\'' && (backslashEscapes || isEscapeStringPrefix(script, i));
                int end = quotedEnd(script, i, c, escapes);
                current.append(script, i, end);
                i = end;
                continue;
            }

            if (c == '$') {
                String tag = dollarTag(script, i);
                if (tag != null) {
                    int close = script.indexOf(tag, i + tag.length());
                    int end = close < 0 ? length : close + tag.length();
                    current.append(script, i, end);
                    i = end;
                    continue;
                }
            }

            if (Character.isLetter(c) || c == '_') {
                int end = i;
                while (end < length && isWordChar(script.charAt(end))) {
                    end++;
                }
                String word = script.substring(i, end).toUpperCase(Locale.ROOT);
                current.append(script, i, end);
                i = end;

                if (firstWord) {
                    firstWord = false;
                    createPrefix = "CREATE".equals(word);
                } else if (createPrefix) {
                    trigger = "TRIGGER".equals(word);
                    createPrefix = CREATE_MODIFIERS.contains(word);
                } else if (trigger && ("BEGIN".equals(word) || "CASE".equals(word))) {
                    blockDepth++;
                } else if (trigger && "END".equals(word) && blockDepth > 0) {
                    blockDepth--;
                }
                continue;
            }

            if (c == ';' && blockDepth == 0) {
                addStatement(statements, current);
                current.setLength(0);
                firstWord = true;
                createPrefix = false;
                trigger = false;
                i++;
                continue;
            }

            current.append(c);
            i++;
        }

        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder sql) {
        String statement = sql.toString().strip();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }

    /**
     * Index just past the quote that closes the one at {@code start}, or the script length if unclosed.
     */
    private static int quotedEnd(String script, int start, char quote, boolean backslashEscapes) {
        int i = start + 1;
        while (i < script.length()) {
            if (backslashEscapes && script.charAt(i) == '\\') {
                i += 2;
                continue;
            }
            if (script.charAt(i) == quote) {
                if (i + 1 < script.length() && script.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return script.length();
    }

    /**
     * True for the quote of a PostgreSQL escape string, {@code E'...'}.
     */
    private static boolean isEscapeStringPrefix(String script, int quote) {
        if (quote < 1) {
            return false;
        }
        char prefix = script.charAt(quote - 1);
        return (prefix == 'E' || prefix == 'e') && (quote < 2 || !isWordChar(script.charAt(quote - 2)));
    }

    /**
     * Returns the dollar-quote tag opening at {@code start} ({@code $$} or {@code $name$}), or null.
     */
    private static String dollarTag(String script, int start) {
        if (start > 0 && isWordChar(script.charAt(start - 1))) {
            return null; // part of an identifier such as a$b
        }
        int i = start + 1;
        if (i < script.length() && Character.isDigit(script.charAt(i))) {
            return null; // positional parameter $1
        }
        while (i < script.length() && isWordChar(script.charAt(i))) {
            i++;
        }
        if (i < script.length() && script.charAt(i) == '$') {
            return script.substring(start, i + 1);
        }
        return null;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
