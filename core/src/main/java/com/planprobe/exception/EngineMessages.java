package com.planprobe.exception;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts identifiers from DuckDB error messages.
 *
 * <p>DuckDB reports binder, catalog and parser failures as prefixed text
 * ({@code Binder Error: ...}). The probe surfaces the named column, table or
 * token next to the error kind so users see what to fix.
 */
public final class EngineMessages {

    private static final List<Pattern> IDENTIFIER_PATTERNS = List.of(
        Pattern.compile("column \"([^\"]+)\" not found", Pattern.CASE_INSENSITIVE),
        Pattern.compile("Table with name ([^\\s!]+) does not exist", Pattern.CASE_INSENSITIVE),
        Pattern.compile("Table Function with name ([^\\s!(]+) does not exist", Pattern.CASE_INSENSITIVE),
        Pattern.compile("Scalar Function with name ([^\\s!(]+) does not exist", Pattern.CASE_INSENSITIVE),
        Pattern.compile("syntax error at or near \"([^\"]+)\"", Pattern.CASE_INSENSITIVE),
        Pattern.compile("syntax error at (end of input)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("Could not convert string '([^']*)'", Pattern.CASE_INSENSITIVE),
        Pattern.compile("No files found that match the pattern \"([^\"]+)\"", Pattern.CASE_INSENSITIVE)
    );

    private EngineMessages() {}

    /**
     * Finds the identifier named in an engine error message.
     *
     * @param message the engine message (may be null)
     * @return the identifier, or null if none is recognized
     */
    public static String offendingIdentifier(String message) {
        if (message == null) {
            return null;
        }
        for (Pattern pattern : IDENTIFIER_PATTERNS) {
            Matcher matcher = pattern.matcher(message);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    /**
     * True for messages DuckDB raises while parsing or binding a statement.
     *
     * @param message the engine message
     * @return true for parser, binder and catalog errors
     */
    public static boolean isCompileTimeError(String message) {
        return message != null
            && (message.contains("Parser Error")
                || message.contains("Binder Error")
                || message.contains("Catalog Error"));
    }
}
