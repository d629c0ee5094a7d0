package com.planprobe.plan;

/**
 * Checks that SQL text holds exactly one statement.
 *
 * <p>Semicolons inside string literals, quoted identifiers and comments do not
 * count as separators; one trailing semicolon is allowed and removed.
 */
public final class SqlStatements {

    private SqlStatements() {}

    /**
     * Normalizes a single statement.
     *
     * @param sql the SQL text
     * @return the trimmed statement without a trailing semicolon
     * @throws IllegalArgumentException if the text is blank or holds several statements
     */
    public static String singleStatement(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("SQL text is empty");
        }
        int separator = firstSeparator(sql);
        if (separator < 0) {
            return sql.strip();
        }
        String rest = stripComments(sql.substring(separator + 1));
        if (!rest.isBlank()) {
            throw new IllegalArgumentException("Only one statement is allowed; found more after ';' at offset " + separator);
        }
        String statement = sql.substring(0, separator).strip();
        if (stripComments(statement).isBlank()) {
            throw new IllegalArgumentException("SQL text is empty");
        }
        return statement;
    }

    private static int firstSeparator(String sql) {
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(sql, i, c);
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? n : end + 1;
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
            } else if (c == ';') {
                return i;
            } else {
                i++;
            }
        }
        return -1;
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private static String stripComments(String sql) {
        return sql.replaceAll("(?s)/\\*.*?\\*/", " ").replaceAll("--[^\\n]*", " ");
    }
}
