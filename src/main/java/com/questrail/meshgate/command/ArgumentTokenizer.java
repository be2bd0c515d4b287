package com.questrail.meshgate.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ArgumentTokenizer
 * -----------------------------------------------------------------------------
 * Splits command arguments the way a POSIX shell splits words.
 *
 * <ul>
 *   <li>Whitespace separates tokens.</li>
 *   <li>Single quotes keep everything up to the next single quote literally.</li>
 *   <li>Double quotes group words; inside them a backslash escapes only
 *       {@code "} and {@code \}.</li>
 *   <li>Outside quotes a backslash escapes the next character.</li>
 * </ul>
 *
 * <p>{@code INFO "Mock Node 1"} yields one token {@code Mock Node 1}.</p>
 */
public final class ArgumentTokenizer
{
    private ArgumentTokenizer() {}

    /**
     * @throws ArgumentSyntaxException on an unmatched quote or a trailing backslash
     */
    public static List<String> tokenize(String text)
    {
        Objects.requireNonNull(text, "text");
        List<String> tokens = new ArrayList<>();
        int pos = 0;
        while (true) {
            pos = skipWhitespace(text, pos);
            if (pos >= text.length()) {
                return tokens;
            }
            StringBuilder token = new StringBuilder();
            pos = readToken(text, pos, token);
            tokens.add(token.toString());
        }
    }

    /**
     * Splits off the first token and returns the rest of the text verbatim, so
     * free text after a node reference keeps its quotes and apostrophes.
     *
     * @return {@code [first, rest]}; both empty for blank input
     * @throws ArgumentSyntaxException if the first token is malformed
     */
    public static String[] splitFirst(String text)
    {
        Objects.requireNonNull(text, "text");
        int pos = skipWhitespace(text, 0);
        if (pos >= text.length()) {
            return new String[] {"", ""};
        }
        StringBuilder first = new StringBuilder();
        int end = readToken(text, pos, first);
        return new String[] {first.toString(), text.substring(skipWhitespace(text, end))};
    }

    private static int readToken(String text, int pos, StringBuilder out)
    {
        int len = text.length();
        while (pos < len && !Character.isWhitespace(text.charAt(pos))) {
            char c = text.charAt(pos);
            if (c == '\'') {
                int close = text.indexOf('\'', pos + 1);
                if (close < 0) {
                    throw new ArgumentSyntaxException("No closing quotation");
                }
                out.append(text, pos + 1, close);
                pos = close + 1;
            }
            else if (c == '"') {
                pos++;
                boolean closed = false;
                while (pos < len) {
                    char d = text.charAt(pos);
                    if (d == '"') {
                        closed = true;
                        pos++;
                        break;
                    }
                    if (d == '\\' && pos + 1 < len && (text.charAt(pos + 1) == '"' || text.charAt(pos + 1) == '\\')) {
                        out.append(text.charAt(pos + 1));
                        pos += 2;
                        continue;
                    }
                    out.append(d);
                    pos++;
                }
                if (!closed) {
                    throw new ArgumentSyntaxException("No closing quotation");
                }
            }
            else if (c == '\\') {
                if (pos + 1 >= len) {
                    throw new ArgumentSyntaxException("No escaped character");
                }
                out.append(text.charAt(pos + 1));
                pos += 2;
            }
            else {
                out.append(c);
                pos++;
            }
        }
        return pos;
    }

    private static int skipWhitespace(String text, int pos)
    {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }
}
