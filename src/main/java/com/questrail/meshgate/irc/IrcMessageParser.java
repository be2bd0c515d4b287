package com.questrail.meshgate.irc;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the RFC 1459 line grammar:
 *
 * <pre>
 *   [ ':' prefix SPACE ] command { SPACE param } [ SPACE ':' trailing ]
 * </pre>
 *
 * <p>IRCv3 message tags ({@code @...}) are skipped. A line that does not fit
 * the grammar yields {@link Optional#empty()}: malformed input is dropped, never
 * answered.</p>
 */
public final class IrcMessageParser
{
    static final int MAX_PARAMS = 15;

    private IrcMessageParser() {}

    public static Optional<IrcMessage> parse(String rawLine)
    {
        if (rawLine == null) {
            return Optional.empty();
        }

        String line = stripLineEnd(rawLine);
        int pos = 0;
        int len = line.length();

        if (pos < len && line.charAt(pos) == '@') {
            int sp = line.indexOf(' ', pos);
            if (sp < 0) {
                return Optional.empty();
            }
            pos = skipSpaces(line, sp);
        }

        String prefix = null;
        if (pos < len && line.charAt(pos) == ':') {
            int sp = line.indexOf(' ', pos);
            if (sp < 0 || sp == pos + 1) {
                return Optional.empty();
            }
            prefix = line.substring(pos + 1, sp);
            pos = skipSpaces(line, sp);
        }

        int commandEnd = line.indexOf(' ', pos);
        if (commandEnd < 0) {
            commandEnd = len;
        }
        String command = line.substring(pos, commandEnd);
        if (!isValidCommand(command)) {
            return Optional.empty();
        }
        pos = skipSpaces(line, commandEnd);

        List<String> params = new ArrayList<>();
        while (pos < len) {
            if (line.charAt(pos) == ':' || params.size() == MAX_PARAMS - 1) {
                params.add(line.charAt(pos) == ':' ? line.substring(pos + 1) : line.substring(pos));
                break;
            }
            int sp = line.indexOf(' ', pos);
            if (sp < 0) {
                params.add(line.substring(pos));
                break;
            }
            params.add(line.substring(pos, sp));
            pos = skipSpaces(line, sp);
        }

        return Optional.of(new IrcMessage(prefix, command.toUpperCase(Locale.ROOT), params));
    }

    private static String stripLineEnd(String line)
    {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }

    private static int skipSpaces(String line, int pos)
    {
        while (pos < line.length() && line.charAt(pos) == ' ') {
            pos++;
        }
        return pos;
    }

    private static boolean isValidCommand(String command)
    {
        if (command.isEmpty()) {
            return false;
        }
        if (command.length() == 3 && Character.isDigit(command.charAt(0))) {
            return Character.isDigit(command.charAt(1)) && Character.isDigit(command.charAt(2));
        }
        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            if (!((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z'))) {
                return false;
            }
        }
        return true;
    }
}
