package com.questrail.meshgate.irc;

/**
 * RFC 1459 case mapping. Besides ASCII letters, {@code []\~} are the upper-case
 * forms of <code>{}|^</code>, so {@code Op[1]} and <code>op{1}</code> are the
 * same nickname.
 */
public final class IrcCaseMapping
{
    private IrcCaseMapping() {}

    public static String toLower(String s)
    {
        char[] out = s.toCharArray();
        for (int i = 0; i < out.length; i++) {
            out[i] = toLower(out[i]);
        }
        return new String(out);
    }

    public static boolean equalsIgnoreCase(String a, String b)
    {
        if (a == null || b == null) {
            return a == b;
        }
        if (a.length() != b.length()) {
            return false;
        }
        for (int i = 0; i < a.length(); i++) {
            if (toLower(a.charAt(i)) != toLower(b.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    static char toLower(char c)
    {
        if (c >= 'A' && c <= 'Z') {
            return (char) (c + ('a' - 'A'));
        }
        switch (c) {
            case '[':
                return '{';
            case ']':
                return '}';
            case '\\':
                return '|';
            case '~':
                return '^';
            default:
                return c;
        }
    }
}
