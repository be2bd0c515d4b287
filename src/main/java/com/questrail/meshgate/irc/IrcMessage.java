package com.questrail.meshgate.irc;

import java.util.List;
import java.util.Objects;

/**
 * One parsed client line.
 *
 * @param prefix  origin prefix without the leading colon, or {@code null}
 * @param command verb in upper case, or a three-digit numeric
 * @param params  middle parameters followed by the trailing parameter, if any
 */
public record IrcMessage(String prefix, String command, List<String> params)
{
    public IrcMessage
    {
        Objects.requireNonNull(command, "command");
        params = List.copyOf(params);
    }

    public String param(int index)
    {
        return index < params.size() ? params.get(index) : null;
    }

    public int paramCount()
    {
        return params.size();
    }
}
