package com.questrail.meshgate.correlation;

import java.util.Objects;

/**
 * A chat line owed to the nickname that issued a request.
 */
public record RequesterNotice(String nickname, String line)
{
    public RequesterNotice
    {
        Objects.requireNonNull(nickname, "nickname");
        Objects.requireNonNull(line, "line");
    }
}
