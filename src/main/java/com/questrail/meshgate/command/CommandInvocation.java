package com.questrail.meshgate.command;

import java.util.List;
import java.util.Objects;

/**
 * One command line as typed in the control room.
 *
 * @param requester    nickname of the issuing session
 * @param verb         command name, upper case
 * @param rawArguments text after the verb, leading whitespace removed
 */
public record CommandInvocation(String requester, String verb, String rawArguments)
{
    public CommandInvocation
    {
        Objects.requireNonNull(requester, "requester");
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(rawArguments, "rawArguments");
    }

    /**
     * Quote-aware tokens of the arguments.
     *
     * @throws ArgumentSyntaxException on an unmatched quote or dangling escape
     */
    public List<String> tokens()
    {
        return ArgumentTokenizer.tokenize(rawArguments);
    }

    public boolean hasArguments()
    {
        return !rawArguments.isBlank();
    }
}
