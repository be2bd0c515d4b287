package com.questrail.meshgate.command;

/**
 * Command arguments could not be tokenized.
 */
public class ArgumentSyntaxException extends RuntimeException
{
    public ArgumentSyntaxException(String message)
    {
        super(message);
    }
}
