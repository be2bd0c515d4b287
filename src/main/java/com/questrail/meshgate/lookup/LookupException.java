package com.questrail.meshgate.lookup;

/**
 * An external lookup failed: timeout, unexpected HTTP status, or a payload that
 * does not have the expected shape. The message is fit for display.
 */
public class LookupException extends RuntimeException
{
    public LookupException(String message)
    {
        super(message);
    }

    public LookupException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
