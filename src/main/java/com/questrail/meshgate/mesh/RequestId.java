package com.questrail.meshgate.mesh;

/**
 * Identifier the mesh interface assigns to an outbound send or ping. Completion
 * events carry the same identifier.
 */
public record RequestId(long value)
{
    public static RequestId of(long value)
    {
        return new RequestId(value);
    }

    @Override
    public String toString()
    {
        return Long.toString(value);
    }
}
