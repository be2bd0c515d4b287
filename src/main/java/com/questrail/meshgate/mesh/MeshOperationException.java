package com.questrail.meshgate.mesh;

/**
 * Thrown when the mesh interface rejects a send or ping synchronously, for
 * example because the link is down or the destination is unknown.
 */
public class MeshOperationException extends RuntimeException
{
    public MeshOperationException(String message)
    {
        super(message);
    }

    public MeshOperationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
