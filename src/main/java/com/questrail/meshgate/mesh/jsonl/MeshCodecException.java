package com.questrail.meshgate.mesh.jsonl;

/**
 * A line from the mesh daemon that is not a decodable event.
 */
public final class MeshCodecException extends RuntimeException
{
    public MeshCodecException(String message)
    {
        super(message);
    }

    public MeshCodecException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
