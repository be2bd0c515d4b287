package com.questrail.meshgate.config;

import java.util.Locale;

/**
 * How the gateway reaches the mesh.
 */
public enum MeshTransport
{
    /** In-memory simulated mesh. */
    SIMULATOR("simulator"),

    /** Newline-delimited JSON over TCP to a mesh daemon. */
    JSON_TCP("json-tcp");

    private final String key;

    MeshTransport(String key)
    {
        this.key = key;
    }

    public String key()
    {
        return key;
    }

    /**
     * @throws IllegalArgumentException for an unknown key
     */
    public static MeshTransport fromKey(String key)
    {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (MeshTransport t : values()) {
            if (t.key.equals(normalized)) {
                return t;
            }
        }
        throw new IllegalArgumentException("mesh.transport: unknown transport '" + key + "' (expected simulator or json-tcp)");
    }

    @Override
    public String toString()
    {
        return key;
    }
}
