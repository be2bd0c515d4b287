package com.questrail.meshgate.mesh;

/**
 * Receives the asynchronous event stream of a {@link MeshInterface}.
 *
 * <p>Callbacks run on the mesh interface's own threads. Implementations must
 * hand events off through a thread-safe primitive and return quickly.</p>
 */
@FunctionalInterface
public interface MeshEventListener
{
    void onMeshEvent(MeshEvent event);
}
