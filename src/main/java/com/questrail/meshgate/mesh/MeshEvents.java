package com.questrail.meshgate.mesh;

import com.questrail.meshgate.directory.MeshNodeRecord;

final class MeshEvents
{
    private MeshEvents() {}

    static String nodeRef(long nodeNumber)
    {
        return MeshNodeRecord.defaultNodeId(nodeNumber);
    }
}
