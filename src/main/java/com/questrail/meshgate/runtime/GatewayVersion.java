package com.questrail.meshgate.runtime;

/**
 * Gateway release identifier, shown in the IRC welcome numerics and by {@code --version}.
 */
public final class GatewayVersion {
    public static final String VERSION = "0.1.0";

    private GatewayVersion() {
    }
}
