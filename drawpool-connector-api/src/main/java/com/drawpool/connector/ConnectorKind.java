package com.drawpool.connector;

/**
 * Backend API flavour a connector speaks. Also the channel-name prefix of its workers.
 */
public enum ConnectorKind {
    PLUS("mj-plus-service"),
    PROXY("mj-proxy-service");

    private final String channelPrefix;

    ConnectorKind(String channelPrefix) {
        this.channelPrefix = channelPrefix;
    }

    /** Channel name for the entry at {@code index} of this kind's configuration list. */
    public String channelName(int index) {
        return channelPrefix + "-" + index;
    }
}
