package com.drawpool.worker.dispatch;

import com.drawpool.config.ChannelConfig;
import com.drawpool.connector.ConnectorKind;
import com.drawpool.connector.ProviderConnector;
import com.drawpool.connector.plus.PlusConnector;
import com.drawpool.connector.proxy.ProxyConnector;

/**
 * Creates the connector for one configured channel.
 */
@FunctionalInterface
public interface ConnectorFactory {

    ProviderConnector create(ConnectorKind kind, ChannelConfig channel);

    /** HTTP connectors: {@link PlusConnector} for PLUS entries, {@link ProxyConnector} for PROXY entries. */
    static ConnectorFactory http() {
        return (kind, channel) -> {
            switch (kind) {
                case PLUS:
                    return new PlusConnector(channel);
                case PROXY:
                    return new ProxyConnector(channel);
                default:
                    throw new IllegalArgumentException("Unknown connector kind: " + kind);
            }
        };
    }
}
