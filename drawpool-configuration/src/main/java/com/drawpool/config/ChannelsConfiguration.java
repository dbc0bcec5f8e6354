package com.drawpool.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Backend channel definitions grouped by connector variant. List order matters: the index of an
 * entry becomes part of its channel name ({@code mj-plus-service-0}, {@code mj-proxy-service-1}, ...).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ChannelsConfiguration {

    private final List<ChannelConfig> plus;
    private final List<ChannelConfig> proxy;

    @JsonCreator
    public ChannelsConfiguration(
            @JsonProperty("plus") List<ChannelConfig> plus,
            @JsonProperty("proxy") List<ChannelConfig> proxy) {
        this.plus = plus != null ? List.copyOf(plus) : List.of();
        this.proxy = proxy != null ? List.copyOf(proxy) : List.of();
    }

    public static ChannelsConfiguration empty() {
        return new ChannelsConfiguration(List.of(), List.of());
    }

    public List<ChannelConfig> getPlus() {
        return plus;
    }

    public List<ChannelConfig> getProxy() {
        return proxy;
    }

    /** Number of entries with {@code enabled=true} across both variants. */
    public int enabledCount() {
        return (int) (plus.stream().filter(ChannelConfig::isEnabled).count()
                + proxy.stream().filter(ChannelConfig::isEnabled).count());
    }
}
