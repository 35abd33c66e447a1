package com.warden.sandbox.proxy;

/**
 * A generated proxy configuration: the ConfigMap name and the YAML document stored under {@link #CONFIG_KEY}.
 */
public record ProxyConfig(String name, String document) {

    public static final String CONFIG_KEY = "envoy.yaml";
    public static final String NAME_PREFIX = "envoy-config-";

    public static String nameFor(String sandboxName) {
        return NAME_PREFIX + sandboxName;
    }
}
