package com.warden.sandbox.proxy;

import java.util.Locale;

/**
 * A third-party API the sandbox may reach through its proxy.
 *
 * @param name       cluster name, also used to derive the agent's {@code <NAME>_BASE_URL} variable
 * @param pathPrefix path prefix routed from the local proxy port to this upstream
 * @param host       upstream host; TLS SNI uses the same value
 * @param port       upstream TLS port
 */
public record Upstream(String name, String pathPrefix, String host, int port) {

    public static final int DEFAULT_PORT = 443;

    public Upstream {
        if (port <= 0) {
            port = DEFAULT_PORT;
        }
    }

    public Upstream(String name, String pathPrefix, String host) {
        this(name, pathPrefix, host, DEFAULT_PORT);
    }

    /**
     * Name of the environment variable that points the agent at the local proxy for this upstream.
     */
    public String baseUrlVariable() {
        return name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_") + "_BASE_URL";
    }
}
