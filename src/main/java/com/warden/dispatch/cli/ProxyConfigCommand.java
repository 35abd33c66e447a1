package com.warden.dispatch.cli;

import com.warden.sandbox.SandboxProperties;
import com.warden.sandbox.SandboxRecord;
import com.warden.sandbox.proxy.ProxyConfigGenerator;
import com.warden.sandbox.proxy.ProxyConfigInspector;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: warden proxy-config &lt;thread-id&gt;
 * <p>
 * Prints the Envoy configuration a sandbox for the thread would receive. The identity
 * token is replaced by a placeholder unless one is passed explicitly.
 */
@Command(name = "proxy-config", mixinStandardHelpOptions = true,
        description = "Render the proxy configuration for a thread's sandbox")
@Component
public class ProxyConfigCommand implements Runnable {

    static final String TOKEN_PLACEHOLDER = "<identity-token>";

    @Parameters(index = "0", description = "Thread ID")
    private String threadId;

    @Option(names = "--token", description = "Token to embed (default: a placeholder)")
    private String token;

    private final ProxyConfigGenerator generator;
    private final SandboxProperties properties;

    public ProxyConfigCommand(ProxyConfigGenerator generator, SandboxProperties properties) {
        this.generator = generator;
        this.properties = properties;
    }

    @Override
    public void run() {
        var sandboxName = SandboxRecord.nameFor(threadId);
        var config = generator.generate(sandboxName, token != null ? token : TOKEN_PLACEHOLDER,
                properties.upstreams());
        System.out.println("# ConfigMap: " + config.name());
        System.out.println(config.document());
        if (ProxyConfigInspector.of(config.document()).forwardsOnAuthorizationFailure()) {
            ConsoleOutput.error("Configuration is fail-open");
        }
    }
}
