package com.warden.dispatch.cli;

import com.warden.core.security.SandboxClaims;
import com.warden.core.security.SandboxTokenService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command group: warden token inspect &lt;jwt&gt;
 */
@Command(name = "token", mixinStandardHelpOptions = true, description = "Sandbox identity token utilities",
        subcommands = {TokenCommand.Inspect.class})
@Component
public class TokenCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "inspect", mixinStandardHelpOptions = true,
            description = "Decode a token's claims; --verify also checks signature, issuer, audience and expiry")
    @Component
    public static class Inspect implements Runnable {

        @Parameters(index = "0", description = "Compact JWT")
        private String token;

        @Option(names = "--verify", description = "Verify the token with the configured secret")
        private boolean verify;

        private final SandboxTokenService tokenService;

        public Inspect(SandboxTokenService tokenService) {
            this.tokenService = tokenService;
        }

        @Override
        public void run() {
            SandboxClaims claims;
            if (verify) {
                claims = tokenService.verify(token);
                if (claims == null) {
                    ConsoleOutput.error("Token is NOT valid");
                    return;
                }
                ConsoleOutput.success("Signature, issuer, audience and expiry verified");
            } else {
                try {
                    claims = tokenService.inspectUnverified(token);
                } catch (IllegalArgumentException e) {
                    ConsoleOutput.error(e.getMessage());
                    return;
                }
                ConsoleOutput.info("Claims decoded WITHOUT verification");
            }
            System.out.println("Issuer:    " + claims.issuer());
            System.out.println("Audience:  " + claims.audience());
            System.out.println("Issued:    " + claims.issuedAt());
            System.out.println("Expires:   " + claims.expiresAt());
            System.out.println("Tenant:    " + claims.tenantId());
            System.out.println("Team:      " + claims.teamId());
            System.out.println("Sandbox:   " + claims.sandboxName());
            System.out.println("Thread:    " + claims.threadId());
        }
    }
}
