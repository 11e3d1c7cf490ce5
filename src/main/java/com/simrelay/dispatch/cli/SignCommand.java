package com.simrelay.dispatch.cli;

import com.simrelay.core.security.RelayProperties;
import com.simrelay.core.security.SignatureVerifier;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: simrelay sign &lt;file&gt;
 * <p>
 * Prints the {@code X-Signature} value for a request body, for manual uploads with curl.
 */
@Command(name = "sign", mixinStandardHelpOptions = true,
        description = "Print the hex HMAC-SHA256 signature of a request body file")
@Component
public class SignCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "File containing the exact request body")
    private Path file;

    @Option(names = "--key", description = "Signing key (default: simrelay.api-key)")
    private String key;

    private final RelayProperties relayProperties;

    public SignCommand(RelayProperties relayProperties) {
        this.relayProperties = relayProperties;
    }

    @Override
    public Integer call() {
        try {
            byte[] body = Files.readAllBytes(file);
            System.out.println(SignatureVerifier.sign(key != null ? key : relayProperties.getApiKey(), body));
            return 0;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 1;
        }
    }
}
