package com.platform.resilience.fleet;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {
    
    private final Duration timeout;
    
    public ProcessCommandRunner(Duration timeout) {
        this.timeout = timeout;
    }
    
    @Override
    public CommandResult run(List<String> command) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command)
            .redirectErrorStream(true)
            .start();
        
        // Output is small (one line per container); read fully before waiting
        String output;
        try (InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            log.warn("Command timed out after {}: {}", timeout, String.join(" ", command));
            return new CommandResult(-1, "timed out after " + timeout);
        }
        return new CommandResult(process.exitValue(), output.strip());
    }
}
