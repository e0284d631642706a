package com.platform.resilience.fleet;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command and captures its combined output.
 */
@FunctionalInterface
public interface CommandRunner {
    
    CommandResult run(List<String> command) throws IOException, InterruptedException;
    
    record CommandResult(int exitCode, String output) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }
}
