package com.platform.resilience.fleet;

import com.platform.resilience.error.PlatformOperationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ContainerPlatform} driving the docker CLI against one compose project.
 */
@Slf4j
public class DockerCliPlatform implements ContainerPlatform {
    
    static final String SERVICE_LABEL = "com.docker.compose.service";
    static final String PROJECT_LABEL = "com.docker.compose.project";
    
    private final CommandRunner runner;
    private final String composeProject;
    private final List<String> domainSuffixes;
    
    public DockerCliPlatform(CommandRunner runner, String composeProject, List<String> domainSuffixes) {
        this.runner = runner;
        this.composeProject = composeProject;
        this.domainSuffixes = List.copyOf(domainSuffixes);
    }
    
    @Override
    public List<ContainerInstance> listContainers() {
        String format = "{{.Names}}\t{{.Label \"" + SERVICE_LABEL + "\"}}\t{{.State}}";
        CommandRunner.CommandResult result = execute("ps", "*", List.of(
            "docker", "ps", "-a",
            "--filter", "label=" + PROJECT_LABEL + "=" + composeProject,
            "--format", format));
        
        List<ContainerInstance> containers = new ArrayList<>();
        for (String line : result.output().split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            String[] cols = line.split("\t");
            if (cols.length < 2 || cols[0].isBlank() || cols[1].isBlank()) {
                log.debug("Skipping container row without service label: {}", line);
                continue;
            }
            ContainerState state = cols.length > 2 ? ContainerState.fromPlatform(cols[2]) : ContainerState.UNKNOWN;
            containers.add(new ContainerInstance(
                cols[0].strip(),
                cols[1].strip(),
                ServiceNames.normalize(cols[1], domainSuffixes),
                state));
        }
        return containers;
    }
    
    @Override
    public void stop(String container, int graceSeconds) {
        execute("stop", container, List.of("docker", "stop", "--time", String.valueOf(graceSeconds), container));
    }
    
    @Override
    public void start(String container) {
        execute("start", container, List.of("docker", "start", container));
    }
    
    @Override
    public ContainerState inspectState(String container) {
        CommandRunner.CommandResult result = execute("inspect", container,
            List.of("docker", "inspect", "-f", "{{.State.Status}}", container));
        return ContainerState.fromPlatform(result.output());
    }
    
    @Override
    public Optional<String> serviceLabel(String container) {
        CommandRunner.CommandResult result = execute("inspect", container,
            List.of("docker", "inspect", "-f", "{{ index .Config.Labels \"" + SERVICE_LABEL + "\"}}", container));
        String label = result.output().strip();
        return label.isEmpty() || "<no value>".equals(label) ? Optional.empty() : Optional.of(label);
    }
    
    @Override
    public void updateRestartPolicy(String container, String policy) {
        execute("update", container, List.of("docker", "update", "--restart=" + policy, container));
    }
    
    private CommandRunner.CommandResult execute(String operation, String container, List<String> command) {
        CommandRunner.CommandResult result;
        try {
            result = runner.run(command);
        } catch (IOException e) {
            throw new PlatformOperationException(container, operation,
                "Failed to run docker " + operation + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformOperationException(container, operation,
                "Interrupted while running docker " + operation, e);
        }
        if (!result.succeeded()) {
            throw PlatformOperationException.commandFailed(container, operation, result.exitCode(), result.output());
        }
        return result;
    }
}
