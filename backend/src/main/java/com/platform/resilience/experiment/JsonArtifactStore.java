package com.platform.resilience.experiment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.resilience.chaos.ChaosWindow;
import com.platform.resilience.chaos.ChaosWindowLog;
import com.platform.resilience.config.ExperimentProperties;
import com.platform.resilience.correlation.ComparisonResult;
import com.platform.resilience.error.ErrorCode;
import com.platform.resilience.error.ResilienceException;
import com.platform.resilience.estimator.ModelEstimate;
import com.platform.resilience.estimator.TargetSpec;
import com.platform.resilience.graph.DependencyGraph;
import com.platform.resilience.graph.GraphJson;
import com.platform.resilience.probe.LiveWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stores artifacts as JSON files in the run directory:
 * <ul>
 *   <li>{@code window_log_p{p}_{runId}.jsonl}</li>
 *   <li>{@code model_mode{mode}_p{p}[_{endpoint}].json}</li>
 *   <li>{@code live_p{p}_w{index}.json}</li>
 *   <li>{@code comparison_p{p}_{key}_{scope}.json}</li>
 *   <li>{@code graph.json}, {@code validation_summary.json}</li>
 * </ul>
 */
@Slf4j
@Component
public class JsonArtifactStore implements ArtifactStore {
    
    private final Path runDirectory;
    private final ObjectMapper objectMapper;
    private final Object liveIndexLock = new Object();
    
    public JsonArtifactStore(ExperimentProperties properties, ObjectMapper objectMapper) {
        this.runDirectory = Paths.get(properties.getRunDir());
        this.objectMapper = objectMapper;
    }
    
    @Override
    public Path runDirectory() {
        return runDirectory;
    }
    
    @Override
    public ChaosWindowLog windowLog(String runId, double failureFraction) {
        return new ChaosWindowLog(runDirectory.resolve(ChaosWindowLog.fileName(failureFraction, runId)), objectMapper);
    }
    
    @Override
    public List<ChaosWindow> loadChaosWindows() {
        List<ChaosWindow> windows = new ArrayList<>();
        for (Path file : list("window_log_*.jsonl")) {
            windows.addAll(ChaosWindowLog.read(file, objectMapper));
        }
        return windows;
    }
    
    @Override
    public Path saveModelEstimate(ModelEstimate estimate) {
        StringBuilder name = new StringBuilder("model_mode")
            .append(estimate.mode().getLabel())
            .append("_p").append(estimate.failureFraction());
        if (!estimate.isAggregate()) {
            name.append('_').append(TargetSpec.safeLabel(estimate.endpoint()));
        }
        return write(runDirectory.resolve(name.append(".json").toString()), estimate);
    }
    
    @Override
    public List<ModelEstimate> loadModelEstimates() {
        List<ModelEstimate> estimates = new ArrayList<>();
        for (Path file : list("model_mode*.json")) {
            estimates.add(read(file, ModelEstimate.class));
        }
        return estimates;
    }
    
    @Override
    public List<ModelEstimate> loadModelEstimates(double failureFraction) {
        return loadModelEstimates().stream()
            .filter(e -> e.failureFraction() == failureFraction)
            .collect(Collectors.toList());
    }
    
    @Override
    public Path saveLiveWindow(LiveWindow window) {
        synchronized (liveIndexLock) {
            String prefix = "live_p" + window.failureFraction() + "_w";
            int index = 0;
            for (Path file : list(prefix + "*.json")) {
                String name = file.getFileName().toString();
                try {
                    int existing = Integer.parseInt(name.substring(prefix.length(), name.length() - ".json".length()));
                    index = Math.max(index, existing + 1);
                } catch (NumberFormatException e) {
                    log.debug("Ignoring unrelated artifact {}", name);
                }
            }
            return write(runDirectory.resolve(prefix + index + ".json"), window);
        }
    }
    
    @Override
    public List<LiveWindow> loadLiveWindows(double failureFraction) {
        List<LiveWindow> windows = new ArrayList<>();
        for (Path file : list("live_p" + failureFraction + "_w*.json")) {
            windows.add(read(file, LiveWindow.class));
        }
        return windows;
    }
    
    @Override
    public Path saveComparison(ComparisonResult result) {
        String name = String.format("comparison_p%s_%s_%s.json", 
            result.failureFraction(), TargetSpec.safeLabel(result.key()), result.scope().label());
        return write(runDirectory.resolve(name), result);
    }
    
    @Override
    public Path saveGraph(DependencyGraph graph) {
        Path path = runDirectory.resolve("graph.json");
        try {
            GraphJson.write(graph, path, objectMapper);
            return path;
        } catch (IOException e) {
            throw new ResilienceException(ErrorCode.SERIALIZATION_ERROR, "Cannot write " + path, e);
        }
    }
    
    @Override
    public Path saveValidation(ValidationSummary summary) {
        return write(runDirectory.resolve("validation_summary.json"), summary);
    }
    
    private Path write(Path path, Object value) {
        try {
            Files.createDirectories(runDirectory);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), value);
            log.debug("Wrote {}", path);
            return path;
        } catch (IOException e) {
            throw new ResilienceException(ErrorCode.SERIALIZATION_ERROR, "Cannot write " + path, e);
        }
    }
    
    private <T> T read(Path path, Class<T> type) {
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new ResilienceException(ErrorCode.SERIALIZATION_ERROR, "Cannot read " + path, e);
        }
    }
    
    private List<Path> list(String glob) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(runDirectory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(runDirectory, glob)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new ResilienceException(ErrorCode.SERIALIZATION_ERROR, "Cannot list " + runDirectory, e);
        }
        files.sort(Comparator.comparing(Path::toString));
        return files;
    }
}
