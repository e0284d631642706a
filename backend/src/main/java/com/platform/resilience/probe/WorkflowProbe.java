package com.platform.resilience.probe;

import com.platform.resilience.config.ProbeProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered request sequence counted as a single probe. A plain target is a one-step workflow.
 */
public record WorkflowProbe(String label, List<ProbeTarget> steps) {
    
    public WorkflowProbe {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("workflow " + label + " has no steps");
        }
        steps = List.copyOf(steps);
    }
    
    public static WorkflowProbe single(ProbeTarget target) {
        return new WorkflowProbe(target.label(), List.of(target));
    }
    
    public static WorkflowProbe from(ProbeProperties.Workflow workflow) {
        List<ProbeTarget> steps = new ArrayList<>();
        workflow.getSteps().forEach(step -> steps.add(ProbeTarget.from(step)));
        return new WorkflowProbe(workflow.getLabel(), steps);
    }
}
