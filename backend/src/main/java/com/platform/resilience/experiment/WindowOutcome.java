package com.platform.resilience.experiment;

import com.platform.resilience.chaos.ChaosWindow;
import com.platform.resilience.probe.LiveWindow;

/**
 * A chaos window together with the live measurement taken during its outage.
 */
public record WindowOutcome(ChaosWindow chaos, LiveWindow live) {
}
