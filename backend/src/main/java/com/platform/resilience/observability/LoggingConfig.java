package com.platform.resilience.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Logging configuration and MDC helpers for experiment correlation.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_WINDOW_ID = "windowId";
    public static final String MDC_FAILURE_FRACTION = "pFail";
    public static final String MDC_MODE = "mode";
    
    @Value("${spring.application.name:resilience-lab}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);

        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Set window context for a chaos window.
     */
    public static void setWindowContext(String runId, int windowId, double failureFraction) {
        MDC.put(MDC_RUN_ID, runId);
        MDC.put(MDC_WINDOW_ID, String.valueOf(windowId));
        MDC.put(MDC_FAILURE_FRACTION, String.valueOf(failureFraction));
    }
    
    /**
     * Clear window context.
     */
    public static void clearWindowContext() {
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_WINDOW_ID);
        MDC.remove(MDC_FAILURE_FRACTION);
    }
    
    /**
     * Set model context for a simulation.
     */
    public static void setModelContext(String mode, double failureFraction) {
        MDC.put(MDC_MODE, mode);
        MDC.put(MDC_FAILURE_FRACTION, String.valueOf(failureFraction));
    }
    
    /**
     * Clear model context.
     */
    public static void clearModelContext() {
        MDC.remove(MDC_MODE);
        MDC.remove(MDC_FAILURE_FRACTION);
    }
}
