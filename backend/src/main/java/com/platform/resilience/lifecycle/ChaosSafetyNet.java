package com.platform.resilience.lifecycle;

import com.platform.resilience.chaos.StoppedContainers;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Restores containers still held stopped when the application shuts down mid-window.
 * 
 * Backs up the per-window try-with-resources restore for the exit paths it cannot cover:
 * context close while a window is cooling, and JVM termination signals.
 */
@Slf4j
@Component
public class ChaosSafetyNet implements ApplicationListener<ContextClosedEvent> {
    
    private final Set<StoppedContainers> held = ConcurrentHashMap.newKeySet();
    
    private Thread shutdownHook;
    
    /**
     * Install the JVM shutdown hook. Repeated calls keep the single hook already installed.
     */
    @PostConstruct
    public synchronized void installShutdownHook() {
        if (shutdownHook != null) {
            return;
        }
        shutdownHook = new Thread(this::restoreAll, "chaos-safety-net");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }
    
    /**
     * Remove the JVM shutdown hook once the context is gone; the context close event has
     * already restored anything held.
     */
    @PreDestroy
    public synchronized void removeShutdownHook() {
        if (shutdownHook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, leaving safety net hook in place");
        }
        shutdownHook = null;
    }
    
    public synchronized boolean isShutdownHookInstalled() {
        return shutdownHook != null;
    }
    
    public void register(StoppedContainers stopped) {
        held.add(stopped);
    }
    
    public void unregister(StoppedContainers stopped) {
        held.remove(stopped);
    }
    
    public int heldCount() {
        return held.size();
    }
    
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        restoreAll();
    }
    
    /**
     * Restore every registered kill set.
     */
    public void restoreAll() {
        if (held.isEmpty()) {
            return;
        }
        List<StoppedContainers> pending = List.copyOf(held);
        log.warn("Shutdown with {} kill set(s) still stopped, restoring", pending.size());
        for (StoppedContainers stopped : pending) {
            try {
                stopped.close();
            } catch (RuntimeException e) {
                log.error("Emergency restore failed for {}: {}", stopped.victims(), e.getMessage(), e);
            }
        }
    }
}
