package com.libauto.internal;

import com.libauto.AutomationService;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Ties {@link AutomationService} to the application context: initialized after
 * every other bean has started, shut down before any of them stops.
 */
@Component
public class AutomationLifecycle implements SmartLifecycle {

    private final AutomationService automationService;
    private volatile boolean running = false;

    public AutomationLifecycle(AutomationService automationService) {
        this.automationService = automationService;
    }

    @Override
    public void start() {
        automationService.initialize();
        running = true;
    }

    @Override
    public void stop() {
        try {
            automationService.shutdown();
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
