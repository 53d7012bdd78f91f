package com.company.silencing.config;

import com.company.silencing.service.ManagerState;
import com.company.silencing.service.SilenceManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts the silence manager once the context is refreshed and stops it on shutdown.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "silencing.manager.auto-start",
        havingValue = "true",
        matchIfMissing = true
)
public class SilenceManagerLifecycle implements SmartLifecycle {

    private final SilenceManager silenceManager;

    @Override
    public void start() {
        log.info("Auto-starting silence manager");
        silenceManager.start();
    }

    @Override
    public void stop() {
        silenceManager.stop();
    }

    @Override
    public boolean isRunning() {
        return silenceManager.getState() == ManagerState.RUNNING;
    }
}
