package com.elssolution.powermonitor.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Catches whatever escapes a scheduler, poll-worker or JVM thread and turns it
 * into an {@link AlertService#UNCAUGHT} alert. Silent once the context closes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    private final AlertService alerts;

    private volatile boolean closing;

    @PostConstruct
    void install() {
        Thread.setDefaultUncaughtExceptionHandler(this);
    }

    @EventListener(ContextClosedEvent.class)
    public void onClose() {
        closing = true;
    }

    @Override
    public void uncaughtException(Thread thread, Throwable error) {
        if (closing) return;
        log.error("thread_died name={} err={}", thread.getName(), error.toString(), error);
        alerts.raise(AlertService.UNCAUGHT, thread.getName() + " died: " + error, AlertService.Severity.CRITICAL);
    }
}
