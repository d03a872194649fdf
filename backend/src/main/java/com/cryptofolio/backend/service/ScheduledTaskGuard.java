package com.cryptofolio.backend.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps a failing scheduled job from killing its scheduler thread; the failure is logged and
 * counted instead.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final MeterRegistry meterRegistry;

    public boolean run(String taskName, Runnable task) {
        try {
            task.run();
            return true;
        } catch (Exception e) {
            log.error("Scheduled task failed task={}", taskName, e);
            meterRegistry.counter("scheduled_task_failures_total", "task", taskName).increment();
            return false;
        }
    }
}
