package com.vigil.service.core.engine;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

/**
 * Runs a task at most once per cooldown, on the trailing edge: the first trigger arms a timer, triggers
 * while it is armed are absorbed, and the task runs once when the cooldown has elapsed.
 */
@Slf4j
public class TrailingThrottle {
    private final String name;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration cooldown;
    private final Runnable task;
    private final AtomicBoolean pending = new AtomicBoolean();

    public TrailingThrottle(String name, TaskScheduler scheduler, Clock clock, Duration cooldown, Runnable task) {
        this.name = name;
        this.scheduler = scheduler;
        this.clock = clock;
        this.cooldown = cooldown;
        this.task = task;
    }

    /** @return true if this call armed the timer, false if a run was already pending */
    public boolean trigger() {
        if (!pending.compareAndSet(false, true)) {
            return false;
        }
        try {
            scheduler.schedule(this::fire, clock.instant().plus(cooldown));
            log.debug("Scheduled {} in {}", name, cooldown);
            return true;
        } catch (TaskRejectedException e) {
            pending.set(false);
            log.warn("Could not schedule {}", name, e);
            return false;
        }
    }

    public boolean isPending() {
        return pending.get();
    }

    void fire() {
        pending.set(false);
        try {
            task.run();
        } catch (RuntimeException e) {
            log.warn("{} failed", name, e);
        }
    }
}
