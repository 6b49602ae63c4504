package com.eyelevel.uploadqueue.common.time;

import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Reads wall-clock time from a Reactor {@link Scheduler}, so timers and deadline checks share one clock
 * (and tests can replace both with a virtual one).
 */
public final class SchedulerClock {

    private SchedulerClock() {
    }

    public static Instant now(final Scheduler scheduler) {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }
}
