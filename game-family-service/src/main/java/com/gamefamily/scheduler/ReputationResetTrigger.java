package com.gamefamily.scheduler;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Clock;
import java.time.Instant;

/**
 * Spring trigger for the daily reset. The next fire is computed from the later of the clock and the
 * previous scheduled time, so a fire that ran early by clock skew is not repeated the same day.
 */
public class ReputationResetTrigger implements Trigger {

    private final ReputationResetSchedule schedule;
    private final Clock clock;

    public ReputationResetTrigger(ReputationResetSchedule schedule, Clock clock) {
        this.schedule = schedule;
        this.clock = clock;
    }

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
        Instant now = clock.instant();
        Instant lastScheduled = triggerContext.lastScheduledExecution();
        Instant from = lastScheduled != null && lastScheduled.isAfter(now) ? lastScheduled : now;
        return schedule.nextFireTime(from);
    }
}
