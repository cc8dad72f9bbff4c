package com.gamefamily.scheduler;

import com.gamefamily.config.ReputationResetProperties;
import com.gamefamily.model.BatchResetResult;
import com.gamefamily.service.FamilyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs the daily reputation reset for the lifetime of the application context.
 */
@Component
public class ReputationResetScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ReputationResetScheduler.class);

    private final FamilyService familyService;
    private final TaskScheduler taskScheduler;
    private final ReputationResetProperties properties;
    private final Clock clock;

    private volatile ScheduledFuture<?> future;

    public ReputationResetScheduler(FamilyService familyService,
                                    @Qualifier("reputationResetTaskScheduler") TaskScheduler taskScheduler,
                                    ReputationResetProperties properties,
                                    Clock clock) {
        this.familyService = familyService;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (!properties.isEnabled()) {
            log.info("Daily reputation reset is disabled");
            return;
        }
        if (future != null) {
            return;
        }
        ReputationResetSchedule schedule = ReputationResetSchedule.from(properties);
        future = taskScheduler.schedule(this::runReset, new ReputationResetTrigger(schedule, clock));
        log.info("Daily reputation reset scheduled at {}, next run {}", schedule, schedule.nextFireTime(clock.instant()));
    }

    @Override
    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
            log.info("Daily reputation reset stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return future != null;
    }

    /**
     * One reset. Never throws, so a failed run leaves the schedule in place.
     */
    void runReset() {
        try {
            BatchResetResult result = familyService.resetDailyRep();
            log.info("Daily reputation reset at {} cleared {} members", result.resetTime(), result.affectedCount());
        } catch (RuntimeException e) {
            // FamilyService has already reported the failure as an event.
            log.error("Daily reputation reset at {} failed, will retry at the next scheduled time", clock.instant(), e);
        }
    }
}
