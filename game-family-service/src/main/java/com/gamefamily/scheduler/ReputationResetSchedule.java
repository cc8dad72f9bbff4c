package com.gamefamily.scheduler;

import com.gamefamily.config.ReputationResetProperties;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Daily wall-clock fire time in a fixed zone.
 */
public class ReputationResetSchedule {

    private final LocalTime fireTime;
    private final ZoneId zone;

    public ReputationResetSchedule(int hour, int minute, ZoneId zone) {
        this.fireTime = LocalTime.of(hour, minute);
        this.zone = zone;
    }

    public static ReputationResetSchedule from(ReputationResetProperties properties) {
        return new ReputationResetSchedule(properties.getHour(), properties.getMinute(), properties.getTimezone());
    }

    /**
     * Today's fire time if {@code now} is still before it, otherwise the same wall-clock time tomorrow.
     * A fire time skipped by a DST gap moves forward by the length of the gap.
     */
    public Instant nextFireTime(Instant now) {
        ZonedDateTime current = now.atZone(zone);
        ZonedDateTime today = current.toLocalDate().atTime(fireTime).atZone(zone);
        if (current.isBefore(today)) {
            return today.toInstant();
        }
        return current.toLocalDate().plusDays(1).atTime(fireTime).atZone(zone).toInstant();
    }

    @Override
    public String toString() {
        return fireTime + " " + zone;
    }
}
