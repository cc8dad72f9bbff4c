package com.gamefamily.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Wall-clock time of the daily reputation reset.
 * Define under 'family.reputation-reset' in application.yml; out-of-range values fail startup.
 */
@Configuration
@ConfigurationProperties(prefix = "family.reputation-reset")
@Validated
public class ReputationResetProperties {

    private boolean enabled = true;

    @Min(0)
    @Max(23)
    private int hour = 0;

    @Min(0)
    @Max(59)
    private int minute = 0;

    @NotNull
    private ZoneId timezone = ZoneId.of("UTC");

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getHour() { return hour; }
    public void setHour(int hour) { this.hour = hour; }

    public int getMinute() { return minute; }
    public void setMinute(int minute) { this.minute = minute; }

    public ZoneId getTimezone() { return timezone; }
    public void setTimezone(ZoneId timezone) { this.timezone = timezone; }
}
