package com.gamefamily.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Topic names for inbound commands and outbound events.
 * Define under 'family.kafka.topics' in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "family.kafka.topics")
public class KafkaTopicsProperties {

    private String commands = "family-commands";
    private String status = "family-status-events";
    private String reputation = "family-reputation-events";
    private String errors = "family-error-events";

    public String getCommands() { return commands; }
    public void setCommands(String commands) { this.commands = commands; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getReputation() { return reputation; }
    public void setReputation(String reputation) { this.reputation = reputation; }

    public String getErrors() { return errors; }
    public void setErrors(String errors) { this.errors = errors; }
}
