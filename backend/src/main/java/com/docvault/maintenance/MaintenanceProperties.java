package com.docvault.maintenance;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param enabled whether the scheduled sweeps run
 * @param interval delay between the end of one sweep and the start of the next
 * @param accessLogRetention how long share access-log entries are kept
 */
@ConfigurationProperties(prefix = "docvault.maintenance")
public record MaintenanceProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("PT1H") Duration interval,
        @DefaultValue("90d") Duration accessLogRetention) {}
