package com.docvault.share;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param baseUrl origin that share URLs are built on
 * @param defaultExpiration lifetime of a share created without an explicit expiry
 * @param maxExpiration longest lifetime a share may be given, at creation or by extension
 */
@ConfigurationProperties(prefix = "docvault.sharing")
public record SharingProperties(
        @DefaultValue("http://localhost:8080") String baseUrl,
        @DefaultValue("30d") Duration defaultExpiration,
        @DefaultValue("365d") Duration maxExpiration) {}
