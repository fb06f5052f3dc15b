package com.docvault.share;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.regex.Pattern;

/** Coarse device class derived from a User-Agent header. */
public enum DeviceType {
    DESKTOP("desktop"),
    MOBILE("mobile"),
    TABLET("tablet");

    private static final Pattern TABLET_AGENT = Pattern.compile("tablet|ipad|playbook|silk", Pattern.CASE_INSENSITIVE);
    private static final Pattern MOBILE_AGENT = Pattern.compile(
            "mobile|iphone|ipod|android|blackberry|opera|mini|windows\\sce|palm|smartphone|iemobile",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BOT_AGENT = Pattern.compile(
            "bot|crawler|spider|scraper|curl|wget|python|go-http", Pattern.CASE_INSENSITIVE);

    private final String code;

    DeviceType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static DeviceType fromUserAgent(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return DESKTOP;
        }
        if (TABLET_AGENT.matcher(userAgent).find()) {
            return TABLET;
        }
        if (MOBILE_AGENT.matcher(userAgent).find()) {
            return MOBILE;
        }
        return DESKTOP;
    }

    /** Crawlers, scrapers and scripted HTTP clients. A missing agent is not treated as a bot. */
    public static boolean isBot(String userAgent) {
        return userAgent != null && BOT_AGENT.matcher(userAgent).find();
    }
}
