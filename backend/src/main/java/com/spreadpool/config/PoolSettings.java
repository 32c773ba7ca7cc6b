package com.spreadpool.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Operational flags read once at startup and handed to every component that needs them.
 * Instances are immutable; tests derive variants through the {@code with*} copies.
 */
@Component
public class PoolSettings {

    private final boolean offseason;
    private final boolean allowAnyDayOddsImport;
    private final DayOfWeek oddsImportDay;
    private final ZoneId legacyZone;
    private final ZoneId appZone;
    private final String providerBaseUrl;
    private final String providerSummaryUrl;
    private final Duration providerTimeout;
    private final int providerMaxAttempts;
    private final Duration providerInitialBackoff;
    private final double providerBackoffMultiplier;
    private final Duration providerMaxBackoff;
    private final int defaultSeasonYear;

    @Autowired
    public PoolSettings(@Value("${pool.offseason:false}") boolean offseason,
                        @Value("${pool.odds.allow-any-day:false}") boolean allowAnyDayOddsImport,
                        @Value("${pool.odds.import-day:TUESDAY}") DayOfWeek oddsImportDay,
                        @Value("${pool.time.legacy-zone:America/Los_Angeles}") String legacyZone,
                        @Value("${pool.time.app-zone:America/Los_Angeles}") String appZone,
                        @Value("${pool.provider.base-url:https://site.api.espn.com/apis/site/v2/sports/football/nfl/scoreboard}") String providerBaseUrl,
                        @Value("${pool.provider.summary-url:https://site.api.espn.com/apis/site/v2/sports/football/nfl/summary}") String providerSummaryUrl,
                        @Value("${pool.provider.timeout:PT20S}") Duration providerTimeout,
                        @Value("${pool.provider.max-attempts:3}") int providerMaxAttempts,
                        @Value("${pool.provider.initial-backoff:PT1.5S}") Duration providerInitialBackoff,
                        @Value("${pool.provider.backoff-multiplier:2.0}") double providerBackoffMultiplier,
                        @Value("${pool.provider.max-backoff:PT30S}") Duration providerMaxBackoff,
                        @Value("${pool.season.default-year:2025}") int defaultSeasonYear) {
        this(offseason, allowAnyDayOddsImport, oddsImportDay, ZoneId.of(legacyZone), ZoneId.of(appZone),
                providerBaseUrl, providerSummaryUrl, providerTimeout, providerMaxAttempts, providerInitialBackoff,
                providerBackoffMultiplier, providerMaxBackoff, defaultSeasonYear);
    }

    private PoolSettings(boolean offseason, boolean allowAnyDayOddsImport, DayOfWeek oddsImportDay,
                         ZoneId legacyZone, ZoneId appZone, String providerBaseUrl, String providerSummaryUrl,
                         Duration providerTimeout,
                         int providerMaxAttempts, Duration providerInitialBackoff, double providerBackoffMultiplier,
                         Duration providerMaxBackoff, int defaultSeasonYear) {
        if (providerMaxAttempts < 1) {
            throw new IllegalArgumentException("pool.provider.max-attempts must be >= 1");
        }
        this.offseason = offseason;
        this.allowAnyDayOddsImport = allowAnyDayOddsImport;
        this.oddsImportDay = oddsImportDay;
        this.legacyZone = legacyZone;
        this.appZone = appZone;
        this.providerBaseUrl = providerBaseUrl;
        this.providerSummaryUrl = providerSummaryUrl;
        this.providerTimeout = providerTimeout;
        this.providerMaxAttempts = providerMaxAttempts;
        this.providerInitialBackoff = providerInitialBackoff;
        this.providerBackoffMultiplier = providerBackoffMultiplier;
        this.providerMaxBackoff = providerMaxBackoff;
        this.defaultSeasonYear = defaultSeasonYear;
    }

    public static PoolSettings defaults() {
        return new PoolSettings(false, false, DayOfWeek.TUESDAY,
                ZoneId.of("America/Los_Angeles"), ZoneId.of("America/Los_Angeles"),
                "https://site.api.espn.com/apis/site/v2/sports/football/nfl/scoreboard",
                "https://site.api.espn.com/apis/site/v2/sports/football/nfl/summary",
                Duration.ofSeconds(20), 3, Duration.ofMillis(1500), 2.0, Duration.ofSeconds(30), 2025);
    }

    public PoolSettings withOffseason(boolean value) {
        return new PoolSettings(value, allowAnyDayOddsImport, oddsImportDay, legacyZone, appZone, providerBaseUrl, providerSummaryUrl,
                providerTimeout, providerMaxAttempts, providerInitialBackoff, providerBackoffMultiplier,
                providerMaxBackoff, defaultSeasonYear);
    }

    public PoolSettings withAllowAnyDayOddsImport(boolean value) {
        return new PoolSettings(offseason, value, oddsImportDay, legacyZone, appZone, providerBaseUrl, providerSummaryUrl,
                providerTimeout, providerMaxAttempts, providerInitialBackoff, providerBackoffMultiplier,
                providerMaxBackoff, defaultSeasonYear);
    }

    public PoolSettings withLegacyZone(ZoneId value) {
        return new PoolSettings(offseason, allowAnyDayOddsImport, oddsImportDay, value, appZone, providerBaseUrl, providerSummaryUrl,
                providerTimeout, providerMaxAttempts, providerInitialBackoff, providerBackoffMultiplier,
                providerMaxBackoff, defaultSeasonYear);
    }

    public PoolSettings withProviderMaxAttempts(int value) {
        return new PoolSettings(offseason, allowAnyDayOddsImport, oddsImportDay, legacyZone, appZone, providerBaseUrl, providerSummaryUrl,
                providerTimeout, value, providerInitialBackoff, providerBackoffMultiplier,
                providerMaxBackoff, defaultSeasonYear);
    }

    public PoolSettings withProviderBaseUrl(String value) {
        return new PoolSettings(offseason, allowAnyDayOddsImport, oddsImportDay, legacyZone, appZone, value, providerSummaryUrl,
                providerTimeout, providerMaxAttempts, providerInitialBackoff, providerBackoffMultiplier,
                providerMaxBackoff, defaultSeasonYear);
    }

    public PoolSettings withProviderSummaryUrl(String value) {
        return new PoolSettings(offseason, allowAnyDayOddsImport, oddsImportDay, legacyZone, appZone, providerBaseUrl, value,
                providerTimeout, providerMaxAttempts, providerInitialBackoff, providerBackoffMultiplier,
                providerMaxBackoff, defaultSeasonYear);
    }

    public boolean isOffseason() { return offseason; }
    public boolean isAllowAnyDayOddsImport() { return allowAnyDayOddsImport; }
    public DayOfWeek getOddsImportDay() { return oddsImportDay; }
    public ZoneId getLegacyZone() { return legacyZone; }
    public ZoneId getAppZone() { return appZone; }
    public String getProviderBaseUrl() { return providerBaseUrl; }
    public String getProviderSummaryUrl() { return providerSummaryUrl; }
    public Duration getProviderTimeout() { return providerTimeout; }
    public int getProviderMaxAttempts() { return providerMaxAttempts; }
    public Duration getProviderInitialBackoff() { return providerInitialBackoff; }
    public double getProviderBackoffMultiplier() { return providerBackoffMultiplier; }
    public Duration getProviderMaxBackoff() { return providerMaxBackoff; }
    public int getDefaultSeasonYear() { return defaultSeasonYear; }
}
