package com.spreadpool.service;

import com.spreadpool.config.PoolSettings;
import org.springframework.stereotype.Service;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Single place where wall-clock time enters the engine and where timestamps of
 * doubtful origin are normalized to UTC instants. Deadline and kickoff comparisons
 * elsewhere only ever see {@link Instant}s produced here.
 */
@Service
public class ClockService {

    private final Clock clock;
    private final PoolSettings settings;

    public ClockService(Clock clock, PoolSettings settings) {
        this.clock = clock;
        this.settings = settings;
    }

    public Instant nowUtc() {
        return clock.instant();
    }

    public ZonedDateTime toAppZoned(Instant instant) {
        return instant.atZone(settings.getAppZone());
    }

    public LocalTime toAppLocal(Instant instant) {
        return toAppZoned(instant).toLocalTime();
    }

    public DayOfWeek appDayOfWeek(Instant instant) {
        return toAppZoned(instant).getDayOfWeek();
    }

    /**
     * Reinterprets a stored timestamp of unknown origin as an instant. Values carrying an
     * offset or zone are converted as-is; naive values are read in {@code assumedZone}.
     */
    public Instant coerceLegacy(String raw, ZoneId assumedZone) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("timestamp is blank");
        }
        String s = raw.trim().replace(' ', 'T');
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(s,
                    ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) return ((ZonedDateTime) parsed).toInstant();
            if (parsed instanceof OffsetDateTime) return ((OffsetDateTime) parsed).toInstant();
            return coerceLegacy((LocalDateTime) parsed, assumedZone);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Unparseable timestamp: " + raw, ex);
        }
    }

    public Instant coerceLegacy(String raw) {
        return coerceLegacy(raw, settings.getLegacyZone());
    }

    public Instant coerceLegacy(LocalDateTime naive, ZoneId assumedZone) {
        return naive.atZone(assumedZone).toInstant();
    }

    public Instant coerceLegacy(LocalDateTime naive) {
        return coerceLegacy(naive, settings.getLegacyZone());
    }
}
