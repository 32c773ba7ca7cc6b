package com.spreadpool.provider;

import com.spreadpool.model.GameStatus;

import java.time.Instant;

/**
 * @param unresolvedTeam true when either side is a placeholder or an unknown name passed through verbatim
 */
public record ScheduleRecord(String externalId,
                             String homeTeam,
                             String awayTeam,
                             Instant kickoff,
                             GameStatus status,
                             boolean unresolvedTeam) implements ProviderRecord {

    @Override
    public Kind kind() {
        return Kind.SCHEDULE;
    }
}
