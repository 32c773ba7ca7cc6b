package com.spreadpool.provider;

/**
 * One event of a scoreboard payload as read off the wire, before any name resolution
 * or type checking. Fields are null when the payload omits them.
 */
public record ScoreboardEvent(String id,
                              String date,
                              String state,
                              Boolean completed,
                              String homeName,
                              String homeAbbreviation,
                              String homeScore,
                              String awayName,
                              String awayAbbreviation,
                              String awayScore,
                              String oddsDetails) {
}
