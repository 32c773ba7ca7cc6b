package com.spreadpool.provider;

/** Per-game box score source used to settle proposition bets. */
public interface GameSummaryClient {

    /**
     * @throws ProviderException permanent failures immediately, transient ones after the
     *         configured attempts are spent
     */
    GameSummary fetchSummary(String eventId);
}
