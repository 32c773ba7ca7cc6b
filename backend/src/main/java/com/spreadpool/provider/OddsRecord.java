package com.spreadpool.provider;

import java.math.BigDecimal;

/**
 * @param spreadPts magnitude laid by the favorite; null when {@code rawDetails} could not be read
 * @param rawDetails the provider's line text, kept for integrity reporting
 */
public record OddsRecord(String externalId,
                         String favoriteTeam,
                         BigDecimal spreadPts,
                         String rawDetails) implements ProviderRecord {

    @Override
    public Kind kind() {
        return Kind.ODDS;
    }
}
