package com.spreadpool.provider;

/**
 * Canonical record produced at the provider boundary. Each payload kind has its own
 * variant so business code never inspects loosely typed provider fields.
 */
public interface ProviderRecord {

    enum Kind { SCHEDULE, SCORE, ODDS }

    Kind kind();

    String externalId();
}
