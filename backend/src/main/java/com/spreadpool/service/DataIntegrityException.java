package com.spreadpool.service;

/**
 * A single provider record or stored row that violates a domain rule (negative spread,
 * missing kickoff, favorite outside the matchup). Handled per record; never aborts a job.
 */
public class DataIntegrityException extends RuntimeException {
    private final String externalId;

    public DataIntegrityException(String externalId, String message) {
        super(message);
        this.externalId = externalId;
    }

    public String getExternalId() { return externalId; }
}
