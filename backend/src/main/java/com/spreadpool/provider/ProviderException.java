package com.spreadpool.provider;

public class ProviderException extends RuntimeException {

    public enum Kind { TRANSIENT, PERMANENT }

    private final Kind kind;
    private final boolean exhaustedRetries;
    private final Integer httpStatus;

    public ProviderException(Kind kind, String message, Integer httpStatus, Throwable cause) {
        this(kind, false, message, httpStatus, cause);
    }

    private ProviderException(Kind kind, boolean exhaustedRetries, String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.exhaustedRetries = exhaustedRetries;
        this.httpStatus = httpStatus;
    }

    public static ProviderException transientFailure(String message, Integer httpStatus, Throwable cause) {
        return new ProviderException(Kind.TRANSIENT, message, httpStatus, cause);
    }

    public static ProviderException permanentFailure(String message, Integer httpStatus, Throwable cause) {
        return new ProviderException(Kind.PERMANENT, message, httpStatus, cause);
    }

    /** The permanent error surfaced once every attempt failed transiently. */
    public static ProviderException exhausted(int attempts, ProviderException last) {
        return new ProviderException(Kind.PERMANENT, true,
                "Provider failed after " + attempts + " attempt(s): " + last.getMessage(),
                last.getHttpStatus(), last);
    }

    public Kind getKind() { return kind; }
    public boolean isTransient() { return kind == Kind.TRANSIENT; }
    public boolean isExhaustedRetries() { return exhaustedRetries; }
    public Integer getHttpStatus() { return httpStatus; }
}
