package com.mikov.accountvalidator.probe;

/**
 * A remote probe call that failed or did not answer within its timeout.
 */
public class ProbeFailureException extends RuntimeException {

    private final boolean timedOut;

    public ProbeFailureException(final String message, final boolean timedOut, final Throwable cause) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isFatal() {
        return ProbeErrorCode.isFatal(getMessage());
    }

    /**
     * Code inferred from the underlying failure including its type, so a transport
     * error such as {@code SocketTimeoutException: Read timed out} still reads as a timeout.
     */
    public ProbeErrorCode getErrorCode() {
        final var cause = getCause();
        return ProbeErrorCode.fromMessage(timedOut || cause == null ? getMessage() : cause.toString());
    }
}
