package com.prediction.market.settlement_engine.error;

/**
 * Thrown by every failing operation. Carries exactly one {@link SettlementError};
 * the host discards all staged effects of the invocation when it sees one.
 */
public class SettlementException extends RuntimeException {

    private final SettlementError error;

    public SettlementException(SettlementError error) {
        super(String.format("%s (code %d)", error, error.getCode()));
        this.error = error;
    }

    public SettlementException(SettlementError error, String detail) {
        super(String.format("%s (code %d): %s", error, error.getCode(), detail));
        this.error = error;
    }

    public SettlementError getError() {
        return error;
    }

    public int getCode() {
        return error.getCode();
    }
}
