package io.github.riemr.voucher.application.exception;

/**
 * The active-employee roster is missing or has no identifier column; no ledger
 * can be produced.
 */
public class RosterUnavailableException extends RuntimeException {

    public RosterUnavailableException(String message) {
        super(message);
    }
}
