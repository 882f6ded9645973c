package com.flagship.fx_payments.exception;

import java.util.UUID;

/**
 * Another transition on the same payment won the row lock or bumped its version first.
 */
public class ConcurrentTransitionException extends StateTransitionException {

    public ConcurrentTransitionException(UUID paymentId) {
        super("CONCURRENT_MODIFICATION",
            "Payment " + paymentId + " was modified concurrently; reload and retry the action");
    }
}
