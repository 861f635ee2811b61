package com.flagship.finance_ledger.payment;

import lombok.Value;

/**
 * Outcome of one charge attempt.
 */
@Value
public class GatewayResponse {
    boolean successful;
    String transactionId;
    String errorCode;
    String errorMessage;

    public static GatewayResponse approved(String transactionId) {
        return new GatewayResponse(true, transactionId, null, null);
    }

    public static GatewayResponse declined(String errorCode, String errorMessage) {
        return new GatewayResponse(false, null, errorCode, errorMessage);
    }
}
