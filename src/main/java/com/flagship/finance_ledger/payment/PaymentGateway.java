package com.flagship.finance_ledger.payment;

/**
 * Card processor integration.
 *
 * Declines and processor errors come back as a failed {@link GatewayResponse} carrying the
 * processor's error code. A thrown exception is treated as a connection error.
 */
public interface PaymentGateway {

    GatewayResponse charge(GatewayChargeRequest request);
}
