package com.flagship.finance_ledger.payment;

import lombok.extern.slf4j.Slf4j;

/**
 * Gateway used when no processor integration is registered. Every charge is declined
 * with a non-retryable error code.
 */
@Slf4j
public class UnconfiguredPaymentGateway implements PaymentGateway {

    public static final String ERROR_CODE = "gateway_not_configured";

    @Override
    public GatewayResponse charge(GatewayChargeRequest request) {
        log.error("No payment gateway configured; declining charge for payment {} on processor {}",
            request.getPaymentId(), request.getProcessorKey());
        return GatewayResponse.declined(ERROR_CODE, "No payment gateway configured");
    }
}
