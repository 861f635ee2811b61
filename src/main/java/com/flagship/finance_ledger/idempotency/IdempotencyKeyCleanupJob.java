package com.flagship.finance_ledger.idempotency;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background sweep that removes expired idempotency keys from every organization.
 *
 * Expired keys already behave as absent, so the sweep has no ordering requirement relative
 * to key generation or use. Its job is storage: each organization's key history is rewritten
 * as a snapshot of its live keys.
 */
@Component
@ConditionalOnProperty(name = "ledger.idempotency.cleanup.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class IdempotencyKeyCleanupJob {

    private final IdempotencyService idempotencyService;

    @Scheduled(fixedDelayString = "${ledger.idempotency.cleanup.interval-ms:300000}")
    public void sweepExpiredKeys() {
        try {
            int removed = idempotencyService.cleanupAllExpiredKeys();
            if (removed > 0) {
                log.info("Idempotency sweep removed {} expired key(s)", removed);
            }
        } catch (Exception e) {
            log.error("Error in idempotency key sweep", e);
        }
    }
}
