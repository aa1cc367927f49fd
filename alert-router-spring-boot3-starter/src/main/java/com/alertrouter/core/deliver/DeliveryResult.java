package com.alertrouter.core.deliver;

import com.alertrouter.exception.TransientDeliveryException;

import java.util.List;

/**
 * 一次批次投递的结果
 */
public final class DeliveryResult {

    private final int attempted;

    private final List<TransientDeliveryException> failures;

    public DeliveryResult(int attempted, List<TransientDeliveryException> failures) {
        this.attempted = attempted;
        this.failures = List.copyOf(failures);
    }

    public static DeliveryResult nothing() {
        return new DeliveryResult(0, List.of());
    }

    public int getAttempted() {
        return attempted;
    }

    public List<TransientDeliveryException> getFailures() {
        return failures;
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }
}
