package com.adpilot.port;

/**
 * Payment provider operations used by the payment retry job.
 */
public interface PaymentGateway {

    /**
     * Re-attempts collection of a failed payment.
     */
    PaymentOutcome retryPayment(String paymentIntentId, String customerId);

    /**
     * Records the payment as definitively failed, e.g. to suspend the subscription.
     */
    void markPaymentFailed(String paymentIntentId, String subscriptionId, String reason);

    record PaymentOutcome(boolean succeeded, String status, String failureMessage) {
    }
}
