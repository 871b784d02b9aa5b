package com.adpilot.worker;

import com.adpilot.error.ConfigurationException;
import com.adpilot.error.FailureKind;
import com.adpilot.port.PaymentGateway;
import com.adpilot.port.PaymentGateway.PaymentOutcome;
import com.adpilot.queue.JobClient;
import com.adpilot.queue.JobOptions;
import com.adpilot.queue.JobPayloads.Payment;
import com.adpilot.queue.JobResult;
import com.adpilot.queue.JobType;
import com.adpilot.queue.JobWorker;
import com.adpilot.queue.annotation.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Re-attempts a failed payment. Each failed attempt schedules the next one itself, {@code 2^n} seconds
 * later, until {@link #MAX_RETRIES} attempts were made; then the payment is marked as failed.
 */
@Component
@Job(JobType.PAYMENT_RETRY)
public class PaymentRetryWorker implements JobWorker<Payment> {

    private static final Logger log = LoggerFactory.getLogger(PaymentRetryWorker.class);

    public static final int MAX_RETRIES = 3;

    private final ObjectProvider<PaymentGateway> gateway;
    private final JobClient jobClient;

    public PaymentRetryWorker(ObjectProvider<PaymentGateway> gateway, JobClient jobClient) {
        this.gateway = gateway;
        this.jobClient = jobClient;
    }

    @Override
    public JobResult process(UUID jobId, Payment payload) {
        int attempt = payload.retryCount() + 1;
        if (payload.retryCount() < 0 || attempt > MAX_RETRIES) {
            return JobResult.failed(FailureKind.VALIDATION, "Payment retry limit exceeded (" + MAX_RETRIES + ")");
        }
        PaymentGateway paymentGateway = gateway.getIfAvailable();
        if (paymentGateway == null) {
            throw new ConfigurationException("No PaymentGateway configured");
        }

        log.info("Retrying payment {} (attempt {}/{})", payload.paymentIntentId(), attempt, MAX_RETRIES);
        PaymentOutcome outcome = paymentGateway.retryPayment(payload.paymentIntentId(), payload.customerId());
        if (outcome.succeeded()) {
            log.info("Payment retry succeeded for {}", payload.paymentIntentId());
            return JobResult.success(Map.of("status", String.valueOf(outcome.status()), "retryCount", attempt));
        }

        String reason = outcome.failureMessage() != null ? outcome.failureMessage() : String.valueOf(outcome.status());
        if (attempt < MAX_RETRIES) {
            Duration delay = Duration.ofSeconds(1L << attempt);
            Payment next = new Payment(payload.paymentIntentId(), payload.amount(), payload.currency(),
                    payload.customerId(), payload.subscriptionId(), attempt);
            UUID followUp = jobClient.enqueue(JobType.PAYMENT_RETRY, next,
                    JobOptions.defaults().withDelay(delay).withMaxAttempts(1));
            log.warn("Payment retry {} failed for {}: {}; next attempt {} in {}s", attempt,
                    payload.paymentIntentId(), reason, followUp, delay.toSeconds());
            return JobResult.success(Map.of("status", "RETRY_SCHEDULED", "retryCount", attempt,
                    "nextJobId", followUp.toString()));
        }

        log.error("Final payment retry failed for {}: {}", payload.paymentIntentId(), reason);
        paymentGateway.markPaymentFailed(payload.paymentIntentId(), payload.subscriptionId(), reason);
        return JobResult.failed(FailureKind.PERMANENT, "Payment retry failed: " + reason);
    }
}
