package com.pikdrive.booking.service;

import com.pikdrive.booking.client.PaymentGatewayRegistry;
import com.pikdrive.booking.constants.PaymentConstants;
import com.pikdrive.booking.dto.PaymentStatusEntry;
import com.pikdrive.booking.enums.ProviderStatus;
import com.pikdrive.booking.enums.TransactionStatus;
import com.pikdrive.booking.event.PaymentPendingEvent;
import com.pikdrive.booking.model.PaymentTransaction;
import com.pikdrive.booking.repository.PaymentTransactionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Polls providers for transactions that have not reached a final status.
 * <p>
 * Each pending transaction gets one fixed-delay task. A task stops when the
 * transaction is resolved by anyone (poller, webhook, abandon, TTL sweep) or
 * after {@code payment.polling.max-attempts} polls, at which point the
 * transaction is expired. Pending transactions are picked up again on startup.
 */
@Service
@Slf4j
public class PaymentStatusPoller {

    private final PaymentTransactionRepository transactionRepository;
    private final PaymentGatewayRegistry gatewayRegistry;
    private final PaymentOrchestrator paymentOrchestrator;
    private final TaskScheduler taskScheduler;
    private final MeterRegistry meterRegistry;

    private final Duration interval;
    private final int maxAttempts;

    private final Map<String, PollTask> activePolls = new ConcurrentHashMap<>();

    public PaymentStatusPoller(
            PaymentTransactionRepository transactionRepository,
            PaymentGatewayRegistry gatewayRegistry,
            PaymentOrchestrator paymentOrchestrator,
            TaskScheduler taskScheduler,
            MeterRegistry meterRegistry,
            @Value("${payment.polling.interval-seconds:" + PaymentConstants.DEFAULT_POLL_INTERVAL_SECONDS + "}") int intervalSeconds,
            @Value("${payment.polling.max-attempts:" + PaymentConstants.DEFAULT_POLL_MAX_ATTEMPTS + "}") int maxAttempts) {
        this.transactionRepository = transactionRepository;
        this.gatewayRegistry = gatewayRegistry;
        this.paymentOrchestrator = paymentOrchestrator;
        this.taskScheduler = taskScheduler;
        this.meterRegistry = meterRegistry;
        this.interval = Duration.ofSeconds(intervalSeconds);
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    @EventListener
    public void onPaymentPending(PaymentPendingEvent event) {
        startPolling(event.getTransactionId());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumePendingPolls() {
        List<PaymentTransaction> pending = transactionRepository.findByStatusIn(TransactionStatus.ACTIVE);
        if (!pending.isEmpty()) {
            log.info("Resuming status polling for {} open transactions", pending.size());
        }
        for (PaymentTransaction transaction : pending) {
            startPolling(transaction.getTransactionId());
        }
    }

    /**
     * Starts polling unless a poll for the transaction is already running.
     */
    public void startPolling(String transactionId) {
        activePolls.computeIfAbsent(transactionId, id -> {
            PollTask task = new PollTask(id);
            task.future = taskScheduler.scheduleWithFixedDelay(task, Instant.now().plus(interval), interval);
            log.info("Status polling started: transactionId={}, interval={}s, maxAttempts={}",
                    id, interval.getSeconds(), maxAttempts);
            return task;
        });
    }

    /**
     * Applies a terminal status and stops polling. Safe to call for a
     * transaction that is already resolved.
     *
     * @return true when this call resolved the transaction
     */
    public boolean resolve(String transactionId, TransactionStatus terminalStatus, String reason) {
        boolean applied = paymentOrchestrator.reconcile(transactionId, terminalStatus, reason);
        stopPolling(transactionId);
        return applied;
    }

    /**
     * Rider gave up on the open payment: expire it and release the unpaid seats.
     */
    public PaymentStatusEntry abandon(String bookingId) {
        Optional<PaymentTransaction> active = transactionRepository.findByActiveBookingId(bookingId);
        if (active.isPresent()) {
            log.info("Abandoning payment: bookingId={}, transactionId={}", bookingId, active.get().getTransactionId());
            resolve(active.get().getTransactionId(), TransactionStatus.EXPIRED, PaymentConstants.REASON_ABANDONED);
        } else {
            log.info("No open payment to abandon: bookingId={}", bookingId);
        }
        return paymentOrchestrator.getPaymentStatus(bookingId);
    }

    public boolean isPolling(String transactionId) {
        return activePolls.containsKey(transactionId);
    }

    private void stopPolling(String transactionId) {
        PollTask task = activePolls.remove(transactionId);
        if (task != null && task.future != null) {
            task.future.cancel(false);
            log.debug("Status polling stopped: transactionId={}, attempts={}", transactionId, task.attempts);
        }
    }

    void poll(PollTask task) {
        String transactionId = task.transactionId;
        task.attempts++;

        Optional<PaymentTransaction> transaction = transactionRepository.findById(transactionId);
        if (transaction.isEmpty() || transaction.get().getStatus().isTerminal()) {
            stopPolling(transactionId);
            return;
        }

        ProviderStatus status = queryProvider(transaction.get());
        meterRegistry.counter("payment.poll.total", "result", status.name().toLowerCase()).increment();

        if (status.isTerminal()) {
            log.info("Provider reported final status: transactionId={}, status={}, attempt={}",
                    transactionId, status, task.attempts);
            resolve(transactionId, status.toTransactionStatus(), "Provider reported " + status.name().toLowerCase());
        } else if (task.attempts >= maxAttempts) {
            log.warn("Polling exhausted, expiring transaction: transactionId={}, attempts={}",
                    transactionId, task.attempts);
            resolve(transactionId, TransactionStatus.EXPIRED, PaymentConstants.REASON_POLL_EXHAUSTED);
        }
    }

    private ProviderStatus queryProvider(PaymentTransaction transaction) {
        if (transaction.getExternalReference() == null) {
            return ProviderStatus.UNKNOWN;
        }
        return gatewayRegistry.get(transaction.getProvider()).queryStatus(transaction.getExternalReference());
    }

    final class PollTask implements Runnable {

        private final String transactionId;
        private volatile ScheduledFuture<?> future;
        private volatile int attempts;

        PollTask(String transactionId) {
            this.transactionId = transactionId;
        }

        @Override
        public void run() {
            try {
                poll(this);
            } catch (RuntimeException e) {
                // keep the schedule alive; the next tick retries the read or the reconcile
                log.error("Status poll failed: transactionId={}, attempt={}, error={}",
                        transactionId, attempts, e.getMessage(), e);
            }
        }
    }
}
