package com.socialnet.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks consecutive connectivity failures of the background loops (dispatcher
 * and scheduler) and terminates the process once they reach the threshold.
 *
 * Any successful loop iteration resets the count. Failures that are not about
 * reaching the database or the broker are logged by the caller and not counted.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConnectivityGuard {

    private final ProcessTerminator processTerminator;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    @Value("${app.jobs.fatal-after-consecutive-failures:10}")
    private int threshold;

    public void recordSuccess() {
        int previous = consecutiveFailures.getAndSet(0);
        if (previous > 0) {
            log.info("Connectivity restored after {} consecutive failures", previous);
        }
    }

    /**
     * Record a failed loop iteration.
     *
     * @param loop name of the loop, for logging
     * @param failure the exception raised
     * @return true if the failure counted as a connectivity failure
     */
    public boolean recordFailure(String loop, Throwable failure) {
        if (!isConnectivityFailure(failure)) {
            return false;
        }
        int failures = consecutiveFailures.incrementAndGet();
        log.warn("Connectivity failure in {}: consecutive={}/{}, error={}",
                loop, failures, threshold, failure.getMessage());
        if (threshold > 0 && failures >= threshold) {
            processTerminator.terminate(String.format("%d consecutive connectivity failures, last in %s: %s",
                    failures, loop, failure.getMessage()));
        }
        return true;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    static boolean isConnectivityFailure(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof DataAccessResourceFailureException
                    || current instanceof TransientDataAccessResourceException
                    || current instanceof CannotCreateTransactionException
                    || current instanceof AmqpConnectException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
