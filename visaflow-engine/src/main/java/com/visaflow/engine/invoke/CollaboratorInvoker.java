package com.visaflow.engine.invoke;

import com.visaflow.core.exception.CollaboratorUnavailableException;
import com.visaflow.core.exception.VisaflowException;
import com.visaflow.core.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Calls stores and external collaborators with a deadline and a retry policy.
 * <p>
 * Each call runs on a dedicated pool so a hung collaborator never blocks the caller
 * past the timeout. Failures are retried with the policy's backoff; when attempts run
 * out, the last failure surfaces as {@link CollaboratorUnavailableException}.
 * Domain exceptions other than {@code CollaboratorUnavailableException} are thrown
 * immediately without retry.
 * <p>
 * Store writes go through {@link #runToCompletion}: a timed out attempt cannot be
 * cancelled once started, so a write is never abandoned while it may still land.
 */
public class CollaboratorInvoker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorInvoker.class);

    private final Duration timeout;
    private final ExecutorService executor;

    public CollaboratorInvoker(Duration timeout) {
        this.timeout = timeout;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "visaflow-collaborator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Run a call once, within the timeout.
     */
    public <T> T call(String collaborator, Supplier<T> call) {
        return call(collaborator, RetryPolicy.noRetry(), call);
    }

    /**
     * Run a call under a retry policy.
     *
     * @param collaborator name used in logs and errors
     * @param policy       retry behavior
     * @param call         the call to make
     * @return the call result
     * @throws CollaboratorUnavailableException when every attempt failed or timed out
     */
    public <T> T call(String collaborator, RetryPolicy policy, Supplier<T> call) {
        return withRetry(collaborator, policy, () -> attemptOnce(collaborator, call));
    }

    /**
     * Run a call that returns nothing under a retry policy.
     */
    public void run(String collaborator, RetryPolicy policy, Runnable call) {
        call(collaborator, policy, () -> {
            call.run();
            return null;
        });
    }

    /**
     * Run a write on the calling thread, without a deadline, under a retry policy.
     * Only failed attempts are retried; an attempt that is slow is waited for.
     *
     * @throws CollaboratorUnavailableException when every attempt failed
     */
    public void runToCompletion(String collaborator, RetryPolicy policy, Runnable call) {
        withRetry(collaborator, policy, () -> {
            try {
                call.run();
                return null;
            } catch (VisaflowException | IllegalArgumentException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new CollaboratorUnavailableException(collaborator, String.valueOf(e.getMessage()), e);
            }
        });
    }

    private <T> T withRetry(String collaborator, RetryPolicy policy, Supplier<T> attempt) {
        int attemptNumber = 1;
        while (true) {
            try {
                return attempt.get();
            } catch (CollaboratorUnavailableException e) {
                if (!policy.hasMoreAttempts(attemptNumber)) {
                    log.error("{} failed after {} attempt(s): {}", collaborator, attemptNumber, e.getMessage());
                    throw e;
                }
                Duration backoff = policy.computeBackoff(attemptNumber);
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                    collaborator, attemptNumber, policy.maxAttempts(), backoff.toMillis(), e.getMessage());
                sleep(collaborator, backoff);
                attemptNumber++;
            }
        }
    }

    private <T> T attemptOnce(String collaborator, Supplier<T> call) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = CompletableFuture.supplyAsync(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return call.get();
            } finally {
                MDC.clear();
            }
        }, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CollaboratorUnavailableException(collaborator,
                "no response within " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CollaboratorUnavailableException(collaborator, "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VisaflowException || cause instanceof IllegalArgumentException) {
                throw (RuntimeException) cause;
            }
            String message = cause != null ? cause.getMessage() : e.getMessage();
            throw new CollaboratorUnavailableException(collaborator, String.valueOf(message), cause);
        }
    }

    private void sleep(String collaborator, Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorUnavailableException(collaborator, "interrupted during retry backoff", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
