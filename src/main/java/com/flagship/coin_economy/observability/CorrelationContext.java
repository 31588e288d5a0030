package com.flagship.coin_economy.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation id of the work the current thread is doing, kept in the MDC so that
 * it shows up in every log line and follows {@code MDC.getCopyOfContextMap()} into
 * job worker threads.
 *
 * An id is opened by the HTTP filter (one per request), by each batch job run and
 * by the Kafka consumer (one per record). Outbox events capture the id that was
 * open when they were written and carry it to Kafka as a header.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String WALLET_ID_MDC_KEY = "walletId";
    public static final String JOB_MDC_KEY = "job";

    // Ids end up in outbox rows and Kafka headers; anything else is replaced.
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private CorrelationContext() {
    }

    public static Optional<String> current() {
        return Optional.ofNullable(MDC.get(CORRELATION_ID_MDC_KEY));
    }

    /**
     * The open id, or a fresh one for code running outside any scope.
     */
    public static String currentOrNew() {
        return current().orElseGet(CorrelationContext::newId);
    }

    /**
     * Opens a scope for an id received from a caller. Blank or malformed ids are
     * replaced by a generated one.
     */
    public static Scope begin(String correlationId) {
        return new Scope(isValid(correlationId) ? correlationId : newId(), null);
    }

    /**
     * Opens a scope for one run of a batch job: a fresh id prefixed with the job
     * name, plus the {@code job} MDC key.
     */
    public static Scope beginJob(String jobName) {
        return new Scope(jobName + "-" + newId(), jobName);
    }

    /**
     * Shorter than a full UUID for readability in logs.
     */
    public static String newId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    static boolean isValid(String correlationId) {
        return correlationId != null && VALID_ID.matcher(correlationId).matches();
    }

    /**
     * Restores whatever was open before on close, so scopes nest.
     */
    public static final class Scope implements AutoCloseable {

        private final String correlationId;
        private final String previousCorrelationId;
        private final String previousJob;
        private final boolean jobScope;

        private Scope(String correlationId, String jobName) {
            this.correlationId = correlationId;
            this.previousCorrelationId = MDC.get(CORRELATION_ID_MDC_KEY);
            this.previousJob = MDC.get(JOB_MDC_KEY);
            this.jobScope = jobName != null;
            MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
            if (jobScope) {
                MDC.put(JOB_MDC_KEY, jobName);
            }
        }

        public String getCorrelationId() {
            return correlationId;
        }

        @Override
        public void close() {
            restore(CORRELATION_ID_MDC_KEY, previousCorrelationId);
            if (jobScope) {
                restore(JOB_MDC_KEY, previousJob);
            }
            MDC.remove(TRANSACTION_ID_MDC_KEY);
            MDC.remove(WALLET_ID_MDC_KEY);
        }

        private static void restore(String key, String previous) {
            if (previous != null) {
                MDC.put(key, previous);
            } else {
                MDC.remove(key);
            }
        }
    }
}
