package edu.stanford.futuredata.uniquery.utilities;

import edu.stanford.futuredata.uniquery.interfaces.RequestRetryPolicy;
import edu.stanford.futuredata.uniquery.model.QueryResult;

import java.time.Duration;
import java.util.Optional;

/**
 * Retries requests the server rejected for exceeding throughput (429), honoring its retry-after hint.
 */
public class ThrottlingRetryPolicy implements RequestRetryPolicy {
    public static final int TOO_MANY_REQUESTS = 429;

    public static int defaultMaxAttempts = 9;
    public static long defaultBackoffMillis = 100;

    private final int maxAttempts;
    private final long backoffMillis;

    public ThrottlingRetryPolicy() {
        this(defaultMaxAttempts, defaultBackoffMillis);
    }

    public ThrottlingRetryPolicy(int maxAttempts, long backoffMillis) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.backoffMillis = backoffMillis;
    }

    @Override
    public Optional<Duration> shouldRetry(QueryResult.Failure failure, int attempt) {
        if (failure.statusCode != TOO_MANY_REQUESTS || attempt >= maxAttempts) {
            return Optional.empty();
        }
        long retryAfter = failure.headers == null ? 0 : failure.headers.retryAfterMillis;
        return Optional.of(Duration.ofMillis(retryAfter > 0 ? retryAfter : backoffMillis));
    }
}
