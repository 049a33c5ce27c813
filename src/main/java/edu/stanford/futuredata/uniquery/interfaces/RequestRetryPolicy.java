package edu.stanford.futuredata.uniquery.interfaces;

import edu.stanford.futuredata.uniquery.model.QueryResult;

import java.time.Duration;
import java.util.Optional;

public interface RequestRetryPolicy {
    // How long to wait before retrying after this failure, or empty to give up.  Attempts count from 1.
    Optional<Duration> shouldRetry(QueryResult.Failure failure, int attempt);
}
