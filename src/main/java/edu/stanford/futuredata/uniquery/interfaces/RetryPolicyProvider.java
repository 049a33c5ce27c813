package edu.stanford.futuredata.uniquery.interfaces;

public interface RetryPolicyProvider {
    RequestRetryPolicy getRequestPolicy();
}
