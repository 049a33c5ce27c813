package edu.stanford.futuredata.uniquery.model;

public enum ConsistencyLevel {
    STRONG,
    BOUNDED_STALENESS,
    SESSION,
    EVENTUAL,
    CONSISTENT_PREFIX
}
