package edu.stanford.futuredata.uniquery.model;

public enum OperationKind {
    QUERY,
    SQL_QUERY,
    READ_FEED
}
