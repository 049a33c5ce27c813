package edu.stanford.futuredata.uniquery.model;

public class QueryParameter {
    public final String name;
    public final Object value;

    public QueryParameter(String name, Object value) {
        this.name = name;
        this.value = value;
    }
}
