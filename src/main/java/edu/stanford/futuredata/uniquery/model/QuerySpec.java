package edu.stanford.futuredata.uniquery.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Query text plus its named parameters.
 */
public class QuerySpec {
    public final String queryText;
    public final List<QueryParameter> parameters;

    public QuerySpec(String queryText, List<QueryParameter> parameters) {
        this.queryText = Objects.requireNonNull(queryText);
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public QuerySpec(String queryText) {
        this(queryText, List.of());
    }

    public QuerySpec withParameter(String name, Object value) {
        List<QueryParameter> p = new ArrayList<>(parameters);
        p.add(new QueryParameter(name, value));
        return new QuerySpec(queryText, p);
    }
}
