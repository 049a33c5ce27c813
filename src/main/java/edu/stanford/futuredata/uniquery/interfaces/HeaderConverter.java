package edu.stanford.futuredata.uniquery.interfaces;

import edu.stanford.futuredata.uniquery.model.CollectionIdentity;
import edu.stanford.futuredata.uniquery.model.QueryHeaders;
import edu.stanford.futuredata.uniquery.model.ResourceKind;

import java.util.Map;

public interface HeaderConverter {
    QueryHeaders convert(Map<String, String> rawHeaders, ResourceKind resourceKind,
                         CollectionIdentity collectionIdentity);
}
