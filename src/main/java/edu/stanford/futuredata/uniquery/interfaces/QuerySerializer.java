package edu.stanford.futuredata.uniquery.interfaces;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.uniquery.model.QuerySpec;

public interface QuerySerializer {
    ByteString encode(QuerySpec querySpec);
}
