package com.mvccdb.backend.tbm;

import com.mvccdb.common.QueryResult;

public class BeginResult {
    public long xid;
    public QueryResult result;
}
