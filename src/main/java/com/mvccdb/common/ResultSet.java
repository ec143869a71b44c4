package com.mvccdb.common;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * 按 record id 顺序排列的可见行，值已按列类型格式化成字符串。
 * 第一列通常是 {@code id}。
 */
public class ResultSet {
    private static final ResultSet EMPTY = new ResultSet(List.of(), List.of());

    private final ImmutableList<String> headers;
    private final ImmutableList<List<String>> rows;

    public ResultSet(List<String> headers, List<List<String>> rows) {
        this.headers = headers == null ? ImmutableList.of() : ImmutableList.copyOf(headers);
        ImmutableList.Builder<List<String>> builder = ImmutableList.builder();
        if(rows != null) {
            for (List<String> row : rows) {
                Preconditions.checkArgument(row.size() == this.headers.size(),
                        "row width %s does not match %s columns", row.size(), this.headers.size());
                builder.add(ImmutableList.copyOf(row));
            }
        }
        this.rows = builder.build();
    }

    public static ResultSet empty() {
        return EMPTY;
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /**
     * 取某一列的全部值
     *
     * @throws RuntimeException 列不存在时抛 FieldNotFoundException
     */
    public List<String> column(String header) {
        int idx = headers.indexOf(header);
        if(idx < 0) {
            throw Error.FieldNotFoundException;
        }
        ImmutableList.Builder<String> values = ImmutableList.builder();
        for (List<String> row : rows) {
            values.add(row.get(idx));
        }
        return values.build();
    }
}
