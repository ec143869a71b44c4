package com.mvccdb.backend.dbm;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;

import com.mvccdb.backend.txm.TransactionInfo;
import com.mvccdb.common.Error;

/**
 * 数据库快照的 JSON 编解码
 */
public class SnapshotCodec {

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            // 整数按 long 解析，int64 不会经过 double 丢精度
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();

    private SnapshotCodec() {
    }

    public static String encode(DatabaseSnapshot snapshot) {
        return GSON.toJson(snapshot);
    }

    /**
     * @throws RuntimeException JSON 非法或缺少必需字段时抛 BadSnapshotException
     */
    public static DatabaseSnapshot decode(String json) {
        DatabaseSnapshot snapshot;
        try {
            snapshot = GSON.fromJson(json, DatabaseSnapshot.class);
        } catch (JsonParseException e) {
            throw Error.BadSnapshotException;
        }
        validate(snapshot);
        return snapshot;
    }

    static void validate(DatabaseSnapshot snapshot) {
        if(snapshot == null || snapshot.transactions == null || snapshot.tables == null) {
            throw Error.BadSnapshotException;
        }
        for (TransactionInfo info : snapshot.transactions) {
            if(info == null || info.getId() <= 0 || info.getStatus() == null || info.getIsolation() == null) {
                throw Error.BadSnapshotException;
            }
        }
        for (DatabaseSnapshot.TableData table : snapshot.tables) {
            if(table == null || table.name == null || table.columns == null || table.versions == null) {
                throw Error.BadSnapshotException;
            }
            for (DatabaseSnapshot.VersionData v : table.versions) {
                if(v == null || v.values == null || v.deleteMarks == null) {
                    throw Error.BadSnapshotException;
                }
            }
        }
    }
}
