package com.mvccdb.backend.statement.operator;

import java.util.Locale;

import com.mvccdb.common.Error;

public enum LogicOperator {
    AND,
    OR;

    public String symbol() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LogicOperator from(String op) {
        if (op == null || op.isEmpty()) {
            throw Error.InvalidLogOpException;
        }
        try {
            return LogicOperator.valueOf(op.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw Error.InvalidLogOpException;
        }
    }
}
