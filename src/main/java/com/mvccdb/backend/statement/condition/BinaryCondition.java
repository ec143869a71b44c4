package com.mvccdb.backend.statement.condition;

import com.mvccdb.backend.statement.operator.LogicOperator;

/**
 * 逻辑组合条件：AND / OR
 */
public class BinaryCondition implements Condition {
    public Condition left;
    public LogicOperator lop;
    public Condition right;
}
