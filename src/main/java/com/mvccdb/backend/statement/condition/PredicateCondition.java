package com.mvccdb.backend.statement.condition;

import com.mvccdb.backend.statement.operator.CompareOperator;

/**
 * 基本谓词：field cop value，field 为 "id" 时比较 record id
 */
public class PredicateCondition implements Condition {
    public String field;
    public CompareOperator cop;
    public Object value;
}
