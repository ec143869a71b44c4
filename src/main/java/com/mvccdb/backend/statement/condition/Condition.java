package com.mvccdb.backend.statement.condition;

import com.mvccdb.backend.statement.operator.CompareOperator;
import com.mvccdb.backend.statement.operator.LogicOperator;

/**
 * WHERE 条件节点标记接口
 */
public interface Condition {

    static PredicateCondition of(String field, CompareOperator cop, Object value) {
        PredicateCondition condition = new PredicateCondition();
        condition.field = field;
        condition.cop = cop;
        condition.value = value;
        return condition;
    }

    static BinaryCondition ofBinary(Condition left, LogicOperator lop, Condition right) {
        BinaryCondition condition = new BinaryCondition();
        condition.left = left;
        condition.lop = lop;
        condition.right = right;
        return condition;
    }

    static BinaryCondition and(Condition left, Condition right) {
        return ofBinary(left, LogicOperator.AND, right);
    }

    static BinaryCondition or(Condition left, Condition right) {
        return ofBinary(left, LogicOperator.OR, right);
    }
}
