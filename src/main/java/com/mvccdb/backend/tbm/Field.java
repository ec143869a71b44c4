package com.mvccdb.backend.tbm;

/**
 * 列定义：列名 + 声明类型
 */
public class Field {
    final String fieldName;
    final FieldType fieldType;

    public Field(String fieldName, FieldType fieldType) {
        this.fieldName = fieldName;
        this.fieldType = fieldType;
    }

    public String getName() {
        return fieldName;
    }

    public FieldType getType() {
        return fieldType;
    }

    public String getTypeName() {
        return fieldType.typeName();
    }

    @Override
    public String toString() {
        return "(" + fieldName + ", " + fieldType.typeName() + ")";
    }
}
