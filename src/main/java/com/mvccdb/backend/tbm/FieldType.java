package com.mvccdb.backend.tbm;

import java.util.Locale;

import com.mvccdb.common.Error;

/**
 * 列类型。
 * 每种类型负责把外部传入的值规整为自己的 Java 表示，并定义比较规则。
 */
public enum FieldType {
    INT32 {
        @Override
        public Object parse(String str) {
            return Integer.valueOf(str.trim());
        }

        @Override
        Object coerceNonNull(Object value) {
            long l = toIntegral(value);
            if(l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw Error.InvalidValuesException;
            }
            return (int) l;
        }

        @Override
        public int compare(Object left, Object right) {
            return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
        }

        @Override
        public Object defaultValue() {
            return 0;
        }
    },

    INT64 {
        @Override
        public Object parse(String str) {
            return Long.valueOf(str.trim());
        }

        @Override
        Object coerceNonNull(Object value) {
            return toIntegral(value);
        }

        @Override
        public int compare(Object left, Object right) {
            return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
        }

        @Override
        public Object defaultValue() {
            return 0L;
        }
    },

    FLOAT64 {
        @Override
        public Object parse(String str) {
            return Double.valueOf(str.trim());
        }

        @Override
        Object coerceNonNull(Object value) {
            if(value instanceof Number) {
                return ((Number) value).doubleValue();
            }
            return parse(value.toString());
        }

        @Override
        public int compare(Object left, Object right) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }

        @Override
        public Object defaultValue() {
            return 0.0d;
        }
    },

    STRING {
        @Override
        public Object parse(String str) {
            return str;
        }

        @Override
        Object coerceNonNull(Object value) {
            return value.toString();
        }

        @Override
        public int compare(Object left, Object right) {
            return ((String) left).compareTo((String) right);
        }

        @Override
        public Object defaultValue() {
            return "";
        }
    },

    BOOL {
        @Override
        public Object parse(String str) {
            String s = str.trim().toLowerCase(Locale.ROOT);
            if("true".equals(s) || "1".equals(s)) {
                return Boolean.TRUE;
            }
            if("false".equals(s) || "0".equals(s)) {
                return Boolean.FALSE;
            }
            throw Error.InvalidValuesException;
        }

        @Override
        Object coerceNonNull(Object value) {
            if(value instanceof Boolean) {
                return value;
            }
            return parse(value.toString());
        }

        @Override
        public int compare(Object left, Object right) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }

        @Override
        public Object defaultValue() {
            return Boolean.FALSE;
        }
    };

    /**
     * 从字符串字面量解析
     */
    public abstract Object parse(String str);

    public abstract int compare(Object left, Object right);

    public abstract Object defaultValue();

    abstract Object coerceNonNull(Object value);

    /**
     * 把任意输入规整为该类型的值
     * @throws RuntimeException 值为 null 或无法转换时抛 InvalidValuesException
     */
    public Object coerce(Object value) {
        if(value == null) {
            throw Error.InvalidValuesException;
        }
        try {
            return coerceNonNull(value);
        } catch (NumberFormatException e) {
            throw Error.InvalidValuesException;
        }
    }

    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String print(Object value) {
        return value == null ? "NULL" : value.toString();
    }

    /**
     * 整数列接受整数值的浮点数（JSON 里写成小数形式的数字会解析成 Double）
     */
    private static long toIntegral(Object value) {
        if(value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if(value instanceof Number) {
            double d = ((Number) value).doubleValue();
            // 超出 long 范围的 double 强转会被截断到边界值
            if(d != Math.rint(d) || d >= 0x1p63 || d < -0x1p63) {
                throw Error.InvalidValuesException;
            }
            return (long) d;
        }
        return Long.parseLong(value.toString().trim());
    }

    /**
     * 从字段类型字符串解析 FieldType
     */
    public static FieldType from(String s) {
        if (s == null) {
            throw Error.InvalidFieldException;
        }
        try {
            // "int64" -> "INT64" -> FieldType.INT64
            return FieldType.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw Error.InvalidFieldException;
        }
    }
}
