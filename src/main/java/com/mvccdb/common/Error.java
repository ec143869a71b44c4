package com.mvccdb.common;

/**
 * 错误目录。
 * 各层直接抛出这里的常量，调用方通过 {@code e == Error.X} 判断错误类型。
 */
public class Error {

    // txm / vm
    public static final RuntimeException InvalidTransactionException = new RuntimeException("Invalid transaction!");
    public static final RuntimeException InvalidIsolationException = new RuntimeException("Invalid isolation level!");
    public static final RuntimeException RecordNotFoundException = new RuntimeException("Record not found!");
    public static final RuntimeException DuplicateKeyException = new RuntimeException("Duplicate key!");
    public static final RuntimeException SerializationConflictException = new RuntimeException("Could not serialize access due to concurrent update!");

    // tbm
    public static final RuntimeException TableNotFoundException = new RuntimeException("Table not found!");
    public static final RuntimeException DuplicatedTableException = new RuntimeException("Duplicated table!");
    public static final RuntimeException FieldNotFoundException = new RuntimeException("Field not found!");
    public static final RuntimeException InvalidFieldException = new RuntimeException("Invalid field type!");
    public static final RuntimeException InvalidValuesException = new RuntimeException("Invalid values!");
    public static final RuntimeException InvalidLogOpException = new RuntimeException("Invalid logic operation!");

    // dbm
    public static final RuntimeException DatabaseExistsException = new RuntimeException("Database already exists!");
    public static final RuntimeException DatabaseNotFoundException = new RuntimeException("Database not found!");
    public static final RuntimeException DatabaseInUseException = new RuntimeException("Database is in use!");
    public static final RuntimeException BadSnapshotException = new RuntimeException("Bad database snapshot!");

    // server
    public static final RuntimeException InvalidCommandException = new RuntimeException("Invalid command!");
    public static final RuntimeException InvalidStatementException = new RuntimeException("Invalid statement!");
    public static final RuntimeException NestedTransactionException = new RuntimeException("Nested transaction not supported!");
    public static final RuntimeException NoTransactionException = new RuntimeException("Not in transaction!");
    public static final RuntimeException NoDatabaseSelectedException = new RuntimeException("No database selected!");
    public static final RuntimeException SwitchDatabaseInTxnException = new RuntimeException("Cannot switch database inside a transaction!");
    public static final RuntimeException TooManySessionsException = new RuntimeException("Too many sessions!");

    private Error() {
    }
}
