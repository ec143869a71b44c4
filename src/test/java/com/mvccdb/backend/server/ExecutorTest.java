package com.mvccdb.backend.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.mvccdb.backend.dbm.DatabaseManager;
import com.mvccdb.backend.statement.Abort;
import com.mvccdb.backend.statement.Begin;
import com.mvccdb.backend.statement.Commit;
import com.mvccdb.backend.statement.Create;
import com.mvccdb.backend.statement.CreateDatabase;
import com.mvccdb.backend.statement.Delete;
import com.mvccdb.backend.statement.DropDatabase;
import com.mvccdb.backend.statement.Insert;
import com.mvccdb.backend.statement.Select;
import com.mvccdb.backend.statement.Show;
import com.mvccdb.backend.statement.Update;
import com.mvccdb.backend.statement.Use;
import com.mvccdb.backend.txm.IsolationLevel;
import com.mvccdb.common.Error;
import com.mvccdb.common.ExecResult;

public class ExecutorTest {

    private DatabaseManager provider;

    @BeforeEach
    public void setUp() {
        provider = new DatabaseManager();
        provider.createDefault();
        Executor exe = new Executor(provider);
        Create create = new Create();
        create.tableName = "test_table";
        create.fieldName = new String[]{"name"};
        create.fieldType = new String[]{"string"};
        exe.execute(create);
        exe.close();
    }

    private static Insert insert(String name) {
        Insert insert = new Insert();
        insert.tableName = "test_table";
        insert.values = Map.of("name", name);
        return insert;
    }

    private static Select selectAll() {
        Select select = new Select();
        select.tableName = "test_table";
        return select;
    }

    @Test
    public void testImplicitTransactionCommits() {
        Executor exe = new Executor(provider, "c1");
        ExecResult res = exe.execute(insert("Alice"));
        assertEquals(ExecResult.Type.OK, res.getType());
        assertEquals(1, res.getAffectedRows());
        assertEquals(0, res.getXid());
        assertFalse(exe.inTransaction());

        Executor other = new Executor(provider, "c2");
        ExecResult rows = other.execute(selectAll());
        assertEquals(ExecResult.Type.RESULT, rows.getType());
        assertEquals(List.of(List.of("1", "Alice")), rows.getResultSet().getRows());
    }

    @Test
    public void testImplicitTransactionRollsBackOnFailure() {
        Executor exe = new Executor(provider);
        Update update = new Update();
        update.tableName = "test_table";
        update.recordId = 5L;
        update.values = Map.of("name", "x");
        assertSame(Error.RecordNotFoundException, assertThrows(RuntimeException.class, () -> exe.execute(update)));
        assertFalse(exe.inTransaction());
        assertEquals(0, provider.get("system").getTransactionManager().snapshot().getActive().size());
        assertEquals(1, provider.get("system").getTransactionManager().snapshot().getAborted().size());
    }

    @Test
    public void testExplicitTransactionIsolation() {
        Executor writer = new Executor(provider, "writer");
        Executor reader = new Executor(provider, "reader");
        ExecResult begun = writer.execute(Begin.of(IsolationLevel.READ_COMMITTED));
        assertTrue(begun.getXid() > 0);
        writer.execute(insert("Bob"));
        assertEquals(0, reader.execute(selectAll()).getResultRows());
        writer.execute(new Commit());
        assertEquals(1, reader.execute(selectAll()).getResultRows());
    }

    @Test
    public void testAbortDiscardsWrites() {
        Executor exe = new Executor(provider);
        exe.execute(new Begin());
        exe.execute(insert("Temp"));
        assertEquals(1, exe.execute(selectAll()).getResultRows());
        exe.execute(new Abort());
        assertEquals(0, exe.execute(selectAll()).getResultRows());
    }

    @Test
    public void testTransactionControlErrors() {
        Executor exe = new Executor(provider);
        assertSame(Error.NoTransactionException, assertThrows(RuntimeException.class, () -> exe.execute(new Commit())));
        assertSame(Error.NoTransactionException, assertThrows(RuntimeException.class, () -> exe.execute(new Abort())));
        exe.execute(new Begin());
        assertSame(Error.NestedTransactionException, assertThrows(RuntimeException.class, () -> exe.execute(new Begin())));
        Use use = new Use();
        use.databaseName = "system";
        assertSame(Error.SwitchDatabaseInTxnException, assertThrows(RuntimeException.class, () -> exe.execute(use)));
        assertSame(Error.InvalidStatementException, assertThrows(RuntimeException.class, () -> exe.execute("select 1")));
        // 语句出错不影响事务
        assertTrue(exe.inTransaction());
        exe.execute(new Commit());
    }

    @Test
    public void testSerializationConflictEndsTransaction() {
        Executor seed = new Executor(provider);
        seed.execute(insert("Alice"));

        Executor t1 = new Executor(provider, "t1");
        Executor t2 = new Executor(provider, "t2");
        t1.execute(Begin.of(IsolationLevel.SERIALIZABLE));
        t2.execute(Begin.of(IsolationLevel.SERIALIZABLE));
        Update u1 = new Update();
        u1.tableName = "test_table";
        u1.recordId = 1L;
        u1.values = Map.of("name", "one");
        Update u2 = new Update();
        u2.tableName = "test_table";
        u2.recordId = 1L;
        u2.values = Map.of("name", "two");
        t1.execute(u1);
        t2.execute(u2);
        t1.execute(new Commit());
        assertSame(Error.SerializationConflictException, assertThrows(RuntimeException.class, () -> t2.execute(new Commit())));
        assertFalse(t2.inTransaction());
        assertEquals(List.of(List.of("1", "one")), t2.execute(selectAll()).getResultSet().getRows());
    }

    @Test
    public void testDatabaseStatements() {
        Executor exe = new Executor(provider);
        assertEquals("system", exe.getDatabaseName());
        CreateDatabase create = new CreateDatabase();
        create.databaseName = "other";
        exe.execute(create);

        Show show = new Show();
        show.isDatabases = true;
        assertEquals(List.of(List.of("other"), List.of("system")), exe.execute(show).getResultSet().getRows());

        Use use = new Use();
        use.databaseName = "other";
        exe.execute(use);
        assertEquals("other", exe.getDatabaseName());
        assertSame(Error.TableNotFoundException, assertThrows(RuntimeException.class, () -> exe.execute(selectAll())));

        DropDatabase drop = new DropDatabase();
        drop.databaseName = "other";
        exe.execute(drop);
        assertNull(exe.getDatabaseName());
        assertSame(Error.NoDatabaseSelectedException, assertThrows(RuntimeException.class, () -> exe.execute(selectAll())));
    }

    @Test
    public void testFailedDropKeepsCurrentDatabase() {
        Executor exe = new Executor(provider);
        Executor other = new Executor(provider);
        exe.execute(insert("kept"));
        assertEquals(2, provider.get("system").refCount());

        DropDatabase drop = new DropDatabase();
        drop.databaseName = "system";
        assertSame(Error.DatabaseInUseException, assertThrows(RuntimeException.class, () -> exe.execute(drop)));
        assertEquals("system", exe.getDatabaseName());
        assertEquals(2, provider.get("system").refCount());
        assertEquals(1, exe.execute(selectAll()).getResultRows());

        other.close();
        exe.execute(drop);
        assertNull(exe.getDatabaseName());
        assertNull(provider.get("system"));
        exe.close();
    }

    @Test
    public void testDdlInsideTransaction() {
        Executor exe = new Executor(provider);
        exe.execute(new Begin());
        Create create = new Create();
        create.tableName = "t2";
        create.fieldName = new String[]{"v"};
        create.fieldType = new String[]{"int32"};
        exe.execute(create);
        assertTrue(exe.inTransaction());
        assertEquals(2, exe.execute(new Show()).getResultRows());
        exe.execute(new Abort());
        // DDL 不随事务回滚
        assertEquals(2, exe.execute(new Show()).getResultRows());
    }

    @Test
    public void testCloseRollsBackOpenTransaction() {
        Executor exe = new Executor(provider);
        exe.execute(new Begin());
        exe.execute(insert("Lost"));
        long xid = exe.getXid();
        exe.close();
        assertTrue(provider.get("system").getTransactionManager().isAborted(xid));
        assertFalse(provider.get("system").inUse());
    }

    @Test
    public void testMultiInsert() throws InterruptedException {
        int workers = 4;
        int perWorker = 200;
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();
        CountDownLatch cdl = new CountDownLatch(workers);
        for (int i = 0; i < workers; i++) {
            final int no = i;
            // 每个线程用自己的 Executor
            new Thread(() -> {
                Executor worker = new Executor(provider, "worker-" + no);
                try {
                    for (int j = 0; j < perWorker; j++) {
                        worker.execute(insert(no + ":" + j));
                    }
                } catch (Throwable e) {
                    failures.add(e);
                } finally {
                    worker.close();
                    cdl.countDown();
                }
            }).start();
        }
        assertTrue(cdl.await(60, TimeUnit.SECONDS));
        assertTrue(failures.isEmpty(), failures.toString());

        Executor exe = new Executor(provider);
        assertEquals(workers * perWorker, exe.execute(selectAll()).getResultRows());
        Delete delete = new Delete();
        delete.tableName = "test_table";
        assertEquals(workers * perWorker, exe.execute(delete).getAffectedRows());
    }
}
