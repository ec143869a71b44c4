package com.mvccdb.backend.vm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.mvccdb.backend.txm.IsolationLevel;
import com.mvccdb.backend.txm.RecordKey;
import com.mvccdb.backend.txm.Transaction;
import com.mvccdb.backend.txm.TransactionManager;
import com.mvccdb.backend.txm.TransactionStatus;
import com.mvccdb.common.Error;

public class VersionManagerTest {

    private static final String TABLE = "users";

    private TransactionManager txm;
    private VersionManager vm;

    @BeforeEach
    public void setUp() {
        txm = TransactionManager.create();
        vm = VersionManager.newVersionManager(txm);
        vm.createPartition(TABLE);
    }

    private void committedInsert(long recordId, String name) {
        Transaction t = vm.begin(IsolationLevel.READ_COMMITTED);
        vm.insert(t.xid, TABLE, recordId, Map.of("name", name));
        vm.commit(t.xid);
    }

    @Test
    public void testCommittedInsertVisible() {
        // t1 插入并提交，t2 能读到
        Transaction t1 = vm.begin(IsolationLevel.READ_COMMITTED);
        vm.insert(t1.xid, TABLE, 1, Map.of("name", "Alice"));
        vm.commit(t1.xid);

        Transaction t2 = vm.begin(IsolationLevel.READ_COMMITTED);
        List<Version> rows = vm.scan(t2.xid, TABLE);
        assertEquals(1, rows.size());
        assertEquals("Alice", rows.get(0).getValues().get("name"));
        assertEquals(1, rows.get(0).getRecordId());
    }

    @Test
    public void testSnapshotFrozenAtBegin() {
        Transaction t1 = vm.begin(IsolationLevel.REPEATABLE_READ);
        assertTrue(vm.scan(t1.xid, TABLE).isEmpty());

        Transaction t2 = vm.begin(IsolationLevel.READ_COMMITTED);
        vm.insert(t2.xid, TABLE, 1, Map.of("name", "Bob"));
        vm.commit(t2.xid);

        assertTrue(vm.scan(t1.xid, TABLE).isEmpty());
        assertNull(vm.read(t1.xid, TABLE, 1));
    }

    @Test
    public void testSerializableFirstCommitterWins() {
        committedInsert(1, "Alice");
        Transaction t1 = vm.begin(IsolationLevel.SERIALIZABLE);
        Transaction t2 = vm.begin(IsolationLevel.SERIALIZABLE);
        vm.update(t1.xid, TABLE, 1, Map.of("name", "t1"));
        vm.update(t2.xid, TABLE, 1, Map.of("name", "t2"));

        vm.commit(t1.xid);
        RuntimeException e = assertThrows(RuntimeException.class, () -> vm.commit(t2.xid));
        assertSame(Error.SerializationConflictException, e);
        assertEquals(TransactionStatus.ABORTED, txm.statusOf(t2.xid));

        Transaction reader = vm.begin(IsolationLevel.READ_COMMITTED);
        assertEquals("t1", vm.read(reader.xid, TABLE, 1).getValues().get("name"));
    }

    @Test
    public void testRollbackUndoesDelete() {
        committedInsert(1, "Alice");
        Transaction t1 = vm.begin(IsolationLevel.READ_COMMITTED);
        vm.delete(t1.xid, TABLE, 1);
        assertNull(vm.read(t1.xid, TABLE, 1));
        vm.abort(t1.xid);

        Transaction t2 = vm.begin(IsolationLevel.READ_COMMITTED);
        Version v = vm.read(t2.xid, TABLE, 1);
        assertNotNull(v);
        assertEquals("Alice", v.getValues().get("name"));
    }

    @Test
    public void testUncommittedWriteInvisibleToOthers() {
        committedInsert(1, "Alice");
        for (IsolationLevel level : new IsolationLevel[]{
                IsolationLevel.READ_COMMITTED, IsolationLevel.REPEATABLE_READ, IsolationLevel.SERIALIZABLE}) {
            Transaction writer = vm.begin(IsolationLevel.READ_COMMITTED);
            Transaction reader = vm.begin(level);
            vm.update(writer.xid, TABLE, 1, Map.of("name", "changed"));
            vm.insert(writer.xid, TABLE, 100, Map.of("name", "new"));

            assertEquals("Alice", vm.read(reader.xid, TABLE, 1).getValues().get("name"));
            assertNull(vm.read(reader.xid, TABLE, 100));
            // 自己的写入对自己可见
            assertEquals("changed", vm.read(writer.xid, TABLE, 1).getValues().get("name"));
            vm.abort(writer.xid);
            vm.abort(reader.xid);
        }
    }

    @Test
    public void testReadCommittedSeesLaterCommits() {
        committedInsert(1, "Alice");
        Transaction reader = vm.begin(IsolationLevel.READ_COMMITTED);
        assertEquals("Alice", vm.read(reader.xid, TABLE, 1).getValues().get("name"));

        Transaction writer = vm.begin(IsolationLevel.READ_COMMITTED);
        vm.update(writer.xid, TABLE, 1, Map.of("name", "Carol"));
        vm.commit(writer.xid);

        assertEquals("Carol", vm.read(reader.xid, TABLE, 1).getValues().get("name"));
    }

    @Test
    public void testRepeatableReadReturnsSameContent() {
        committedInsert(1, "Alice");
        Transaction reader = vm.begin(IsolationLevel.REPEATABLE_READ);
        Version first = vm.read(reader.xid, TABLE, 1);

        Transaction writer = vm.begin(IsolationLevel.READ_COMMITTED);
        vm.update(writer.xid, TABLE, 1, Map.of("name", "Carol"));
        vm.commit(writer.xid);
        Transaction deleter = vm.begin(IsolationLevel.READ_COMMITTED);
        vm.delete(deleter.xid, TABLE, 1);
        vm.commit(deleter.xid);

        Version second = vm.read(reader.xid, TABLE, 1);
        assertSame(first, second);
        assertEquals("Alice", second.getValues().get("name"));
    }

    @Test
    public void testUpdateMergesValuesAndTracksWriteSet() {
        Transaction t = vm.begin(IsolationLevel.READ_COMMITTED);
        vm.insert(t.xid, TABLE, 7, Map.of("name", "Dave", "age", 30));
        Version v = vm.update(t.xid, TABLE, 7, Map.of("age", 31));
        assertEquals("Dave", v.getValues().get("name"));
        assertEquals(31, v.getValues().get("age"));
        assertEquals(t.xid, v.getCreatedBy());
        assertTrue(t.writeSet.contains(new RecordKey(TABLE, 7)));
        assertEquals(2, vm.partition(TABLE).chainOf(7).versions().size());
    }

    @Test
    public void testUpdateAndDeleteMissingRecord() {
        Transaction t = vm.begin(IsolationLevel.READ_COMMITTED);
        assertSame(Error.RecordNotFoundException,
                assertThrows(RuntimeException.class, () -> vm.update(t.xid, TABLE, 9, Map.of("name", "x"))));
        assertSame(Error.RecordNotFoundException,
                assertThrows(RuntimeException.class, () -> vm.delete(t.xid, TABLE, 9)));

        committedInsert(1, "Alice");
        vm.delete(t.xid, TABLE, 1);
        assertSame(Error.RecordNotFoundException,
                assertThrows(RuntimeException.class, () -> vm.delete(t.xid, TABLE, 1)));
        // 出错不影响事务状态
        assertTrue(txm.isActive(t.xid));
    }

    @Test
    public void testInsertDuplicateKey() {
        committedInsert(1, "Alice");
        Transaction t = vm.begin(IsolationLevel.REPEATABLE_READ);
        assertSame(Error.DuplicateKeyException,
                assertThrows(RuntimeException.class, () -> vm.insert(t.xid, TABLE, 1, Map.of("name", "dup"))));
        assertTrue(txm.isActive(t.xid));

        // 删除后可以重新插入同一个 record id
        vm.delete(t.xid, TABLE, 1);
        vm.insert(t.xid, TABLE, 1, Map.of("name", "again"));
        assertEquals("again", vm.read(t.xid, TABLE, 1).getValues().get("name"));
    }

    @Test
    public void testInsertUsesLatestCommittedStateEvenUnderSnapshot() {
        Transaction rr = vm.begin(IsolationLevel.REPEATABLE_READ);
        committedInsert(1, "Alice");
        // 快照里看不到，但写者规则能看到已提交的存活记录
        assertNull(vm.read(rr.xid, TABLE, 1));
        assertSame(Error.DuplicateKeyException,
                assertThrows(RuntimeException.class, () -> vm.insert(rr.xid, TABLE, 1, Map.of("name", "x"))));
    }

    @Test
    public void testOperationsRequireActiveTransaction() {
        Transaction t = vm.begin(IsolationLevel.READ_COMMITTED);
        vm.commit(t.xid);
        assertSame(Error.InvalidTransactionException,
                assertThrows(RuntimeException.class, () -> vm.insert(t.xid, TABLE, 1, Map.of())));
        assertSame(Error.InvalidTransactionException,
                assertThrows(RuntimeException.class, () -> vm.read(t.xid, TABLE, 1)));
        assertSame(Error.InvalidTransactionException,
                assertThrows(RuntimeException.class, () -> vm.scan(999, TABLE)));
    }

    @Test
    public void testUnknownPartition() {
        Transaction t = vm.begin(IsolationLevel.READ_COMMITTED);
        assertSame(Error.TableNotFoundException,
                assertThrows(RuntimeException.class, () -> vm.scan(t.xid, "missing")));
        assertSame(Error.DuplicatedTableException,
                assertThrows(RuntimeException.class, () -> vm.createPartition(TABLE)));
        vm.dropPartition(TABLE);
        assertNull(vm.partition(TABLE));
        assertSame(Error.TableNotFoundException,
                assertThrows(RuntimeException.class, () -> vm.dropPartition(TABLE)));
    }

    @Test
    public void testRolledBackInsertPermanentlyInvisible() {
        Transaction t1 = vm.begin(IsolationLevel.READ_COMMITTED);
        vm.insert(t1.xid, TABLE, 1, Map.of("name", "ghost"));
        vm.abort(t1.xid);

        for (IsolationLevel level : IsolationLevel.values()) {
            Transaction reader = vm.begin(level);
            assertNull(vm.read(reader.xid, TABLE, 1), level.name());
            vm.commit(reader.xid);
        }
        // 版本仍留在链上，只是不可见
        assertEquals(1, vm.partition(TABLE).chainOf(1).versions().size());
    }

    @Test
    public void testScanOrderedByRecordId() {
        Transaction t = vm.begin(IsolationLevel.READ_COMMITTED);
        vm.insert(t.xid, TABLE, 30, Map.of("name", "c"));
        vm.insert(t.xid, TABLE, 10, Map.of("name", "a"));
        vm.insert(t.xid, TABLE, 20, Map.of("name", "b"));
        vm.commit(t.xid);

        Transaction r = vm.begin(IsolationLevel.READ_COMMITTED);
        List<Version> rows = vm.scan(r.xid, TABLE);
        assertEquals(List.of(10L, 20L, 30L), List.of(rows.get(0).getRecordId(), rows.get(1).getRecordId(), rows.get(2).getRecordId()));
    }
}
