package com.mvccdb.backend.dbm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.mvccdb.backend.statement.Begin;
import com.mvccdb.backend.statement.Create;
import com.mvccdb.backend.statement.Insert;
import com.mvccdb.backend.statement.Select;
import com.mvccdb.backend.tbm.TableManager;
import com.mvccdb.backend.txm.IsolationLevel;
import com.mvccdb.common.Error;

public class DatabaseManagerTest {

    @Test
    public void testCreateDefaultOnlyWhenEmpty() {
        DatabaseManager manager = new DatabaseManager();
        manager.createDefault();
        manager.createDefault("other");
        assertEquals(List.of("system"), manager.show());
        assertEquals("system", manager.defaultDatabaseName());
    }

    @Test
    public void testCreateDropLifecycle() {
        DatabaseManager manager = new DatabaseManager();
        manager.create("shop");
        manager.create("blog");
        assertEquals(List.of("blog", "shop"), manager.show());
        assertEquals("blog", manager.defaultDatabaseName());
        assertSame(Error.DatabaseExistsException, assertThrows(RuntimeException.class, () -> manager.create("shop")));
        assertSame(Error.InvalidCommandException, assertThrows(RuntimeException.class, () -> manager.create("bad name")));

        DatabaseContext ctx = manager.acquire("shop");
        assertTrue(ctx.inUse());
        assertSame(Error.DatabaseInUseException, assertThrows(RuntimeException.class, () -> manager.drop("shop")));
        manager.release(ctx);
        manager.release(ctx);
        assertFalse(ctx.inUse());
        assertEquals(0, ctx.refCount());

        manager.drop("shop");
        assertNull(manager.get("shop"));
        assertSame(Error.DatabaseNotFoundException, assertThrows(RuntimeException.class, () -> manager.drop("shop")));
        assertSame(Error.DatabaseNotFoundException, assertThrows(RuntimeException.class, () -> manager.acquire("shop")));
    }

    @Test
    public void testDatabasesAreIndependent() {
        DatabaseManager manager = new DatabaseManager(IsolationLevel.SERIALIZABLE);
        manager.create("a");
        manager.create("b");
        TableManager a = manager.get("a").getTableManager();
        TableManager b = manager.get("b").getTableManager();

        Create create = new Create();
        create.tableName = "t";
        create.fieldName = new String[]{"v"};
        create.fieldType = new String[]{"int64"};
        a.create(create);
        b.create(create);

        long xa = a.begin(new Begin()).xid;
        Insert insert = new Insert();
        insert.tableName = "t";
        insert.values = Map.of("v", 1);
        a.insert(xa, insert);
        a.commit(xa);

        long xb = b.begin(new Begin()).xid;
        Select select = new Select();
        select.tableName = "t";
        assertEquals(0, b.read(xb, select).getResultRows());
        // 各自独立分配事务 id
        assertEquals(xa, xb);
        assertEquals(IsolationLevel.SERIALIZABLE, manager.get("b").getTransactionManager().get(xb).level);
    }

    @Test
    public void testShutdownClearsDatabases() {
        DatabaseManager manager = new DatabaseManager();
        manager.createDefault();
        manager.shutdown();
        assertTrue(manager.show().isEmpty());
        assertNull(manager.defaultDatabaseName());
    }
}
