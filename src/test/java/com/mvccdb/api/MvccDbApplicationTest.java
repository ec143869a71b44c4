package com.mvccdb.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.mvccdb.api.config.MvccDbProperties;
import com.mvccdb.api.monitor.TransactionMonitor;
import com.mvccdb.api.service.StatementService;
import com.mvccdb.api.session.SessionManager;
import com.mvccdb.backend.dbm.DatabaseManager;
import com.mvccdb.backend.statement.Begin;
import com.mvccdb.backend.txm.IsolationLevel;

@SpringBootTest(properties = {
        "mvccdb.engine.default-database=main",
        "mvccdb.engine.default-isolation=serializable",
        "mvccdb.engine.monitor.enabled=true",
        "mvccdb.engine.monitor.interval-ms=60000"
})
public class MvccDbApplicationTest {

    @Autowired
    private MvccDbProperties properties;

    @Autowired
    private DatabaseManager databaseManager;

    @Autowired
    private SessionManager sessionManager;

    @Autowired
    private StatementService statementService;

    @Autowired
    private TransactionMonitor monitor;

    @Test
    public void testContextWiring() {
        assertEquals(IsolationLevel.SERIALIZABLE, properties.getDefaultIsolation());
        assertEquals("main", databaseManager.defaultDatabaseName());

        String session = sessionManager.createSession();
        long xid = statementService.execute(session, new Begin()).getData().getXid();
        assertEquals(IsolationLevel.SERIALIZABLE,
                databaseManager.get("main").getTransactionManager().get(xid).level);
        assertTrue(monitor.collect().containsKey("main"));
        sessionManager.closeSession(session);
    }
}
