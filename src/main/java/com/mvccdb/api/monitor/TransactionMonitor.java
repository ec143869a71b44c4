package com.mvccdb.api.monitor;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.mvccdb.backend.dbm.DatabaseContext;
import com.mvccdb.backend.dbm.DatabaseManager;
import com.mvccdb.backend.txm.RegistrySnapshot;

/**
 * 定期输出各数据库的事务登记表快照
 */
@Component
@ConditionalOnProperty(prefix = "mvccdb.engine.monitor", name = "enabled", havingValue = "true")
public class TransactionMonitor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionMonitor.class);

    private final DatabaseManager databaseManager;

    public TransactionMonitor(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
    }

    @Scheduled(fixedDelayString = "${mvccdb.engine.monitor.interval-ms:5000}")
    public void report() {
        collect().forEach((name, snapshot) -> LOGGER.info("[db={}] {}", name, snapshot));
    }

    public Map<String, RegistrySnapshot> collect() {
        Map<String, RegistrySnapshot> res = new LinkedHashMap<>();
        for (DatabaseContext ctx : databaseManager.contexts()) {
            res.put(ctx.getName(), ctx.getTableManager().registrySnapshot());
        }
        return res;
    }
}
