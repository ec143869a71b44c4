package com.mvccdb.backend.vm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;

import org.junit.jupiter.api.Test;

import com.mvccdb.backend.txm.RecordKey;

public class CommitLockTableTest {

    @Test
    public void testEmptyWriteSetTakesNoLocks() {
        CommitLockTable lt = new CommitLockTable();
        List<Lock> locks = lt.lockAll(Collections.emptyList());
        assertTrue(locks.isEmpty());
        lt.unlockAll(locks);
    }

    @Test
    public void testLockedKeyBlocksOtherCommitter() throws InterruptedException {
        CommitLockTable lt = new CommitLockTable();
        RecordKey key = new RecordKey("t", 1);
        List<Lock> held = lt.lockAll(List.of(key));

        AtomicBoolean acquired = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);
        Thread other = new Thread(() -> {
            List<Lock> locks = lt.lockAll(List.of(key));
            acquired.set(true);
            lt.unlockAll(locks);
            done.countDown();
        });
        other.start();
        assertFalse(done.await(200, TimeUnit.MILLISECONDS));
        assertFalse(acquired.get());

        lt.unlockAll(held);
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(acquired.get());
    }

    @Test
    public void testOppositeOrderDoesNotDeadlock() throws InterruptedException {
        // 条带很少，保证大量键落在同一条带上
        CommitLockTable lt = new CommitLockTable(4);
        List<RecordKey> forward = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            forward.add(new RecordKey("t", i));
        }
        List<RecordKey> backward = new ArrayList<>(forward);
        Collections.reverse(backward);

        int rounds = 2000;
        AtomicInteger finished = new AtomicInteger();
        CountDownLatch cdl = new CountDownLatch(2);
        for (List<RecordKey> keys : List.of(forward, backward)) {
            new Thread(() -> {
                try {
                    for (int i = 0; i < rounds; i++) {
                        List<Lock> locks = lt.lockAll(keys);
                        lt.unlockAll(locks);
                        finished.incrementAndGet();
                    }
                } finally {
                    cdl.countDown();
                }
            }).start();
        }
        assertTrue(cdl.await(30, TimeUnit.SECONDS));
        assertEquals(2 * rounds, finished.get());
    }
}
