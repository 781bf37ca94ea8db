package com.flapmyport.core.runtime;

import com.flapmyport.core.model.Oids;
import com.flapmyport.core.spi.SnmpQueryException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MutexSnmpAccessGateTest {

    @Test
    void queriesNeverOverlap() throws Exception {
        MutexSnmpAccessGate gate = new MutexSnmpAccessGate();
        RecordingSnmpQueryClient snmp = new RecordingSnmpQueryClient().answer(Oids.SYS_NAME, "sw");
        snmp.delayMillis = 10;

        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String target = "10.0.0." + i;
                results.add(pool.submit(() -> {
                    go.await();
                    return gate.execute(() -> snmp.get(Oids.SYS_NAME, target, "public"));
                }));
            }
            go.countDown();
            for (Future<String> f : results) {
                assertEquals("sw", f.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(threads, snmp.requests.size());
        assertEquals(1, snmp.maxInFlight.get());
    }

    @Test
    void failedQueryReleasesTheGate() throws Exception {
        MutexSnmpAccessGate gate = new MutexSnmpAccessGate();

        SnmpQueryException e = assertThrows(SnmpQueryException.class,
                () -> gate.execute(() -> { throw new SnmpQueryException("timeout"); }));
        assertEquals("timeout", e.getMessage());

        // another thread must be able to pass right away
        ExecutorService other = Executors.newSingleThreadExecutor();
        try {
            Future<String> f = other.submit(() -> gate.execute(() -> "ok"));
            assertEquals("ok", f.get(2, TimeUnit.SECONDS));
        } finally {
            other.shutdownNow();
        }
        assertEquals(0, gate.queueLength());
    }
}
