package com.flapmyport.core.runtime;

import com.flapmyport.core.classify.LinkEventClassifier;
import com.flapmyport.core.classify.LinkFieldExtractor;
import com.flapmyport.core.model.LinkEvent;
import com.flapmyport.core.model.Oids;
import com.flapmyport.core.model.TrapNotification;
import com.flapmyport.core.model.VarBind;
import com.flapmyport.core.spi.SnmpAccessGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LinkEventPipelineTest {

    private static final String DEVICE = "10.0.0.5";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:30:45Z"), ZoneOffset.UTC);

    private RecordingEventStore store;
    private RecordingSnmpQueryClient snmp;
    private LinkEventPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new RecordingEventStore();
        snmp = new RecordingSnmpQueryClient()
                .answer(Oids.SYS_NAME, "sw1")
                .answer(Oids.ifName(3), "Gi0/3")
                .answer(Oids.ifAlias(3), "uplink");
        AtomicInteger seq = new AtomicInteger();
        pipeline = new LinkEventPipeline(new LinkEventClassifier(), new LinkFieldExtractor(),
                new MetadataResolver(store, snmp, SnmpAccessGate.PASS_THROUGH, "public"),
                store, CLOCK, () -> "sid-" + seq.incrementAndGet());
    }

    // ========== classification ==========

    @Test
    void nonLinkTrapTouchesNeitherStoreNorDevice() {
        pipeline.onTrap(trap("1.3.6.1.6.3.1.1.5.1",
                new VarBind(Oids.SYS_UPTIME, 100L)));   // coldStart
        pipeline.onTrap(new TrapNotification(DEVICE, 50000,
                List.of(new VarBind(Oids.SYS_UPTIME, 100L))));   // no snmpTrapOID at all

        assertTrue(store.calls.isEmpty());
        assertTrue(snmp.requests.isEmpty());
    }

    // ========== happy path ==========

    @Test
    void linkDownWithColdCacheIsInsertedThenEnriched() {
        pipeline.onTrap(linkTrap(Oids.LINK_DOWN, 3, 2, 2, 4242L));

        assertEquals(1, store.inserts.size());
        RecordingEventStore.Row row = store.inserts.get(0);
        assertEquals("sid-1", row.sid());
        assertEquals(DEVICE, row.ipAddress());
        assertEquals(3, row.ifIndex());
        assertEquals("down", row.adminStatus());
        assertEquals("down", row.operStatus());
        assertEquals(4242L, row.timeTicks());
        assertNull(row.hostName());
        assertNull(row.ifName());
        assertNull(row.ifAlias());

        assertEquals(List.of(Oids.SYS_NAME, Oids.ifName(3), Oids.ifAlias(3)), snmp.oids());
        assertEquals(DEVICE, snmp.requests.get(0).target());
        assertEquals("public", snmp.requests.get(0).community());

        assertEquals(List.of(new RecordingEventStore.Update("sid-1", "sw1", "Gi0/3", "uplink")), store.updates);
        assertEquals("sw1", store.hostnames.get(DEVICE));
        assertEquals("Gi0/3", store.ifNames.get(RecordingEventStore.key(DEVICE, 3)));
        assertEquals("uplink", store.ifAliases.get(RecordingEventStore.key(DEVICE, 3)));
    }

    @Test
    void insertPrecedesUpdateForTheSameSid() {
        pipeline.onTrap(linkTrap(Oids.LINK_UP, 3, 1, 1, 1L));

        List<String> writes = store.calls.stream()
                .filter(c -> c.startsWith("insert:") || c.startsWith("update:"))
                .toList();
        assertEquals(List.of("insert:sid-1", "update:sid-1"), writes);
    }

    @Test
    void eventTimeComesFromTheClock() {
        LinkEvent event = pipeline.handle(linkTrap(Oids.LINK_UP, 3, 1, 1, 1L));
        assertEquals(LocalDateTime.of(2026, 3, 1, 12, 30, 45), event.eventTime());
    }

    @Test
    void cachedHostnameSkipsItsQueryOnly() {
        store.hostnames.put(DEVICE, "cached-sw");

        pipeline.onTrap(linkTrap(Oids.LINK_DOWN, 3, 1, 2, 10L));

        assertEquals(List.of(Oids.ifName(3), Oids.ifAlias(3)), snmp.oids());
        assertEquals("cached-sw", store.updates.get(0).hostName());
        assertTrue(store.callsStartingWith("putHostname").isEmpty());
    }

    @Test
    void ifNameCarriedInTrapIsNotQueried() {
        pipeline.onTrap(trap(Oids.LINK_DOWN,
                new VarBind(Oids.SYS_UPTIME, 7L),
                new VarBind(Oids.IF_INDEX + ".3", 3),
                new VarBind(Oids.IF_ADMIN_STATUS + ".3", 1),
                new VarBind(Oids.IF_OPER_STATUS + ".3", 2),
                new VarBind(Oids.IF_NAME + ".3", "ge-0/0/3".getBytes(StandardCharsets.UTF_8))));

        assertEquals(List.of(Oids.SYS_NAME, Oids.ifAlias(3)), snmp.oids());
        assertEquals("ge-0/0/3", store.inserts.get(0).ifName());
        assertEquals("ge-0/0/3", store.updates.get(0).ifName());
        assertTrue(store.callsStartingWith("getIfName").isEmpty());
    }

    // ========== failures ==========

    @Test
    void failedAliasLookupLeavesAliasNull() {
        snmp.unreachable.add(Oids.ifAlias(3));

        pipeline.onTrap(linkTrap(Oids.LINK_DOWN, 3, 1, 2, 10L));

        assertEquals(List.of(new RecordingEventStore.Update("sid-1", "sw1", "Gi0/3", null)), store.updates);
        assertTrue(store.callsStartingWith("putIfAlias").isEmpty());
        assertEquals(1, store.callsStartingWith("putIfName").size());
    }

    @Test
    void uncheckedLookupFailureStillUpdatesWithWhatWasResolved() {
        snmp.broken.add(Oids.ifName(3));

        assertDoesNotThrow(() -> pipeline.onTrap(linkTrap(Oids.LINK_DOWN, 3, 2, 2, 10L)));

        assertEquals(List.of(new RecordingEventStore.Update("sid-1", "sw1", null, "uplink")), store.updates);
        assertTrue(store.callsStartingWith("putIfName").isEmpty());
        assertEquals("sw1", store.hostnames.get(DEVICE));
    }

    @Test
    void uncheckedCacheReadFailureFallsBackToTheDevice() {
        store.breakCacheReads = true;

        pipeline.onTrap(linkTrap(Oids.LINK_DOWN, 3, 2, 2, 10L));

        assertEquals(List.of(Oids.SYS_NAME, Oids.ifName(3), Oids.ifAlias(3)), snmp.oids());
        assertEquals(List.of(new RecordingEventStore.Update("sid-1", "sw1", "Gi0/3", "uplink")), store.updates);
    }

    @Test
    void failedInsertAbandonsTheTrap() {
        store.failInsert = true;

        pipeline.onTrap(linkTrap(Oids.LINK_DOWN, 3, 1, 2, 10L));

        assertEquals(List.of("insert:sid-1"), store.calls);
        assertTrue(snmp.requests.isEmpty());
    }

    @Test
    void failedUpdateDoesNotEscape() {
        store.failUpdate = true;

        LinkEvent event = assertDoesNotThrow(() -> pipeline.handle(linkTrap(Oids.LINK_DOWN, 3, 1, 2, 10L)));

        assertEquals("sw1", event.hostName());
        assertEquals(1, store.inserts.size());
        assertTrue(store.updates.isEmpty());
    }

    @Test
    void missingUptimeStillStoresTheEvent() {
        pipeline.onTrap(trap(Oids.LINK_UP,
                new VarBind(Oids.IF_INDEX + ".3", 3),
                new VarBind(Oids.IF_ADMIN_STATUS + ".3", 1),
                new VarBind(Oids.IF_OPER_STATUS + ".3", 1)));

        assertEquals(0L, store.inserts.get(0).timeTicks());
        assertEquals(1, store.updates.size());
    }

    @Test
    void eachTrapGetsItsOwnSid() {
        pipeline.onTrap(linkTrap(Oids.LINK_DOWN, 3, 1, 2, 10L));
        pipeline.onTrap(linkTrap(Oids.LINK_UP, 3, 1, 1, 20L));

        assertEquals("sid-1", store.inserts.get(0).sid());
        assertEquals("sid-2", store.inserts.get(1).sid());
        // second trap is served from the cache filled by the first
        assertEquals(3, snmp.requests.size());
    }

    // ============================================================
    // Helpers
    // ============================================================

    private static TrapNotification linkTrap(String trapOid, int ifIndex, int admin, int oper, long ticks) {
        return trap(trapOid,
                new VarBind(Oids.SYS_UPTIME, ticks),
                new VarBind(Oids.IF_INDEX + "." + ifIndex, ifIndex),
                new VarBind(Oids.IF_ADMIN_STATUS + "." + ifIndex, admin),
                new VarBind(Oids.IF_OPER_STATUS + "." + ifIndex, oper));
    }

    private static TrapNotification trap(String trapOid, VarBind... rest) {
        VarBind[] all = new VarBind[rest.length + 1];
        all[0] = new VarBind(Oids.SNMP_TRAP_OID, trapOid);
        System.arraycopy(rest, 0, all, 1, rest.length);
        return new TrapNotification(DEVICE, 50000, List.of(all));
    }
}
