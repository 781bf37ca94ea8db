package com.flapmyport.core.classify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.flapmyport.core.model.LinkEvent;
import com.flapmyport.core.model.Oids;
import com.flapmyport.core.model.TrapNotification;
import com.flapmyport.core.model.VarBind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkFieldExtractorTest {

    private final LinkFieldExtractor extractor = new LinkFieldExtractor();
    private final Logger extractorLog = (Logger) LoggerFactory.getLogger(LinkFieldExtractor.class);
    private ListAppender<ILoggingEvent> logs;

    @BeforeEach
    void attachAppender() {
        logs = new ListAppender<>();
        logs.start();
        extractorLog.addAppender(logs);
    }

    @AfterEach
    void detachAppender() {
        extractorLog.detachAppender(logs);
    }

    private static LinkEvent run(LinkFieldExtractor extractor, VarBind... vbs) {
        LinkEvent event = new LinkEvent("sid-x", "10.9.8.7", LocalDateTime.now());
        extractor.extract(new TrapNotification("10.9.8.7", 162, List.of(vbs)), event);
        return event;
    }

    @Test
    void readsStandardLinkBindings() {
        LinkEvent e = run(extractor,
                new VarBind(Oids.SNMP_TRAP_OID, Oids.LINK_DOWN),
                new VarBind(Oids.SYS_UPTIME, 123456L),
                new VarBind(Oids.IF_INDEX + ".3", 3),
                new VarBind(Oids.IF_ADMIN_STATUS + ".3", 1),
                new VarBind(Oids.IF_OPER_STATUS + ".3", 2));

        assertEquals(3, e.ifIndex());
        assertEquals(1, e.ifAdminStatus());
        assertEquals(2, e.ifOperStatus());
        assertEquals(123456L, e.timeTicks());
        assertNull(e.ifName());
        assertTrue(logs.list.isEmpty());
    }

    @Test
    void leadingDotOidsMatch() {
        LinkEvent e = run(extractor,
                new VarBind(".1.3.6.1.2.1.1.3.0", 9L),
                new VarBind(".1.3.6.1.2.1.2.2.1.1.17", 17),
                new VarBind(".1.3.6.1.2.1.2.2.1.8.17", 1));

        assertEquals(17, e.ifIndex());
        assertEquals(1, e.ifOperStatus());
        assertEquals(9L, e.timeTicks());
    }

    @Test
    void ifNameCarriedByTheTrapIsDecoded() {
        LinkEvent e = run(extractor,
                new VarBind(Oids.IF_INDEX + ".520", 520),
                new VarBind(Oids.IF_NAME + ".520", "ge-0/0/1.0".getBytes(StandardCharsets.UTF_8)));

        assertEquals("ge-0/0/1.0", e.ifName());
    }

    @Test
    void wrongValueTypeIsSkippedWithWarning() {
        LinkEvent e = run(extractor,
                new VarBind(Oids.IF_INDEX + ".3", "three"),
                new VarBind(Oids.IF_ADMIN_STATUS + ".3", 1),
                new VarBind(Oids.IF_NAME + ".3", 42));

        assertEquals(0, e.ifIndex());
        assertEquals(1, e.ifAdminStatus());
        assertNull(e.ifName());
        assertEquals(2, logs.list.size());
        assertTrue(logs.list.stream().allMatch(l -> l.getLevel() == Level.WARN));
        assertTrue(logs.list.get(0).getFormattedMessage().contains("ifIndex"));
    }

    @Test
    void nonTicksUptimeIsReportedAsMissing() {
        LinkEvent e = run(extractor, new VarBind(Oids.SYS_UPTIME, "yesterday"));

        assertEquals(0L, e.timeTicks());
        assertEquals(1, logs.list.size());
        assertTrue(logs.list.get(0).getFormattedMessage().startsWith("sid-x missing timeTicks"));
    }

    @Test
    void unrelatedBindingsAreIgnored() {
        LinkEvent e = run(extractor,
                new VarBind("1.3.6.1.2.1.2.2.1.10.3", 99L),   // ifInOctets
                new VarBind("1.3.6.1.4.1.9.2.2.1.1.20.3", "administratively down".getBytes(StandardCharsets.UTF_8)));

        assertEquals(0, e.ifIndex());
        assertTrue(logs.list.isEmpty());
    }
}
