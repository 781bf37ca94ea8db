package com.flapmyport.core.classify;

import com.flapmyport.core.model.LinkEvent;
import com.flapmyport.core.model.Oids;
import com.flapmyport.core.model.TrapNotification;
import com.flapmyport.core.model.VarBind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Copies interface fields out of a link trap's bindings.
 * <p>
 * Each field is independent: a binding whose value has an unexpected type is logged and
 * skipped, the field keeps its zero/null value and the rest of the trap is still read.
 */
public class LinkFieldExtractor {
    private static final Logger log = LoggerFactory.getLogger(LinkFieldExtractor.class);

    public void extract(TrapNotification trap, LinkEvent event) {
        for (VarBind vb : trap.varbinds()) {
            String oid = vb.oid();
            Object value = vb.value();

            if (Oids.startsWith(oid, Oids.IF_INDEX)) {
                Integer v = asInt(event, "ifIndex", value);
                if (v != null) event.setIfIndex(v);
            } else if (Oids.startsWith(oid, Oids.IF_ADMIN_STATUS)) {
                Integer v = asInt(event, "ifAdminStatus", value);
                if (v != null) event.setIfAdminStatus(v);
            } else if (Oids.startsWith(oid, Oids.IF_OPER_STATUS)) {
                Integer v = asInt(event, "ifOperStatus", value);
                if (v != null) event.setIfOperStatus(v);
            } else if (Oids.startsWith(oid, Oids.IF_NAME)) {
                if (value instanceof byte[] bytes) {
                    event.setIfName(new String(bytes, StandardCharsets.UTF_8));
                } else {
                    log.warn("{} unexpected ifName value type {} in trap from {}",
                            event.sid(), typeName(value), event.ipAddress());
                }
            } else if (oid.equals(Oids.SYS_UPTIME)) {
                if (value instanceof Long ticks) {
                    event.setTimeTicks(ticks);
                } else {
                    log.warn("{} missing timeTicks in the SNMP trap from {} (got {})",
                            event.sid(), event.ipAddress(), typeName(value));
                }
            }
        }
    }

    private static Integer asInt(LinkEvent event, String field, Object value) {
        if (value instanceof Integer i) return i;
        log.warn("{} unexpected {} value type {} in trap from {}",
                event.sid(), field, typeName(value), event.ipAddress());
        return null;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
