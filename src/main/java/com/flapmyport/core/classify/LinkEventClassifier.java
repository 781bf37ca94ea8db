package com.flapmyport.core.classify;

import com.flapmyport.core.model.Oids;
import com.flapmyport.core.model.TrapNotification;

/**
 * Tells linkUp/linkDown traps apart from everything else by the value of snmpTrapOID.0.
 */
public class LinkEventClassifier {

    public boolean isLinkEvent(TrapNotification trap) {
        String type = eventType(trap);
        return Oids.LINK_UP.equals(type) || Oids.LINK_DOWN.equals(type);
    }

    /** The notification OID carried in snmpTrapOID.0, canonical, or null when absent. */
    public String eventType(TrapNotification trap) {
        Object value = trap.valueOf(Oids.SNMP_TRAP_OID);
        if (value == null) return null;
        return Oids.canonical(value.toString());
    }
}
