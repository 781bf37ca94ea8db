package com.flapmyport.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A trap as handed over by the transport: sender address, PDU type and ordered variable bindings.
 * v1 traps arrive already translated, with sysUpTime.0 and snmpTrapOID.0 in front.
 */
public record TrapNotification(
        String sourceAddress,   // sender IP, textual
        int sourcePort,
        String pduType,         // TRAP, V1TRAP, INFORM
        List<VarBind> varbinds
) {
    public TrapNotification {
        Objects.requireNonNull(sourceAddress, "sourceAddress");
        pduType = (pduType == null) ? "TRAP" : pduType;
        varbinds = (varbinds == null) ? List.of() : List.copyOf(varbinds);
    }

    public TrapNotification(String sourceAddress, int sourcePort, List<VarBind> varbinds) {
        this(sourceAddress, sourcePort, "TRAP", varbinds);
    }

    /** Value of the first binding with exactly this OID, or null. */
    public Object valueOf(String oid) {
        String canonical = Oids.canonical(oid);
        for (VarBind vb : varbinds) {
            if (vb.oid().equals(canonical)) return vb.value();
        }
        return null;
    }
}
