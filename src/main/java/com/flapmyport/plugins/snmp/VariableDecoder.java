package com.flapmyport.plugins.snmp;

import org.snmp4j.smi.Counter64;
import org.snmp4j.smi.Integer32;
import org.snmp4j.smi.IpAddress;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.OctetString;
import org.snmp4j.smi.UnsignedInteger32;
import org.snmp4j.smi.Variable;

/**
 * Maps SNMP4J variables to the plain Java values carried by
 * {@link com.flapmyport.core.model.VarBind}.
 */
final class VariableDecoder {
    private VariableDecoder() {}

    static Object decode(Variable v) {
        if (v == null) return null;
        if (v instanceof Integer32 i) return i.getValue();
        // TimeTicks, Counter32, Gauge32
        if (v instanceof UnsignedInteger32 u) return u.getValue();
        if (v instanceof Counter64 c) return c.getValue();
        if (v instanceof OctetString s) return s.getValue();
        if (v instanceof OID oid) return oid.toDottedString();
        if (v instanceof IpAddress ip) return ip.getInetAddress().getHostAddress();
        return v.toString();
    }
}
