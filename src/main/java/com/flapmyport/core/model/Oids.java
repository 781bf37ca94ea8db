package com.flapmyport.core.model;

/**
 * Object identifiers used by the link event pipeline, in canonical dotted form (no leading dot).
 */
public final class Oids {
    private Oids() {}

    /** snmpTrapOID.0: its value tells which notification this trap is. */
    public static final String SNMP_TRAP_OID = "1.3.6.1.6.3.1.1.4.1.0";
    public static final String LINK_DOWN = "1.3.6.1.6.3.1.1.5.3";
    public static final String LINK_UP = "1.3.6.1.6.3.1.1.5.4";

    public static final String SYS_UPTIME = "1.3.6.1.2.1.1.3.0";
    public static final String SYS_NAME = "1.3.6.1.2.1.1.5.0";

    public static final String IF_INDEX = "1.3.6.1.2.1.2.2.1.1";
    public static final String IF_ADMIN_STATUS = "1.3.6.1.2.1.2.2.1.7";
    public static final String IF_OPER_STATUS = "1.3.6.1.2.1.2.2.1.8";
    /** ifXTable ifName column; some vendors (JunOS) put it in the trap itself. */
    public static final String IF_NAME = "1.3.6.1.2.1.31.1.1.1.1";
    public static final String IF_ALIAS = "1.3.6.1.2.1.31.1.1.1.18";

    public static String ifName(int ifIndex) {
        return IF_NAME + "." + ifIndex;
    }

    public static String ifAlias(int ifIndex) {
        return IF_ALIAS + "." + ifIndex;
    }

    /** Strips the leading dot some stacks print. */
    public static String canonical(String oid) {
        if (oid == null) return null;
        String s = oid.trim();
        return s.startsWith(".") ? s.substring(1) : s;
    }

    /** True when {@code oid} is {@code prefix} itself or a sub-identifier of it. */
    public static boolean startsWith(String oid, String prefix) {
        return oid.equals(prefix) || oid.startsWith(prefix + ".");
    }
}
