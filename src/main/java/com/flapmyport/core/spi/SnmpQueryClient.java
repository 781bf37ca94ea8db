package com.flapmyport.core.spi;

/**
 * Synchronous single-value SNMP GET against a device.
 */
@FunctionalInterface
public interface SnmpQueryClient {
    /**
     * @return the value at {@code oid}, an OCTET STRING decoded as text
     * @throws SnmpQueryException on timeout, device error, or a missing / non-string value
     */
    String get(String oid, String targetAddress, String community) throws SnmpQueryException;
}
