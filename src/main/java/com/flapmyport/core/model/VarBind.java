package com.flapmyport.core.model;

import java.util.Objects;

/**
 * One decoded variable binding.
 * <p>
 * {@code value} is already mapped to a plain Java type by the transport:
 * {@code Integer} (INTEGER), {@code Long} (TimeTicks, counters, gauges),
 * {@code byte[]} (OCTET STRING) or {@code String} (OID, IpAddress, anything else).
 * Byte arrays are copied on the way in and out.
 */
public record VarBind(String oid, Object value) {
    public VarBind {
        oid = Oids.canonical(Objects.requireNonNull(oid, "oid"));
        if (value instanceof byte[] bytes) value = bytes.clone();
    }

    @Override
    public Object value() {
        return value instanceof byte[] bytes ? bytes.clone() : value;
    }
}
