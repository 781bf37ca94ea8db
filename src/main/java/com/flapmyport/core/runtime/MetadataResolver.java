package com.flapmyport.core.runtime;

import com.flapmyport.core.model.CacheKind;
import com.flapmyport.core.model.LinkEvent;
import com.flapmyport.core.model.Oids;
import com.flapmyport.core.spi.EventStore;
import com.flapmyport.core.spi.SnmpAccessGate;
import com.flapmyport.core.spi.SnmpQueryClient;
import com.flapmyport.core.spi.SnmpQueryException;
import com.flapmyport.core.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Fills hostname, ifName and ifAlias of a {@link LinkEvent}: live cache row first, then an SNMP
 * GET to the device through the {@link SnmpAccessGate}, written back to the cache on success.
 * <p>
 * Fields already set (e.g. an ifName carried in the trap) are left alone. Nothing here throws,
 * unchecked failures of the store or client included: a field that cannot be resolved stays null.
 */
public class MetadataResolver {
    private static final Logger log = LoggerFactory.getLogger(MetadataResolver.class);

    private final EventStore store;
    private final SnmpQueryClient snmp;
    private final SnmpAccessGate gate;
    private final String community;

    public MetadataResolver(EventStore store, SnmpQueryClient snmp, SnmpAccessGate gate, String community) {
        this.store = Objects.requireNonNull(store, "store");
        this.snmp = Objects.requireNonNull(snmp, "snmp");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.community = community != null ? community : "";
    }

    public void resolve(LinkEvent event) {
        log.debug("{} fetching missing data", event.sid());
        String ip = event.ipAddress();
        int ifIndex = event.ifIndex();

        if (event.hostName() == null) {
            fill(event, CacheKind.HOSTNAME, Oids.SYS_NAME, event::setHostName,
                    () -> store.getCachedHostname(ip),
                    v -> store.putCachedHostname(ip, v));
        }
        if (event.ifName() == null) {
            fill(event, CacheKind.IF_NAME, Oids.ifName(ifIndex), event::setIfName,
                    () -> store.getCachedIfName(ip, ifIndex),
                    v -> store.putCachedIfName(ip, ifIndex, v));
        }
        if (event.ifAlias() == null) {
            fill(event, CacheKind.IF_ALIAS, Oids.ifAlias(ifIndex), event::setIfAlias,
                    () -> store.getCachedIfAlias(ip, ifIndex),
                    v -> store.putCachedIfAlias(ip, ifIndex, v));
        }
    }

    private void fill(LinkEvent event, CacheKind kind, String oid, Consumer<String> setter,
                      CacheRead read, CacheWrite write) {
        // 1. cache
        Optional<String> cached = readCache(event, kind, read);
        if (cached.isPresent()) {
            setter.accept(cached.get());
            log.debug("{} used cached {} '{}'", event.sid(), kind.label(), cached.get());
            return;
        }

        // 2. device
        String value;
        try {
            value = gate.execute(() -> snmp.get(oid, event.ipAddress(), community));
        } catch (SnmpQueryException e) {
            log.warn("{} unable to get {} from {} via SNMP: {}",
                    event.sid(), kind.label(), event.ipAddress(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("{} SNMP query for {} to {} failed unexpectedly",
                    event.sid(), kind.label(), event.ipAddress(), e);
            return;
        }
        setter.accept(value);
        log.debug("{} received {} '{}' from {} via SNMP", event.sid(), kind.label(), value, event.ipAddress());

        // 3. write back
        try {
            write.write(value);
        } catch (StoreException | RuntimeException e) {
            log.warn("{} unable to cache {} for {}: {}", event.sid(), kind.label(), event.ipAddress(), e.toString());
        }
    }

    private Optional<String> readCache(LinkEvent event, CacheKind kind, CacheRead read) {
        try {
            return read.read();
        } catch (StoreException | RuntimeException e) {
            // treated as a miss
            log.debug("{} cache lookup for {} failed: {}", event.sid(), kind.label(), e.toString());
            return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface CacheRead {
        Optional<String> read() throws StoreException;
    }

    @FunctionalInterface
    private interface CacheWrite {
        void write(String value) throws StoreException;
    }
}
