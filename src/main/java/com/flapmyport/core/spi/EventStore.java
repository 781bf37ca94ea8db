package com.flapmyport.core.spi;

import com.flapmyport.core.model.LinkEvent;

import java.io.Closeable;
import java.util.Optional;

/**
 * Durable link events plus the three expiring metadata caches.
 * <p>
 * Cache reads only return rows younger than the kind's TTL. Every {@code putCached*} replaces
 * all rows of its key atomically (delete then insert in one transaction), so a key never has
 * more than one live row.
 */
public interface EventStore extends Closeable {

    /** Inserts the event as it is now; null metadata columns are fine. */
    void insertEvent(LinkEvent event) throws StoreException;

    /** Writes hostname/ifName/ifAlias of the row with this sid. Nulls are written as NULL. */
    void updateEvent(String sid, String hostName, String ifName, String ifAlias) throws StoreException;

    Optional<String> getCachedHostname(String ipAddress) throws StoreException;

    void putCachedHostname(String ipAddress, String hostName) throws StoreException;

    Optional<String> getCachedIfName(String ipAddress, int ifIndex) throws StoreException;

    void putCachedIfName(String ipAddress, int ifIndex, String ifName) throws StoreException;

    Optional<String> getCachedIfAlias(String ipAddress, int ifIndex) throws StoreException;

    void putCachedIfAlias(String ipAddress, int ifIndex, String ifAlias) throws StoreException;

    /** Deletes cache rows older than their kind's TTL, all kinds in one transaction. */
    void cleanup() throws StoreException;

    @Override
    void close();
}
