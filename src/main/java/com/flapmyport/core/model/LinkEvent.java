package com.flapmyport.core.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * One interface up/down event.
 * <p>
 * Created when the trap is received, inserted before enrichment, then updated by {@link #sid()}
 * with whatever metadata got resolved. Owned by the worker handling the trap, not thread-safe.
 */
public final class LinkEvent {
    public static final int STATUS_UP = 1;
    public static final int STATUS_DOWN = 2;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // --- fixed at receipt ---
    private final String sid;
    private final String ipAddress;
    private final LocalDateTime eventTime;

    // --- from the trap ---
    private int ifIndex;
    private int ifAdminStatus;
    private int ifOperStatus;
    private long timeTicks;

    // --- resolved (null until known) ---
    private String ifName;
    private String ifAlias;
    private String hostName;

    public LinkEvent(String sid, String ipAddress, LocalDateTime eventTime) {
        this.sid = Objects.requireNonNull(sid, "sid");
        this.ipAddress = Objects.requireNonNull(ipAddress, "ipAddress");
        this.eventTime = Objects.requireNonNull(eventTime, "eventTime");
    }

    public String sid() { return sid; }
    public String ipAddress() { return ipAddress; }
    public LocalDateTime eventTime() { return eventTime; }
    public int ifIndex() { return ifIndex; }
    public int ifAdminStatus() { return ifAdminStatus; }
    public int ifOperStatus() { return ifOperStatus; }
    public long timeTicks() { return timeTicks; }
    public String ifName() { return ifName; }
    public String ifAlias() { return ifAlias; }
    public String hostName() { return hostName; }

    public void setIfIndex(int ifIndex) { this.ifIndex = ifIndex; }
    public void setIfAdminStatus(int ifAdminStatus) { this.ifAdminStatus = ifAdminStatus; }
    public void setIfOperStatus(int ifOperStatus) { this.ifOperStatus = ifOperStatus; }
    public void setTimeTicks(long timeTicks) { this.timeTicks = timeTicks; }
    public void setIfName(String ifName) { this.ifName = ifName; }
    public void setIfAlias(String ifAlias) { this.ifAlias = ifAlias; }
    public void setHostName(String hostName) { this.hostName = hostName; }

    /** Stored admin status column: "up" for 1, "down" otherwise. */
    public String adminStatusText() {
        return ifAdminStatus == STATUS_UP ? "up" : "down";
    }

    /** Stored oper status column: "up" for 1, "down" otherwise. */
    public String operStatusText() {
        return ifOperStatus == STATUS_UP ? "up" : "down";
    }

    /** Combined state for logs. Admin down wins over whatever the oper status says. */
    public String stateText() {
        if (ifAdminStatus == STATUS_DOWN) return "admin down";
        if (ifAdminStatus == STATUS_UP) return ifOperStatus == STATUS_UP ? "up" : "down";
        return "";
    }

    @Override
    public String toString() {
        return String.format("eventTime=%s host=%s ifName=%s ifIndex=%d ifAlias=%s status=%s",
                eventTime.format(TIME_FORMAT),
                hostName != null ? hostName : ipAddress,
                ifName != null ? ifName : "NULL",
                ifIndex,
                ifAlias != null ? ifAlias : "NULL",
                stateText());
    }
}
