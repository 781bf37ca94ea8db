package com.flapmyport.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    public String logFilename = "snmpflapd.log";
    public ListenConfig listen = new ListenConfig();
    public DbConfig db = new DbConfig();
    public SnmpConfig snmp = new SnmpConfig();
    public CacheConfig cache = new CacheConfig();
    public WorkersConfig workers = new WorkersConfig();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ListenConfig {
        public String address = "0.0.0.0";
        public int port = 162;
        /** SO_RCVBUF requested for the trap socket (bytes). */
        public int receiveBufferBytes = 4 * 1024 * 1024;
        /** Largest datagram accepted (bytes). */
        public int maxInboundMessageSize = 64 * 1024;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DbConfig {
        public String host = "127.0.0.1";
        public String name = "snmpflapd";
        public String user = "root";
        public String password = "";
        public int poolSize = 4;
        /** Run the bundled DDL on startup (CREATE TABLE IF NOT EXISTS). */
        public boolean initSchema = false;

        public String jdbcUrl() {
            return "jdbc:mysql://" + host + "/" + name;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SnmpConfig {
        public String community = "";
        /** Agent port used for GET requests. */
        public int port = 161;
        public long timeoutMs = 2000;
        public int retries = 1;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        public int hostnameMinutes = 1440;
        public int ifNameMinutes = 1440;
        public int ifAliasMinutes = 60;
        /** Period of the expired-row sweep, independent of the TTLs above. */
        public int cleanupIntervalMinutes = 60;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WorkersConfig {
        /** Threads handling traps; also the bound on traps enriched at once. */
        public int threads = 4;
        public int queueCapacity = 4096;
        /** BLOCK or DROP_NEWEST. */
        public String overflowPolicy = "BLOCK";
        /** offer() timeout when overflowPolicy=BLOCK (ms). */
        public long offerTimeoutMs = 5;
    }
}
