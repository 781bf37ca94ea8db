package com.flapmyport;

import ch.qos.logback.classic.Level;
import com.flapmyport.config.AppConfig;
import com.flapmyport.config.ConfigException;
import com.flapmyport.config.ConfigLoader;
import com.flapmyport.core.model.CacheTtl;
import com.flapmyport.core.runtime.CacheEvictionScheduler;
import com.flapmyport.core.runtime.LinkEventPipeline;
import com.flapmyport.core.runtime.MetadataResolver;
import com.flapmyport.core.runtime.MutexSnmpAccessGate;
import com.flapmyport.core.spi.StoreException;
import com.flapmyport.plugins.jdbc.JdbcEventStore;
import com.flapmyport.plugins.snmp.Snmp4jQueryClient;
import com.flapmyport.plugins.snmp.SnmpTrapDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Daemon entry point: {@code snmpflapd [-f settings.yml] [-v] [-V]}.
 */
public final class SnmpFlapd {
    static final String DEFAULT_CONFIG = "settings.yml";
    static final String BASE_LOGGER = "com.flapmyport";

    private SnmpFlapd() {}

    record Options(String configFile, boolean verbose, boolean version) {}

    public static void main(String[] args) throws InterruptedException {
        Options opts;
        try {
            opts = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            usage(System.err);
            System.exit(2);
            return;
        }

        if (opts.version()) {
            System.out.println(versionLine());
            return;
        }

        ConfigLoader.Loaded loaded;
        try {
            loaded = new ConfigLoader().load(Path.of(opts.configFile()), System.getenv());
        } catch (ConfigException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }
        AppConfig cfg = loaded.config();

        // read by logback.xml; must be set before the first logger is created
        System.setProperty("LOGFILE", cfg.logFilename);
        Logger log = LoggerFactory.getLogger(SnmpFlapd.class);
        if (opts.verbose()) enableVerbose();

        log.info("snmpflapd started ({})", versionLine());
        if (!loaded.fileFound()) {
            String msg = opts.configFile() + " not found. Suppose we're using environment variables";
            System.out.println(msg);
            log.info(msg);
        }

        JdbcEventStore store;
        try {
            store = JdbcEventStore.open(cfg.db.jdbcUrl(), cfg.db.user, cfg.db.password, cfg.db.poolSize,
                    CacheTtl.ofMinutes(cfg.cache.hostnameMinutes, cfg.cache.ifNameMinutes, cfg.cache.ifAliasMinutes),
                    Clock.systemDefaultZone());
            if (cfg.db.initSchema) store.initSchema();
        } catch (StoreException e) {
            log.error("Unable to open database: {}", e.getMessage(), e);
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }

        MetadataResolver resolver = new MetadataResolver(store,
                new Snmp4jQueryClient(cfg.snmp.port, cfg.snmp.timeoutMs, cfg.snmp.retries),
                new MutexSnmpAccessGate(),
                cfg.snmp.community);
        LinkEventPipeline pipeline = new LinkEventPipeline(resolver, store);

        CacheEvictionScheduler scheduler =
                new CacheEvictionScheduler(store, Duration.ofMinutes(cfg.cache.cleanupIntervalMinutes));

        SnmpTrapDriver driver = new SnmpTrapDriver(
                cfg.listen.address, cfg.listen.port,
                cfg.workers.queueCapacity,
                cfg.workers.threads,
                SnmpTrapDriver.OverflowPolicy.valueOf(cfg.workers.overflowPolicy),
                cfg.workers.offerTimeoutMs, TimeUnit.MILLISECONDS,
                cfg.listen.receiveBufferBytes,
                cfg.listen.maxInboundMessageSize);
        driver.setListener(pipeline);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("snmpflapd stopping");
            scheduler.stop();
            driver.stop(5_000);
            store.close();
            log.info("snmpflapd stopped");
            stopped.countDown();
        }, "shutdown"));

        try {
            scheduler.start();
            driver.start();
        } catch (Exception e) {
            log.error("Unable to listen on {}:{}: {}", cfg.listen.address, cfg.listen.port, e.toString(), e);
            System.err.println(e);
            System.exit(1);
            return;
        }

        stopped.await();
    }

    static Options parseArgs(String[] args) {
        String config = DEFAULT_CONFIG;
        boolean verbose = false;
        boolean version = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-f" -> {
                    if (i + 1 >= args.length) throw new IllegalArgumentException("-f requires a file name");
                    config = args[++i];
                }
                case "-v" -> verbose = true;
                case "-V" -> version = true;
                default -> throw new IllegalArgumentException("unknown option: " + args[i]);
            }
        }
        return new Options(config, verbose, version);
    }

    static String versionLine() {
        String v = SnmpFlapd.class.getPackage().getImplementationVersion();
        return "FlapMyPort snmpflapd version " + (v != null ? v : "dev");
    }

    static void enableVerbose() {
        Logger base = LoggerFactory.getLogger(BASE_LOGGER);
        if (base instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.DEBUG);
        }
    }

    private static void usage(PrintStream out) {
        out.println("usage: snmpflapd [-f config.yml] [-v] [-V]");
        out.println("  -f  location of config file (default " + DEFAULT_CONFIG + ")");
        out.println("  -v  enable verbose logging");
        out.println("  -V  print version information and quit");
    }
}
