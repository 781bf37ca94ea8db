package com.flapmyport.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Reads {@link AppConfig} from a YAML file and applies environment overrides on top.
 * <p>
 * A missing file is not an error: defaults plus environment are used and
 * {@link Loaded#fileFound()} reports it so the caller can say so once logging is up.
 * Nothing in here logs, because it runs before the log file is known.
 */
public final class ConfigLoader {

    static final Set<String> OVERFLOW_POLICIES = Set.of("BLOCK", "DROP_NEWEST");

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public record Loaded(AppConfig config, boolean fileFound) {}

    public Loaded load(Path file, Map<String, String> env) {
        AppConfig cfg;
        boolean found = file != null && Files.isRegularFile(file);
        if (found) {
            try (InputStream in = Files.newInputStream(file)) {
                cfg = read(in);
            } catch (IOException e) {
                throw new ConfigException("Error reading config file " + file, e);
            }
        } else {
            cfg = new AppConfig();
        }
        applyEnv(cfg, env);
        validate(cfg);
        return new Loaded(cfg, found);
    }

    AppConfig read(InputStream in) throws IOException {
        AppConfig cfg = yaml.readValue(in, AppConfig.class);
        // empty document
        if (cfg == null) return new AppConfig();
        // a section key with no entries under it reads as null
        if (cfg.listen == null) cfg.listen = new AppConfig.ListenConfig();
        if (cfg.db == null) cfg.db = new AppConfig.DbConfig();
        if (cfg.snmp == null) cfg.snmp = new AppConfig.SnmpConfig();
        if (cfg.cache == null) cfg.cache = new AppConfig.CacheConfig();
        if (cfg.workers == null) cfg.workers = new AppConfig.WorkersConfig();
        if (cfg.logFilename == null) cfg.logFilename = new AppConfig().logFilename;
        return cfg;
    }

    /** Rejects values the daemon cannot start with; normalizes {@code workers.overflowPolicy} to upper case. */
    static void validate(AppConfig cfg) {
        port("listen.port", cfg.listen.port);
        port("snmp.port", cfg.snmp.port);
        atLeast("listen.receiveBufferBytes", cfg.listen.receiveBufferBytes, 1);
        atLeast("listen.maxInboundMessageSize", cfg.listen.maxInboundMessageSize, 1);
        atLeast("db.poolSize", cfg.db.poolSize, 1);
        atLeast("snmp.timeoutMs", cfg.snmp.timeoutMs, 1);
        atLeast("snmp.retries", cfg.snmp.retries, 0);
        atLeast("cache.hostnameMinutes", cfg.cache.hostnameMinutes, 1);
        atLeast("cache.ifNameMinutes", cfg.cache.ifNameMinutes, 1);
        atLeast("cache.ifAliasMinutes", cfg.cache.ifAliasMinutes, 1);
        atLeast("cache.cleanupIntervalMinutes", cfg.cache.cleanupIntervalMinutes, 1);
        atLeast("workers.threads", cfg.workers.threads, 1);
        atLeast("workers.queueCapacity", cfg.workers.queueCapacity, 1);
        atLeast("workers.offerTimeoutMs", cfg.workers.offerTimeoutMs, 0);

        String policy = cfg.workers.overflowPolicy == null
                ? "" : cfg.workers.overflowPolicy.trim().toUpperCase(Locale.ROOT);
        if (!OVERFLOW_POLICIES.contains(policy)) {
            throw new ConfigException("Wrong workers.overflowPolicy: '" + cfg.workers.overflowPolicy
                    + "' (expected BLOCK or DROP_NEWEST)");
        }
        cfg.workers.overflowPolicy = policy;
    }

    private static void port(String key, int value) {
        if (value < 1 || value > 65535) {
            throw new ConfigException("Wrong " + key + ": " + value + " (expected 1-65535)");
        }
    }

    private static void atLeast(String key, long value, long min) {
        if (value < min) {
            throw new ConfigException("Wrong " + key + ": " + value + " (expected >= " + min + ")");
        }
    }

    static void applyEnv(AppConfig cfg, Map<String, String> env) {
        str(env, "LOGFILE", v -> cfg.logFilename = v);
        str(env, "LISTEN_ADDRESS", v -> cfg.listen.address = v);
        num(env, "LISTEN_PORT", v -> cfg.listen.port = v);
        str(env, "DBHOST", v -> cfg.db.host = v);
        str(env, "DBNAME", v -> cfg.db.name = v);
        str(env, "DBUSER", v -> cfg.db.user = v);
        str(env, "DBPASSWORD", v -> cfg.db.password = v);
        str(env, "COMMUNITY", v -> cfg.snmp.community = v);
        num(env, "CACHE_HOSTNAME_MINUTES", v -> cfg.cache.hostnameMinutes = v);
        num(env, "CACHE_IFNAME_MINUTES", v -> cfg.cache.ifNameMinutes = v);
        num(env, "CACHE_IFALIAS_MINUTES", v -> cfg.cache.ifAliasMinutes = v);
        num(env, "CLEANUP_INTERVAL_MINUTES", v -> cfg.cache.cleanupIntervalMinutes = v);
    }

    private static void str(Map<String, String> env, String key, Consumer<String> setter) {
        String v = env.get(key);
        if (v != null) setter.accept(v);
    }

    private static void num(Map<String, String> env, String key, IntConsumer setter) {
        String v = env.get(key);
        if (v == null) return;
        try {
            setter.accept(Integer.parseInt(v.trim()));
        } catch (NumberFormatException e) {
            throw new ConfigException("Wrong environment variable " + key + ": '" + v + "'", e);
        }
    }
}
