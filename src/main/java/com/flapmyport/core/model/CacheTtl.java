package com.flapmyport.core.model;

import java.time.Duration;
import java.util.Objects;

/** How long a cached value stays live, per cache kind. */
public record CacheTtl(Duration hostname, Duration ifName, Duration ifAlias) {
    public CacheTtl {
        Objects.requireNonNull(hostname, "hostname");
        Objects.requireNonNull(ifName, "ifName");
        Objects.requireNonNull(ifAlias, "ifAlias");
    }

    public static CacheTtl ofMinutes(int hostname, int ifName, int ifAlias) {
        return new CacheTtl(Duration.ofMinutes(hostname), Duration.ofMinutes(ifName), Duration.ofMinutes(ifAlias));
    }

    public Duration forKind(CacheKind kind) {
        return switch (kind) {
            case HOSTNAME -> hostname;
            case IF_NAME -> ifName;
            case IF_ALIAS -> ifAlias;
        };
    }
}
