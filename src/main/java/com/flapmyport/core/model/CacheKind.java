package com.flapmyport.core.model;

public enum CacheKind {
    HOSTNAME("hostname"),
    IF_NAME("ifName"),
    IF_ALIAS("ifAlias");

    private final String label;

    CacheKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
