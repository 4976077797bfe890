package com.koni.mobility.domain.model;

/**
 * Kinds of catalogue entities the reconciler creates.
 */
public enum EntityKind {
    SENSOR("sensor"),
    DATASTREAM("datastream");

    private final String tag;

    EntityKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
