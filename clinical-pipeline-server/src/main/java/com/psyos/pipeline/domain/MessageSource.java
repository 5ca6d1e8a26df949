package com.psyos.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where an inbound patient message entered the system.
 */
public enum MessageSource {
    WHATSAPP("whatsapp"),
    WEB("web");

    private final String wireName;

    MessageSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static MessageSource fromWire(String value) {
        for (MessageSource source : values()) {
            if (source.wireName.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown message source: " + value);
    }
}
