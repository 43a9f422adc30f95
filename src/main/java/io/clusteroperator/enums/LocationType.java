package io.clusteroperator.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of storage locations a server may declare. Every location is created by the
 * init container before the main process starts.
 */
public enum LocationType {
    MASTER_CHANGELOGS("MasterChangelogs"),
    MASTER_SNAPSHOTS("MasterSnapshots"),
    CHUNK_STORE("ChunkStore"),
    CHUNK_CACHE("ChunkCache"),
    SLOTS("Slots"),
    LOGS("Logs");

    private final String value;

    LocationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static LocationType fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (LocationType type : LocationType.values()) {
            if (type.value.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }

        return null;
    }
}
