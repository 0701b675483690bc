package com.di.execmaps.schema;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable lookup of {@link MapSchema} by {@link MapKind}. Built once by the composition root
 * and shared by every store; it is the only place table and column names are defined.
 */
public final class MapSchemaRegistry {

    private static final List<String> PAYLOAD_COLUMNS = List.of("data", "data_encoding");

    private final Map<MapKind, MapSchema> schemas;

    public MapSchemaRegistry(Map<MapKind, MapSchema> schemas) {
        EnumMap<MapKind, MapSchema> copy = new EnumMap<>(MapKind.class);
        copy.putAll(schemas);
        for (MapKind kind : MapKind.values()) {
            if (!copy.containsKey(kind)) {
                throw new IllegalArgumentException("No schema registered for map kind " + kind);
            }
        }
        this.schemas = Collections.unmodifiableMap(copy);
    }

    /** The six map tables of an execution. */
    public static MapSchemaRegistry standard() {
        Map<MapKind, MapSchema> schemas = new EnumMap<>(MapKind.class);
        schemas.put(MapKind.ACTIVITY_INFO, new MapSchema("activity_info_maps", "schedule_id",
                List.of("data", "data_encoding", "last_heartbeat_details", "last_heartbeat_updated_time")));
        schemas.put(MapKind.TIMER_INFO, new MapSchema("timer_info_maps", "timer_id", PAYLOAD_COLUMNS));
        schemas.put(MapKind.CHILD_EXECUTION_INFO, new MapSchema("child_execution_info_maps", "initiated_id", PAYLOAD_COLUMNS));
        schemas.put(MapKind.REQUEST_CANCEL_INFO, new MapSchema("request_cancel_info_maps", "initiated_id", PAYLOAD_COLUMNS));
        schemas.put(MapKind.SIGNAL_INFO, new MapSchema("signal_info_maps", "initiated_id", PAYLOAD_COLUMNS));
        schemas.put(MapKind.SIGNALS_REQUESTED, new MapSchema("signals_requested_sets", "signal_id", List.of()));
        return new MapSchemaRegistry(schemas);
    }

    public MapSchema get(MapKind kind) {
        MapSchema schema = schemas.get(kind);
        if (schema == null) {
            throw new IllegalArgumentException("Unknown map kind: " + kind);
        }
        return schema;
    }

    public Map<MapKind, MapSchema> all() {
        return schemas;
    }
}
