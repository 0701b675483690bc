package com.di.execmaps.query;

import com.di.execmaps.schema.MapKind;
import com.di.execmaps.schema.MapSchemaRegistry;
import com.di.execmaps.sql.SqlDialect;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Templates of every map kind for one dialect, generated once at startup.
 */
@Slf4j
public final class MapQueryTemplateCatalog {

    private final SqlDialect dialect;
    private final Map<MapKind, MapQueryTemplates> templates;

    private MapQueryTemplateCatalog(SqlDialect dialect, Map<MapKind, MapQueryTemplates> templates) {
        this.dialect = dialect;
        this.templates = templates;
    }

    public static MapQueryTemplateCatalog build(MapSchemaRegistry registry, SqlDialect dialect) {
        Map<MapKind, MapQueryTemplates> generated = new EnumMap<>(MapKind.class);
        registry.all().forEach((kind, schema) -> {
            MapQueryTemplates t = MapQueryTemplateGenerator.generate(schema, dialect);
            log.debug("[MAPS] Generated templates for {} ({}): upsert=[{}]", kind.tag(), dialect.type(), t.upsert());
            generated.put(kind, t);
        });
        log.info("[MAPS] Generated query templates for {} map kind(s) using dialect '{}'", generated.size(), dialect.type());
        return new MapQueryTemplateCatalog(dialect, Collections.unmodifiableMap(generated));
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public MapQueryTemplates get(MapKind kind) {
        MapQueryTemplates t = templates.get(kind);
        if (t == null) {
            throw new IllegalArgumentException("No templates generated for map kind " + kind);
        }
        return t;
    }
}
