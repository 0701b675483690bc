package com.di.execmaps.sql;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Registry of the {@link SqlDialect} beans, looked up by their configured type.
 *
 * <p>Dialects are collected from the application context at startup; lookups are
 * case-insensitive and two dialects claiming the same type fail initialization.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqlDialectRegistry {

    private final List<SqlDialect> dialects;

    private Map<String, SqlDialect> dialectsByType = Collections.emptyMap();

    @PostConstruct
    void initialize() {
        if (dialects == null || dialects.isEmpty()) {
            log.warn("No SqlDialect beans found. Registry will be empty.");
            dialectsByType = Collections.emptyMap();
            return;
        }

        Map<String, List<SqlDialect>> grouped = dialects.stream()
                .peek(SqlDialectRegistry::validateType)
                .collect(Collectors.groupingBy(d -> normalizeType(d.type())));

        String duplicates = grouped.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> String.format("'%s' -> %s", e.getKey(),
                        e.getValue().stream().map(d -> d.getClass().getName()).toList()))
                .collect(Collectors.joining(" ; "));
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Duplicate SqlDialect type() values detected: " + duplicates);
        }

        dialectsByType = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().get(0)));
        log.info("Registered {} SQL dialect(s): {}", dialectsByType.size(), dialectsByType.keySet());
    }

    /**
     * @param type dialect key from configuration (case-insensitive)
     * @throws IllegalArgumentException if the type is blank or unknown
     */
    public SqlDialect getDialect(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Dialect type cannot be null or blank");
        }
        SqlDialect dialect = dialectsByType.get(normalizeType(type));
        if (dialect == null) {
            throw new IllegalArgumentException(String.format(
                    "Unsupported SQL dialect: '%s'. Available dialects: %s", type, dialectsByType.keySet()));
        }
        return dialect;
    }

    private static void validateType(SqlDialect dialect) {
        String type = dialect.type();
        if (type == null || type.isBlank()) {
            throw new IllegalStateException(String.format(
                    "Dialect %s returned blank type(). Dialect type must be non-null and non-blank.",
                    dialect.getClass().getName()));
        }
    }

    private static String normalizeType(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
