package com.di.execmaps.query;

import com.di.execmaps.error.ParameterExpansionException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Expands a collection parameter ({@code key IN (:keys)}) into one {@code ?} per element.
 *
 * <p>All checks run before anything reaches the backend: an empty key set, a {@code null}
 * element or a statement that would exceed the backend's bind-parameter limit raise
 * {@link ParameterExpansionException}.
 */
public final class KeySetBinder {

    private KeySetBinder() {
    }

    /**
     * @param template          template containing {@code :keysParam} inside an {@code IN (...)} list
     * @param params            the other (scalar) parameters of the template
     * @param keysParam         name of the collection parameter
     * @param keys              key values, at least one, no {@code null}s
     * @param maxBindParameters upper bound on positional parameters for the target backend
     */
    public static BoundStatement bind(NamedTemplate template,
                                      MapSqlParameterSource params,
                                      String keysParam,
                                      Collection<?> keys,
                                      int maxBindParameters) {
        if (keys == null || keys.isEmpty()) {
            throw new ParameterExpansionException("Key set '" + keysParam + "' is empty; nothing to expand");
        }
        if (keys.stream().anyMatch(Objects::isNull)) {
            throw new ParameterExpansionException("Key set '" + keysParam + "' contains a null key");
        }
        int total = params.getParameterNames().length + keys.size();
        if (total > maxBindParameters) {
            throw new ParameterExpansionException(String.format(
                    "Key set '%s' of %d keys needs %d bind parameters; backend limit is %d",
                    keysParam, keys.size(), total, maxBindParameters));
        }

        MapSqlParameterSource source = new MapSqlParameterSource(params.getValues())
                .addValue(keysParam, List.copyOf(keys));
        String sql;
        Object[] values;
        try {
            sql = NamedParameterUtils.substituteNamedParameters(template.parsed(), source);
            values = NamedParameterUtils.buildValueArray(template.parsed(), source, null);
        } catch (InvalidDataAccessApiUsageException e) {
            throw new ParameterExpansionException("Could not expand key set '" + keysParam + "': " + e.getMessage(), e);
        }

        List<Object> args = new ArrayList<>(total);
        for (Object value : values) {
            if (value instanceof Collection<?> collection) {
                args.addAll(collection);
            } else {
                args.add(value);
            }
        }
        return new BoundStatement(sql, args);
    }
}
