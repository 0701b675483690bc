package com.di.execmaps.query;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Column-list helpers shared by the template generator and the dialects.
 */
public final class SqlFragments {

    private SqlFragments() {
    }

    /** {@code a, b, c} */
    public static String columnList(List<String> columns) {
        return String.join(", ", columns);
    }

    /** {@code :a, :b, :c} */
    public static String namedParameterList(List<String> columns) {
        return columns.stream().map(c -> ":" + c).collect(Collectors.joining(", "));
    }

    /** {@code a = <prefix>a, b = <prefix>b} using the given right-hand-side format. */
    public static String assignments(List<String> columns, String rightHandFormat) {
        return columns.stream()
                .map(c -> c + " = " + String.format(rightHandFormat, c))
                .collect(Collectors.joining(", "));
    }

    /** Predicate matching one execution: identity columns bound by name. */
    public static String identityPredicate() {
        return "shard_id = :shard_id AND domain_id = :domain_id AND workflow_id = :workflow_id AND run_id = :run_id";
    }
}
