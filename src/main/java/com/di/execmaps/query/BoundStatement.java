package com.di.execmaps.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JDBC-ready statement: {@code ?} placeholders plus positional arguments.
 */
public record BoundStatement(String sql, List<Object> args) {

    public BoundStatement {
        args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public Object[] argArray() {
        return args.toArray();
    }
}
