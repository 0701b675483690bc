package com.di.execmaps.config;

import java.io.Serializable;

public record DbConfigSnapshot(String jdbcUrl, String username, String password, String driverClassName,
                               int maximumPoolSize, int minimumIdle, long idleTimeoutMs, long connectionTimeoutMs,
                               long maxLifetimeMs) implements Serializable {

    @Override
    public String toString() {
        return "DbConfigSnapshot[jdbcUrl=" + jdbcUrl + ", username=" + username + ", password=***"
                + ", driverClassName=" + driverClassName + ", maximumPoolSize=" + maximumPoolSize
                + ", minimumIdle=" + minimumIdle + ", idleTimeoutMs=" + idleTimeoutMs
                + ", connectionTimeoutMs=" + connectionTimeoutMs + ", maxLifetimeMs=" + maxLifetimeMs + "]";
    }
}
