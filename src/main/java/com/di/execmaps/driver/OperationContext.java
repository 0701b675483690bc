package com.di.execmaps.driver;

import com.di.execmaps.error.OperationCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.QueryTimeoutException;

import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-call deadline and cancellation handle.
 *
 * <p>A context is checked before a statement is prepared and its remaining time is pushed down
 * to the driver as the statement's query timeout. {@link #cancel()} may be called from any
 * thread; it marks the context and asks the driver to abort the statement currently running
 * under it.
 */
@Slf4j
public final class OperationContext {

    private final Instant deadline;
    private final AtomicReference<Statement> inFlight = new AtomicReference<>();
    private volatile boolean cancelled;

    private OperationContext(Instant deadline) {
        this.deadline = deadline;
    }

    /** No deadline; the driver's default operation timeout applies. */
    public static OperationContext background() {
        return new OperationContext(null);
    }

    public static OperationContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return new OperationContext(Instant.now().plus(timeout));
    }

    public static OperationContext withDeadline(Instant deadline) {
        return new OperationContext(Objects.requireNonNull(deadline, "deadline"));
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        cancelled = true;
        Statement statement = inFlight.get();
        if (statement != null) {
            cancelStatement(statement);
        }
    }

    /**
     * @throws OperationCancelledException if {@link #cancel()} was called
     * @throws QueryTimeoutException       if the deadline has passed
     */
    public void checkActive() {
        if (cancelled) {
            throw new OperationCancelledException("Operation cancelled by caller");
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            throw new QueryTimeoutException("Operation deadline " + deadline + " exceeded before execution");
        }
    }

    /**
     * Sets the statement's query timeout from the remaining time, or from {@code defaultTimeout}
     * when the context has no deadline. A zero or absent default leaves the driver's setting.
     */
    void applyTo(Statement statement, Duration defaultTimeout) throws SQLException {
        checkActive();
        Duration remaining = deadline != null ? Duration.between(Instant.now(), deadline) : defaultTimeout;
        if (remaining == null || remaining.isZero() || remaining.isNegative()) {
            return;
        }
        statement.setQueryTimeout(toTimeoutSeconds(remaining));
    }

    void attach(Statement statement) {
        inFlight.set(statement);
        if (cancelled) {
            cancelStatement(statement);
        }
    }

    void detach(Statement statement) {
        inFlight.compareAndSet(statement, null);
    }

    static int toTimeoutSeconds(Duration remaining) {
        long millis = remaining.toMillis();
        long seconds = (millis + 999) / 1000;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
    }

    private static void cancelStatement(Statement statement) {
        try {
            statement.cancel();
        } catch (SQLException e) {
            log.warn("[MAPS] Statement cancel failed: {}", e.getMessage());
        }
    }
}
