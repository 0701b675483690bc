package com.di.execmaps.model;

/**
 * Outcome of a replace or delete.
 *
 * @param rowsAffected rows reported by the backend (drivers that answer
 *                     {@code SUCCESS_NO_INFO} for batched rows contribute nothing)
 * @param executed     {@code false} when the call was a defined no-op and no statement ran
 */
public record WriteResult(long rowsAffected, boolean executed) {

    private static final WriteResult NO_OP = new WriteResult(0, false);

    public static WriteResult noOp() {
        return NO_OP;
    }

    public static WriteResult of(long rowsAffected) {
        return new WriteResult(rowsAffected, true);
    }

    public WriteResult plus(WriteResult other) {
        return new WriteResult(rowsAffected + other.rowsAffected, executed || other.executed);
    }
}
