package com.di.execmaps.codec;

import com.di.execmaps.model.SignalsRequestedSetsRow;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * {@code signals_requested_sets} has no value columns; only the signal id is read back.
 */
public final class SignalsRequestedSetsRowCodec implements MapRowCodec<SignalsRequestedSetsRow, String> {

    @Override
    public String keyOf(SignalsRequestedSetsRow row) {
        return row.getSignalId();
    }

    @Override
    public List<Object> encodeValues(SignalsRequestedSetsRow row, DateTimeConverter converter) {
        return List.of();
    }

    @Override
    public SignalsRequestedSetsRow decode(ResultSet rs, DateTimeConverter converter) throws SQLException {
        SignalsRequestedSetsRow row = new SignalsRequestedSetsRow();
        row.setSignalId(rs.getString(1));
        return row;
    }
}
