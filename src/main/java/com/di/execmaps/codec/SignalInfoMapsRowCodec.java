package com.di.execmaps.codec;

import com.di.execmaps.model.SignalInfoMapsRow;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

public final class SignalInfoMapsRowCodec implements MapRowCodec<SignalInfoMapsRow, Long> {

    @Override
    public Long keyOf(SignalInfoMapsRow row) {
        return row.getInitiatedId();
    }

    @Override
    public List<Object> encodeValues(SignalInfoMapsRow row, DateTimeConverter converter) {
        return Arrays.asList(row.getData(), row.getDataEncoding());
    }

    @Override
    public SignalInfoMapsRow decode(ResultSet rs, DateTimeConverter converter) throws SQLException {
        SignalInfoMapsRow row = new SignalInfoMapsRow();
        row.setInitiatedId(rs.getLong(1));
        row.setData(rs.getBytes(2));
        row.setDataEncoding(rs.getString(3));
        return row;
    }
}
