package com.di.execmaps.codec;

import com.di.execmaps.model.ChildExecutionInfoMapsRow;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

public final class ChildExecutionInfoMapsRowCodec implements MapRowCodec<ChildExecutionInfoMapsRow, Long> {

    @Override
    public Long keyOf(ChildExecutionInfoMapsRow row) {
        return row.getInitiatedId();
    }

    @Override
    public List<Object> encodeValues(ChildExecutionInfoMapsRow row, DateTimeConverter converter) {
        return Arrays.asList(row.getData(), row.getDataEncoding());
    }

    @Override
    public ChildExecutionInfoMapsRow decode(ResultSet rs, DateTimeConverter converter) throws SQLException {
        ChildExecutionInfoMapsRow row = new ChildExecutionInfoMapsRow();
        row.setInitiatedId(rs.getLong(1));
        row.setData(rs.getBytes(2));
        row.setDataEncoding(rs.getString(3));
        return row;
    }
}
