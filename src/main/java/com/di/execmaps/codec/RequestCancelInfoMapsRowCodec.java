package com.di.execmaps.codec;

import com.di.execmaps.model.RequestCancelInfoMapsRow;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

public final class RequestCancelInfoMapsRowCodec implements MapRowCodec<RequestCancelInfoMapsRow, Long> {

    @Override
    public Long keyOf(RequestCancelInfoMapsRow row) {
        return row.getInitiatedId();
    }

    @Override
    public List<Object> encodeValues(RequestCancelInfoMapsRow row, DateTimeConverter converter) {
        return Arrays.asList(row.getData(), row.getDataEncoding());
    }

    @Override
    public RequestCancelInfoMapsRow decode(ResultSet rs, DateTimeConverter converter) throws SQLException {
        RequestCancelInfoMapsRow row = new RequestCancelInfoMapsRow();
        row.setInitiatedId(rs.getLong(1));
        row.setData(rs.getBytes(2));
        row.setDataEncoding(rs.getString(3));
        return row;
    }
}
