package com.di.execmaps.codec;

import com.di.execmaps.model.TimerInfoMapsRow;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

public final class TimerInfoMapsRowCodec implements MapRowCodec<TimerInfoMapsRow, String> {

    @Override
    public String keyOf(TimerInfoMapsRow row) {
        return row.getTimerId();
    }

    @Override
    public List<Object> encodeValues(TimerInfoMapsRow row, DateTimeConverter converter) {
        return Arrays.asList(row.getData(), row.getDataEncoding());
    }

    @Override
    public TimerInfoMapsRow decode(ResultSet rs, DateTimeConverter converter) throws SQLException {
        TimerInfoMapsRow row = new TimerInfoMapsRow();
        row.setTimerId(rs.getString(1));
        row.setData(rs.getBytes(2));
        row.setDataEncoding(rs.getString(3));
        return row;
    }
}
