package com.di.execmaps.codec;

import com.di.execmaps.model.ActivityInfoMapsRow;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * {@code activity_info_maps}: data, data_encoding, last_heartbeat_details, last_heartbeat_updated_time.
 */
public final class ActivityInfoMapsRowCodec implements MapRowCodec<ActivityInfoMapsRow, Long> {

    @Override
    public Long keyOf(ActivityInfoMapsRow row) {
        return row.getScheduleId();
    }

    @Override
    public List<Object> encodeValues(ActivityInfoMapsRow row, DateTimeConverter converter) {
        return Arrays.asList(
                row.getData(),
                row.getDataEncoding(),
                row.getLastHeartbeatDetails(),
                converter.toDbDateTime(row.getLastHeartbeatUpdatedTime()));
    }

    @Override
    public ActivityInfoMapsRow decode(ResultSet rs, DateTimeConverter converter) throws SQLException {
        ActivityInfoMapsRow row = new ActivityInfoMapsRow();
        row.setScheduleId(rs.getLong(1));
        row.setData(rs.getBytes(2));
        row.setDataEncoding(rs.getString(3));
        row.setLastHeartbeatDetails(rs.getBytes(4));
        row.setLastHeartbeatUpdatedTime(converter.fromDbDateTime(rs.getObject(5, LocalDateTime.class)));
        return row;
    }
}
