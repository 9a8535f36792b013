package com.poolintel.schedule.source;

import java.util.Map;

/** A tabular row keyed by header name. */
public class MapRecordAccessor implements RecordAccessor {

    private final Map<String, String> row;

    public MapRecordAccessor(Map<String, String> row) {
        this.row = row;
    }

    @Override
    public String raw(String field) {
        return row.get(field);
    }
}
