package com.poolintel.schedule.source;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A JSON object. Numbers and booleans are read as their text form.
 */
public class JsonRecordAccessor implements RecordAccessor {

    private final JsonNode node;

    public JsonRecordAccessor(JsonNode node) {
        this.node = node;
    }

    @Override
    public String raw(String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
