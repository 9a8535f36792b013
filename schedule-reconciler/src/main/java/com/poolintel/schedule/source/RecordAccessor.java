package com.poolintel.schedule.source;

import java.util.List;

/**
 * Read-only view over one upstream record, whatever its wire shape.
 */
public interface RecordAccessor {

    /** Raw value of one field, or null when absent. */
    String raw(String field);

    /**
     * First non-blank value among the synonyms, trimmed; null when none is present.
     */
    default String get(List<String> synonyms) {
        for (String name : synonyms) {
            String value = raw(name);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
