package com.catalogharvester.crawl.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** One CSV row; unset columns are written empty. */
public final class OutputRow {
    private final Map<OutputColumn, String> values;

    private OutputRow(Map<OutputColumn, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String get(OutputColumn column) {
        return values.getOrDefault(column, "");
    }

    public boolean isBlank(OutputColumn column) {
        return get(column).isEmpty();
    }

    /** Values in {@link OutputColumn} order. */
    public List<String> values() {
        List<String> out = new ArrayList<>();
        for (OutputColumn column : OutputColumn.values()) {
            out.add(get(column));
        }
        return out;
    }

    public static final class Builder {
        private final Map<OutputColumn, String> values = new EnumMap<>(OutputColumn.class);

        private Builder() {
        }

        public Builder set(OutputColumn column, String value) {
            if (value != null && !value.isEmpty()) {
                values.put(column, value);
            }
            return this;
        }

        public OutputRow build() {
            return new OutputRow(new EnumMap<>(values));
        }
    }
}
