package com.planprobe.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one probe run needs: dataset, relation name, SQL, options and
 * preview bounds.
 */
public final class ProbeRequest {

    public static final String DEFAULT_TABLE = "runs";
    public static final int DEFAULT_MAX_ROWS = 5;
    public static final int DEFAULT_MAX_VALUE_LENGTH = 100;

    private final String dataPath;
    private final String tableName;
    private final String sql;
    private final Map<String, Object> options;
    private final String previewColumn;
    private final int maxRows;
    private final int maxValueLength;
    private final boolean explainAnalyze;

    private ProbeRequest(Builder builder) {
        this.dataPath = Objects.requireNonNull(builder.dataPath, "dataPath must not be null");
        this.tableName = Objects.requireNonNull(builder.tableName, "tableName must not be null");
        this.sql = Objects.requireNonNull(builder.sql, "sql must not be null");
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
        this.previewColumn = builder.previewColumn;
        this.maxRows = builder.maxRows;
        this.maxValueLength = builder.maxValueLength;
        this.explainAnalyze = builder.explainAnalyze;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String dataPath() {
        return dataPath;
    }

    public String tableName() {
        return tableName;
    }

    public String sql() {
        return sql;
    }

    /**
     * Raw option values, validated when the run starts.
     *
     * @return unmodifiable option map in insertion order
     */
    public Map<String, Object> options() {
        return options;
    }

    /**
     * Column to preview.
     *
     * @return the column name, or null for the first result column
     */
    public String previewColumn() {
        return previewColumn;
    }

    public int maxRows() {
        return maxRows;
    }

    public int maxValueLength() {
        return maxValueLength;
    }

    public boolean explainAnalyze() {
        return explainAnalyze;
    }

    public static final class Builder {

        private String dataPath;
        private String tableName = DEFAULT_TABLE;
        private String sql;
        private final Map<String, Object> options = new LinkedHashMap<>();
        private String previewColumn;
        private int maxRows = DEFAULT_MAX_ROWS;
        private int maxValueLength = DEFAULT_MAX_VALUE_LENGTH;
        private boolean explainAnalyze = true;

        private Builder() {}

        public Builder dataPath(String dataPath) {
            this.dataPath = dataPath;
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder sql(String sql) {
            this.sql = sql;
            return this;
        }

        public Builder option(String key, Object value) {
            this.options.put(key, value);
            return this;
        }

        public Builder options(Map<String, ?> values) {
            this.options.putAll(values);
            return this;
        }

        public Builder previewColumn(String previewColumn) {
            this.previewColumn = previewColumn;
            return this;
        }

        public Builder maxRows(int maxRows) {
            this.maxRows = maxRows;
            return this;
        }

        public Builder maxValueLength(int maxValueLength) {
            this.maxValueLength = maxValueLength;
            return this;
        }

        public Builder explainAnalyze(boolean explainAnalyze) {
            this.explainAnalyze = explainAnalyze;
            return this;
        }

        public ProbeRequest build() {
            return new ProbeRequest(this);
        }
    }
}
