package com.planprobe.source;

import java.util.Objects;

/**
 * What a source exposes when opened: its schema and statistics.
 */
public record SourceDescriptor(RelationSchema schema, SourceStatistics statistics) {

    public SourceDescriptor {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
    }
}
