package com.planprobe.session;

import com.planprobe.source.RelationSchema;
import com.planprobe.source.RelationSource;
import com.planprobe.source.SourceStatistics;

import java.util.Objects;

/**
 * A relation name bound to an external source for the lifetime of a session.
 */
public record RelationBinding(String name,
                              RelationSource source,
                              RelationSchema schema,
                              SourceStatistics statistics) {

    public RelationBinding {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
    }
}
