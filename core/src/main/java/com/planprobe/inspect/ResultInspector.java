package com.planprobe.inspect;

import com.planprobe.exception.ColumnException;
import com.planprobe.execution.QueryResult;
import com.planprobe.execution.RowBatch;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts a bounded, truncated preview of one string or binary column.
 *
 * <p>Rows are taken in batch order, then row order, until {@code maxRows}
 * values were collected. Each value is cut to {@code maxValueLength} code
 * points (never inside a surrogate pair) followed by {@value #TRUNCATION_MARKER}.
 * Binary values are decoded as UTF-8, replacing malformed sequences.
 */
public class ResultInspector {

    public static final String TRUNCATION_MARKER = "...";
    public static final String NULL_TEXT = "NULL";

    private static final Set<ArrowType.ArrowTypeID> DISPLAYABLE = EnumSet.of(
        ArrowType.ArrowTypeID.Utf8,
        ArrowType.ArrowTypeID.LargeUtf8,
        ArrowType.ArrowTypeID.Utf8View,
        ArrowType.ArrowTypeID.Binary,
        ArrowType.ArrowTypeID.LargeBinary,
        ArrowType.ArrowTypeID.BinaryView);

    /**
     * Previews a column of a query result.
     *
     * <p>The column is checked against the result schema, so an unknown column
     * fails even when the result has no rows.
     *
     * @param result the materialized result
     * @param column column name
     * @param maxRows maximum number of values
     * @param maxValueLength maximum code points per value before truncation
     * @return preview rows in result order
     * @throws ColumnException if the column is missing or not a string/binary column
     */
    public List<PreviewRow> preview(QueryResult result, String column, int maxRows, int maxValueLength) {
        Objects.requireNonNull(result, "result must not be null");
        requireDisplayable(result.schema(), column);
        return collect(result.batches(), column, maxRows, maxValueLength);
    }

    /**
     * Previews a column across batches.
     *
     * @param batches result batches in order
     * @param column column name
     * @param maxRows maximum number of values
     * @param maxValueLength maximum code points per value before truncation
     * @return preview rows in batch-then-row order
     * @throws ColumnException if the column is missing from any batch or not a string/binary column
     */
    public List<PreviewRow> preview(List<RowBatch> batches, String column, int maxRows, int maxValueLength) {
        Objects.requireNonNull(batches, "batches must not be null");
        if (batches.isEmpty()) {
            throw new ColumnException(ColumnException.Kind.NOT_FOUND, column,
                "Column '" + column + "' not found: result has no batches");
        }
        for (RowBatch batch : batches) {
            requireDisplayable(batch.schema(), column);
        }
        return collect(batches, column, maxRows, maxValueLength);
    }

    /**
     * Finds the first string or binary column of a schema.
     *
     * @param schema result schema
     * @return the column name, or empty when no column can be displayed
     */
    public Optional<String> firstDisplayableColumn(Schema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        for (Field field : schema.getFields()) {
            if (DISPLAYABLE.contains(field.getType().getTypeID())) {
                return Optional.of(field.getName());
            }
        }
        return Optional.empty();
    }

    private List<PreviewRow> collect(List<RowBatch> batches, String column, int maxRows, int maxValueLength) {
        if (maxRows < 0 || maxValueLength < 0) {
            throw new IllegalArgumentException("maxRows and maxValueLength must not be negative");
        }
        List<PreviewRow> rows = new ArrayList<>();
        long rowIndex = 0;
        for (RowBatch batch : batches) {
            if (rows.size() >= maxRows) {
                break;
            }
            FieldVector vector = batch.column(column);
            for (int i = 0; i < batch.rowCount() && rows.size() < maxRows; i++) {
                rows.add(new PreviewRow(rowIndex + i, truncate(valueText(vector, i), maxValueLength)));
            }
            rowIndex += batch.rowCount();
        }
        return rows;
    }

    private static void requireDisplayable(Schema schema, String column) {
        Field field = null;
        if (column != null) {
            for (Field candidate : schema.getFields()) {
                if (candidate.getName().equals(column)) {
                    field = candidate;
                    break;
                }
            }
        }
        if (field == null) {
            throw new ColumnException(ColumnException.Kind.NOT_FOUND, column,
                "Column '" + column + "' not found in result");
        }
        if (!DISPLAYABLE.contains(field.getType().getTypeID())) {
            throw new ColumnException(ColumnException.Kind.NOT_FOUND, column,
                "Column '" + column + "' is " + field.getType() + ", not a string or binary column");
        }
    }

    private static String valueText(FieldVector vector, int index) {
        Object value = vector.getObject(index);
        if (value == null) {
            return NULL_TEXT;
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        // Text for the string vectors; decodes as UTF-8
        return value.toString();
    }

    /**
     * Cuts text to a number of code points, appending the truncation marker.
     *
     * @param text the text
     * @param maxLength maximum code points kept
     * @return the text itself if short enough, else the prefix plus marker
     */
    public static String truncate(String text, int maxLength) {
        if (text.codePointCount(0, text.length()) <= maxLength) {
            return text;
        }
        int end = text.offsetByCodePoints(0, maxLength);
        return text.substring(0, end) + TRUNCATION_MARKER;
    }
}
