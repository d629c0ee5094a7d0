package com.planprobe.execution;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorLoader;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.VectorUnloader;
import org.apache.arrow.vector.ipc.message.ArrowRecordBatch;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.Objects;

/**
 * One fixed-width columnar chunk of a result set.
 *
 * <p>A batch owns its Arrow buffers. Its vectors are exposed for reading
 * only; nothing in the probe writes to a batch after it was produced.
 * Batches are released by closing the {@link QueryResult} that holds them.
 */
public final class RowBatch implements AutoCloseable {

    private final VectorSchemaRoot root;

    private RowBatch(VectorSchemaRoot root) {
        this.root = root;
    }

    /**
     * Wraps a root, taking ownership of it.
     *
     * @param root the populated root; closed when this batch is closed
     * @return the batch
     */
    public static RowBatch wrap(VectorSchemaRoot root) {
        return new RowBatch(Objects.requireNonNull(root, "root must not be null"));
    }

    /**
     * Copies the current contents of a (reused) root into a new batch.
     *
     * @param source root whose current batch is copied
     * @param allocator allocator for the copy
     * @return the owned copy
     */
    public static RowBatch copyOf(VectorSchemaRoot source, BufferAllocator allocator) {
        VectorSchemaRoot copy = VectorSchemaRoot.create(source.getSchema(), allocator);
        try (ArrowRecordBatch recordBatch = new VectorUnloader(source).getRecordBatch()) {
            new VectorLoader(copy).load(recordBatch);
        } catch (RuntimeException e) {
            copy.close();
            throw e;
        }
        return new RowBatch(copy);
    }

    public int rowCount() {
        return root.getRowCount();
    }

    public Schema schema() {
        return root.getSchema();
    }

    /**
     * Returns a column vector for reading.
     *
     * @param name the column name
     * @return the vector, or null if the batch has no such column
     */
    public FieldVector column(String name) {
        return root.getVector(name);
    }

    public FieldVector column(int index) {
        return root.getVector(index);
    }

    @Override
    public void close() {
        root.close();
    }

    @Override
    public String toString() {
        return "RowBatch[rows=" + rowCount() + ", columns=" + root.getFieldVectors().size() + "]";
    }
}
