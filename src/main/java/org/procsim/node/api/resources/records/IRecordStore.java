package org.procsim.node.api.resources.records;

import java.io.IOException;
import java.util.List;

import org.procsim.node.api.resources.IResource;

/**
 * Durable key-value store for {@link LifecycleRecord}s.
 * <p>
 * Records are keyed by {@link LifecycleRecord#id()}; there is at most one record per id.
 * Each record lives in a folder (normally its class name) which only affects storage
 * locality, never lookup.
 * <p>
 * <strong>Thread Safety:</strong> implementations must be safe for concurrent use by the
 * restore procedure and the lifecycle event writer.
 */
public interface IRecordStore extends IResource {

    /**
     * Lists the ids of all stored records.
     *
     * @return ids in a stable order, never {@code null}.
     * @throws IOException if the store cannot be read.
     */
    List<String> keys() throws IOException;

    /**
     * Reads the record stored for an id.
     *
     * @param id the instance id.
     * @return the stored record.
     * @throws RecordNotFoundException if no record exists for the id.
     * @throws IOException             if the record cannot be read or decoded.
     */
    LifecycleRecord getItem(String id) throws IOException;

    /**
     * Inserts or replaces the record for {@code record.id()}.
     * <p>
     * If a record with the same id exists in another folder it is moved, so ids stay unique.
     *
     * @param record the record to store.
     * @param folder grouping folder, usually {@code record.className()}.
     * @throws IOException if the record cannot be written.
     */
    void setItem(LifecycleRecord record, String folder) throws IOException;

    /**
     * Removes the record for an id. Removing an absent id is not an error.
     *
     * @param id the instance id.
     * @throws IOException if the record exists but cannot be removed.
     */
    void removeItem(String id) throws IOException;
}
