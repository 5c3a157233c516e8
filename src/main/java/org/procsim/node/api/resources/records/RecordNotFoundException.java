package org.procsim.node.api.resources.records;

import java.io.IOException;

/**
 * Thrown by {@link IRecordStore#getItem(String)} when no record exists for the id.
 */
public class RecordNotFoundException extends IOException {

    private final String id;

    public RecordNotFoundException(String id) {
        super("No record stored for id '" + id + "'");
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
