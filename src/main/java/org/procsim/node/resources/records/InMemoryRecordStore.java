package org.procsim.node.resources.records;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.procsim.node.api.resources.records.IRecordStore;
import org.procsim.node.api.resources.records.LifecycleRecord;
import org.procsim.node.api.resources.records.RecordNotFoundException;
import org.procsim.node.resources.AbstractResource;

import com.typesafe.config.Config;

/**
 * Map-backed record store. Records live only as long as the process; useful for
 * ephemeral nodes and tests.
 */
public class InMemoryRecordStore extends AbstractResource implements IRecordStore {

    private final Map<String, Entry> records = new LinkedHashMap<>();

    public InMemoryRecordStore(String name, Config options) {
        super(name, options);
    }

    @Override
    public synchronized List<String> keys() {
        return new ArrayList<>(records.keySet());
    }

    @Override
    public synchronized LifecycleRecord getItem(String id) throws IOException {
        Entry entry = records.get(id);
        if (entry == null) {
            throw new RecordNotFoundException(id);
        }
        return entry.record();
    }

    @Override
    public synchronized void setItem(LifecycleRecord record, String folder) {
        records.put(record.id(), new Entry(folder, record));
    }

    @Override
    public synchronized void removeItem(String id) {
        records.remove(id);
    }

    /**
     * Returns the folder a record is grouped under, or {@code null} if absent.
     */
    public synchronized String folderOf(String id) {
        Entry entry = records.get(id);
        return entry == null ? null : entry.folder();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        synchronized (this) {
            metrics.put("records_stored", records.size());
        }
    }

    private record Entry(String folder, LifecycleRecord record) {}
}
