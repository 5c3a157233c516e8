package org.procsim.node.persistence;

import java.util.List;

/**
 * Outcome of {@link InstancePersistor#restore()}.
 *
 * @param restored    ids that were recreated (or were already live).
 * @param purged      ids of broken records that were removed from the store.
 * @param purgeFailed ids of broken records whose removal failed; they stay in the store.
 * @param retries     number of failed attempts that were re-enqueued.
 */
public record RestoreReport(List<String> restored, List<String> purged, List<String> purgeFailed, int retries) {

    public RestoreReport {
        restored = List.copyOf(restored);
        purged = List.copyOf(purged);
        purgeFailed = List.copyOf(purgeFailed);
    }

    public static RestoreReport empty() {
        return new RestoreReport(List.of(), List.of(), List.of(), 0);
    }

    /**
     * Returns the number of records that could not be restored.
     */
    public int brokenCount() {
        return purged.size() + purgeFailed.size();
    }
}
