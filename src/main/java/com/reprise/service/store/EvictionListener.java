package com.reprise.service.store;

import com.reprise.model.EvictionReason;

/**
 * Notified after an entry has left the store.
 */
@FunctionalInterface
public interface EvictionListener {

    void onEvicted(String entryId, EvictionReason reason, long bytes);
}
