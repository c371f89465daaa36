package com.reprise.config;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared, swappable reference to the current {@link CacheSettings}. Updates take effect on the
 * next operation of every component holding this instance.
 */
@Slf4j
public class CacheSettingsHolder {

    private final AtomicReference<CacheSettings> current;

    public CacheSettingsHolder(CacheSettings initial) {
        this.current = new AtomicReference<>(initial);
    }

    public CacheSettings get() {
        return current.get();
    }

    public CacheSettings update(CacheSettingsPatch patch) {
        CacheSettings updated = current.updateAndGet(patch::applyTo);
        log.info("Cache settings updated: {}", updated);
        return updated;
    }
}
