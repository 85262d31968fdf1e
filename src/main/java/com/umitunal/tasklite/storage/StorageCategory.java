package com.umitunal.tasklite.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a stored item, inferred from its key prefix unless given
 * explicitly on write.
 */
public enum StorageCategory {
    SCRAPE_DATA("scrape_data", "scrape_"),
    RECORDING("recording", "recording_"),
    TUTORIAL("tutorial", "tutorial_"),
    ENCRYPTED_KEY("encrypted_key", "encrypted_key_"),
    SETTINGS("settings", "settings_"),
    CACHE("cache", "cache_"),
    JOB_QUEUE("job_queue", "job_queue"),
    UNKNOWN("unknown", null);

    private final String tag;
    private final String keyPrefix;

    StorageCategory(String tag, String keyPrefix) {
        this.tag = tag;
        this.keyPrefix = keyPrefix;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    /**
     * Category whose prefix starts the key, or {@link #UNKNOWN}.
     */
    public static StorageCategory infer(String key) {
        for (StorageCategory category : values()) {
            if (category.keyPrefix != null && key.startsWith(category.keyPrefix)) {
                return category;
            }
        }
        return UNKNOWN;
    }

    @JsonCreator
    public static StorageCategory fromTag(String tag) {
        for (StorageCategory category : values()) {
            if (category.tag.equals(tag)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
