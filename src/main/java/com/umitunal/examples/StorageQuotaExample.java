package com.umitunal.examples;

import com.umitunal.tasklite.TaskCore;
import com.umitunal.tasklite.config.StorageConfig;
import com.umitunal.tasklite.config.StorageManagerConfig;
import com.umitunal.tasklite.event.EventType;
import com.umitunal.tasklite.storage.StorageItemMeta;
import com.umitunal.tasklite.storage.StorageManager;
import com.umitunal.tasklite.storage.StorageUnits;

/**
 * Storage quota example - least recently used cache entries make room for new data.
 */
public class StorageQuotaExample {

    public static void main(String[] args) {
        System.out.println("=== Storage Quota Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/tasklite-storage")
                .withQuotaBytes(64 * 1024)
                .build();

        try (TaskCore core = TaskCore.builder(config)
                .withStorageManagerConfig(StorageManagerConfig.newBuilder().withCleanupTarget(60).build())
                .open()) {

            StorageManager storage = core.storageManager();
            core.eventBus().subscribe(EventType.STORAGE_CLEANED, event ->
                    System.out.println("  [event] " + event.getPayload()));

            storage.set("settings_theme", "dark");
            String page = "x".repeat(8 * 1024);
            for (int i = 0; i < 12; i++) {
                storage.set("cache_page_" + i, page);
                System.out.println("Stored cache_page_" + i + ", " + storage.getStats());
            }

            System.out.println("\nLargest items:");
            for (StorageItemMeta meta : storage.getLargestItems(3)) {
                System.out.println("  " + meta.getKey() + " " + StorageUnits.formatBytes(meta.getSize()));
            }
            System.out.println("Theme survived cleanup: " + storage.get("settings_theme", String.class));
            System.out.println("Quota level: " + storage.checkQuota());
        }
    }
}
