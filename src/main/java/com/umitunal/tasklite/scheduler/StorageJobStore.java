package com.umitunal.tasklite.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.umitunal.tasklite.core.Job;
import com.umitunal.tasklite.serialization.JsonCodec;
import com.umitunal.tasklite.storage.StorageCategory;
import com.umitunal.tasklite.storage.StorageManager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the job list under a single key of the storage manager, as a JSON
 * array of {@code [id, job]} pairs.
 */
public class StorageJobStore implements JobStore {
    private final StorageManager storage;
    private final String key;
    private final JsonCodec codec;

    public StorageJobStore(StorageManager storage, String key) {
        this(storage, key, new JsonCodec());
    }

    public StorageJobStore(StorageManager storage, String key, JsonCodec codec) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public List<Job> load() {
        JsonNode entries = storage.get(key, JsonNode.class);
        List<Job> jobs = new ArrayList<>();
        if (entries == null || !entries.isArray()) {
            return jobs;
        }
        for (JsonNode entry : entries) {
            Job job = codec.fromTree(entry.get(1), Job.class);
            if (job != null) {
                jobs.add(job);
            }
        }
        return jobs;
    }

    @Override
    public void save(Collection<Job> jobs) {
        ArrayNode entries = codec.getMapper().createArrayNode();
        for (Job job : jobs) {
            ArrayNode pair = entries.addArray();
            pair.add(job.getId());
            pair.add(codec.toTree(job));
        }
        storage.set(key, entries, StorageCategory.JOB_QUEUE);
    }
}
