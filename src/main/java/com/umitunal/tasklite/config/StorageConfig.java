package com.umitunal.tasklite.config;

/**
 * Configuration for the underlying RocksDB store.
 */
public class StorageConfig {
    public static final long DEFAULT_QUOTA_BYTES = 10L * 1024 * 1024;

    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final long quotaBytes;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.quotaBytes = builder.quotaBytes;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public long getQuotaBytes() { return quotaBytes; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 8;
        private int maxMemoryBuffers = 2;
        private int backgroundThreads = 2;
        private long quotaBytes = DEFAULT_QUOTA_BYTES;

        private Builder(String dataDirectory) {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("dataDirectory must not be blank");
            }
            this.dataDirectory = dataDirectory;
        }

        /**
         * Enable durable writes (fsync on every write).
         * The job list relies on this to survive an abrupt termination.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memory buffer size in MB.
         * Default: 8 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Set maximum number of memory buffers.
         * Default: 2
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Set number of background compaction threads.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * Hard capacity ceiling of the store, counted as key bytes plus value bytes.
         * Default: 10 MB
         */
        public Builder withQuotaBytes(long quotaBytes) {
            if (quotaBytes <= 0) {
                throw new IllegalArgumentException("quotaBytes must be > 0, got: " + quotaBytes);
            }
            this.quotaBytes = quotaBytes;
            return this;
        }

        public StorageConfig build() {
            return new StorageConfig(this);
        }
    }
}
