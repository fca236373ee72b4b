package com.tqc.config;

public class TqcConfig {

    private final int defaultMsgSize;
    private final int readBufferSize;
    private final int maxChunkSize;
    private final long partitionLeaseTimeoutMs;
    private final long expiryCheckIntervalMs;

    private TqcConfig(Builder builder) {
        this.defaultMsgSize = builder.defaultMsgSize;
        this.readBufferSize = builder.readBufferSize;
        this.maxChunkSize = builder.maxChunkSize;
        this.partitionLeaseTimeoutMs = builder.partitionLeaseTimeoutMs;
        this.expiryCheckIntervalMs = builder.expiryCheckIntervalMs;
    }

    public int getDefaultMsgSize() {
        return defaultMsgSize;
    }

    public int getReadBufferSize() {
        return readBufferSize;
    }

    public int getMaxChunkSize() {
        return maxChunkSize;
    }

    public long getPartitionLeaseTimeoutMs() {
        return partitionLeaseTimeoutMs;
    }

    public long getExpiryCheckIntervalMs() {
        return expiryCheckIntervalMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int defaultMsgSize = 4096;
        private int readBufferSize = 128 * 1024;
        private int maxChunkSize = 8192;
        private long partitionLeaseTimeoutMs = 30000;
        private long expiryCheckIntervalMs = 5000;

        public Builder defaultMsgSize(int defaultMsgSize) {
            this.defaultMsgSize = defaultMsgSize;
            return this;
        }

        public Builder readBufferSize(int readBufferSize) {
            this.readBufferSize = readBufferSize;
            return this;
        }

        public Builder maxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
            return this;
        }

        public Builder partitionLeaseTimeoutMs(long partitionLeaseTimeoutMs) {
            this.partitionLeaseTimeoutMs = partitionLeaseTimeoutMs;
            return this;
        }

        public Builder expiryCheckIntervalMs(long expiryCheckIntervalMs) {
            this.expiryCheckIntervalMs = expiryCheckIntervalMs;
            return this;
        }

        public TqcConfig build() {
            // token, serial number and chunk count must fit in the scratch buffer
            if (defaultMsgSize < 12) {
                throw new IllegalArgumentException("Invalid defaultMsgSize: " + defaultMsgSize);
            }
            requirePositive("readBufferSize", readBufferSize);
            requirePositive("maxChunkSize", maxChunkSize);
            requirePositive("partitionLeaseTimeoutMs", partitionLeaseTimeoutMs);
            requirePositive("expiryCheckIntervalMs", expiryCheckIntervalMs);
            return new TqcConfig(this);
        }

        private static void requirePositive(String name, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Invalid " + name + ": " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "TqcConfig{defaultMsgSize=" + defaultMsgSize +
                ", readBufferSize=" + readBufferSize +
                ", maxChunkSize=" + maxChunkSize +
                ", partitionLeaseTimeoutMs=" + partitionLeaseTimeoutMs +
                ", expiryCheckIntervalMs=" + expiryCheckIntervalMs + "}";
    }
}
