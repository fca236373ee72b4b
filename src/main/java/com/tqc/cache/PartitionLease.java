package com.tqc.cache;

import com.tqc.model.Partition;

/**
 * A partition handed out for fetching. {@code leaseStartMs} doubles as the token
 * that must be presented to release the lease.
 */
public final class PartitionLease {

    private final Partition partition;
    private final long leaseStartMs;
    private final boolean lastConsumed;

    public PartitionLease(Partition partition, long leaseStartMs, boolean lastConsumed) {
        this.partition = partition;
        this.leaseStartMs = leaseStartMs;
        this.lastConsumed = lastConsumed;
    }

    public Partition getPartition() {
        return partition;
    }

    public String getPartitionKey() {
        return partition.getPartitionKey();
    }

    public long getLeaseStartMs() {
        return leaseStartMs;
    }

    /**
     * The partition's last-consumed flag at the moment the lease was taken.
     */
    public boolean isLastConsumed() {
        return lastConsumed;
    }

    @Override
    public String toString() {
        return "PartitionLease{partition=" + partition.getPartitionKey() +
                ", leaseStartMs=" + leaseStartMs +
                ", lastConsumed=" + lastConsumed + "}";
    }
}
