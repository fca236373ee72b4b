package com.tqc.model;

public class SubscribeInfo {

    private final String consumerId;
    private final String group;
    private final Partition partition;

    public SubscribeInfo(String consumerId, String group, Partition partition) {
        if (partition == null) {
            throw new IllegalArgumentException("Subscribed partition must not be null");
        }
        this.consumerId = consumerId;
        this.group = group;
        this.partition = partition;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public String getGroup() {
        return group;
    }

    public Partition getPartition() {
        return partition;
    }

    @Override
    public String toString() {
        return "SubscribeInfo{consumerId='" + consumerId +
                "', group='" + group +
                "', partition=" + partition.getPartitionKey() + "}";
    }
}
