package com.tqc.model;

public class Partition {

    private final Node broker;
    private final String topic;
    private final int partitionId;
    private final String partitionKey;
    private volatile boolean lastConsumed;

    public Partition(Node broker, String topic, int partitionId) {
        if (broker == null) {
            throw new IllegalArgumentException("Partition broker must not be null");
        }
        if (topic == null || topic.isEmpty()) {
            throw new IllegalArgumentException("Partition topic must not be empty");
        }
        this.broker = broker;
        this.topic = topic;
        this.partitionId = partitionId;
        this.partitionKey = broker.getId() + ":" + topic + ":" + partitionId;
    }

    public Node getBroker() {
        return broker;
    }

    public String getTopic() {
        return topic;
    }

    public int getPartitionId() {
        return partitionId;
    }

    /**
     * Key of the form {@code brokerId:topic:partitionId}, unique within a consumer.
     */
    public String getPartitionKey() {
        return partitionKey;
    }

    /**
     * Whether the last fetch against this partition returned data.
     */
    public boolean isLastConsumed() {
        return lastConsumed;
    }

    public void setLastConsumed(boolean lastConsumed) {
        this.lastConsumed = lastConsumed;
    }

    @Override
    public String toString() {
        return "Partition{key='" + partitionKey + "'" +
                ", broker=" + broker.getAddress() +
                ", lastConsumed=" + lastConsumed + "}";
    }
}
