package com.tqc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rebalance instruction handed from the rebalance driver to the consumer loop.
 * The partition cache only queues these.
 */
public class ConsumerEvent {

    public enum Type {
        CONNECT,
        DISCONNECT,
        REPORT,
        ONLY_CONNECT,
        ONLY_DISCONNECT,
        STOP_REBALANCE
    }

    public enum Status {
        TODO,
        PROCESSING,
        DONE,
        FAILED
    }

    private final long rebalanceId;
    private final Type type;
    private volatile Status status;
    private final List<SubscribeInfo> subscribeInfos;

    public ConsumerEvent(long rebalanceId, Type type, List<SubscribeInfo> subscribeInfos) {
        this.rebalanceId = rebalanceId;
        this.type = type;
        this.status = Status.TODO;
        this.subscribeInfos = subscribeInfos == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(subscribeInfos));
    }

    public long getRebalanceId() {
        return rebalanceId;
    }

    public Type getType() {
        return type;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public List<SubscribeInfo> getSubscribeInfos() {
        return subscribeInfos;
    }

    @Override
    public String toString() {
        return "ConsumerEvent{rebalanceId=" + rebalanceId +
                ", type=" + type +
                ", status=" + status +
                ", subscribeInfos=" + subscribeInfos.size() + "}";
    }
}
