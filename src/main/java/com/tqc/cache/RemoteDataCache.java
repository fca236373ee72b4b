package com.tqc.cache;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.tqc.model.ConsumerEvent;
import com.tqc.model.Node;
import com.tqc.model.Partition;
import com.tqc.model.SubscribeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Consumer-side record of the partitions this consumer owns and of the rebalance
 * events still waiting to be processed.
 *
 * <p>State is split across three locks that are never nested:
 * <ul>
 *   <li>{@code eventLock} guards the rebalance event queue,</li>
 *   <li>{@code metaLock} guards partition metadata, the topic and broker indexes,
 *       leases, the idle pool and pending hold timers,</li>
 *   <li>{@code registerLock} guards the first-registration ledger.</li>
 * </ul>
 * Operations on different locks interleave freely. When an admission and a removal
 * of the same key race, whichever takes {@code metaLock} last decides the outcome;
 * the indexes stay consistent either way.
 *
 * <p>Lease contract: a partition moves from idle to in use only by recording its
 * lease start time in {@code usedPartitions} under {@code metaLock}, which
 * {@link #selectIdlePartition()} and {@link #markPartitionInUse(String, long)} do.
 * Every path that ends a lease goes through {@link #resetIdlePartition(String, boolean)}.
 *
 * <p>Each instance owns a daemon timer thread for {@link #holdPartition}. Whoever
 * creates the cache calls {@link #close()} when the consumer session ends; with
 * Guice that is the code holding the injector, since neither the module nor
 * {@code LeaseExpiryMonitor} closes it.
 */
@Singleton
public class RemoteDataCache implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RemoteDataCache.class);

    public static final long INVALID_VALUE = -2;

    private volatile String consumerId = "";
    private volatile String groupName = "";
    private volatile boolean underGroupCtrl;
    private volatile long defFlowCtrlId = INVALID_VALUE;
    private volatile long groupFlowCtrlId = INVALID_VALUE;
    private volatile int qryPriorityId = (int) INVALID_VALUE;
    private volatile String defFlowCtrlInfo = "";
    private volatile String groupFlowCtrlInfo = "";

    private final Object eventLock = new Object();
    private final Deque<ConsumerEvent> rebalanceResults = new ArrayDeque<>();

    private final Object metaLock = new Object();
    private final Map<String, Partition> partitions = new HashMap<>();
    private final Map<String, SubscribeInfo> partitionSubInfo = new HashMap<>();
    private final Map<String, Set<String>> topicPartitions = new HashMap<>();
    private final Map<Node, Set<String>> brokerPartitions = new HashMap<>();
    private final Map<String, Long> usedPartitions = new HashMap<>();
    private final Set<String> indexPartitions = new LinkedHashSet<>();
    private final Map<String, PartitionTimeout> partitionTimeouts = new HashMap<>();

    private final Object registerLock = new Object();
    private final Set<String> partitionRegBooked = new HashSet<>();

    private final Clock clock;
    private final ScheduledExecutorService timer;

    @Inject
    public RemoteDataCache() {
        this(Clock.systemUTC());
    }

    public RemoteDataCache(Clock clock) {
        this.clock = clock;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tqc-partition-timer");
            t.setDaemon(true);
            return t;
        });
    }

    // Identity and flow control

    public void setConsumerInfo(String consumerId, String groupName) {
        this.consumerId = consumerId;
        this.groupName = groupName;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public String getGroupName() {
        return groupName;
    }

    public boolean isUnderGroupCtrl() {
        return underGroupCtrl;
    }

    public void setUnderGroupCtrl(boolean underGroupCtrl) {
        this.underGroupCtrl = underGroupCtrl;
    }

    public long getDefFlowCtrlId() {
        return defFlowCtrlId;
    }

    public long getGroupFlowCtrlId() {
        return groupFlowCtrlId;
    }

    public int getQryPriorityId() {
        return qryPriorityId;
    }

    public String getDefFlowCtrlInfo() {
        return defFlowCtrlInfo;
    }

    public String getGroupFlowCtrlInfo() {
        return groupFlowCtrlInfo;
    }

    /**
     * Records the default flow control rules. Ignored when the id has not changed.
     * Called from the heartbeat thread only.
     */
    public void updateDefFlowCtrlInfo(long flowCtrlId, String flowCtrlInfo) {
        if (flowCtrlId == defFlowCtrlId) {
            return;
        }
        this.defFlowCtrlInfo = flowCtrlInfo == null ? "" : flowCtrlInfo;
        this.defFlowCtrlId = flowCtrlId;
    }

    /**
     * Records the group flow control rules and query priority. Each id is only
     * applied when it differs from the current one.
     */
    public void updateGroupFlowCtrlInfo(int qryPriorityId, long flowCtrlId, String flowCtrlInfo) {
        if (qryPriorityId != this.qryPriorityId) {
            this.qryPriorityId = qryPriorityId;
        }
        if (flowCtrlId == groupFlowCtrlId) {
            return;
        }
        this.groupFlowCtrlInfo = flowCtrlInfo == null ? "" : flowCtrlInfo;
        this.groupFlowCtrlId = flowCtrlId;
    }

    // Rebalance events

    public void offerEvent(ConsumerEvent event) {
        if (event == null) {
            return;
        }
        synchronized (eventLock) {
            rebalanceResults.addLast(event);
        }
    }

    /**
     * Removes and returns the oldest queued event, or {@code null} when the queue is
     * empty. Never blocks.
     */
    public ConsumerEvent takeEvent() {
        synchronized (eventLock) {
            return rebalanceResults.pollFirst();
        }
    }

    public ConsumerEvent pollEventResult() {
        return takeEvent();
    }

    public void clearEvent() {
        synchronized (eventLock) {
            rebalanceResults.clear();
        }
    }

    public int getEventCount() {
        synchronized (eventLock) {
            return rebalanceResults.size();
        }
    }

    // Partition admission and removal

    /**
     * Admits a newly assigned partition and makes it idle. Re-adding a known key
     * keeps the existing metadata but still ends any lease on it and returns it to
     * the idle pool.
     */
    public void addNewPartition(Partition newPartition) {
        if (newPartition == null) {
            return;
        }
        SubscribeInfo sub = new SubscribeInfo(consumerId, groupName, newPartition);
        String partitionKey = newPartition.getPartitionKey();
        synchronized (metaLock) {
            if (!partitions.containsKey(partitionKey)) {
                partitions.put(partitionKey, newPartition);
                partitionSubInfo.put(partitionKey, sub);
                topicPartitions.computeIfAbsent(newPartition.getTopic(), k -> new HashSet<>())
                        .add(partitionKey);
                brokerPartitions.computeIfAbsent(newPartition.getBroker(), k -> new HashSet<>())
                        .add(partitionKey);
                log.debug("Added partition {} for consumer {}", partitionKey, consumerId);
            }
            resetIdlePartition(partitionKey, true);
        }
    }

    /**
     * Removes the partitions named by a rebalance revocation and groups the removed
     * partitions by broker into {@code brokerPartitionMap}, so one release request
     * can be sent per broker. A partition leased at the time of removal gets
     * {@code lastConsumed = !processingRollback}.
     */
    public void removeAndGetPartition(List<SubscribeInfo> subscribeInfos, boolean processingRollback,
                                      Map<Node, List<Partition>> brokerPartitionMap) {
        if (subscribeInfos == null || subscribeInfos.isEmpty()) {
            return;
        }
        synchronized (metaLock) {
            for (SubscribeInfo sub : subscribeInfos) {
                String partitionKey = sub.getPartition().getPartitionKey();
                Partition partition = partitions.get(partitionKey);
                if (partition != null) {
                    if (usedPartitions.containsKey(partitionKey)) {
                        partition.setLastConsumed(!processingRollback);
                    }
                    brokerPartitionMap.computeIfAbsent(partition.getBroker(), k -> new ArrayList<>())
                            .add(partition);
                    removeMetaInfo(partitionKey);
                }
                resetIdlePartition(partitionKey, false);
            }
        }
    }

    public void removePartition(List<String> partitionKeys) {
        if (partitionKeys == null || partitionKeys.isEmpty()) {
            return;
        }
        synchronized (metaLock) {
            for (String partitionKey : partitionKeys) {
                resetIdlePartition(partitionKey, false);
                removeMetaInfo(partitionKey);
            }
        }
    }

    // Leases

    /**
     * Leases the partition that has been idle the longest.
     *
     * @return the lease, or {@code null} when no partition is idle
     */
    public PartitionLease selectIdlePartition() {
        synchronized (metaLock) {
            Iterator<String> it = indexPartitions.iterator();
            while (it.hasNext()) {
                String partitionKey = it.next();
                it.remove();
                Partition partition = partitions.get(partitionKey);
                if (partition == null) {
                    continue;
                }
                long now = clock.millis();
                usedPartitions.put(partitionKey, now);
                return new PartitionLease(partition, now, partition.isLastConsumed());
            }
            return null;
        }
    }

    /**
     * Records a lease starting at {@code leaseStartMs}. Fails for unknown keys, keys
     * already leased and keys waiting on a hold timer.
     */
    public boolean markPartitionInUse(String partitionKey, long leaseStartMs) {
        synchronized (metaLock) {
            if (!partitions.containsKey(partitionKey)
                    || usedPartitions.containsKey(partitionKey)
                    || partitionTimeouts.containsKey(partitionKey)) {
                return false;
            }
            indexPartitions.remove(partitionKey);
            usedPartitions.put(partitionKey, leaseStartMs);
            return true;
        }
    }

    public boolean isPartitionInUse(String partitionKey, long leaseStartMs) {
        synchronized (metaLock) {
            Long current = usedPartitions.get(partitionKey);
            return current != null && current == leaseStartMs && partitions.containsKey(partitionKey);
        }
    }

    /**
     * Ends a lease and makes the partition idle again. The lease start time acts as
     * a token: a release carrying a stale token is ignored.
     *
     * @return whether the lease was released
     */
    public boolean releasePartition(String partitionKey, long leaseStartMs, boolean lastConsumed) {
        synchronized (metaLock) {
            Partition partition = leasedPartition(partitionKey, leaseStartMs);
            if (partition == null) {
                return false;
            }
            partition.setLastConsumed(lastConsumed);
            resetIdlePartition(partitionKey, true);
            return true;
        }
    }

    /**
     * Ends a lease but keeps the partition out of the idle pool for {@code delayMs},
     * for example while the broker asks the consumer to slow down.
     *
     * @return whether the lease was released
     */
    public boolean holdPartition(String partitionKey, long leaseStartMs, boolean lastConsumed, long delayMs) {
        synchronized (metaLock) {
            Partition partition = leasedPartition(partitionKey, leaseStartMs);
            if (partition == null) {
                return false;
            }
            partition.setLastConsumed(lastConsumed);
            boolean delayed = delayMs > 0 && !timer.isShutdown();
            resetIdlePartition(partitionKey, !delayed);
            if (delayed) {
                PartitionTimeout timeout = new PartitionTimeout(partitionKey);
                timeout.future = timer.schedule(timeout, delayMs, TimeUnit.MILLISECONDS);
                partitionTimeouts.put(partitionKey, timeout);
            }
            return true;
        }
    }

    /**
     * Returns every lease older than {@code waitMs} to the idle pool with
     * {@code lastConsumed = false}. Must be called periodically; nothing else
     * reclaims leases whose holder never released them.
     */
    public void handleExpiredPartitions(long waitMs) {
        synchronized (metaLock) {
            if (usedPartitions.isEmpty()) {
                return;
            }
            long curr = clock.millis();
            List<String> expired = new ArrayList<>();
            for (Map.Entry<String, Long> entry : usedPartitions.entrySet()) {
                if (curr - entry.getValue() > waitMs) {
                    expired.add(entry.getKey());
                    Partition partition = partitions.get(entry.getKey());
                    if (partition != null) {
                        partition.setLastConsumed(false);
                    }
                }
            }
            for (String partitionKey : expired) {
                resetIdlePartition(partitionKey, true);
            }
            if (!expired.isEmpty()) {
                log.info("Reclaimed {} expired partition lease(s): {}", expired.size(), expired);
            }
        }
    }

    // Queries

    public Partition getPartitionByKey(String partitionKey) {
        synchronized (metaLock) {
            return partitions.get(partitionKey);
        }
    }

    public List<Partition> getPartitionByBroker(Node broker) {
        synchronized (metaLock) {
            Set<String> keys = brokerPartitions.get(broker);
            if (keys == null) {
                return new ArrayList<>();
            }
            List<Partition> result = new ArrayList<>(keys.size());
            for (String partitionKey : keys) {
                result.add(partitions.get(partitionKey));
            }
            return result;
        }
    }

    public Set<String> getPartitionKeysByTopic(String topic) {
        synchronized (metaLock) {
            Set<String> keys = topicPartitions.get(topic);
            return keys == null ? Collections.emptySet() : new HashSet<>(keys);
        }
    }

    public Set<String> getTopics() {
        synchronized (metaLock) {
            return new HashSet<>(topicPartitions.keySet());
        }
    }

    public Set<Node> getBrokers() {
        synchronized (metaLock) {
            return new HashSet<>(brokerPartitions.keySet());
        }
    }

    public List<SubscribeInfo> getSubscribeInfo() {
        synchronized (metaLock) {
            return new ArrayList<>(partitionSubInfo.values());
        }
    }

    /**
     * Returns the partitions of {@code subInfos} this consumer does not hold yet.
     */
    public List<Partition> filterPartitions(List<SubscribeInfo> subInfos) {
        if (subInfos == null) {
            return new ArrayList<>();
        }
        synchronized (metaLock) {
            List<Partition> unsubPartitions = new ArrayList<>(subInfos.size());
            if (partitions.isEmpty()) {
                for (SubscribeInfo sub : subInfos) {
                    unsubPartitions.add(sub.getPartition());
                }
            } else {
                for (SubscribeInfo sub : subInfos) {
                    if (!partitions.containsKey(sub.getPartition().getPartitionKey())) {
                        unsubPartitions.add(sub.getPartition());
                    }
                }
            }
            return unsubPartitions;
        }
    }

    public int getPartitionCount() {
        synchronized (metaLock) {
            return partitions.size();
        }
    }

    public int getIdlePartitionCount() {
        synchronized (metaLock) {
            return indexPartitions.size();
        }
    }

    public int getUsedPartitionCount() {
        synchronized (metaLock) {
            return usedPartitions.size();
        }
    }

    public boolean isPartitionIdle(String partitionKey) {
        synchronized (metaLock) {
            return indexPartitions.contains(partitionKey);
        }
    }

    public boolean isPartitionLeased(String partitionKey) {
        synchronized (metaLock) {
            return usedPartitions.containsKey(partitionKey);
        }
    }

    public boolean hasPendingTimeout(String partitionKey) {
        synchronized (metaLock) {
            return partitionTimeouts.containsKey(partitionKey);
        }
    }

    /**
     * Books the key in the registration ledger and reports whether it is booked,
     * which it always is once this returns, including on the first call for a key.
     * The ledger is never cleared.
     */
    public boolean isFirstRegister(String partitionKey) {
        synchronized (registerLock) {
            partitionRegBooked.add(partitionKey);
            return partitionRegBooked.contains(partitionKey);
        }
    }

    @Override
    public void close() {
        synchronized (metaLock) {
            for (PartitionTimeout timeout : partitionTimeouts.values()) {
                timeout.cancel();
            }
            partitionTimeouts.clear();
        }
        timer.shutdownNow();
    }

    private Partition leasedPartition(String partitionKey, long leaseStartMs) {
        Long current = usedPartitions.get(partitionKey);
        if (current == null || current != leaseStartMs) {
            return null;
        }
        return partitions.get(partitionKey);
    }

    private void removeMetaInfo(String partitionKey) {
        Partition partition = partitions.remove(partitionKey);
        if (partition == null) {
            return;
        }
        Set<String> topicKeys = topicPartitions.get(partition.getTopic());
        if (topicKeys != null) {
            topicKeys.remove(partitionKey);
            if (topicKeys.isEmpty()) {
                topicPartitions.remove(partition.getTopic());
            }
        }
        Set<String> brokerKeys = brokerPartitions.get(partition.getBroker());
        if (brokerKeys != null) {
            brokerKeys.remove(partitionKey);
            if (brokerKeys.isEmpty()) {
                brokerPartitions.remove(partition.getBroker());
            }
        }
        partitionSubInfo.remove(partitionKey);
        log.debug("Removed partition {}", partitionKey);
    }

    /**
     * Ends any lease or pending hold on the key and drops it from the idle pool.
     * With {@code reuse}, a key still in the cache goes back to the idle pool.
     * Caller holds {@code metaLock}.
     */
    private void resetIdlePartition(String partitionKey, boolean reuse) {
        usedPartitions.remove(partitionKey);
        PartitionTimeout timeout = partitionTimeouts.remove(partitionKey);
        if (timeout != null) {
            timeout.cancel();
        }
        indexPartitions.remove(partitionKey);
        if (reuse && partitions.containsKey(partitionKey)) {
            indexPartitions.add(partitionKey);
        }
    }

    /**
     * Returns a held partition to the idle pool when its delay elapses. A fire that
     * lost the race against {@link #resetIdlePartition} finds another entry (or
     * none) registered for the key and does nothing.
     */
    private final class PartitionTimeout implements Runnable {

        private final String partitionKey;
        private volatile ScheduledFuture<?> future;

        PartitionTimeout(String partitionKey) {
            this.partitionKey = partitionKey;
        }

        void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }

        @Override
        public void run() {
            synchronized (metaLock) {
                if (partitionTimeouts.get(partitionKey) != this) {
                    return;
                }
                partitionTimeouts.remove(partitionKey);
                if (partitions.containsKey(partitionKey) && !usedPartitions.containsKey(partitionKey)) {
                    indexPartitions.add(partitionKey);
                }
            }
        }
    }
}
