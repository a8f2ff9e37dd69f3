package com.david.spring.cache.local.event;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 有界事件通道，由调用方主动拉取
 *
 * <p>写入永不阻塞：通道满时丢弃最旧的事件。
 */
@Slf4j
public class CacheEventChannel {

    private final ArrayBlockingQueue<CacheEvent> queue;
    private final AtomicLong droppedEvents = new AtomicLong(0);

    public CacheEventChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * 写入事件
     *
     * @param event 事件
     */
    public void offer(CacheEvent event) {
        while (!queue.offer(event)) {
            if (queue.poll() != null) {
                long dropped = droppedEvents.incrementAndGet();
                if (log.isDebugEnabled()) {
                    log.debug("Event channel full, dropped oldest event. Dropped events: {}", dropped);
                }
            }
        }
    }

    /**
     * 取出至多 maxEvents 个事件
     *
     * @param maxEvents 最大数量
     * @return 按写入顺序排列的事件
     */
    public List<CacheEvent> drain(int maxEvents) {
        List<CacheEvent> drained = new ArrayList<>();
        queue.drainTo(drained, maxEvents);
        return drained;
    }

    public int size() {
        return queue.size();
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    public void clear() {
        queue.clear();
    }
}
