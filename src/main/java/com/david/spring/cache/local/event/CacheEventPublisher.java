package com.david.spring.cache.local.event;

import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 缓存事件发布器
 *
 * <p>每个事件先写入有界通道（供调用方拉取），再交给执行器分发给监听器。
 * 发布操作不会阻塞，也不会在存储锁内执行监听器代码（除非调用方传入同步执行器）。
 */
@Slf4j
public class CacheEventPublisher {

    private final List<CacheEventListener> listeners = new CopyOnWriteArrayList<>();
    private final CacheEventChannel channel;
    private final Executor dispatchExecutor;
    private final AtomicLong publishedEvents = new AtomicLong(0);
    private final AtomicLong droppedEvents = new AtomicLong(0);
    private final AtomicLong processingErrors = new AtomicLong(0);

    public CacheEventPublisher(int channelCapacity, Executor dispatchExecutor) {
        this.channel = new CacheEventChannel(channelCapacity);
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * 同步分发的发布器，监听器在发布线程执行
     */
    public static CacheEventPublisher synchronous(int channelCapacity) {
        return new CacheEventPublisher(channelCapacity, Runnable::run);
    }

    /**
     * 注册事件监听器
     *
     * @param listener 监听器
     */
    public void registerListener(CacheEventListener listener) {
        listeners.add(listener);
        listeners.sort(Comparator.comparingInt(CacheEventListener::getOrder));
        log.info("Registered cache event listener: {}", listener.getClass().getSimpleName());
    }

    /**
     * 移除事件监听器
     *
     * @param listener 监听器
     */
    public void removeListener(CacheEventListener listener) {
        listeners.remove(listener);
        log.info("Removed cache event listener: {}", listener.getClass().getSimpleName());
    }

    /**
     * 发布事件
     *
     * @param event 事件
     */
    public void publish(CacheEvent event) {
        publishedEvents.incrementAndGet();
        channel.offer(event);

        if (listeners.isEmpty()) {
            return;
        }

        try {
            dispatchExecutor.execute(() -> dispatch(event));
        } catch (RejectedExecutionException e) {
            droppedEvents.incrementAndGet();
            log.warn(
                    "Failed to dispatch cache event, executor rejected it. Event dropped: {}",
                    event.getEventType());
        }
    }

    /**
     * 拉取待处理事件
     *
     * @param maxEvents 最大数量
     * @return 事件列表
     */
    public List<CacheEvent> drain(int maxEvents) {
        return channel.drain(maxEvents);
    }

    /** 丢弃通道中所有未拉取的事件 */
    public void clearPending() {
        channel.clear();
    }

    public int getPendingCount() {
        return channel.size();
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public long getPublishedEvents() {
        return publishedEvents.get();
    }

    public long getDroppedEvents() {
        return droppedEvents.get() + channel.getDroppedEvents();
    }

    public long getProcessingErrors() {
        return processingErrors.get();
    }

    /**
     * 关闭事件发布器
     */
    public void shutdown() {
        if (dispatchExecutor instanceof ExecutorService) {
            ((ExecutorService) dispatchExecutor).shutdown();
        }
        log.info("Cache event publisher shutdown completed");
    }

    private void dispatch(CacheEvent event) {
        for (CacheEventListener listener : listeners) {
            if (listener.supports(event)) {
                try {
                    listener.onCacheEvent(event);
                } catch (Exception e) {
                    processingErrors.incrementAndGet();
                    log.warn(
                            "Error processing cache event by listener {}: {}",
                            listener.getClass().getSimpleName(),
                            e.getMessage());
                }
            }
        }
    }
}
