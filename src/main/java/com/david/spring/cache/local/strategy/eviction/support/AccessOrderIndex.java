package com.david.spring.cache.local.strategy.eviction.support;

import lombok.extern.slf4j.Slf4j;

import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于槽位数组的访问顺序索引
 *
 * <p>双向链表的 prev/next 用 int 下标存放在并行数组中，配合 key -> 槽位 的哈希表，
 * 实现 O(1) 的插入、移到最近、删除与查找最久未使用。被删除的槽位进入空闲链表复用。
 *
 * <p>非线程安全，由所属存储的锁保护。
 */
@Slf4j
public class AccessOrderIndex {

    /** 空下标 */
    private static final int NIL = -1;

    /** 默认初始槽位数 */
    private static final int DEFAULT_INITIAL_CAPACITY = 16;

    /** 元素映射表，用于快速查找槽位 */
    private final Map<String, Integer> slots;

    private String[] keys;
    private int[] prev;
    private int[] next;

    /** 最近使用端 */
    private int head;

    /** 最久未使用端 */
    private int tail;

    /** 空闲槽位链表头（通过 next 数组串联） */
    private int freeHead;

    /** 已分配过的最高槽位 */
    private int highWater;

    public AccessOrderIndex() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    public AccessOrderIndex(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        this.slots = new HashMap<>();
        this.keys = new String[initialCapacity];
        this.prev = new int[initialCapacity];
        this.next = new int[initialCapacity];
        resetLinks();
    }

    /**
     * 将键放到最近使用端，不存在时新增
     *
     * @param key 键
     */
    public void addFirst(String key) {
        Integer slot = slots.get(key);
        if (slot != null) {
            moveToFrontUnsafe(slot);
            return;
        }

        int newSlot = allocateSlot();
        keys[newSlot] = key;
        linkFirst(newSlot);
        slots.put(key, newSlot);
    }

    /**
     * 将已存在的键移到最近使用端
     *
     * @param key 键
     * @return true=键存在
     */
    public boolean moveToFront(String key) {
        Integer slot = slots.get(key);
        if (slot == null) {
            return false;
        }
        moveToFrontUnsafe(slot);
        return true;
    }

    /**
     * 移除键
     *
     * @param key 键
     * @return true=键存在并已移除
     */
    public boolean remove(String key) {
        Integer slot = slots.remove(key);
        if (slot == null) {
            return false;
        }
        unlink(slot);
        releaseSlot(slot);
        return true;
    }

    /**
     * 最久未使用的键
     *
     * @return 键，为空时返回 null
     */
    @Nullable
    public String leastRecent() {
        return tail == NIL ? null : keys[tail];
    }

    /**
     * 最近使用的键
     *
     * @return 键，为空时返回 null
     */
    @Nullable
    public String mostRecent() {
        return head == NIL ? null : keys[head];
    }

    public boolean contains(String key) {
        return slots.containsKey(key);
    }

    public int size() {
        return slots.size();
    }

    /**
     * 从最近到最久的键列表，用于诊断
     */
    public List<String> keysFromMostRecent() {
        List<String> ordered = new ArrayList<>(slots.size());
        for (int cursor = head; cursor != NIL; cursor = next[cursor]) {
            ordered.add(keys[cursor]);
        }
        return ordered;
    }

    /** 清空所有元素 */
    public void clear() {
        slots.clear();
        Arrays.fill(keys, null);
        resetLinks();
        if (log.isDebugEnabled()) {
            log.debug("Cleared access order index");
        }
    }

    private void resetLinks() {
        head = NIL;
        tail = NIL;
        freeHead = NIL;
        highWater = 0;
    }

    private void moveToFrontUnsafe(int slot) {
        if (slot == head) {
            return;
        }
        unlink(slot);
        linkFirst(slot);
    }

    private void linkFirst(int slot) {
        prev[slot] = NIL;
        next[slot] = head;
        if (head != NIL) {
            prev[head] = slot;
        }
        head = slot;
        if (tail == NIL) {
            tail = slot;
        }
    }

    private void unlink(int slot) {
        int before = prev[slot];
        int after = next[slot];

        if (before != NIL) {
            next[before] = after;
        } else {
            head = after;
        }

        if (after != NIL) {
            prev[after] = before;
        } else {
            tail = before;
        }

        prev[slot] = NIL;
        next[slot] = NIL;
    }

    private int allocateSlot() {
        if (freeHead != NIL) {
            int slot = freeHead;
            freeHead = next[slot];
            return slot;
        }
        if (highWater == keys.length) {
            grow();
        }
        return highWater++;
    }

    private void releaseSlot(int slot) {
        keys[slot] = null;
        next[slot] = freeHead;
        freeHead = slot;
    }

    private void grow() {
        int newCapacity = keys.length << 1;
        keys = Arrays.copyOf(keys, newCapacity);
        prev = Arrays.copyOf(prev, newCapacity);
        next = Arrays.copyOf(next, newCapacity);
        if (log.isDebugEnabled()) {
            log.debug("Grew access order index to {} slots", newCapacity);
        }
    }
}
