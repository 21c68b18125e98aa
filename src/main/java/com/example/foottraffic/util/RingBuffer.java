package com.example.foottraffic.util;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 固定容量环形缓冲区，写满后淘汰最旧元素
 * <p>
 * 非线程安全，只允许单个写线程使用。
 */
public class RingBuffer<T> {

    private final Object[] items;
    private int head;
    private int size;

    public RingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("容量必须大于0: " + capacity);
        }
        this.items = new Object[capacity];
    }

    /**
     * 追加元素，已满时覆盖最旧的一个
     */
    public void add(T item) {
        int tail = (head + size) % items.length;
        items[tail] = item;
        if (size < items.length) {
            size++;
        } else {
            head = (head + 1) % items.length;
        }
    }

    /**
     * 按时间顺序取元素，0为最旧
     */
    @SuppressWarnings("unchecked")
    public T get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + ", size " + size);
        }
        return (T) items[(head + index) % items.length];
    }

    public T last() {
        if (size == 0) {
            throw new NoSuchElementException("缓冲区为空");
        }
        return get(size - 1);
    }

    /**
     * 倒数第n个元素，1为最新
     */
    public T fromEnd(int n) {
        return get(size - n);
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return items.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void clear() {
        for (int i = 0; i < items.length; i++) {
            items[i] = null;
        }
        head = 0;
        size = 0;
    }

    public List<T> toList() {
        List<T> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            list.add(get(i));
        }
        return list;
    }
}
