package org.muma.mini.kv.common;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 双端列表，插入顺序有意义
 */
public final class ListValue implements RedisValue {

    private final Deque<String> items;

    public ListValue() {
        this.items = new ArrayDeque<>();
    }

    public ListValue(Collection<String> items) {
        this.items = new ArrayDeque<>(items);
    }

    @Override
    public RedisDataType type() {
        return RedisDataType.LIST;
    }

    @Override
    public ListValue copy() {
        return new ListValue(items);
    }

    public int lpush(String item) {
        items.addFirst(item);
        return items.size();
    }

    public int rpush(String item) {
        items.addLast(item);
        return items.size();
    }

    public String lpop() {
        return items.pollFirst();
    }

    public String rpop() {
        return items.pollLast();
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * LRANGE 语义: 闭区间，支持负数下标 (-1 表示最后一个元素)
     */
    public List<String> range(long start, long stop) {
        int size = items.size();
        if (start < 0) start = size + start;
        if (stop < 0) stop = size + stop;
        if (start < 0) start = 0;
        if (stop >= size) stop = size - 1;
        if (start > stop || start >= size) {
            return new ArrayList<>();
        }

        List<String> result = new ArrayList<>((int) (stop - start + 1));
        Iterator<String> it = items.iterator();
        for (int i = 0; i <= stop && it.hasNext(); i++) {
            String item = it.next();
            if (i >= start) {
                result.add(item);
            }
        }
        return result;
    }

    public List<String> items() {
        return new ArrayList<>(items);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListValue other)) return false;
        return items().equals(other.items());
    }

    @Override
    public int hashCode() {
        return items().hashCode();
    }

    @Override
    public String toString() {
        return "ListValue" + items;
    }
}
