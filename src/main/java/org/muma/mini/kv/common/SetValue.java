package org.muma.mini.kv.common;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 无序且唯一的字符串集合
 */
public final class SetValue implements RedisValue {

    private final Set<String> members;

    public SetValue() {
        this.members = new HashSet<>();
    }

    public SetValue(Collection<String> members) {
        this.members = new HashSet<>(members);
    }

    @Override
    public RedisDataType type() {
        return RedisDataType.SET;
    }

    @Override
    public SetValue copy() {
        return new SetValue(members);
    }

    /**
     * @return 1 表示新增，0 表示已存在
     */
    public int add(String member) {
        return members.add(member) ? 1 : 0;
    }

    public int remove(String member) {
        return members.remove(member) ? 1 : 0;
    }

    public boolean contains(String member) {
        return members.contains(member);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public List<String> members() {
        return new ArrayList<>(members);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SetValue other)) return false;
        return members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return "SetValue" + members;
    }
}
