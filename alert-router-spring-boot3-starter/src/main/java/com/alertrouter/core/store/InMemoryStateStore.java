package com.alertrouter.core.store;

import com.alertrouter.core.spi.StateStore;
import com.alertrouter.model.enums.StateNamespace;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 内存实现, 进程重启后数据丢失
 * 未配置数据源时兜底使用
 */
public class InMemoryStateStore implements StateStore {

    private final Map<StateNamespace, ConcurrentMap<String, String>> data = new EnumMap<>(StateNamespace.class);

    public InMemoryStateStore() {
        for (StateNamespace ns : StateNamespace.values()) {
            data.put(ns, new ConcurrentHashMap<>());
        }
    }

    @Override
    public Optional<String> get(StateNamespace ns, String key) {
        return Optional.ofNullable(data.get(ns).get(key));
    }

    @Override
    public void set(StateNamespace ns, String key, String value) {
        data.get(ns).put(key, value);
    }

    @Override
    public long increment(StateNamespace ns, String key) {
        String v = data.get(ns).merge(key, "1", (old, one) -> Long.toString(Long.parseLong(old) + 1));
        return Long.parseLong(v);
    }

    @Override
    public boolean compareAndSet(StateNamespace ns, String key, String expected, String value) {
        ConcurrentMap<String, String> m = data.get(ns);
        if (expected == null) {
            return m.putIfAbsent(key, value) == null;
        }
        return m.replace(key, expected, value);
    }

    @Override
    public void delete(StateNamespace ns, String key) {
        data.get(ns).remove(key);
    }

    @Override
    public boolean deleteIfEquals(StateNamespace ns, String key, String expected) {
        return data.get(ns).remove(key, expected);
    }

    @Override
    public Map<String, String> scan(StateNamespace ns) {
        return Collections.unmodifiableMap(new TreeMap<>(data.get(ns)));
    }
}
