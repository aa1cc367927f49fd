package com.alertrouter.core.store;

import com.alertrouter.core.spi.StateStore;
import com.alertrouter.exception.StoreException;
import com.alertrouter.mapper.StateEntryMapper;
import com.alertrouter.model.entity.StateEntryEntity;
import com.alertrouter.model.enums.StateNamespace;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 基于 MyBatis 的持久化实现, 表 alert_router_state
 * 自增依赖 INSERT .. ON DUPLICATE KEY UPDATE 的行级原子性
 */
public class MybatisStateStore implements StateStore {

    private final StateEntryMapper mapper;

    /** 编程式事务 */
    private final TransactionTemplate tt;

    public MybatisStateStore(StateEntryMapper mapper, TransactionTemplate tt) {
        this.mapper = mapper;
        this.tt = tt;
    }

    @Override
    public Optional<String> get(StateNamespace ns, String key) {
        return call("get", ns, key, () -> Optional.ofNullable(mapper.selectValue(ns.code(), key)));
    }

    @Override
    public void set(StateNamespace ns, String key, String value) {
        call("set", ns, key, () -> mapper.upsert(ns.code(), key, value));
    }

    @Override
    public long increment(StateNamespace ns, String key) {
        Long v = call("increment", ns, key, () -> tt.execute(status -> {
            mapper.incrementValue(ns.code(), key);
            String after = mapper.selectValue(ns.code(), key);
            if (after == null) {
                throw new IllegalStateException("counter vanished after increment");
            }
            return Long.parseLong(after);
        }));
        if (v == null) {
            throw new StoreException("increment not confirmed, ns=" + ns.code() + ", key=" + key, null);
        }
        return v;
    }

    @Override
    public boolean compareAndSet(StateNamespace ns, String key, String expected, String value) {
        return call("compareAndSet", ns, key, () -> expected == null
                ? mapper.insertIfAbsent(ns.code(), key, value) > 0
                : mapper.updateIfValue(ns.code(), key, expected, value) > 0);
    }

    @Override
    public void delete(StateNamespace ns, String key) {
        call("delete", ns, key, () -> mapper.deleteByKey(ns.code(), key));
    }

    @Override
    public boolean deleteIfEquals(StateNamespace ns, String key, String expected) {
        return call("deleteIfEquals", ns, key, () -> mapper.deleteIfValue(ns.code(), key, expected) > 0);
    }

    @Override
    public Map<String, String> scan(StateNamespace ns) {
        return call("scan", ns, "*", () -> {
            Map<String, String> out = new LinkedHashMap<>();
            for (StateEntryEntity e : mapper.selectByNamespace(ns.code())) {
                out.put(e.getStateKey(), e.getStateValue());
            }
            return Collections.unmodifiableMap(out);
        });
    }

    private static <T> T call(String op, StateNamespace ns, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (StoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreException("state store " + op + " failed, ns=" + ns.code() + ", key=" + key, e);
        }
    }
}
