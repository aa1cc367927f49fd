package com.alertrouter.core.spi;

import com.alertrouter.model.enums.StateNamespace;

import java.util.Map;
import java.util.Optional;

/**
 * 持久化状态存储
 * 保存静默、去重时间戳、限流计数与 DLQ 记录
 * 实现需保证单 key 原子自增, 且进程重启后数据仍在
 * 所有方法失败时抛出 {@link com.alertrouter.exception.StoreException}
 */
public interface StateStore {

    Optional<String> get(StateNamespace ns, String key);

    void set(StateNamespace ns, String key, String value);

    /**
     * 原子自增, key 不存在时从 0 开始
     * @return 自增后的值
     */
    long increment(StateNamespace ns, String key);

    /**
     * 条件写入
     * expected 为 null 时仅在 key 不存在时写入, 否则仅当当前值等于 expected 时覆盖
     * @return 是否写入
     */
    boolean compareAndSet(StateNamespace ns, String key, String expected, String value);

    void delete(StateNamespace ns, String key);

    /**
     * 仅当当前值等于 expected 时删除
     * @return 是否删除
     */
    boolean deleteIfEquals(StateNamespace ns, String key, String expected);

    /** 按 key 升序返回命名空间内全部条目 */
    Map<String, String> scan(StateNamespace ns);
}
