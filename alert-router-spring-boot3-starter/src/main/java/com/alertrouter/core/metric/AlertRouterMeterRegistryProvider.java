package com.alertrouter.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * alert.router.* 指标的落点
 * 内置一个 SimpleMeterRegistry, 宿主应用没有任何注册表时接入/丢弃/投递计数仍可读取;
 * 宿主的注册表(Prometheus 等)并入同一个组合注册表, 嵌套的组合注册表会被展开
 */
public class AlertRouterMeterRegistryProvider {

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    private final Set<MeterRegistry> members = Collections.newSetFromMap(new IdentityHashMap<>());

    public AlertRouterMeterRegistryProvider(List<MeterRegistry> discovered) {
        join(new SimpleMeterRegistry());
        if (discovered == null) {
            return;
        }
        for (MeterRegistry mr : discovered) {
            if (mr instanceof CompositeMeterRegistry nested) {
                nested.getRegistries().forEach(this::join);
            } else {
                join(mr);
            }
        }
    }

    /** 同一个注册表只挂一次, 否则计数会翻倍导出 */
    private void join(MeterRegistry registry) {
        if (members.add(registry)) {
            composite.add(registry);
        }
    }

    public MeterRegistry getRegistry() {
        return composite;
    }

    int memberCount() {
        return members.size();
    }
}
