package com.alertrouter.core.silence;

import com.alertrouter.core.spi.PayloadSerializer;
import com.alertrouter.core.spi.StateStore;
import com.alertrouter.exception.ValidationException;
import com.alertrouter.model.Alert;
import com.alertrouter.model.Silence;
import com.alertrouter.model.enums.StateNamespace;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 静默规则的创建、查询与判定
 * 规则保存在 StateStore 的 silence 命名空间, 正则在创建时校验并缓存编译结果
 */
public class SilenceRegistry {

    private static final Logger log = LoggerFactory.getLogger(SilenceRegistry.class);

    private static final TypeReference<Silence> SILENCE_TYPE = new TypeReference<>() {};

    private final StateStore store;

    private final PayloadSerializer serializer;

    private final Clock clock;

    /** silence id -> 编译后的正则, 随删除与清理一起移除 */
    private final ConcurrentHashMap<String, Pattern> patterns = new ConcurrentHashMap<>();

    public SilenceRegistry(StateStore store, PayloadSerializer serializer, Clock clock) {
        this.store = store;
        this.serializer = serializer;
        this.clock = clock;
    }

    /**
     * 创建静默, id 默认为 label:regex
     */
    public String create(String label, String regex, Instant expiresAt) {
        return create(null, label, regex, expiresAt);
    }

    /**
     * 创建或覆盖同 id 的静默
     */
    public String create(String id, String label, String regex, Instant expiresAt) {
        if (label == null || label.isBlank()) {
            throw new ValidationException("silence label is required");
        }
        if (regex == null || regex.isEmpty()) {
            throw new ValidationException("silence regex is required");
        }
        if (expiresAt == null) {
            throw new ValidationException("silence expiry is required");
        }
        Pattern pattern = compile(regex);
        String sid = (id == null || id.isBlank()) ? label + ":" + regex : id;
        Silence silence = Silence.builder()
                .id(sid)
                .label(label)
                .regex(regex)
                .expiresAt(expiresAt)
                .build();
        store.set(StateNamespace.SILENCE, sid, serializer.serialize(silence));
        patterns.put(sid, pattern);
        log.info("[Silence] saved id={}, label={}, regex={}, expiresAt={}", sid, label, regex, expiresAt);
        return sid;
    }

    /**
     * @param includeExpired false 时只返回未过期的
     */
    public List<Silence> list(boolean includeExpired) {
        Instant now = clock.instant();
        List<Silence> out = new ArrayList<>();
        for (Silence s : loadAll().values()) {
            if (includeExpired || !s.isExpired(now)) {
                out.add(s);
            }
        }
        out.sort(Comparator.comparing(Silence::getId));
        return out;
    }

    public boolean delete(String id) {
        boolean existed = store.get(StateNamespace.SILENCE, id).isPresent();
        store.delete(StateNamespace.SILENCE, id);
        forget(id);
        if (existed) {
            log.info("[Silence] deleted id={}", id);
        }
        return existed;
    }

    /**
     * 任一未过期静默的标签存在且正则命中即为静默, 首个命中即返回
     */
    public boolean isSilenced(Alert alert) {
        Instant now = clock.instant();
        for (Silence s : loadAll().values()) {
            if (s.isExpired(now)) {
                continue;
            }
            String value = alert.label(s.getLabel());
            if (value == null) {
                continue;
            }
            Pattern p = pattern(s);
            if (p != null && p.matcher(value).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 原始存储值, 供清理任务做条件删除
     */
    Map<String, String> rawEntries() {
        return store.scan(StateNamespace.SILENCE);
    }

    Silence decode(String json) {
        return serializer.deserialize(json, SILENCE_TYPE);
    }

    StateStore store() {
        return store;
    }

    void forget(String id) {
        patterns.remove(id);
    }

    int cachedPatternCount() {
        return patterns.size();
    }

    private Map<String, Silence> loadAll() {
        Map<String, String> raw = store.scan(StateNamespace.SILENCE);
        Map<String, Silence> out = new LinkedHashMap<>();
        raw.forEach((id, json) -> {
            try {
                out.put(id, decode(json));
            } catch (IllegalStateException e) {
                log.warn("[Silence] skip undecodable entry id={}: {}", id, e.getMessage());
            }
        });
        return out;
    }

    private Pattern pattern(Silence s) {
        try {
            // 同 id 被外部改写过正则时重新编译
            return patterns.compute(s.getId(), (id, cached) ->
                    cached != null && cached.pattern().equals(s.getRegex()) ? cached : Pattern.compile(s.getRegex()));
        } catch (PatternSyntaxException e) {
            // 只可能来自存储中被外部写入的条目
            log.warn("[Silence] ignore silence with invalid regex id={}, regex={}", s.getId(), s.getRegex());
            return null;
        }
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ValidationException("invalid silence regex: " + regex, e);
        }
    }
}
