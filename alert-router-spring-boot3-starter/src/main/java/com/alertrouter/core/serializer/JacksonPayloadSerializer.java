package com.alertrouter.core.serializer;

import com.alertrouter.core.spi.PayloadSerializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * 状态存储里的 JSON 编解码: 静默规则(silence 命名空间)、死信记录(dlq 命名空间)
 * 以及死信里内嵌的告警批次都经由这里
 * 编解码失败抛 IllegalStateException, 由调用方决定跳过条目还是上抛
 */
public class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper mapper;

    public JacksonPayloadSerializer() {
        this(createDefaultMapper());
    }

    /** 宿主已有 ObjectMapper 时复用其配置 */
    public JacksonPayloadSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public <T> T deserialize(String json, TypeReference<T> typeRef) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readValue(json, typeRef);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("undecodable state record: " + abbreviate(json), e);
        }
    }

    @Override
    public String serialize(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode " + payload.getClass().getSimpleName() + " for state store", e);
        }
    }

    private static String abbreviate(String json) {
        return json.length() <= 64 ? json : json.substring(0, 64) + "...";
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        // 静默过期时间、死信失败时间写成 ISO-8601
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 旧版本写入的记录多出字段时照常读取
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        m.findAndRegisterModules();
        return m;
    }
}
