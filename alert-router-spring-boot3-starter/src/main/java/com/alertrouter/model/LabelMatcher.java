package com.alertrouter.model;

import lombok.Getter;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * 已编译的标签匹配器, 配置加载时构建一次
 */
@Getter
public final class LabelMatcher {

    private final String label;

    private final Pattern pattern;

    public LabelMatcher(String label, Pattern pattern) {
        this.label = label;
        this.pattern = pattern;
    }

    /**
     * 标签缺失视为不匹配
     */
    public boolean matches(Map<String, String> labels) {
        if (labels == null) {
            return false;
        }
        String value = labels.get(label);
        return value != null && pattern.matcher(value).find();
    }

    @Override
    public String toString() {
        return label + "=~" + pattern.pattern();
    }
}
