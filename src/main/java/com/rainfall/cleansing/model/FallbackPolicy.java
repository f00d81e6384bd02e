package com.rainfall.cleansing.model;

/**
 * 兜底填充策略，两者互斥，由配置选择其一
 */
public enum FallbackPolicy {
    /** 全局中位数，无可用数据时取量程下限 */
    MEDIAN_OR_FLOOR("median_or_floor"),
    /** 固定填零 */
    FIXED_ZERO("fixed_zero");

    private final String configValue;

    FallbackPolicy(String configValue) {
        this.configValue = configValue;
    }

    public String getConfigValue() {
        return configValue;
    }

    public static FallbackPolicy fromConfigValue(String value) {
        for (FallbackPolicy policy : values()) {
            if (policy.configValue.equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown fallback policy: " + value);
    }
}
