package com.rainfall.cleansing.model;

/**
 * 插补方法标签，写入输出行的 imputation_method 列。
 * 原始测量值保留时该列为null，不对应任何枚举值。
 */
public enum ImputationMethod {
    /** 经典自回归模型预测 */
    ARIMA_FORECAST("arima_forecast"),
    /** 滞后特征梯度提升回归预测 */
    GBM_FORECAST("gbm_forecast"),
    /** 按时间线性插值 */
    TIME_INTERP("time_interp"),
    /** 同小时中位数 */
    HOUR_MEDIAN("hour_median"),
    /** 全局中位数，无可用数据时取量程下限 */
    GLOBAL_MEDIAN("global_median"),
    /** 固定零值，表示无降水 */
    ZERO_FALLBACK("zero_fallback");

    private final String label;

    ImputationMethod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static ImputationMethod fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (ImputationMethod method : values()) {
            if (method.label.equals(label)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown imputation method label: " + label);
    }
}
