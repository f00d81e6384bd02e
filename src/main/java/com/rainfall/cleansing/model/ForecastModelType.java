package com.rainfall.cleansing.model;

/**
 * 预测填补阶段使用的模型族
 */
public enum ForecastModelType {
    ARIMA("arima"),
    GBM("gbm");

    private final String configValue;

    ForecastModelType(String configValue) {
        this.configValue = configValue;
    }

    public String getConfigValue() {
        return configValue;
    }

    public static ForecastModelType fromConfigValue(String value) {
        for (ForecastModelType type : values()) {
            if (type.configValue.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown forecast model: " + value);
    }
}
