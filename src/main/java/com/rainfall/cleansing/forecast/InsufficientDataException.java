package com.rainfall.cleansing.forecast;

/**
 * 训练数据不满足最小样本要求，整个预测阶段跳过该传感器
 */
public class InsufficientDataException extends ForecastException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super("Insufficient training data: " + available + " < " + required);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() { return available; }
    public int getRequired() { return required; }
}
