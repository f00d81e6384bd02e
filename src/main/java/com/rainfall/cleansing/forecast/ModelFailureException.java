package com.rainfall.cleansing.forecast;

/**
 * 模型拟合或预测因数值原因失败
 */
public class ModelFailureException extends ForecastException {

    public ModelFailureException(String message) {
        super(message);
    }

    public ModelFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
