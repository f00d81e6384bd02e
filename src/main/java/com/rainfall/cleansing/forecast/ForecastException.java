package com.rainfall.cleansing.forecast;

/**
 * 预测填补失败的基类异常
 */
public class ForecastException extends Exception {

    public ForecastException(String message) {
        super(message);
    }

    public ForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}
