package com.rainfall.cleansing.storage;

/**
 * 存储层访问失败，包装底层的SQLException
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
