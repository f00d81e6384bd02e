package com.rainfall.cleansing.model;

/**
 * 单传感器清洗任务状态
 */
public enum TaskStatus {
    /** 已创建，等待执行 */
    PENDING,
    /** 正在执行级联 */
    RUNNING,
    /** 执行成功，结果待写入 */
    COMPLETED,
    /** 执行失败，本次运行丢弃该传感器的结果 */
    FAILED
}
