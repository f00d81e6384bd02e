package com.rainfall.cleansing.core;

import com.rainfall.cleansing.model.RawSample;
import com.rainfall.cleansing.model.RunReport;
import com.rainfall.cleansing.model.SensorTask;

import java.util.List;

/**
 * 任务执行器接口：驱动各传感器的清洗级联。
 *
 * 执行流程：
 *   按传感器分组 → 每个传感器构建工作序列 → 依次执行级联各阶段 → 汇总结果
 *
 * 传感器之间互不共享可变状态；某个传感器的异常只丢弃该传感器本次的结果，
 * 不影响同一次运行中的其他传感器。
 */
public interface TaskExecutor {

    /**
     * 对单个传感器执行完整级联。
     * 异常被捕获并记录在任务状态中，不向外抛出。
     *
     * @param task 待执行的传感器任务
     */
    void executeTask(SensorTask task);

    /**
     * 清洗一批原始记录（可包含多个传感器）。
     *
     * @param samples 原始记录
     * @return 运行汇总，包含成功传感器的全部结果行
     */
    RunReport execute(List<RawSample> samples);

    /**
     * 释放执行线程等资源
     */
    void shutdown();
}
