package com.rainfall.cleansing.core;

import com.rainfall.cleansing.model.CleanRow;
import com.rainfall.cleansing.model.ImputationMethod;
import com.rainfall.cleansing.model.ProvenanceTracker;
import com.rainfall.cleansing.model.WorkingSeries;

import java.util.List;

/**
 * 阶段上下文接口：阶段与单次传感器运行交互的唯一桥梁。
 *
 * 持有该传感器独占的工作序列及与之按下标对齐的溯源附表，
 * 在级联中从一个阶段依次交给下一个阶段，任何时刻只有一个阶段在写。
 */
public interface OperatorContext {

    String getSensorId();

    /**
     * 当前工作序列。各阶段看到的是前序阶段处理后的状态。
     */
    WorkingSeries getSeries();

    /**
     * 整体替换工作序列，仅允许在任何点被标记或插补之前调用（预聚合阶段）。
     *
     * @throws IllegalStateException 溯源附表已有记录时抛出
     */
    void replaceSeries(WorkingSeries series);

    ProvenanceTracker getProvenance();

    /**
     * 剔除一个点：置空其值并累积质控标志。
     *
     * @param index 点下标
     * @param flag  质控标志位
     */
    void rejectValue(int index, int flag);

    /**
     * 为缺失点写入插补值并记录插补方法。
     * 点已有值时不做任何修改。
     *
     * @param index  点下标
     * @param value  插补值
     * @param method 插补方法
     * @return 是否实际写入
     */
    boolean fillValue(int index, double value, ImputationMethod method);

    /**
     * 向输出写入一行清洗结果。
     */
    void emit(CleanRow row);

    /**
     * 已输出的清洗结果行，按写入顺序排列
     */
    List<CleanRow> getOutput();
}
