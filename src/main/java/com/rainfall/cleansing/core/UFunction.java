package com.rainfall.cleansing.core;

import com.rainfall.cleansing.model.FunctionMetadata;

/**
 * 统一清洗阶段接口：级联中所有阶段的基础契约。
 *
 * 阶段是清洗逻辑的最小执行单元：质控、各类填补、截断输出都实现本接口，
 * 按元数据中的顺序串联，依次作用于同一条工作序列。
 *
 * 实现约定：
 * - 阶段实例在构造时取得全部参数，之后不可变，可被多个传感器的运行并发调用
 * - 填补类阶段只能写入执行时仍缺失的点，通过 {@link OperatorContext#fillValue} 完成
 * - 阶段不直接持有存储等系统资源，所有交互通过OperatorContext完成
 */
public interface UFunction {

    /**
     * 对当前传感器的工作序列执行本阶段。
     *
     * @param context 当前传感器的阶段上下文，提供工作序列、溯源附表和输出通道
     */
    void execute(OperatorContext context);

    /**
     * 返回阶段元数据，包括标识、级联顺序和读取的配置项定义，
     * 用于日志展示和启动前的参数校验。
     *
     * @return 阶段元数据
     */
    FunctionMetadata getMetadata();
}
