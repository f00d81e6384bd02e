package com.rainfall.cleansing.core;

import com.rainfall.cleansing.model.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * 阶段管理器接口：清洗阶段的注册表。
 *
 * 负责阶段的注册、卸载、查询和参数校验，并按级联顺序给出可执行的阶段列表。
 */
public interface FunctionManager {

    /**
     * 注册一个阶段。functionId重复时拒绝并返回false。
     *
     * @param functionId 阶段唯一标识
     * @param uFunction  阶段实例
     * @return 注册是否成功
     */
    boolean registerFunction(String functionId, UFunction uFunction);

    /**
     * 卸载指定阶段。
     *
     * @param functionId 阶段唯一标识
     * @return 卸载是否成功
     */
    boolean unregisterFunction(String functionId);

    /**
     * 获取指定阶段实例。
     *
     * @param functionId 阶段唯一标识
     * @return 阶段实例；未找到返回null
     */
    UFunction getFunction(String functionId);

    /**
     * 按级联顺序返回全部已注册阶段。
     *
     * @return 阶段列表，stageOrder小的在前
     */
    List<UFunction> getPipeline();

    /**
     * 校验参数是否满足指定阶段的参数定义。
     *
     * 校验内容包括：
     * - 阶段是否已注册
     * - 必选参数是否缺失
     * - 参数类型是否匹配
     * - 数值参数是否在合法范围内
     * - 枚举参数是否为合法选项
     *
     * @param functionId 阶段唯一标识
     * @param parameters 参数集合，键为配置项名
     * @return 详细的校验结果
     */
    ValidationResult validateFunction(String functionId, Map<String, Object> parameters);
}
