package com.rainfall.cleansing.forecast;

import com.rainfall.cleansing.model.ImputationMethod;
import com.rainfall.cleansing.model.WorkingSeries;

import java.util.List;

/**
 * 预测填补策略接口。
 *
 * 经典自回归与滞后特征回归两类模型实现同一接口，由配置选择，
 * 外层级联不因模型族不同而改变。实现必须无状态：模型对象由fit返回，
 * 只在一次传感器运行的一个回合内使用。
 *
 * @param <M> 拟合得到的模型类型
 */
public interface ForecastStrategy<M> {

    /**
     * 写入溯源附表的插补方法
     */
    ImputationMethod getMethod();

    /**
     * 最大回合数，每回合重新拟合一次
     */
    int getMaxIterations();

    /**
     * 用工作序列中当前有值的点拟合模型。
     *
     * @throws InsufficientDataException 可用训练样本不足
     * @throws ModelFailureException     数值原因导致拟合失败
     */
    M fit(WorkingSeries history) throws InsufficientDataException, ModelFailureException;

    /**
     * 本回合可由模型预测的缺失点下标，升序。
     */
    List<Integer> selectTargets(M model, WorkingSeries series);

    /**
     * 预测指定缺失点的值（未截断到量程）。
     *
     * @throws ModelFailureException 数值原因导致预测失败
     */
    double predict(M model, WorkingSeries series, int index) throws ModelFailureException;

    /**
     * 单点预测失败时的处理方式：true表示仅跳过该点，false表示中止本阶段
     */
    boolean skipsFailedPoints();
}
