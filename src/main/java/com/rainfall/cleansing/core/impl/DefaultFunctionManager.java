package com.rainfall.cleansing.core.impl;

import com.rainfall.cleansing.CleansingConfig;
import com.rainfall.cleansing.core.FunctionManager;
import com.rainfall.cleansing.core.UFunction;
import com.rainfall.cleansing.forecast.ArimaForecastStrategy;
import com.rainfall.cleansing.forecast.ForecastStrategy;
import com.rainfall.cleansing.forecast.GradientBoostingForecastStrategy;
import com.rainfall.cleansing.model.FunctionMetadata;
import com.rainfall.cleansing.model.ParameterDefinition;
import com.rainfall.cleansing.model.ValidationResult;
import com.rainfall.cleansing.operators.ClampEmitOperator;
import com.rainfall.cleansing.operators.ForecastFillOperator;
import com.rainfall.cleansing.operators.GlobalFallbackOperator;
import com.rainfall.cleansing.operators.HourMedianFillOperator;
import com.rainfall.cleansing.operators.InterpolationFillOperator;
import com.rainfall.cleansing.operators.QualityControlOperator;
import com.rainfall.cleansing.operators.WindowAggregationOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 阶段管理器默认实现。
 * 使用ConcurrentHashMap存储阶段注册表，级联顺序取自各阶段元数据。
 */
public class DefaultFunctionManager implements FunctionManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultFunctionManager.class);

    /** 阶段注册表：functionId -> UFunction实例 */
    private final ConcurrentHashMap<String, UFunction> functionRegistry = new ConcurrentHashMap<>();

    /**
     * 按配置注册内置阶段。
     * 预聚合与预测填补仅在启用时注册；预测模型族由配置选择其一。
     */
    public static DefaultFunctionManager forConfig(CleansingConfig config) {
        DefaultFunctionManager manager = new DefaultFunctionManager();
        if (config.isAggregationEnabled()) {
            manager.register(new WindowAggregationOperator(config.getAggregationBucket()));
        }
        manager.register(new QualityControlOperator(
                config.getMinValueMm(), config.getMaxValueMm(), config.getMinQuality()));
        if (config.isForecastEnabled()) {
            manager.register(new ForecastFillOperator(createStrategy(config),
                    config.getMinValueMm(), config.getMaxValueMm()));
        }
        manager.register(new InterpolationFillOperator(config.getInterpolationLimit()));
        manager.register(new HourMedianFillOperator());
        manager.register(new GlobalFallbackOperator(config.getFallbackPolicy(), config.getMinValueMm()));
        manager.register(new ClampEmitOperator(config.getMinValueMm(), config.getMaxValueMm(), config.getVersion()));

        log.info("Registered {} cleansing stages: {}", manager.functionRegistry.size(), manager.describePipeline());
        return manager;
    }

    static ForecastStrategy<?> createStrategy(CleansingConfig config) {
        switch (config.getForecastModel()) {
            case GBM:
                return new GradientBoostingForecastStrategy(config);
            case ARIMA:
            default:
                return new ArimaForecastStrategy(config);
        }
    }

    private void register(UFunction function) {
        registerFunction(function.getMetadata().getFunctionId(), function);
    }

    @Override
    public boolean registerFunction(String functionId, UFunction uFunction) {
        if (functionId == null || functionId.isBlank()) {
            log.error("Cannot register stage with null or blank id");
            return false;
        }
        if (uFunction == null) {
            log.error("Cannot register null stage for id: {}", functionId);
            return false;
        }

        UFunction existing = functionRegistry.putIfAbsent(functionId, uFunction);
        if (existing != null) {
            log.warn("Stage '{}' is already registered, registration rejected.", functionId);
            return false;
        }

        log.debug("Stage '{}' registered. Version: {}", functionId, uFunction.getMetadata().getVersion());
        return true;
    }

    @Override
    public boolean unregisterFunction(String functionId) {
        if (functionId == null || functionId.isBlank()) {
            return false;
        }
        UFunction removed = functionRegistry.remove(functionId);
        if (removed == null) {
            log.warn("Stage '{}' not found, nothing to unregister.", functionId);
            return false;
        }
        log.info("Stage '{}' unregistered.", functionId);
        return true;
    }

    @Override
    public UFunction getFunction(String functionId) {
        return functionRegistry.get(functionId);
    }

    @Override
    public List<UFunction> getPipeline() {
        List<UFunction> pipeline = new ArrayList<>(functionRegistry.values());
        pipeline.sort(Comparator.comparingInt(f -> f.getMetadata().getStageOrder()));
        return Collections.unmodifiableList(pipeline);
    }

    /**
     * 对全部已注册阶段校验同一份参数
     */
    public ValidationResult validateAll(Map<String, Object> parameters) {
        ValidationResult result = new ValidationResult();
        for (UFunction function : getPipeline()) {
            result.merge(validateFunction(function.getMetadata().getFunctionId(), parameters));
        }
        return result;
    }

    @Override
    public ValidationResult validateFunction(String functionId, Map<String, Object> parameters) {
        ValidationResult result = new ValidationResult();

        UFunction function = functionRegistry.get(functionId);
        if (function == null) {
            result.addError("Stage '" + functionId + "' is not registered.");
            return result;
        }

        FunctionMetadata metadata = function.getMetadata();
        if (metadata == null || metadata.getParameterDefinitions() == null) {
            return result;
        }

        Map<String, Object> params = (parameters != null) ? parameters : Collections.emptyMap();
        for (ParameterDefinition def : metadata.getParameterDefinitions()) {
            String paramName = def.getName();
            Object value = params.get(paramName);

            if (def.isRequired() && value == null) {
                result.addError("Required parameter '" + paramName + "' is missing.");
                continue;
            }
            if (value == null) {
                continue;
            }

            switch (def.getType()) {
                case NUMBER:
                    if (!(value instanceof Number)) {
                        result.addError("Parameter '" + paramName
                                + "' expects NUMBER type, got: " + value.getClass().getSimpleName());
                    } else {
                        double numVal = ((Number) value).doubleValue();
                        if (Double.isNaN(numVal)) {
                            result.addError("Parameter '" + paramName + "' must not be NaN");
                        }
                        if (def.getMinValue() != null && numVal < def.getMinValue()) {
                            result.addError("Parameter '" + paramName + "' value "
                                    + numVal + " is below minimum " + def.getMinValue());
                        }
                        if (def.getMaxValue() != null && numVal > def.getMaxValue()) {
                            result.addError("Parameter '" + paramName + "' value "
                                    + numVal + " exceeds maximum " + def.getMaxValue());
                        }
                    }
                    break;

                case BOOLEAN:
                    if (!(value instanceof Boolean)) {
                        result.addError("Parameter '" + paramName
                                + "' expects BOOLEAN type, got: " + value.getClass().getSimpleName());
                    }
                    break;

                case ENUM:
                    if (!(value instanceof String)) {
                        result.addError("Parameter '" + paramName
                                + "' expects ENUM (String) type, got: " + value.getClass().getSimpleName());
                    } else if (def.getEnumValues() != null && !def.getEnumValues().contains(value)) {
                        result.addError("Parameter '" + paramName + "' value '"
                                + value + "' is not in allowed values: " + def.getEnumValues());
                    }
                    break;

                default:
                    result.addWarning("Unknown parameter type '" + def.getType()
                            + "' for parameter '" + paramName + "', skipping validation.");
            }
        }
        return result;
    }

    private String describePipeline() {
        List<String> ids = new ArrayList<>();
        for (UFunction function : getPipeline()) {
            ids.add(function.getMetadata().getFunctionId());
        }
        return String.join(" -> ", ids);
    }
}
