package com.rainfall.cleansing.model;

import java.io.Serializable;
import java.util.List;

/**
 * 阶段配置项定义，用于启动前的参数校验
 */
public class ParameterDefinition implements Serializable {

    public enum Type { NUMBER, BOOLEAN, ENUM }

    /** 配置键，如 cleaner.interpolation.limit */
    private String name;
    private String description;
    private Type type;
    private boolean required;
    private Object defaultValue;
    /** 数值型参数的取值范围下限 */
    private Double minValue;
    /** 数值型参数的取值范围上限 */
    private Double maxValue;
    /** 枚举型参数的可选值列表 */
    private List<String> enumValues;

    public ParameterDefinition() {}

    public static ParameterDefinition number(String name, Object defaultValue, Double min, Double max,
                                             String description) {
        ParameterDefinition def = new ParameterDefinition();
        def.name = name;
        def.type = Type.NUMBER;
        def.defaultValue = defaultValue;
        def.minValue = min;
        def.maxValue = max;
        def.description = description;
        return def;
    }

    public static ParameterDefinition bool(String name, boolean defaultValue, String description) {
        ParameterDefinition def = new ParameterDefinition();
        def.name = name;
        def.type = Type.BOOLEAN;
        def.defaultValue = defaultValue;
        def.description = description;
        return def;
    }

    public static ParameterDefinition enumeration(String name, String defaultValue, List<String> values,
                                                  String description) {
        ParameterDefinition def = new ParameterDefinition();
        def.name = name;
        def.type = Type.ENUM;
        def.defaultValue = defaultValue;
        def.enumValues = values;
        def.description = description;
        return def;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public Type getType() { return type; }
    public void setType(Type type) { this.type = type; }
    public boolean isRequired() { return required; }
    public void setRequired(boolean required) { this.required = required; }
    public Object getDefaultValue() { return defaultValue; }
    public void setDefaultValue(Object defaultValue) { this.defaultValue = defaultValue; }
    public Double getMinValue() { return minValue; }
    public void setMinValue(Double minValue) { this.minValue = minValue; }
    public Double getMaxValue() { return maxValue; }
    public void setMaxValue(Double maxValue) { this.maxValue = maxValue; }
    public List<String> getEnumValues() { return enumValues; }
    public void setEnumValues(List<String> enumValues) { this.enumValues = enumValues; }
}
