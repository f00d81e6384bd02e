package com.rainfall.cleansing.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * 清洗阶段元数据，描述阶段的身份、在级联中的位置及其读取的配置项
 */
public class FunctionMetadata implements Serializable {
    private String functionId;
    private String name;
    private String version;
    private String description;
    /** 级联顺序，数值小的先执行 */
    private int stageOrder;
    /** 阶段读取的配置项定义 */
    private List<ParameterDefinition> parameterDefinitions = Collections.emptyList();

    public FunctionMetadata() {}

    public FunctionMetadata(String functionId, String name, String version, int stageOrder, String description) {
        this.functionId = functionId;
        this.name = name;
        this.version = version;
        this.stageOrder = stageOrder;
        this.description = description;
    }

    public String getFunctionId() { return functionId; }
    public void setFunctionId(String functionId) { this.functionId = functionId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public int getStageOrder() { return stageOrder; }
    public void setStageOrder(int stageOrder) { this.stageOrder = stageOrder; }
    public List<ParameterDefinition> getParameterDefinitions() { return parameterDefinitions; }
    public void setParameterDefinitions(List<ParameterDefinition> parameterDefinitions) { this.parameterDefinitions = parameterDefinitions; }
}
