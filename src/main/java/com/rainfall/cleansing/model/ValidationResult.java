package com.rainfall.cleansing.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 配置校验结果
 */
public class ValidationResult implements Serializable {
    private boolean valid;
    private final List<String> errors;
    private final List<String> warnings;

    public ValidationResult() {
        this.valid = true;
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public void addError(String error) {
        this.errors.add(error);
        this.valid = false;
    }

    public void addWarning(String warning) {
        this.warnings.add(warning);
    }

    public ValidationResult merge(ValidationResult other) {
        other.errors.forEach(this::addError);
        other.warnings.forEach(this::addWarning);
        return this;
    }

    /**
     * 校验失败时抛出，错误信息合并为一条
     */
    public void throwIfInvalid() {
        if (!valid) {
            throw new IllegalArgumentException("Invalid cleaner configuration: " + String.join("; ", errors));
        }
    }

    public boolean isValid() { return valid; }
    public List<String> getErrors() { return errors; }
    public List<String> getWarnings() { return warnings; }
}
