package com.rainfall.cleansing.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rainfall.cleansing.model.RawSample;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * 采集消息解析。
 *
 * 消息格式约定（JSON）：
 * {"sensorId":"S001","timestamp":"2024-05-01T10:00:00Z","value":1.2,"quality":0.9,
 *  "variable":"precipitacion","source":"telemetry"}
 *
 * timestamp可为ISO-8601字符串或纪元毫秒；value无法解析为数值时记为缺失；
 * 未带variable时使用默认变量名。
 */
public class RawSampleParser {

    private final ObjectMapper mapper;
    private final String defaultVariable;

    public RawSampleParser(ObjectMapper mapper, String defaultVariable) {
        this.mapper = mapper;
        this.defaultVariable = defaultVariable;
    }

    /**
     * @throws JsonProcessingException  消息不是合法JSON
     * @throws IllegalArgumentException 缺少传感器标识或时间戳不可解析
     */
    public RawSample parse(String json) throws JsonProcessingException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Message is not a JSON object");
        }

        String sensorId = text(root, "sensorId");
        if (sensorId == null || sensorId.isBlank()) {
            throw new IllegalArgumentException("Missing sensorId");
        }
        Instant timestamp = parseTimestamp(root.get("timestamp"));
        String variable = text(root, "variable");

        return new RawSample(sensorId, timestamp,
                number(root.get("value")),
                number(root.get("quality")),
                variable == null ? defaultVariable : variable,
                text(root, "source"));
    }

    static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing timestamp");
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        String text = node.asText().trim();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(text));
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("Unparseable timestamp: " + text, e);
            }
        }
    }

    /** 数值或数值字符串；其他情况（含NaN）返回null */
    static Double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return (node == null || node.isNull()) ? null : node.asText();
    }
}
