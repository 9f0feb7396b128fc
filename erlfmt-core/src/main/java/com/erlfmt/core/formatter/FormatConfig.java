package com.erlfmt.core.formatter;

import com.google.gson.*;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 代码格式化配置
 *
 * <p>可从 JSON 加载，例如 {@code {"maxLineWidth": 80, "indentSize": 2}}。
 * 未知字段被忽略，缺失字段保留默认值。</p>
 */
public class FormatConfig {
    private int indentSize = 4;
    private int maxLineWidth = 100;

    public FormatConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize <= 0) {
            throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public int getMaxLineWidth() {
        return maxLineWidth;
    }

    public void setMaxLineWidth(int maxLineWidth) {
        if (maxLineWidth <= 0) {
            throw new IllegalArgumentException("maxLineWidth must be positive: " + maxLineWidth);
        }
        this.maxLineWidth = maxLineWidth;
    }

    /**
     * 从 JSON 文本读取配置
     *
     * @throws IllegalArgumentException JSON 格式错误或取值非法
     */
    public static FormatConfig fromJson(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid format config: " + e.getMessage(), e);
        }

        FormatConfig config = new FormatConfig();
        if (root.isJsonNull()) {
            return config;
        }
        if (!root.isJsonObject()) {
            throw new IllegalArgumentException("Format config must be a JSON object: " + root);
        }
        JsonObject object = root.getAsJsonObject();
        if (object.has("indentSize")) {
            config.setIndentSize(intValue(object, "indentSize"));
        }
        if (object.has("maxLineWidth")) {
            config.setMaxLineWidth(intValue(object, "maxLineWidth"));
        }
        return config;
    }

    /**
     * 从 UTF-8 编码的 JSON 文件读取配置
     */
    public static FormatConfig load(Path path) throws IOException {
        return fromJson(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    private static int intValue(JsonObject object, String key) {
        JsonElement element = object.get(key);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException(key + " must be a number: " + element);
        }
        BigDecimal value = element.getAsBigDecimal();
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(key + " must be an integer in int range: " + element, e);
        }
    }

    @Override
    public String toString() {
        return "FormatConfig{indentSize=" + indentSize + ", maxLineWidth=" + maxLineWidth + "}";
    }
}
