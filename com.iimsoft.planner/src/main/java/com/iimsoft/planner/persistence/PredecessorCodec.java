package com.iimsoft.planner.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.iimsoft.planner.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 前置任务字段的编解码。存储里可能是：
 * - JSON 数组：[1, 2]
 * - JSON 字符串：“[1,2]”
 * - 逗号分隔：“1, 2”
 * - null / 空串
 * 统一转成有序去重的 id 集合。写回时用 JSON 数组字符串。
 */
public final class PredecessorCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(PredecessorCodec.class);

    static final ObjectMapper MAPPER = new ObjectMapper();

    private PredecessorCodec() {
    }

    /**
     * @throws IllegalArgumentException 无法解析
     */
    public static LinkedHashSet<Long> decode(JsonNode raw) {
        LinkedHashSet<Long> out = new LinkedHashSet<>();
        for (Long id : parseIds(raw)) {
            out.add(id);
        }
        return out;
    }

    public static LinkedHashSet<Long> decode(String raw) {
        return decode(raw == null ? null : TextNode.valueOf(raw));
    }

    /**
     * 解析并写到任务上；解析失败时前置为空，predecessorsMalformed=true，不抛异常。
     */
    public static void applyTo(Task task, JsonNode raw) {
        try {
            task.setPredecessorIds(decode(raw));
            task.setPredecessorsMalformed(false);
        } catch (IllegalArgumentException e) {
            LOGGER.warn("{}: unparseable predecessors {} ({})", task.getLabel(), raw, e.getMessage());
            task.setPredecessorIds(null);
            task.setPredecessorsMalformed(true);
        }
    }

    public static void applyTo(Task task, String raw) {
        applyTo(task, raw == null ? null : TextNode.valueOf(raw));
    }

    /** 写回存储的格式："[1,2]" */
    public static String encode(Collection<Long> predecessorIds) {
        List<Long> ids = new ArrayList<>(new LinkedHashSet<>(predecessorIds == null ? List.of() : predecessorIds));
        try {
            return MAPPER.writeValueAsString(ids);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode predecessors " + ids, e);
        }
    }

    /**
     * 原始 id 列表（未去重），DaysOffCodec 共用。
     */
    static List<Long> parseIds(JsonNode raw) {
        List<Long> out = new ArrayList<>();
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return out;
        }
        if (raw.isArray()) {
            for (JsonNode element : raw) {
                out.add(parseId(element));
            }
            return out;
        }
        if (raw.isIntegralNumber()) {
            out.add(raw.asLong());
            return out;
        }
        if (!raw.isTextual()) {
            throw new IllegalArgumentException("unsupported predecessor encoding: " + raw.getNodeType());
        }

        String text = raw.asText().trim();
        if (text.isEmpty()) {
            return out;
        }
        if (text.startsWith("[")) {
            JsonNode parsed;
            try {
                parsed = MAPPER.readTree(text);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("invalid JSON: " + text, e);
            }
            if (!parsed.isArray()) {
                throw new IllegalArgumentException("not a JSON array: " + text);
            }
            return parseIds(parsed);
        }
        for (String part : text.split(",")) {
            String p = part.trim();
            if (!p.isEmpty()) {
                out.add(parseLong(p));
            }
        }
        return out;
    }

    private static Long parseId(JsonNode element) {
        if (element.isIntegralNumber()) {
            return element.asLong();
        }
        if (element.isTextual()) {
            return parseLong(element.asText().trim());
        }
        throw new IllegalArgumentException("not an id: " + element);
    }

    private static Long parseLong(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an id: '" + text + "'", e);
        }
    }
}
