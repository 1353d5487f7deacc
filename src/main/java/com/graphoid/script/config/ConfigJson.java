package com.graphoid.script.config;

import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphoid.script.errors.GraphoidException;

/**
 * Host configuration in JSON form. Keys match the {@code configure} block keys; string values may be
 * written with or without the leading colon:
 *
 * <pre>{ "error_mode": "collect", "precision": ":high", "integer": true }</pre>
 */
public final class ConfigJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigJson() {}

    public static RuntimeConfig read(String json, RuntimeConfig base) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw GraphoidException.config("Invalid configuration JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw GraphoidException.config("Configuration JSON must be an object");
        }

        RuntimeConfig out = base.copy();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.set(e.getKey(), raw(e.getKey(), e.getValue()));
        }
        return out;
    }

    private static Object raw(String key, JsonNode node) {
        if (node.isNull()) return null;
        if (node.isBoolean()) return node.booleanValue();
        if (node.isNumber()) return node.doubleValue();
        if (node.isTextual()) {
            String s = node.textValue();
            return s.startsWith(":") ? s.substring(1) : s;
        }
        throw GraphoidException.config("Invalid value for " + key + ": " + node);
    }
}
