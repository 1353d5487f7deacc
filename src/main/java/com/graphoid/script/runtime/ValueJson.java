package com.graphoid.script.runtime;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.graph.EdgeInfo;
import com.graphoid.script.graph.Graph;

/**
 * JSON form of script values, used by {@code to_json}/{@code parse_json}, host snapshots and the CLI.
 * Graphs become objects with their data nodes, edges and properties; functions and modules are written
 * as their display string.
 */
public final class ValueJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueJson() {}

    public static JsonNode toJson(Value v) {
        switch (v.type) {
            case NUMBER: {
                double d = v.asNumber();
                if (d == Math.rint(d) && Math.abs(d) < 1e15) return NODES.numberNode((long) d);
                return NODES.numberNode(d);
            }
            case BIGNUM:
                return NODES.numberNode(v.asBigNumber().toBigDecimal());
            case STRING:
                return NODES.textNode(v.asString());
            case BOOL:
                return NODES.booleanNode(v.asBool());
            case NONE:
                return NODES.nullNode();
            case SYMBOL:
                return NODES.textNode(":" + v.asSymbol());
            case LIST: {
                ArrayNode arr = NODES.arrayNode();
                for (Value item : v.asList().items()) arr.add(toJson(item));
                return arr;
            }
            case MAP: {
                ObjectNode obj = NODES.objectNode();
                for (Map.Entry<String, Value> e : v.asMap().entries().entrySet()) obj.set(e.getKey(), toJson(e.getValue()));
                return obj;
            }
            case GRAPH:
                return graphToJson(v.asGraph());
            case ERROR: {
                ObjectNode obj = NODES.objectNode();
                obj.put("error", v.asError().type);
                obj.put("message", v.asError().message);
                return obj;
            }
            default:
                return NODES.textNode(v.toString());
        }
    }

    private static ObjectNode graphToJson(Graph g) {
        ObjectNode obj = NODES.objectNode();
        if (g.getTypeName() != null) obj.put("type", g.getTypeName());
        ObjectNode nodes = obj.putObject("nodes");
        for (String id : g.dataNodeIds()) nodes.set(id, toJson(g.nodeValue(id)));
        ArrayNode edges = obj.putArray("edges");
        for (EdgeInfo e : g.edges()) {
            if (!Graph.isDataId(e.from) || !Graph.isDataId(e.to)) continue;
            ObjectNode edge = edges.addObject();
            edge.put("from", e.from);
            edge.put("to", e.to);
            edge.put("type", e.edgeType);
            if (e.weight != null) edge.put("weight", e.weight);
        }
        List<String> props = g.propertyNames();
        if (!props.isEmpty()) {
            ObjectNode properties = obj.putObject("properties");
            for (String p : props) properties.set(p, toJson(g.getProperty(p)));
        }
        return obj;
    }

    public static String write(Value v) {
        return write(toJson(v), false);
    }

    public static String write(JsonNode node, boolean pretty) {
        try {
            return pretty ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node) : MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw GraphoidException.runtime("Cannot serialize value to JSON: " + e.getOriginalMessage());
        }
    }

    public static Value read(String json) {
        try {
            JsonNode root = MAPPER.readTree(json);
            return fromJson(root == null ? NODES.nullNode() : root);
        } catch (JsonProcessingException e) {
            throw GraphoidException.runtime("Invalid JSON: " + e.getOriginalMessage());
        }
    }

    public static Value fromJson(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) return Value.none();
        if (node.isBoolean()) return Value.bool(node.booleanValue());
        if (node.isNumber()) return Value.number(node.doubleValue());
        if (node.isTextual()) return Value.string(node.textValue());
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) items.add(fromJson(item));
            return Value.list(items);
        }
        LinkedHashMap<String, Value> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            entries.put(e.getKey(), fromJson(e.getValue()));
        }
        return Value.map(new MapValue(entries));
    }
}
