package uk.gegc.planconfigurator.features.backend.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import uk.gegc.planconfigurator.features.backend.domain.exception.ShapeMismatchException;
import uk.gegc.planconfigurator.features.backend.domain.model.FieldMapping;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationShape;
import uk.gegc.planconfigurator.features.backend.domain.model.ShapeMapping;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts between canonical shapes and backend wire shapes, driven by per-operation
 * mapping tables. Pure; no I/O.
 * <p>
 * Outbound, a canonical field without a mapping is rejected. Inbound, wire fields without
 * a mapping are ignored, while a missing required field or a value of the wrong type
 * raises {@link ShapeMismatchException} naming the offending wire path.
 */
public class DataTransformer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private final Map<String, OperationShape> shapes;
    private final ObjectMapper objectMapper;

    public DataTransformer(Collection<OperationShape> shapes, ObjectMapper objectMapper) {
        Map<String, OperationShape> table = new LinkedHashMap<>();
        for (OperationShape shape : shapes) {
            if (table.putIfAbsent(shape.operation(), shape) != null) {
                throw new IllegalArgumentException("Duplicate shape definition for operation: " + shape.operation());
            }
        }
        this.shapes = Collections.unmodifiableMap(table);
        this.objectMapper = objectMapper;
    }

    public Optional<ShapeMapping> requestMapping(String operation) {
        return Optional.ofNullable(shapes.get(operation)).map(OperationShape::request);
    }

    public Optional<ShapeMapping> responseMapping(String operation) {
        return Optional.ofNullable(shapes.get(operation)).map(OperationShape::response);
    }

    public Collection<OperationShape> shapes() {
        return shapes.values();
    }

    public ObjectNode toWire(String operation, Map<String, ?> canonical) {
        ShapeMapping mapping = requestMapping(operation)
                .orElseThrow(() -> new ShapeMismatchException(operation, "$", "operation has no request mapping"));
        return toWire(operation, mapping, canonical);
    }

    public ObjectNode toWire(String operation, ShapeMapping mapping, Map<String, ?> canonical) {
        return writeObject(operation, mapping, canonical != null ? canonical : Map.of(), "");
    }

    public Map<String, Object> fromWire(String operation, JsonNode payload) {
        ShapeMapping mapping = responseMapping(operation)
                .orElseThrow(() -> new ShapeMismatchException(operation, "$", "operation has no response mapping"));
        return fromWire(operation, mapping, payload);
    }

    public Map<String, Object> fromWire(String operation, ShapeMapping mapping, JsonNode payload) {
        return readObject(operation, mapping, payload, "");
    }

    private ObjectNode writeObject(String operation, ShapeMapping mapping, Map<String, ?> canonical, String prefix) {
        Map<String, FieldMapping> byCanonical = new LinkedHashMap<>();
        mapping.fields().forEach(field -> byCanonical.put(field.canonicalPath(), field));
        for (String key : canonical.keySet()) {
            if (!byCanonical.containsKey(key)) {
                throw new ShapeMismatchException(operation, prefix + key, "field has no wire mapping");
            }
        }

        ObjectNode root = NODES.objectNode();
        for (FieldMapping field : mapping.fields()) {
            Object value = canonical.get(field.canonicalPath());
            String path = prefix + field.wirePath();
            if (value == null) {
                if (field.required()) {
                    throw new ShapeMismatchException(operation, prefix + field.canonicalPath(), "required field is missing");
                }
                continue;
            }
            setPath(root, field.wirePath(), writeValue(operation, field, value, path));
        }
        return root;
    }

    private JsonNode writeValue(String operation, FieldMapping field, Object value, String path) {
        switch (field.type()) {
            case STRING -> {
                if (value instanceof CharSequence || value instanceof Enum<?>) {
                    return NODES.textNode(value instanceof Enum<?> e ? e.name() : value.toString());
                }
            }
            case INTEGER -> {
                if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    return NODES.numberNode(((Number) value).longValue());
                }
                if (value instanceof BigInteger big) {
                    return NODES.numberNode(big);
                }
            }
            case DECIMAL -> {
                if (value instanceof BigDecimal decimal) {
                    return NODES.numberNode(decimal);
                }
                if (value instanceof Number number) {
                    return NODES.numberNode(new BigDecimal(number.toString()));
                }
            }
            case BOOLEAN -> {
                if (value instanceof Boolean bool) {
                    return NODES.booleanNode(bool);
                }
            }
            case LIST -> {
                if (value instanceof List<?> list) {
                    ArrayNode array = NODES.arrayNode();
                    for (int i = 0; i < list.size(); i++) {
                        Object element = list.get(i);
                        String elementPath = path + "[" + i + "]";
                        if (field.element() == null) {
                            array.add(objectMapper.valueToTree(element));
                        } else if (element instanceof Map<?, ?> map) {
                            array.add(writeObject(operation, field.element(), stringKeys(map), elementPath + "."));
                        } else {
                            throw new ShapeMismatchException(operation, elementPath, "expected object but was " + typeName(element));
                        }
                    }
                    return array;
                }
            }
            case ANY -> {
                return objectMapper.valueToTree(value);
            }
        }
        throw new ShapeMismatchException(operation, path, "expected " + field.type() + " but was " + typeName(value));
    }

    private Map<String, Object> readObject(String operation, ShapeMapping mapping, JsonNode node, String prefix) {
        if (node == null || !node.isObject()) {
            String path = prefix.isEmpty() ? "$" : prefix.substring(0, prefix.length() - 1);
            throw new ShapeMismatchException(operation, path, "expected object but was " + nodeType(node));
        }
        Map<String, Object> canonical = new LinkedHashMap<>();
        for (FieldMapping field : mapping.fields()) {
            String path = prefix + field.wirePath();
            JsonNode value = node.at(pointer(field.wirePath()));
            if (value.isMissingNode() || value.isNull()) {
                if (field.required()) {
                    throw new ShapeMismatchException(operation, path, "required field is missing");
                }
                continue;
            }
            canonical.put(field.canonicalPath(), readValue(operation, field, value, path));
        }
        return canonical;
    }

    private Object readValue(String operation, FieldMapping field, JsonNode value, String path) {
        switch (field.type()) {
            case STRING -> {
                if (value.isTextual()) {
                    return value.textValue();
                }
            }
            case INTEGER -> {
                if (value.isIntegralNumber() && value.canConvertToLong()) {
                    return value.longValue();
                }
            }
            case DECIMAL -> {
                if (value.isNumber()) {
                    return value.decimalValue();
                }
            }
            case BOOLEAN -> {
                if (value.isBoolean()) {
                    return value.booleanValue();
                }
            }
            case LIST -> {
                if (value.isArray()) {
                    List<Object> items = new ArrayList<>(value.size());
                    for (int i = 0; i < value.size(); i++) {
                        JsonNode element = value.get(i);
                        if (field.element() == null) {
                            items.add(objectMapper.convertValue(element, Object.class));
                        } else {
                            items.add(readObject(operation, field.element(), element, path + "[" + i + "]."));
                        }
                    }
                    return items;
                }
            }
            case ANY -> {
                return objectMapper.convertValue(value, Object.class);
            }
        }
        throw new ShapeMismatchException(operation, path, "expected " + field.type() + " but was " + nodeType(value));
    }

    private static void setPath(ObjectNode root, String wirePath, JsonNode value) {
        String[] segments = wirePath.split("\\.");
        ObjectNode current = root;
        for (int i = 0; i < segments.length - 1; i++) {
            JsonNode child = current.get(segments[i]);
            if (!(child instanceof ObjectNode)) {
                child = current.putObject(segments[i]);
            }
            current = (ObjectNode) child;
        }
        current.set(segments[segments.length - 1], value);
    }

    private static String pointer(String wirePath) {
        return "/" + wirePath.replace(".", "/");
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static String nodeType(JsonNode node) {
        return node == null ? "null" : node.getNodeType().name();
    }
}
