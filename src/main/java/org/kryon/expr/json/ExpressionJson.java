package org.kryon.expr.json;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.kryon.expr.astnode.*;
import org.kryon.expr.astvisitor.Visitor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts expression trees to and from the JSON interchange format.
 * <p>
 * Literals are plain JSON values (integers without a fraction, floats with
 * one). Everything else is an object:
 * <pre>
 * {"var": "count"}
 * {"prop": "user", "field": "name"}
 * {"member": expr, "name": "length"}
 * {"computed": expr, "key": expr}
 * {"index": expr, "at": expr}
 * {"op": "add", "left": expr, "right": expr}
 * {"op": "not", "operand": expr}
 * {"op": "ternary", "condition": expr, "then": expr, "else": expr}
 * {"op": "call", "function": "math_max", "args": [expr, ...]}
 * {"op": "method", "receiver": expr, "method": "push", "args": [expr, ...]}
 * {"op": "group", "expr": expr}
 * {"op": "array", "elements": [expr, ...]}
 * {"op": "object", "keys": ["a", ...], "values": [expr, ...]}
 * {"float": "NaN"}
 * </pre>
 * The last form carries floats JSON cannot represent (NaN and the infinities).
 * <p>
 * The output is deterministic, so equal trees serialize to equal strings.
 */
public class ExpressionJson {

    private ExpressionJson() {
    }

    /**
     * Serializes a tree.
     *
     * @param node the root; null serializes as the null literal
     * @return compact JSON text
     */
    public static String toJson(Node node) {
        return JSON.toJSONString(toJsonValue(node), JSONWriter.Feature.WriteMapNullValue);
    }

    /**
     * Builds the fastjson2 value for a tree: a JSONObject, a JSON scalar or null.
     */
    public static Object toJsonValue(Node node) {
        if (node == null) {
            return null;
        }
        JsonBuilder builder = new JsonBuilder();
        node.accept(builder);
        return builder.result;
    }

    /**
     * Parses a tree.
     *
     * @throws ExpressionJsonException if the text is not JSON or not a valid tree
     */
    public static Node fromJson(String json) {
        Object parsed;
        try {
            parsed = JSON.parse(json);
        } catch (JSONException e) {
            throw new ExpressionJsonException("Malformed JSON: " + e.getMessage(), e);
        }
        return fromJsonValue(parsed);
    }

    /**
     * Converts a parsed fastjson2 value into a tree.
     */
    public static Node fromJsonValue(Object json) {
        if (json == null) {
            return new NullNode();
        } else if (json instanceof Boolean) {
            return new BooleanNode((Boolean) json);
        } else if (json instanceof String) {
            return new StringNode((String) json);
        } else if (json instanceof Integer || json instanceof Long || json instanceof Short || json instanceof Byte) {
            return new IntegerNode(((Number) json).longValue());
        } else if (json instanceof BigInteger) {
            try {
                return new IntegerNode(((BigInteger) json).longValueExact());
            } catch (ArithmeticException e) {
                throw new ExpressionJsonException("Integer literal out of range: " + json);
            }
        } else if (json instanceof BigDecimal || json instanceof Double || json instanceof Float) {
            return new FloatNode(((Number) json).doubleValue());
        } else if (json instanceof JSONObject) {
            return fromJsonObject((JSONObject) json);
        }
        throw new ExpressionJsonException("Unexpected JSON value: " + json);
    }

    private static Node fromJsonObject(JSONObject json) {
        if (json.containsKey("var")) {
            return new VariableNode(requireString(json, "var"));
        }
        if (json.containsKey("prop")) {
            return new PropertyNode(requireString(json, "prop"), requireString(json, "field"));
        }
        if (json.containsKey("member")) {
            return new MemberAccessNode(child(json, "member"), requireString(json, "name"));
        }
        if (json.containsKey("computed")) {
            return new ComputedMemberNode(child(json, "computed"), child(json, "key"));
        }
        if (json.containsKey("index")) {
            return new IndexNode(child(json, "index"), child(json, "at"));
        }
        if (json.containsKey("float")) {
            String text = requireString(json, "float");
            try {
                return new FloatNode(Double.parseDouble(text));
            } catch (NumberFormatException e) {
                throw new ExpressionJsonException("Bad float literal: " + text);
            }
        }

        String op = requireString(json, "op");
        switch (op) {
            case "ternary":
                return new TernaryOperatorNode(child(json, "condition"), child(json, "then"), child(json, "else"));
            case "call":
                return new CallNode(requireString(json, "function"), children(json, "args"));
            case "method":
                return new MethodCallNode(child(json, "receiver"), requireString(json, "method"), children(json, "args"));
            case "group":
                return new GroupNode(child(json, "expr"));
            case "array":
                return new ArrayLiteralNode(children(json, "elements"));
            case "object": {
                JSONArray keyArray = json.getJSONArray("keys");
                if (keyArray == null) {
                    throw new ExpressionJsonException("Object literal has no \"keys\"");
                }
                List<String> keys = new ArrayList<>(keyArray.size());
                for (int i = 0; i < keyArray.size(); i++) {
                    keys.add(String.valueOf(keyArray.get(i)));
                }
                List<Node> values = children(json, "values");
                if (keys.size() != values.size()) {
                    throw new ExpressionJsonException("Object literal has " + keys.size()
                            + " keys but " + values.size() + " values");
                }
                return new ObjectLiteralNode(keys, values);
            }
            default:
                break;
        }

        UnaryOperator unary = UnaryOperator.fromJsonName(op);
        if (unary != null && json.containsKey("operand")) {
            return new UnaryOperatorNode(unary, child(json, "operand"));
        }
        BinaryOperator binary = BinaryOperator.fromJsonName(op);
        if (binary != null && json.containsKey("left") && json.containsKey("right")) {
            return new BinaryOperatorNode(binary, child(json, "left"), child(json, "right"));
        }
        throw new ExpressionJsonException("Unknown or incomplete operation \"" + op + "\"");
    }

    private static String requireString(JSONObject json, String key) {
        Object value = json.get(key);
        if (!(value instanceof String)) {
            throw new ExpressionJsonException("Expected a string for \"" + key + "\" in " + json);
        }
        return (String) value;
    }

    private static Node child(JSONObject json, String key) {
        if (!json.containsKey(key)) {
            throw new ExpressionJsonException("Missing \"" + key + "\" in " + json);
        }
        return fromJsonValue(json.get(key));
    }

    private static List<Node> children(JSONObject json, String key) {
        Object value = json.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof JSONArray)) {
            throw new ExpressionJsonException("Expected an array for \"" + key + "\" in " + json);
        }
        JSONArray array = (JSONArray) value;
        List<Node> nodes = new ArrayList<>(array.size());
        for (Object item : array) {
            nodes.add(fromJsonValue(item));
        }
        return nodes;
    }

    /**
     * Builds fastjson2 values bottom-up.
     */
    private static class JsonBuilder implements Visitor {
        Object result;

        private Object build(Node node) {
            return toJsonValue(node);
        }

        private JSONArray buildAll(List<Node> nodes) {
            JSONArray array = new JSONArray(nodes.size());
            for (Node node : nodes) {
                array.add(build(node));
            }
            return array;
        }

        private JSONObject op(String name) {
            JSONObject json = new JSONObject();
            json.put("op", name);
            return json;
        }

        @Override
        public void visit(IntegerNode node) {
            result = node.value;
        }

        @Override
        public void visit(FloatNode node) {
            if (Double.isFinite(node.value)) {
                result = node.value;
            } else {
                JSONObject json = new JSONObject();
                json.put("float", Double.toString(node.value));
                result = json;
            }
        }

        @Override
        public void visit(StringNode node) {
            result = node.value;
        }

        @Override
        public void visit(BooleanNode node) {
            result = node.value;
        }

        @Override
        public void visit(NullNode node) {
            result = null;
        }

        @Override
        public void visit(VariableNode node) {
            JSONObject json = new JSONObject();
            json.put("var", node.name);
            result = json;
        }

        @Override
        public void visit(PropertyNode node) {
            JSONObject json = new JSONObject();
            json.put("prop", node.object);
            json.put("field", node.field);
            result = json;
        }

        @Override
        public void visit(MemberAccessNode node) {
            JSONObject json = new JSONObject();
            json.put("member", build(node.object));
            json.put("name", node.property);
            result = json;
        }

        @Override
        public void visit(ComputedMemberNode node) {
            JSONObject json = new JSONObject();
            json.put("computed", build(node.object));
            json.put("key", build(node.key));
            result = json;
        }

        @Override
        public void visit(IndexNode node) {
            JSONObject json = new JSONObject();
            json.put("index", build(node.array));
            json.put("at", build(node.index));
            result = json;
        }

        @Override
        public void visit(BinaryOperatorNode node) {
            JSONObject json = op(node.operator.jsonName);
            json.put("left", build(node.left));
            json.put("right", build(node.right));
            result = json;
        }

        @Override
        public void visit(UnaryOperatorNode node) {
            JSONObject json = op(node.operator.jsonName);
            json.put("operand", build(node.operand));
            result = json;
        }

        @Override
        public void visit(TernaryOperatorNode node) {
            JSONObject json = op("ternary");
            json.put("condition", build(node.condition));
            json.put("then", build(node.thenExpr));
            json.put("else", build(node.elseExpr));
            result = json;
        }

        @Override
        public void visit(CallNode node) {
            JSONObject json = op("call");
            json.put("function", node.function);
            json.put("args", buildAll(node.args));
            result = json;
        }

        @Override
        public void visit(MethodCallNode node) {
            JSONObject json = op("method");
            json.put("receiver", build(node.receiver));
            json.put("method", node.method);
            json.put("args", buildAll(node.args));
            result = json;
        }

        @Override
        public void visit(GroupNode node) {
            JSONObject json = op("group");
            json.put("expr", build(node.inner));
            result = json;
        }

        @Override
        public void visit(ArrayLiteralNode node) {
            JSONObject json = op("array");
            json.put("elements", buildAll(node.elements));
            result = json;
        }

        @Override
        public void visit(ObjectLiteralNode node) {
            JSONObject json = op("object");
            json.put("keys", new JSONArray(node.keys));
            json.put("values", buildAll(node.values));
            result = json;
        }
    }
}
