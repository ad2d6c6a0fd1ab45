package org.lituus.mtgl.tree;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.LinkedHashMap;

/**
 * Self-describing JSON form of a tree, for caching by callers.
 *
 * <pre>
 * {"version": "...", "root": {"label": "card", "attributes": {...}, "children": [...]}}
 * </pre>
 */
public final class TreeJson {
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
    private static final Gson PRETTY = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

    private TreeJson() {}

    public static String write(Tree tree) {
        return GSON.toJson(toJson(tree));
    }

    public static String writePretty(Tree tree) {
        return PRETTY.toJson(toJson(tree));
    }

    /**
     * @throws JsonParseException if the text is not a tree document
     */
    public static Tree read(String json) {
        var element = JsonParser.parseString(json);
        if (!element.isJsonObject()) {
            throw new JsonParseException("Tree document must be an object");
        }
        var document = element.getAsJsonObject();
        var version = string(required(document, "version"), "version");
        var root = readNode(required(document, "root"));
        return Tree.of(root, version);
    }

    private static JsonObject toJson(Tree tree) {
        var document = new JsonObject();
        document.addProperty("version", tree.version());
        document.add("root", writeNode(tree.root()));
        return document;
    }

    private static JsonObject writeNode(Node node) {
        var object = new JsonObject();
        object.addProperty("label", node.label());
        if (!node.attributes().isEmpty()) {
            var attributes = new JsonObject();
            node.attributes().forEach(attributes::addProperty);
            object.add("attributes", attributes);
        }
        if (!node.children().isEmpty()) {
            var children = new JsonArray();
            node.children().forEach(child -> children.add(writeNode(child)));
            object.add("children", children);
        }
        return object;
    }

    private static Node readNode(JsonElement element) {
        if (!element.isJsonObject()) {
            throw new JsonParseException("Tree node must be an object: " + element);
        }
        var object = element.getAsJsonObject();
        var attributes = new LinkedHashMap<String, String>();
        var attributesMember = object.get("attributes");
        if (attributesMember != null) {
            if (!attributesMember.isJsonObject()) {
                throw new JsonParseException("Member 'attributes' must be an object: " + attributesMember);
            }
            for (var entry : attributesMember.getAsJsonObject().entrySet()) {
                attributes.put(entry.getKey(), string(entry.getValue(), "attribute '" + entry.getKey() + "'"));
            }
        }
        var node = Node.create(string(required(object, "label"), "label"), attributes);
        var childrenMember = object.get("children");
        if (childrenMember != null) {
            if (!childrenMember.isJsonArray()) {
                throw new JsonParseException("Member 'children' must be an array: " + childrenMember);
            }
            for (var child : childrenMember.getAsJsonArray()) {
                node.addChild(readNode(child));
            }
        }
        return node;
    }

    private static String string(JsonElement element, String what) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new JsonParseException("Value of " + what + " must be a string: " + element);
        }
        return element.getAsString();
    }

    private static JsonElement required(JsonObject object, String member) {
        var value = object.get(member);
        if (value == null || value.isJsonNull()) {
            throw new JsonParseException("Missing member '" + member + "'");
        }
        return value;
    }
}
