package org.lituus.mtgl.tree;

import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.error.MtglException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, labeled, attributed tree node.
 *
 * <p>A node has at most one parent. Ownership is checked when a child is attached, so a tree
 * built from nodes is acyclic by construction. Nodes become read-only once wrapped in a {@link Tree}.
 */
public final class Node {
    private final String label;
    private final Map<String, String> attributes;
    private final List<Node> children;
    private Node parent;
    private boolean frozen;

    private Node(String label, Map<String, String> attributes) {
        this.label = Objects.requireNonNull(label, "label");
        this.attributes = new LinkedHashMap<>();
        this.children = new ArrayList<>();
        attributes.forEach(this::putAttribute);
    }

    public static Node create(String label) {
        return new Node(label, Map.of());
    }

    public static Node create(String label, Map<String, String> attributes) {
        return new Node(label, attributes);
    }

    public String label() {
        return label;
    }

    public Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * @throws NullPointerException if key or value is null
     */
    public Node setAttribute(String key, String value) {
        checkMutable();
        putAttribute(key, value);
        return this;
    }

    private void putAttribute(String key, String value) {
        Objects.requireNonNull(key, "attribute key");
        Objects.requireNonNull(value, () -> "value of attribute '" + key + "'");
        attributes.put(key, value);
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<Node> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Parent, grandparent and so on up to the root.
     */
    public List<Node> ancestors() {
        var result = new ArrayList<Node>();
        for (var ancestor = parent; ancestor != null; ancestor = ancestor.parent) {
            result.add(ancestor);
        }
        return result;
    }

    /**
     * Every node below this one, in pre-order.
     */
    public List<Node> descendants() {
        var result = new ArrayList<Node>();
        collectDescendants(this, result);
        return result;
    }

    /**
     * The other children of this node's parent, in order. A root has none.
     */
    public List<Node> siblings() {
        if (parent == null) {
            return List.of();
        }
        var result = new ArrayList<Node>(parent.children);
        result.remove(indexInParent());
        return result;
    }

    public Optional<Node> leftSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        int index = indexInParent();
        return index > 0 ? Optional.of(parent.children.get(index - 1)) : Optional.empty();
    }

    public Optional<Node> rightSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        int index = indexInParent();
        return index + 1 < parent.children.size() ? Optional.of(parent.children.get(index + 1)) : Optional.empty();
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Append a child, preserving insertion order.
     *
     * @throws MtglException if the child already has a parent or is this node or one of its ancestors
     */
    public Node addChild(Node child) {
        checkMutable();
        if (child.parent != null) {
            throw ownership(child, "node already has a parent");
        }
        for (var ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw ownership(child, "node would become its own ancestor");
            }
        }
        child.parent = this;
        children.add(child);
        return this;
    }

    /**
     * Unfrozen copy of this node and its subtree, detached from any parent.
     */
    public Node deepCopy() {
        var copy = new Node(label, attributes);
        for (var child : children) {
            copy.addChild(child.deepCopy());
        }
        return copy;
    }

    private int indexInParent() {
        for (int i = 0; i < parent.children.size(); i++) {
            if (parent.children.get(i) == this) {
                return i;
            }
        }
        throw new IllegalStateException("Node '" + label + "' missing from its parent");
    }

    private static void collectDescendants(Node node, List<Node> result) {
        for (var child : node.children) {
            result.add(child);
            collectDescendants(child, result);
        }
    }

    void freeze() {
        frozen = true;
        for (var child : children) {
            child.freeze();
        }
    }

    private void checkMutable() {
        if (frozen) {
            throw ownership(this, "tree is frozen");
        }
    }

    private static MtglException ownership(Node node, String reason) {
        return new MtglException(new MtglError.OwnershipError(node.label, reason));
    }

    @Override
    public String toString() {
        return attributes.isEmpty() ? label : label + attributes;
    }
}
