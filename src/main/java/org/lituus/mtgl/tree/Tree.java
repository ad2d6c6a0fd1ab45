package org.lituus.mtgl.tree;

import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.error.MtglException;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Immutable rooted tree tagged with the version of the vocabulary and grammar that built it.
 */
public final class Tree {
    private final Node root;
    private final String version;

    private Tree(Node root, String version) {
        this.root = root;
        this.version = version;
    }

    /**
     * Freeze the subtree under {@code root} and wrap it.
     */
    public static Tree of(Node root, String version) {
        Objects.requireNonNull(version, "version");
        if (root.parent().isPresent()) {
            throw new MtglException(new MtglError.OwnershipError(root.label(), "tree root has a parent"));
        }
        root.freeze();
        return new Tree(root, version);
    }

    public Node root() {
        return root;
    }

    public String version() {
        return version;
    }

    /**
     * Lazy pre-order traversal. Every call to {@code iterator()} starts an independent walk.
     */
    public Iterable<Node> depthFirst() {
        return () -> new PreOrder(root);
    }

    public Stream<Node> stream() {
        return walk(root);
    }

    public List<Node> findAll(String label) {
        return stream().filter(node -> node.label().equals(label)).toList();
    }

    /**
     * Nodes labeled {@code label} whose attribute {@code key} equals {@code value}.
     */
    public List<Node> findAll(String label, String key, String value) {
        return stream().filter(node -> node.label().equals(label))
                       .filter(node -> node.attribute(key).filter(value::equals).isPresent())
                       .toList();
    }

    /**
     * Nodes labeled {@code label} in the subtree under {@code from}, {@code from} included.
     *
     * @throws IllegalArgumentException if {@code from} is not a node of this tree
     */
    public List<Node> findAll(Node from, String label) {
        checkMember(from);
        return walk(from).filter(node -> node.label().equals(label)).toList();
    }

    public List<Node> findAll(Node from, String label, String key, String value) {
        return findAll(from, label).stream()
                                   .filter(node -> node.attribute(key).filter(value::equals).isPresent())
                                   .toList();
    }

    public int size() {
        return (int) stream().count();
    }

    /**
     * Same version, and same labels, attributes and child order at every node.
     */
    public boolean sameStructure(Tree other) {
        return version.equals(other.version) && sameNode(root, other.root);
    }

    private void checkMember(Node node) {
        var top = node;
        while (top.parent().isPresent()) {
            top = top.parent().get();
        }
        if (top != root) {
            throw new IllegalArgumentException("Node '" + node.label() + "' does not belong to this tree");
        }
    }

    private static Stream<Node> walk(Node from) {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(new PreOrder(from), Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }

    private static boolean sameNode(Node a, Node b) {
        if (!a.label().equals(b.label()) || !a.attributes().equals(b.attributes())) {
            return false;
        }
        var left = a.children();
        var right = b.children();
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!sameNode(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return TreePrinter.print(this);
    }

    private static final class PreOrder implements Iterator<Node> {
        private final ArrayDeque<Node> pending = new ArrayDeque<>();

        private PreOrder(Node root) {
            pending.push(root);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public Node next() {
            if (pending.isEmpty()) {
                throw new NoSuchElementException();
            }
            var node = pending.pop();
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
            return node;
        }
    }
}
