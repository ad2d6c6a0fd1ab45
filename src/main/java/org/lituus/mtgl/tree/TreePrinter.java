package org.lituus.mtgl.tree;

import java.util.stream.Collectors;

/**
 * Box-drawing rendering of a tree, one node per line.
 *
 * <pre>
 * card[name=Dark Ritual]
 * └─ line[index=1, text=Add {B}{B}{B}.]
 *    └─ action[action=add]
 *       └─ mana[mana={B}{B}{B}]
 * </pre>
 */
public final class TreePrinter {
    private TreePrinter() {}

    public static String print(Tree tree) {
        return print(tree.root());
    }

    public static String print(Node root) {
        var sb = new StringBuilder();
        sb.append(describe(root)).append('\n');
        var children = root.children();
        for (int i = 0; i < children.size(); i++) {
            printChild(sb, children.get(i), "", i == children.size() - 1);
        }
        return sb.toString();
    }

    private static void printChild(StringBuilder sb, Node node, String indent, boolean last) {
        sb.append(indent).append(last ? "└─ " : "├─ ").append(describe(node)).append('\n');
        var childIndent = indent + (last ? "   " : "│  ");
        var children = node.children();
        for (int i = 0; i < children.size(); i++) {
            printChild(sb, children.get(i), childIndent, i == children.size() - 1);
        }
    }

    private static String describe(Node node) {
        if (node.attributes().isEmpty()) {
            return node.label();
        }
        return node.attributes()
                   .entrySet()
                   .stream()
                   .map(e -> e.getKey() + "=" + e.getValue())
                   .collect(Collectors.joining(", ", node.label() + "[", "]"));
    }
}
