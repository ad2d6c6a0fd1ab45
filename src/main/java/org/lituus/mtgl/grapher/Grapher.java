package org.lituus.mtgl.grapher;

import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.error.MtglException;
import org.lituus.mtgl.parser.Clause;
import org.lituus.mtgl.parser.ClauseKind;
import org.lituus.mtgl.tree.Node;
import org.lituus.mtgl.tree.Tree;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the frozen tree of a card from its parsed clauses.
 *
 * <pre>
 * card[name, catalog-version, grammar-version]
 * ├─ line[index, text]
 * │  └─ trigger[...]
 * │     ├─ condition
 * │     └─ effect
 * └─ line[index, text]
 *    └─ static
 *       └─ action[...]
 * </pre>
 *
 * <p>A line whose first clause gives it no shape of its own (ability word, keyword line, modal, mode, chapter,
 * level, activated or triggered) is wrapped in a {@code spell} node on instants and sorceries and in a
 * {@code static} node otherwise.
 */
public final class Grapher {
    public static final String CARD = "card";
    public static final String LINE = "line";
    public static final String CARD_HALF = "card-half";

    private Grapher() {}

    public static Grapher create() {
        return new Grapher();
    }

    /**
     * @throws MtglException with a {@link MtglError.StructuralError} when one clause instance is reachable twice
     */
    public Tree graph(CardClauses card) {
        var attributes = new LinkedHashMap<String, String>();
        attributes.put("name", card.name());
        attributes.put("catalog-version", card.catalogVersion());
        attributes.put("grammar-version", card.grammarVersion());
        var root = Node.create(CARD, attributes);

        Set<Clause> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (var line : card.lines()) {
            var lineAttributes = new LinkedHashMap<String, String>();
            lineAttributes.put("index", String.valueOf(line.index()));
            lineAttributes.put("text", line.text());
            var lineNode = Node.create(LINE, lineAttributes);
            var parent = lineNode;
            var ability = abilityNode(card, line);
            if (ability.isPresent()) {
                lineNode.addChild(ability.get());
                parent = ability.get();
            }
            for (var clause : line.clauses()) {
                parent.addChild(toNode(card, line, clause, visited));
            }
            root.addChild(lineNode);
        }
        return Tree.of(root, card.versionTag());
    }

    /**
     * Join the two faces of a split or double-faced card under one root.
     *
     * @throws IllegalArgumentException when the faces were built with different versions
     */
    public Tree fuse(String name, Tree sideA, Tree sideB) {
        if (!sideA.version().equals(sideB.version())) {
            throw new IllegalArgumentException("Cannot fuse trees of versions " + sideA.version()
                                               + " and " + sideB.version());
        }
        var attributes = new LinkedHashMap<>(sideA.root().attributes());
        attributes.put("name", name);
        var root = Node.create(CARD, attributes);
        root.addChild(half("a", sideA));
        root.addChild(half("b", sideB));
        return Tree.of(root, sideA.version());
    }

    private static Node half(String side, Tree tree) {
        var attributes = new LinkedHashMap<String, String>();
        attributes.put("side", side);
        tree.root()
            .attribute("name")
            .ifPresent(n -> attributes.put("name", n));
        var half = Node.create(CARD_HALF, attributes);
        for (var child : tree.root().children()) {
            half.addChild(child.deepCopy());
        }
        return half;
    }

    private static Optional<Node> abilityNode(CardClauses card, CardClauses.Line line) {
        if (line.clauses().isEmpty() || line.clauses().get(0).kind().isLineShape()) {
            return Optional.empty();
        }
        var kind = card.spell() ? ClauseKind.SPELL : ClauseKind.STATIC;
        return Optional.of(Node.create(kind.label()));
    }

    private Node toNode(CardClauses card, CardClauses.Line line, Clause clause, Set<Clause> visited) {
        if (!visited.add(clause)) {
            throw new MtglException(new MtglError.StructuralError(card.name(),
                                                                  line.index(),
                                                                  clause.kind().label(),
                                                                  clause.span(),
                                                                  "Clause reachable twice"));
        }
        var node = Node.create(clause.kind().label(), clause.attributes());
        for (var child : clause.children()) {
            node.addChild(toNode(card, line, child, visited));
        }
        return node;
    }
}
