package org.graphplan.graph;

import org.graphplan.problem.Literal;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * NODO LETTERALE (livello S) - Fluente con polarità a un dato livello del grafo
 *
 * Genitori: azioni del livello A precedente che possono produrre il letterale.
 * Figli: azioni del livello A successivo collegate al letterale.
 * Identità strutturale: due nodi letterale sono uguali se simbolo e polarità coincidono.
 */
public final class LiteralNode extends PlanningGraphNode {

    private final Literal literal;
    private final Set<ActionNode> parents = new LinkedHashSet<>();
    private final Set<ActionNode> children = new LinkedHashSet<>();

    public LiteralNode(Literal literal, int level) {
        super(level);
        if (literal == null) {
            throw new IllegalArgumentException("Letterale del nodo non può essere null");
        }
        this.literal = literal;
    }

    public Literal getLiteral() {
        return literal;
    }

    public String getSymbol() {
        return literal.getSymbol();
    }

    public boolean isPositive() {
        return literal.isPositive();
    }

    void addParent(ActionNode action) {
        parents.add(action);
    }

    void addChild(ActionNode action) {
        children.add(action);
    }

    @Override
    public Set<ActionNode> getParents() {
        return Collections.unmodifiableSet(parents);
    }

    @Override
    public Set<ActionNode> getChildren() {
        return Collections.unmodifiableSet(children);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LiteralNode)) return false;
        return literal.equals(((LiteralNode) obj).literal);
    }

    @Override
    public int hashCode() {
        return literal.hashCode();
    }

    @Override
    public String toString() {
        return literal.toString();
    }
}
