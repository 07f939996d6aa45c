package org.graphplan.graph;

import org.graphplan.problem.Action;
import org.graphplan.problem.Literal;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * NODO AZIONE (livello A) - Azione ground, di dominio o di persistenza, a un dato livello
 *
 * Alla costruzione il nodo precalcola:
 * • letterali precondizione: forma letterale di precondizioni positive e negative
 *   (possibili genitori nel livello S precedente)
 * • letterali effetto: forma letterale di effetti di aggiunta e di rimozione
 *   (possibili figli nel livello S successivo)
 * • persistenza: true se precondizioni ed effetti coincidono (azione no-op)
 *
 * Identità strutturale: (nome, argomenti, persistenza).
 */
public final class ActionNode extends PlanningGraphNode {

    private final Action action;
    private final Set<Literal> preconditionLiterals;
    private final Set<Literal> effectLiterals;
    private final boolean persistent;

    private final Set<LiteralNode> parents = new LinkedHashSet<>();
    private final Set<LiteralNode> children = new LinkedHashSet<>();

    public ActionNode(Action action, int level) {
        super(level);
        if (action == null) {
            throw new IllegalArgumentException("Azione del nodo non può essere null");
        }
        this.action = action;
        this.preconditionLiterals = Collections.unmodifiableSet(
                toLiterals(action.getPrecondPos(), action.getPrecondNeg()));
        this.effectLiterals = Collections.unmodifiableSet(
                toLiterals(action.getEffectAdd(), action.getEffectRem()));
        this.persistent = preconditionLiterals.equals(effectLiterals);
    }

    private static Set<Literal> toLiterals(Iterable<String> positives, Iterable<String> negatives) {
        Set<Literal> literals = new LinkedHashSet<>();
        for (String fluent : positives) {
            literals.add(Literal.positive(fluent));
        }
        for (String fluent : negatives) {
            literals.add(Literal.negative(fluent));
        }
        return literals;
    }

    public Action getAction() {
        return action;
    }

    /** @return letterali richiesti dall'azione (possibili genitori) */
    public Set<Literal> getPreconditionLiterals() {
        return preconditionLiterals;
    }

    /** @return letterali prodotti dall'azione (possibili figli) */
    public Set<Literal> getEffectLiterals() {
        return effectLiterals;
    }

    /** @return true se l'azione è di persistenza (no-op) */
    public boolean isPersistent() {
        return persistent;
    }

    void addParent(LiteralNode literal) {
        parents.add(literal);
    }

    void addChild(LiteralNode literal) {
        children.add(literal);
    }

    @Override
    public Set<LiteralNode> getParents() {
        return Collections.unmodifiableSet(parents);
    }

    @Override
    public Set<LiteralNode> getChildren() {
        return Collections.unmodifiableSet(children);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ActionNode)) return false;
        ActionNode other = (ActionNode) obj;
        return persistent == other.persistent
                && action.getName().equals(other.action.getName())
                && action.getArgs().equals(other.action.getArgs());
    }

    @Override
    public int hashCode() {
        return Objects.hash(action.getName(), action.getArgs());
    }

    @Override
    public String toString() {
        return action.toString();
    }
}
