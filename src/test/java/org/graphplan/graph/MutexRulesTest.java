package org.graphplan.graph;

import org.graphplan.graph.GraphOptions.SupportCounting;
import org.graphplan.problem.Action;
import org.graphplan.problem.Literal;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Regole mutex valutate su nodi costruiti a mano:
 * - esclusione seriale solo fra azioni non di persistenza
 * - effetti inconsistenti e interferenza in entrambe le direzioni
 * - bisogni concorrenti dai genitori mutex
 * - negazione e supporto inconsistente con le due formule di conteggio
 */
public class MutexRulesTest {

    private static final MutexRules SERIAL = new MutexRules(true, SupportCounting.REFERENCE);
    private static final MutexRules PARALLEL = new MutexRules(false, SupportCounting.REFERENCE);
    private static final MutexRules ALL_PAIRS = new MutexRules(false, SupportCounting.ALL_PAIRS);

    private static ActionNode action(String name, List<String> pre, List<String> add, List<String> rem) {
        return new ActionNode(new Action(name, List.of(), pre, List.of(), add, rem), 0);
    }

    private static LiteralNode literal(Literal literal, int level) {
        return new LiteralNode(literal, level);
    }

    @Test
    void serialExclusion_onlyBetweenRealActions() {
        ActionNode go = action("Go", List.of(), List.of("X"), List.of());
        ActionNode stay = action("Stay", List.of(), List.of("Y"), List.of());
        ActionNode noop = new ActionNode(Action.positiveNoop("X"), 0);

        assertTrue(noop.isPersistent());
        assertTrue(SERIAL.serializeActions(go, stay));
        assertFalse(SERIAL.serializeActions(go, noop));
        assertFalse(PARALLEL.serializeActions(go, stay));
        assertEquals(MutexReason.SERIAL, SERIAL.actionMutexReason(go, stay));
        assertNull(PARALLEL.actionMutexReason(go, stay));
    }

    @Test
    void inconsistentEffects_bothDirections() {
        ActionNode add = action("Add", List.of(), List.of("X"), List.of());
        ActionNode del = action("Del", List.of(), List.of(), List.of("X"));

        assertTrue(PARALLEL.inconsistentEffects(add, del));
        assertTrue(PARALLEL.inconsistentEffects(del, add));
        assertFalse(PARALLEL.interference(add, del));
        assertEquals(MutexReason.INCONSISTENT_EFFECTS, PARALLEL.actionMutexReason(del, add));
    }

    @Test
    void interference_removesOtherPrecondition() {
        ActionNode user = action("Use", List.of("P"), List.of("Y"), List.of());
        ActionNode breaker = action("Break", List.of(), List.of(), List.of("P"));

        assertTrue(PARALLEL.interference(user, breaker));
        assertTrue(PARALLEL.interference(breaker, user));
        assertFalse(PARALLEL.inconsistentEffects(user, breaker));
        assertEquals(MutexReason.INTERFERENCE, PARALLEL.actionMutexReason(user, breaker));
    }

    @Test
    void competingNeeds_fromMutexParents() {
        LiteralNode x = literal(Literal.positive("X"), 0);
        LiteralNode notX = literal(Literal.negative("X"), 0);
        PlanningGraphNode.mutexify(x, notX);

        ActionNode a = action("A", List.of("X"), List.of("D1"), List.of());
        ActionNode b = new ActionNode(new Action("B", List.of(), List.of(), List.of("X"), List.of("D2"), List.of()), 0);
        a.addParent(x);
        b.addParent(notX);

        assertTrue(PARALLEL.competingNeeds(a, b));
        assertEquals(MutexReason.COMPETING_NEEDS, PARALLEL.actionMutexReason(a, b));
    }

    @Test
    void negation_sameSymbolOppositePolarity() {
        LiteralNode x = literal(Literal.positive("X"), 1);
        LiteralNode notX = literal(Literal.negative("X"), 1);
        LiteralNode y = literal(Literal.positive("Y"), 1);

        assertTrue(PARALLEL.negation(x, notX));
        assertFalse(PARALLEL.negation(x, y));
        assertEquals(MutexReason.NEGATION, PARALLEL.literalMutexReason(notX, x));
    }

    @Test
    void inconsistentSupport_emptyFirstParentSet() {
        LiteralNode orphan = literal(Literal.positive("X"), 1);
        LiteralNode other = literal(Literal.positive("Y"), 1);
        other.addParent(action("Make", List.of(), List.of("Y"), List.of()));

        assertTrue(PARALLEL.inconsistentSupport(orphan, other));
        assertFalse(ALL_PAIRS.inconsistentSupport(orphan, other));
    }

    @Test
    void inconsistentSupport_countingFormulasDiffer() {
        ActionNode a1 = action("A1", List.of(), List.of("X"), List.of());
        ActionNode a2 = action("A2", List.of(), List.of("Y"), List.of());
        ActionNode a3 = action("A3", List.of(), List.of("Y"), List.of());
        PlanningGraphNode.mutexify(a1, a2);
        PlanningGraphNode.mutexify(a1, a3);

        LiteralNode x = literal(Literal.positive("X"), 1);
        LiteralNode y = literal(Literal.positive("Y"), 1);
        x.addParent(a1);
        y.addParent(a2);
        y.addParent(a3);

        // 2 coppie mutex contro 1 produttore di X
        assertFalse(PARALLEL.inconsistentSupport(x, y));
        assertTrue(ALL_PAIRS.inconsistentSupport(x, y));
    }

    @Test
    void inconsistentSupport_compatibleProducers() {
        ActionNode a1 = action("A1", List.of(), List.of("X"), List.of());
        ActionNode a2 = action("A2", List.of(), List.of("Y"), List.of());
        LiteralNode x = literal(Literal.positive("X"), 1);
        LiteralNode y = literal(Literal.positive("Y"), 1);
        x.addParent(a1);
        y.addParent(a2);

        assertFalse(PARALLEL.inconsistentSupport(x, y));
        assertFalse(ALL_PAIRS.inconsistentSupport(x, y));
        assertNull(PARALLEL.literalMutexReason(x, y));
    }

    @Test
    void nullSupportCounting_isError() {
        assertThrows(IllegalArgumentException.class, () -> new MutexRules(true, null));
    }
}
