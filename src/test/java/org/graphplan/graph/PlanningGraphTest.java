package org.graphplan.graph;

import org.graphplan.ProblemFixtures;
import org.graphplan.graph.GraphOptions.ConnectionPolicy;
import org.graphplan.problem.Action;
import org.graphplan.problem.Literal;
import org.graphplan.problem.PlanningProblem;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Costruzione del grafo sui problemi di prova:
 * - dominio banale, azione con due precondizioni, effetti inconsistenti, bisogni concorrenti
 * - proprietà strutturali: simmetria mutex, completezza della negazione, esclusione seriale
 * - usi scorretti: ricostruzione, mutex eterogenei, limite di livelli
 */
public class PlanningGraphTest {

    private static PlanningGraph build(String fixture, GraphOptions options) {
        PlanningProblem problem = ProblemFixtures.load(fixture);
        return new PlanningGraph(problem, problem.getInitialState(), options);
    }

    private static PlanningGraph buildSerial(String fixture) {
        return build(fixture, GraphOptions.defaults());
    }

    private static PlanningGraph buildParallel(String fixture) {
        return build(fixture, GraphOptions.defaults().withSerialPlanning(false));
    }

    private static Set<Literal> literalsAt(PlanningGraph graph, int level) {
        return graph.getLiteralLevel(level).stream().map(LiteralNode::getLiteral).collect(Collectors.toSet());
    }

    //region SCENARI

    @Test
    void trivialDomain_levelsOffAfterOneStep() {
        PlanningGraph graph = buildSerial(ProblemFixtures.TRIVIAL);

        assertTrue(graph.isLeveled());
        assertEquals(2, graph.getLiteralLevelCount());
        assertEquals(1, graph.getActionLevelCount());
        assertEquals(Set.of(Literal.positive("P")), literalsAt(graph, 0));
        assertEquals(Set.of(Literal.positive("P")), literalsAt(graph, 1));

        List<ActionNode> a0 = graph.getActionLevel(0);
        assertEquals(1, a0.size());
        assertEquals(Action.NOOP_POS, a0.get(0).getAction().getName());
        assertTrue(a0.get(0).isPersistent());
        assertEquals(0, LevelSumHeuristic.levelSum(graph));
    }

    @Test
    void twoPreconditionAction_admittedOnceBothHold() {
        PlanningGraph graph = buildSerial(ProblemFixtures.TWO_PRECONDITION);

        assertEquals(Set.of(Literal.positive("P"), Literal.negative("Q"), Literal.negative("R")), literalsAt(graph, 0));
        assertNull(graph.findActionNode(0, "A", List.of()));
        assertNotNull(graph.findActionNode(0, "SetQ", List.of()));

        assertTrue(literalsAt(graph, 1).contains(Literal.positive("Q")));
        assertFalse(literalsAt(graph, 1).contains(Literal.positive("R")));

        ActionNode a = graph.findActionNode(1, "A", List.of());
        assertNotNull(a);
        assertEquals(Set.of(graph.getLiteralNode(1, Literal.positive("P")), graph.getLiteralNode(1, Literal.positive("Q"))),
                a.getParents());

        LiteralNode r = graph.getLiteralNode(2, Literal.positive("R"));
        assertNotNull(r);
        assertEquals(Set.of(a), r.getParents());
        assertTrue(a.getChildren().contains(r));

        assertEquals(2, LevelSumHeuristic.levelCost(graph, Literal.positive("R")));
        assertEquals(2, LevelSumHeuristic.levelSum(graph));
        assertTrue(graph.isLeveled());
        assertEquals(4, graph.getLiteralLevelCount());
    }

    @Test
    void everyProducingActionIsRecordedAsParent() {
        PlanningGraph graph = buildSerial(ProblemFixtures.TWO_PRECONDITION);

        LiteralNode q = graph.getLiteralNode(2, Literal.positive("Q"));
        Set<String> producers = q.getParents().stream()
                .map(node -> node.getAction().getName())
                .collect(Collectors.toSet());

        assertEquals(Set.of("SetQ", Action.NOOP_POS), producers);
    }

    @Test
    void inconsistentEffects_isTheOnlyReason() {
        PlanningGraph graph = buildParallel(ProblemFixtures.INCONSISTENT_EFFECTS);
        MutexRules rules = new MutexRules(false, graph.getOptions().getSupportCounting());

        ActionNode addX = graph.findActionNode(0, "AddX", List.of());
        ActionNode delX = graph.findActionNode(0, "DelX", List.of());

        assertTrue(addX.isMutex(delX));
        assertTrue(rules.inconsistentEffects(addX, delX));
        assertFalse(rules.serializeActions(addX, delX));
        assertFalse(rules.interference(addX, delX));
        assertFalse(rules.competingNeeds(addX, delX));
    }

    @Test
    void competingNeedsCascade() {
        PlanningGraph graph = buildParallel(ProblemFixtures.COMPETING_NEEDS);
        MutexRules rules = new MutexRules(false, graph.getOptions().getSupportCounting());

        LiteralNode x = graph.getLiteralNode(1, Literal.positive("X"));
        LiteralNode notX = graph.getLiteralNode(1, Literal.negative("X"));
        assertTrue(x.isMutex(notX));

        ActionNode a = graph.findActionNode(1, "A", List.of());
        ActionNode b = graph.findActionNode(1, "B", List.of());
        assertNotNull(a);
        assertNotNull(b);
        assertTrue(a.isMutex(b));
        assertEquals(MutexReason.COMPETING_NEEDS, rules.actionMutexReason(a, b));
    }

    //endregion

    //region PROPRIETÀ STRUTTURALI

    @Test
    void mutexIsSymmetric() {
        for (String fixture : List.of(ProblemFixtures.HAVE_CAKE, ProblemFixtures.COMPETING_NEEDS)) {
            PlanningGraph graph = buildSerial(fixture);
            for (int level = 0; level < graph.getLiteralLevelCount(); level++) {
                for (LiteralNode node : graph.getLiteralLevel(level)) {
                    for (PlanningGraphNode other : node.getMutex()) {
                        assertTrue(other.isMutex(node), fixture + ": " + node + " / " + other);
                        assertEquals(level, other.getLevel());
                    }
                }
            }
            for (int level = 0; level < graph.getActionLevelCount(); level++) {
                for (ActionNode node : graph.getActionLevel(level)) {
                    for (PlanningGraphNode other : node.getMutex()) {
                        assertTrue(other.isMutex(node), fixture + ": " + node + " / " + other);
                    }
                }
            }
        }
    }

    @Test
    void negationIsAlwaysMutex() {
        PlanningGraph graph = buildSerial(ProblemFixtures.HAVE_CAKE);

        for (int level = 1; level < graph.getLiteralLevelCount(); level++) {
            for (LiteralNode node : graph.getLiteralLevel(level)) {
                LiteralNode opposite = graph.getLiteralNode(level, node.getLiteral().negate());
                if (opposite != null) {
                    assertTrue(node.isMutex(opposite), "S" + level + ": " + node);
                }
            }
        }
    }

    @Test
    void initialLevelHasNoMutex() {
        PlanningGraph graph = buildSerial(ProblemFixtures.HAVE_CAKE);

        for (LiteralNode node : graph.getLiteralLevel(0)) {
            assertTrue(node.getMutex().isEmpty());
            assertTrue(node.getParents().isEmpty());
        }
    }

    @Test
    void serialPlanning_excludesEveryPairOfRealActions() {
        PlanningGraph graph = buildSerial(ProblemFixtures.HAVE_CAKE);

        ActionNode eat = graph.findActionNode(1, "Eat", List.of("Cake"));
        ActionNode bake = graph.findActionNode(1, "Bake", List.of("Cake"));
        assertNotNull(eat);
        assertNotNull(bake);
        assertTrue(eat.isMutex(bake));

        for (int level = 0; level < graph.getActionLevelCount(); level++) {
            List<ActionNode> actions = graph.getActionLevel(level);
            for (ActionNode first : actions) {
                for (ActionNode second : actions) {
                    if (first != second && !first.isPersistent() && !second.isPersistent()) {
                        assertTrue(first.isMutex(second), first + " / " + second);
                    }
                }
            }
        }
    }

    @Test
    void everyLiteralLevelContainsThePreviousOne() {
        PlanningGraph graph = buildSerial(ProblemFixtures.HAVE_CAKE);

        for (int level = 1; level < graph.getLiteralLevelCount(); level++) {
            assertTrue(literalsAt(graph, level).containsAll(literalsAt(graph, level - 1)));
        }
        int last = graph.getLiteralLevelCount() - 1;
        assertEquals(literalsAt(graph, last - 1), literalsAt(graph, last));
    }

    @Test
    void allLiteralsPolicy_connectsEveryLiteral() {
        PlanningGraph graph = build(ProblemFixtures.HAVE_CAKE,
                GraphOptions.defaults().withConnectionPolicy(ConnectionPolicy.ALL_LITERALS));

        ActionNode eat = graph.findActionNode(0, "Eat", List.of("Cake"));
        assertEquals(graph.getLiteralLevel(0).size(), eat.getParents().size());

        PlanningGraph restricted = buildSerial(ProblemFixtures.HAVE_CAKE);
        assertEquals(1, restricted.findActionNode(0, "Eat", List.of("Cake")).getParents().size());
    }

    @Test
    void statisticsMatchTheLevels() {
        PlanningGraph graph = buildSerial(ProblemFixtures.HAVE_CAKE);
        GraphStatistics stats = graph.getStatistics();

        assertEquals(graph.getLiteralLevelCount(), stats.getLiteralNodesPerLevel().size());
        assertEquals(graph.getActionLevelCount(), stats.getActionNodesPerLevel().size());
        for (int level = 0; level < graph.getActionLevelCount(); level++) {
            assertEquals(graph.getActionLevel(level).size(), stats.getActionNodesPerLevel().get(level));
        }
        assertTrue(stats.getMutexCount(MutexReason.SERIAL) > 0);
        assertTrue(stats.getMutexCount(MutexReason.NEGATION) > 0);
        assertTrue(stats.toCompactString().startsWith("Stats[S:" + graph.getLiteralLevelCount()));
    }

    //endregion

    //region USI SCORRETTI

    @Test
    void rebuild_isRejected() {
        PlanningGraph graph = buildSerial(ProblemFixtures.TRIVIAL);

        assertThrows(IllegalStateException.class, graph::createGraph);
    }

    @Test
    void mutexBetweenDifferentNodeTypes_isRejected() {
        PlanningGraph graph = buildSerial(ProblemFixtures.TRIVIAL);
        LiteralNode p = graph.getLiteralLevel(0).get(0);
        ActionNode noop = graph.getActionLevel(0).get(0);

        assertThrows(IllegalArgumentException.class, () -> PlanningGraphNode.mutexify(p, noop));
    }

    @Test
    void mutexAcrossLevels_isRejected() {
        PlanningGraph graph = buildSerial(ProblemFixtures.TRIVIAL);
        LiteralNode s0 = graph.getLiteralLevel(0).get(0);
        LiteralNode s1 = graph.getLiteralLevel(1).get(0);

        assertThrows(IllegalArgumentException.class, () -> PlanningGraphNode.mutexify(s0, s1));
    }

    @Test
    void levelBound_reportsGraphNotLeveled() {
        PlanningProblem problem = ProblemFixtures.load(ProblemFixtures.TWO_PRECONDITION);

        GraphNotLeveledException e = assertThrows(GraphNotLeveledException.class,
                () -> new PlanningGraph(problem, problem.getInitialState(), GraphOptions.defaults().withMaxLevels(1)));
        assertEquals(1, e.getLevels());

        PlanningGraph bounded = new PlanningGraph(problem, problem.getInitialState(),
                GraphOptions.defaults().withMaxLevels(3));
        assertTrue(bounded.isLeveled());
    }

    @Test
    void invalidState_isRejected() {
        PlanningProblem problem = ProblemFixtures.load(ProblemFixtures.TWO_PRECONDITION);

        assertThrows(IllegalArgumentException.class, () -> new PlanningGraph(problem, "TF", true));
    }

    //endregion
}
