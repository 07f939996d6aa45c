package org.graphplan.graph;

import org.graphplan.graph.GraphOptions.GoalMatching;
import org.graphplan.problem.Literal;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * EURISTICA LEVEL-SUM - Somma dei livelli di prima comparsa dei letterali obiettivo
 *
 * Per ogni obiettivo distinto si scandiscono i livelli S dal primo in avanti e si somma
 * l'indice del primo livello che contiene un nodo corrispondente. Un obiettivo mai
 * raggiunto non contribuisce alla somma.
 *
 * Il confronto fra obiettivo e nodo segue {@link GoalMatching} delle opzioni del grafo.
 * Le funzioni leggono soltanto il grafo e possono essere invocate più volte.
 */
public final class LevelSumHeuristic {

    private LevelSumHeuristic() {
        throw new UnsupportedOperationException("Classe di utilità - non istanziabile");
    }

    /**
     * @param graph grafo livellato
     * @return somma non negativa dei costi di livello degli obiettivi raggiungibili
     */
    public static int levelSum(PlanningGraph graph) {
        Set<Literal> goals = new LinkedHashSet<>(graph.getProblem().getGoal());
        int sum = 0;
        for (Literal goal : goals) {
            int cost = levelCost(graph, goal);
            if (cost > 0) {
                sum += cost;
            }
        }
        return sum;
    }

    /**
     * @param graph grafo livellato
     * @param goal letterale obiettivo
     * @return indice del primo livello S che contiene l'obiettivo, -1 se non compare mai
     */
    public static int levelCost(PlanningGraph graph, Literal goal) {
        GoalMatching matching = graph.getOptions().getGoalMatching();
        for (int level = 0; level < graph.getLiteralLevelCount(); level++) {
            for (LiteralNode node : graph.getLiteralLevel(level)) {
                if (matches(node, goal, matching)) {
                    return level;
                }
            }
        }
        return -1;
    }

    private static boolean matches(LiteralNode node, Literal goal, GoalMatching matching) {
        if (!node.getSymbol().equals(goal.getSymbol())) {
            return false;
        }
        return matching == GoalMatching.SYMBOL_ONLY || node.isPositive() == goal.isPositive();
    }
}
