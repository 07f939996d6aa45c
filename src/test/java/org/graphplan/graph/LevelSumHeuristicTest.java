package org.graphplan.graph;

import org.graphplan.ProblemFixtures;
import org.graphplan.graph.GraphOptions.GoalMatching;
import org.graphplan.problem.Literal;
import org.graphplan.problem.PlanningProblem;
import org.graphplan.problem.ProblemLoader;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LevelSumHeuristicTest {

    private static final String UNREACHABLE =
            "problem Unreachable\n"
                    + "fluents: P, Z\n"
                    + "init: P\n"
                    + "goal: P, Z\n"
                    + "action Keep\n"
                    + "  pre: P\n"
                    + "  eff: P\n";

    private static final String NEGATIVE_GOAL =
            "problem NegativeGoal\n"
                    + "fluents: Have(Cake), Eaten(Cake)\n"
                    + "init: Have(Cake)\n"
                    + "goal: ~Have(Cake)\n"
                    + "action Eat(Cake)\n"
                    + "  pre: Have(Cake)\n"
                    + "  eff: ~Have(Cake), Eaten(Cake)\n";

    private static PlanningGraph graph(PlanningProblem problem, GraphOptions options) {
        return new PlanningGraph(problem, problem.getInitialState(), options);
    }

    @Test
    void goalsAtInitialLevelCostNothing() {
        PlanningProblem problem = ProblemFixtures.load(ProblemFixtures.HAVE_CAKE);
        PlanningGraph graph = graph(problem, GraphOptions.defaults());

        assertEquals(0, LevelSumHeuristic.levelCost(graph, Literal.positive("Have(Cake)")));
        assertEquals(1, LevelSumHeuristic.levelCost(graph, Literal.positive("Eaten(Cake)")));
        assertEquals(1, LevelSumHeuristic.levelSum(graph));
    }

    @Test
    void symbolOnlyMatching_acceptsOppositePolarity() {
        PlanningProblem problem = ProblemFixtures.load(ProblemFixtures.HAVE_CAKE);
        PlanningGraph graph = graph(problem, GraphOptions.defaults().withGoalMatching(GoalMatching.SYMBOL_ONLY));

        // ~Eaten(Cake) è già in S0
        assertEquals(0, LevelSumHeuristic.levelSum(graph));
    }

    @Test
    void negativeGoal_matchedByPolarity() {
        PlanningProblem problem = ProblemLoader.fromString(NEGATIVE_GOAL);
        PlanningGraph graph = graph(problem, GraphOptions.defaults());

        assertEquals(1, LevelSumHeuristic.levelSum(graph));
    }

    @Test
    void unreachableGoal_contributesNothing() {
        PlanningProblem problem = ProblemLoader.fromString(UNREACHABLE);
        PlanningGraph graph = graph(problem, GraphOptions.defaults());

        assertEquals(-1, LevelSumHeuristic.levelCost(graph, Literal.positive("Z")));
        assertEquals(0, LevelSumHeuristic.levelSum(graph));
    }

    @Test
    void repeatedEvaluation_isStable() {
        PlanningProblem problem = ProblemFixtures.load(ProblemFixtures.TWO_PRECONDITION);
        PlanningGraph graph = graph(problem, GraphOptions.defaults());

        int first = LevelSumHeuristic.levelSum(graph);
        assertEquals(first, LevelSumHeuristic.levelSum(graph));
        assertTrue(first >= 0);
    }

    @Test
    void heuristicFromDifferentStates() {
        PlanningProblem problem = ProblemFixtures.load(ProblemFixtures.TWO_PRECONDITION);

        assertEquals(2, problem.levelSumHeuristic("TFF"));
        assertEquals(1, problem.levelSumHeuristic("TTF"));
        assertEquals(0, problem.levelSumHeuristic("FFT"));
    }
}
