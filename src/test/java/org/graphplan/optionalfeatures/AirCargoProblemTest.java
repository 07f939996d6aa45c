package org.graphplan.optionalfeatures;

import org.graphplan.graph.GraphOptions;
import org.graphplan.graph.LevelSumHeuristic;
import org.graphplan.graph.PlanningGraph;
import org.graphplan.problem.Literal;
import org.graphplan.problem.PlanningProblem;
import org.graphplan.problem.ProblemLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AirCargoProblemTest {

    @TempDir
    Path outputDir;

    @Test
    void generatedFiles_parseWithExpectedSize() throws IOException {
        AirCargoProblem generator = new AirCargoProblem();
        generator.setOutputDirectory(outputDir.toString());
        generator.generateInstances(3);

        assertEquals(3, generator.getGeneratedInstancesCount());
        for (int k = 1; k <= 3; k++) {
            Path file = outputDir.resolve("AIRCARGO").resolve("aircargo_" + k + ".plan");
            assertTrue(Files.exists(file), file.toString());

            PlanningProblem problem = ProblemLoader.fromFile(file);
            assertEquals("AirCargo" + k, problem.getName());
            assertEquals(3 * k * k, problem.getStateMap().size());
            assertEquals(AirCargoProblem.countGroundActions(k), problem.getActions().size());
            assertEquals(k, problem.getGoal().size());
        }
    }

    @Test
    void singleCargoInstance_goalAlreadyHolds() {
        PlanningProblem problem = ProblemLoader.fromString(AirCargoProblem.buildDefinition(1));

        assertEquals(List.of(Literal.positive("At(C1,A1)")), problem.getGoal());
        assertEquals(0, problem.levelSumHeuristic(problem.getInitialState()));
    }

    @Test
    void twoCargoInstance_levelsOffWithPositiveEstimate() {
        PlanningProblem problem = ProblemLoader.fromString(AirCargoProblem.buildDefinition(2));
        PlanningGraph graph = new PlanningGraph(problem, problem.getInitialState(), GraphOptions.defaults());

        assertTrue(graph.isLeveled());
        // Load e Fly in A0, Unload in A1: la merce arriva a destinazione in S2
        assertEquals(2, LevelSumHeuristic.levelCost(graph, Literal.positive("At(C1,A2)")));
        assertEquals(4, LevelSumHeuristic.levelSum(graph));
    }

    @Test
    void invalidRequests_areRejected() {
        AirCargoProblem generator = new AirCargoProblem();

        assertThrows(IllegalStateException.class, () -> generator.generateInstances(1));
        assertThrows(IllegalArgumentException.class, () -> generator.setOutputDirectory(" "));

        generator.setOutputDirectory(outputDir.toString());
        assertThrows(IllegalArgumentException.class, () -> generator.generateInstances(0));
        assertThrows(IllegalArgumentException.class,
                () -> generator.generateInstances(AirCargoProblem.MAX_INSTANCES + 1));
    }
}
