package org.graphplan.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * STATISTICHE DEL GRAFO - Metriche raccolte durante la costruzione a livelli
 *
 * METRICHE:
 * • nodi letterale per livello S e nodi azione per livello A
 * • coppie mutex per livello, separate fra livelli S e A
 * • coppie mutex per regola che le ha generate
 * • tempo di costruzione in millisecondi
 */
public class GraphStatistics {

    //region CONTATORI

    private final List<Integer> literalNodesPerLevel = new ArrayList<>();
    private final List<Integer> actionNodesPerLevel = new ArrayList<>();
    private final List<Integer> literalMutexPerLevel = new ArrayList<>();
    private final List<Integer> actionMutexPerLevel = new ArrayList<>();
    private final Map<MutexReason, Integer> mutexByReason = new EnumMap<>(MutexReason.class);

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    /**
     * Inizializza le statistiche avviando il timer di costruzione.
     */
    public GraphStatistics() {
        this.startTime = System.currentTimeMillis();
        for (MutexReason reason : MutexReason.values()) {
            mutexByReason.put(reason, 0);
        }
    }

    //region REGISTRAZIONE

    synchronized void recordLiteralLevel(int nodes, int mutexPairs) {
        literalNodesPerLevel.add(nodes);
        literalMutexPerLevel.add(mutexPairs);
    }

    synchronized void recordActionLevel(int nodes, int mutexPairs) {
        actionNodesPerLevel.add(nodes);
        actionMutexPerLevel.add(mutexPairs);
    }

    synchronized void recordMutex(MutexReason reason) {
        mutexByReason.merge(reason, 1, Integer::sum);
    }

    /**
     * Ferma il timer. Operazione idempotente.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSORS

    public List<Integer> getLiteralNodesPerLevel() {
        return Collections.unmodifiableList(literalNodesPerLevel);
    }

    public List<Integer> getActionNodesPerLevel() {
        return Collections.unmodifiableList(actionNodesPerLevel);
    }

    public List<Integer> getLiteralMutexPerLevel() {
        return Collections.unmodifiableList(literalMutexPerLevel);
    }

    public List<Integer> getActionMutexPerLevel() {
        return Collections.unmodifiableList(actionMutexPerLevel);
    }

    /** @return coppie mutex generate dalla regola indicata */
    public int getMutexCount(MutexReason reason) {
        return mutexByReason.get(reason);
    }

    /** @return tempo di costruzione (parziale se il timer non è fermato) */
    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    //endregion

    //region OUTPUT

    /**
     * Report multilinea con dettaglio per livello e per regola.
     */
    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();

        output.append("===========================[ PLANNING GRAPH: LEVEL STATS ]===========================\n");
        for (int i = 0; i < literalNodesPerLevel.size(); i++) {
            output.append(String.format("    S%-3d letterali: %5d   mutex: %6d%n",
                    i, literalNodesPerLevel.get(i), literalMutexPerLevel.get(i)));
            if (i < actionNodesPerLevel.size()) {
                output.append(String.format("    A%-3d azioni:    %5d   mutex: %6d%n",
                        i, actionNodesPerLevel.get(i), actionMutexPerLevel.get(i)));
            }
        }
        output.append("=================================[ MUTEX STATS ]=====================================\n");
        for (MutexReason reason : MutexReason.values()) {
            output.append(String.format("    %-22s %s %d%n", reason,
                    reason.isActionRule() ? "(A)" : "(S)", mutexByReason.get(reason)));
        }
        output.append("    Tempo: ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=====================================================================================\n");

        return output.toString();
    }

    /**
     * Riepilogo su singola linea per logging.
     */
    public String toCompactString() {
        int actionMutex = 0;
        int literalMutex = 0;
        for (Map.Entry<MutexReason, Integer> entry : mutexByReason.entrySet()) {
            if (entry.getKey().isActionRule()) {
                actionMutex += entry.getValue();
            } else {
                literalMutex += entry.getValue();
            }
        }
        return String.format("Stats[S:%d, A:%d, MutexA:%d, MutexS:%d, Time:%dms]",
                literalNodesPerLevel.size(), actionNodesPerLevel.size(),
                actionMutex, literalMutex, getExecutionTimeMs());
    }

    //endregion
}
