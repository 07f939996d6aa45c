package org.graphplan.graph;

/**
 * OPZIONI DI COSTRUZIONE DEL GRAFO - Configurazione immutabile
 *
 * VALORI PREDEFINITI:
 * • pianificazione seriale attiva
 * • azioni collegate solo ai letterali precondizione
 * • supporto inconsistente con il conteggio di riferimento
 * • obiettivi confrontati per simbolo e polarità
 * • nessun limite al numero di livelli (0)
 * • valutazione mutex sequenziale
 *
 * Ogni metodo with... restituisce una nuova istanza.
 */
public final class GraphOptions {

    /** Thread predefiniti per la valutazione parallela dei mutex */
    public static final int DEFAULT_MUTEX_THREADS = Math.max(2, Runtime.getRuntime().availableProcessors());

    /**
     * Collegamento fra un nodo azione ammesso e il livello S che lo precede.
     */
    public enum ConnectionPolicy {
        /** Comportamento di riferimento: l'azione diventa figlia di ogni letterale del livello */
        ALL_LITERALS,
        /** L'azione diventa figlia solo dei letterali che compaiono fra le sue precondizioni */
        PRECONDITIONS_ONLY
    }

    /**
     * Formula usata dalla regola del supporto inconsistente.
     */
    public enum SupportCounting {
        /** Mutex se il numero di coppie mutex fra produttori è pari ai produttori del primo letterale */
        REFERENCE,
        /** Mutex se ogni coppia di produttori (entrambi gli insiemi non vuoti) è mutex */
        ALL_PAIRS
    }

    /**
     * Confronto fra letterali obiettivo e nodi letterale nell'euristica level-sum.
     */
    public enum GoalMatching {
        /** Solo simbolo, polarità ignorata (comportamento di riferimento) */
        SYMBOL_ONLY,
        /** Simbolo e polarità */
        SYMBOL_AND_POLARITY
    }

    private final boolean serialPlanning;
    private final ConnectionPolicy connectionPolicy;
    private final SupportCounting supportCounting;
    private final GoalMatching goalMatching;
    private final int maxLevels;
    private final boolean parallelMutex;
    private final int mutexThreads;

    private GraphOptions(boolean serialPlanning, ConnectionPolicy connectionPolicy,
                         SupportCounting supportCounting, GoalMatching goalMatching,
                         int maxLevels, boolean parallelMutex, int mutexThreads) {
        if (connectionPolicy == null || supportCounting == null || goalMatching == null) {
            throw new IllegalArgumentException("Politiche del grafo non possono essere null");
        }
        if (maxLevels < 0) {
            throw new IllegalArgumentException("Limite livelli non può essere negativo: " + maxLevels);
        }
        if (mutexThreads < 1) {
            throw new IllegalArgumentException("Numero thread mutex deve essere >= 1, ricevuto: " + mutexThreads);
        }
        this.serialPlanning = serialPlanning;
        this.connectionPolicy = connectionPolicy;
        this.supportCounting = supportCounting;
        this.goalMatching = goalMatching;
        this.maxLevels = maxLevels;
        this.parallelMutex = parallelMutex;
        this.mutexThreads = mutexThreads;
    }

    /**
     * @return opzioni predefinite (pianificazione seriale)
     */
    public static GraphOptions defaults() {
        return new GraphOptions(true, ConnectionPolicy.PRECONDITIONS_ONLY, SupportCounting.REFERENCE,
                GoalMatching.SYMBOL_AND_POLARITY, 0, false, DEFAULT_MUTEX_THREADS);
    }

    public GraphOptions withSerialPlanning(boolean serial) {
        return new GraphOptions(serial, connectionPolicy, supportCounting, goalMatching,
                maxLevels, parallelMutex, mutexThreads);
    }

    public GraphOptions withConnectionPolicy(ConnectionPolicy policy) {
        return new GraphOptions(serialPlanning, policy, supportCounting, goalMatching,
                maxLevels, parallelMutex, mutexThreads);
    }

    public GraphOptions withSupportCounting(SupportCounting counting) {
        return new GraphOptions(serialPlanning, connectionPolicy, counting, goalMatching,
                maxLevels, parallelMutex, mutexThreads);
    }

    public GraphOptions withGoalMatching(GoalMatching matching) {
        return new GraphOptions(serialPlanning, connectionPolicy, supportCounting, matching,
                maxLevels, parallelMutex, mutexThreads);
    }

    /**
     * @param levels numero massimo di livelli azione prima di dichiarare il grafo non livellato (0 = nessun limite)
     */
    public GraphOptions withMaxLevels(int levels) {
        return new GraphOptions(serialPlanning, connectionPolicy, supportCounting, goalMatching,
                levels, parallelMutex, mutexThreads);
    }

    public GraphOptions withParallelMutex(boolean parallel, int threads) {
        return new GraphOptions(serialPlanning, connectionPolicy, supportCounting, goalMatching,
                maxLevels, parallel, threads);
    }

    public boolean isSerialPlanning() { return serialPlanning; }
    public ConnectionPolicy getConnectionPolicy() { return connectionPolicy; }
    public SupportCounting getSupportCounting() { return supportCounting; }
    public GoalMatching getGoalMatching() { return goalMatching; }
    public int getMaxLevels() { return maxLevels; }
    public boolean isParallelMutex() { return parallelMutex; }
    public int getMutexThreads() { return mutexThreads; }

    @Override
    public String toString() {
        return String.format("GraphOptions[seriale=%s, collegamento=%s, supporto=%s, obiettivi=%s, maxLivelli=%d, mutexParalleli=%s]",
                serialPlanning, connectionPolicy, supportCounting, goalMatching, maxLevels,
                parallelMutex ? mutexThreads + " thread" : "no");
    }
}
