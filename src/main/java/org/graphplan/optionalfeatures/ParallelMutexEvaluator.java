package org.graphplan.optionalfeatures;

import org.graphplan.graph.MutexReason;
import org.graphplan.graph.PlanningGraphNode;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.logging.Logger;

/**
 * VALUTAZIONE PARALLELA DEI MUTEX - Test delle coppie di fratelli su pool di thread
 *
 * STRATEGIA:
 * • unità di lavoro = una riga del triangolo delle coppie (nodo i contro i+1..n-1)
 * • ogni task legge soltanto il grafo e restituisce le coppie mutex trovate
 * • i risultati sono raccolti nell'ordine delle righe, quindi identici alla scansione sequenziale
 * • l'applicazione di mutexify resta al chiamante, su un solo thread
 *
 * I test di un livello dipendono solo dal livello precedente, già completo: le letture
 * concorrenti non hanno scrittori.
 */
public class ParallelMutexEvaluator implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ParallelMutexEvaluator.class.getName());

    /** Coppia di fratelli riconosciuta mutex con la regola che l'ha prodotta */
    public record MutexPair<N extends PlanningGraphNode>(N first, N second, MutexReason reason) {}

    private final ExecutorService executor;
    private final int threads;

    /**
     * @param threads dimensione del pool, almeno 1
     */
    public ParallelMutexEvaluator(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Numero thread deve essere >= 1, ricevuto: " + threads);
        }
        this.threads = threads;
        this.executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "mutex-worker");
            thread.setDaemon(true);
            return thread;
        });
        LOGGER.fine("Pool mutex avviato con " + threads + " thread");
    }

    /**
     * Valuta la regola su tutte le coppie non ordinate della lista.
     *
     * @param nodes fratelli di un livello
     * @param rule regola che restituisce il motivo del mutex o null
     * @return coppie mutex in ordine di riga
     * @throws IllegalStateException se un task fallisce o il thread chiamante viene interrotto
     */
    public <N extends PlanningGraphNode> List<MutexPair<N>> evaluate(List<N> nodes,
                                                                    BiFunction<N, N, MutexReason> rule) {
        List<Future<List<MutexPair<N>>>> rows = new ArrayList<>();
        for (int i = 0; i < nodes.size() - 1; i++) {
            final int row = i;
            Callable<List<MutexPair<N>>> task = () -> evaluateRow(nodes, row, rule);
            rows.add(executor.submit(task));
        }

        List<MutexPair<N>> result = new ArrayList<>();
        try {
            for (Future<List<MutexPair<N>>> row : rows) {
                result.addAll(row.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            rows.forEach(row -> row.cancel(true));
            throw new IllegalStateException("Valutazione mutex interrotta", e);
        } catch (ExecutionException e) {
            rows.forEach(row -> row.cancel(true));
            throw new IllegalStateException("Errore nella valutazione mutex: " + e.getCause().getMessage(), e.getCause());
        }
        return result;
    }

    /**
     * Scansione sequenziale delle coppie, stesso ordine della versione parallela.
     */
    public static <N extends PlanningGraphNode> List<MutexPair<N>> evaluateSequential(List<N> nodes,
                                                                                    BiFunction<N, N, MutexReason> rule) {
        List<MutexPair<N>> result = new ArrayList<>();
        for (int i = 0; i < nodes.size() - 1; i++) {
            result.addAll(evaluateRow(nodes, i, rule));
        }
        return result;
    }

    private static <N extends PlanningGraphNode> List<MutexPair<N>> evaluateRow(List<N> nodes, int row,
                                                                              BiFunction<N, N, MutexReason> rule) {
        List<MutexPair<N>> pairs = new ArrayList<>();
        N first = nodes.get(row);
        for (int j = row + 1; j < nodes.size(); j++) {
            N second = nodes.get(j);
            MutexReason reason = rule.apply(first, second);
            if (reason != null) {
                pairs.add(new MutexPair<>(first, second, reason));
            }
        }
        return pairs;
    }

    public int getThreads() {
        return threads;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
