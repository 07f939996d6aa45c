package org.graphplan.graph;

import org.graphplan.graph.GraphOptions.ConnectionPolicy;
import org.graphplan.optionalfeatures.ParallelMutexEvaluator;
import org.graphplan.optionalfeatures.ParallelMutexEvaluator.MutexPair;
import org.graphplan.problem.Action;
import org.graphplan.problem.FluentState;
import org.graphplan.problem.Literal;
import org.graphplan.problem.PlanningProblem;
import org.graphplan.problem.StateCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.logging.Logger;

/**
 * GRAFO DI PIANIFICAZIONE - Struttura a livelli alternati S0, A0, S1, A1, ... costruita una sola volta
 *
 * COSTRUZIONE:
 * 1. S0 dai letterali dello stato iniziale, nessun mutex
 * 2. A_k: ogni azione candidata le cui precondizioni sono tutte in S_k, collegata ai genitori
 * 3. mutex fra le azioni di A_k
 * 4. S_k+1: effetti delle azioni di A_k, un solo nodo per letterale con tutti i produttori
 * 5. mutex fra i letterali di S_k+1
 * 6. stop quando S_k+1 contiene gli stessi letterali di S_k (grafo livellato)
 *
 * Le azioni candidate sono le azioni del dominio seguite da due azioni di persistenza
 * (positiva e negativa) per ogni fluente della mappa di stato.
 *
 * Terminazione: i letterali sono finiti e ogni livello S contiene il precedente grazie
 * alle azioni di persistenza, quindi la sequenza si stabilizza.
 */
public class PlanningGraph {

    private static final Logger LOGGER = Logger.getLogger(PlanningGraph.class.getName());

    //region CONFIGURAZIONE E INPUT

    private final PlanningProblem problem;
    private final GraphOptions options;
    private final MutexRules rules;
    private final FluentState initialFluentState;

    /** Azioni del dominio seguite dalle azioni di persistenza, fisse per tutta la costruzione */
    private final List<Action> allActions;

    //endregion

    //region LIVELLI

    private final List<Map<Literal, LiteralNode>> literalLevels = new ArrayList<>();
    private final List<List<ActionNode>> actionLevels = new ArrayList<>();
    private boolean leveled = false;

    //endregion

    private final GraphStatistics statistics;

    /**
     * Costruisce il grafo con le opzioni predefinite e la modalità di pianificazione indicata.
     *
     * @param problem problema di pianificazione
     * @param state stato codificato "TF..." rispetto alla mappa di stato
     * @param serialPlanning true per pianificazione seriale (una azione reale per passo)
     */
    public PlanningGraph(PlanningProblem problem, String state, boolean serialPlanning) {
        this(problem, state, GraphOptions.defaults().withSerialPlanning(serialPlanning));
    }

    /**
     * Costruisce il grafo fino al livellamento.
     *
     * @throws IllegalArgumentException se lo stato non è valido per la mappa di stato
     * @throws GraphNotLeveledException se il limite di livelli viene superato
     */
    public PlanningGraph(PlanningProblem problem, String state, GraphOptions options) {
        if (problem == null || options == null) {
            throw new IllegalArgumentException("Problema e opzioni non possono essere null");
        }
        this.problem = problem;
        this.options = options;
        this.rules = new MutexRules(options.isSerialPlanning(), options.getSupportCounting());
        this.initialFluentState = StateCodec.decode(state, problem.getStateMap());
        this.allActions = Collections.unmodifiableList(candidateActions(problem));
        this.statistics = new GraphStatistics();

        LOGGER.fine("Costruzione grafo per " + problem.getName() + " da stato " + state + " con " + options);
        createGraph();
        statistics.stopTimer();
        LOGGER.fine("Grafo costruito: " + statistics.toCompactString());
    }

    private static List<Action> candidateActions(PlanningProblem problem) {
        List<Action> candidates = new ArrayList<>(problem.getActions());
        for (String fluent : problem.getStateMap()) {
            candidates.add(Action.positiveNoop(fluent));
            candidates.add(Action.negativeNoop(fluent));
        }
        return candidates;
    }

    //region COSTRUZIONE

    /**
     * Riempie i livelli alternati fino al livellamento. Invocato solo dal costruttore.
     *
     * @throws IllegalStateException se il grafo contiene già dei livelli
     */
    void createGraph() {
        if (!literalLevels.isEmpty() || !actionLevels.isEmpty()) {
            throw new IllegalStateException(
                    "Grafo già costruito: creare un nuovo grafo per ogni nuovo stato della pianificazione");
        }

        Map<Literal, LiteralNode> initialLevel = new LinkedHashMap<>();
        for (Literal literal : initialFluentState.toLiterals()) {
            initialLevel.put(literal, new LiteralNode(literal, 0));
        }
        literalLevels.add(initialLevel);
        statistics.recordLiteralLevel(initialLevel.size(), 0);

        ParallelMutexEvaluator evaluator = options.isParallelMutex()
                ? new ParallelMutexEvaluator(options.getMutexThreads())
                : null;
        try {
            int level = 0;
            while (!leveled) {
                if (options.getMaxLevels() > 0 && level >= options.getMaxLevels()) {
                    throw new GraphNotLeveledException(level);
                }
                if (Thread.currentThread().isInterrupted()) {
                    throw new IllegalStateException("Costruzione del grafo interrotta al livello " + level);
                }

                List<ActionNode> actions = addActionLevel(level);
                int actionMutex = applyMutex(actions, rules::actionMutexReason, evaluator);
                statistics.recordActionLevel(actions.size(), actionMutex);

                level++;
                Map<Literal, LiteralNode> literals = addLiteralLevel(level);
                List<LiteralNode> literalNodes = new ArrayList<>(literals.values());
                int literalMutex = applyMutex(literalNodes, rules::literalMutexReason, evaluator);
                statistics.recordLiteralLevel(literals.size(), literalMutex);

                LOGGER.finest(() -> "Livello " + literalLevels.size() + ": " + literals.size() + " letterali, "
                        + actions.size() + " azioni");

                leveled = literals.keySet().equals(literalLevels.get(level - 1).keySet());
            }
        } finally {
            if (evaluator != null) {
                evaluator.close();
            }
        }
    }

    /**
     * Livello A_k: ammette le azioni candidate con precondizioni tutte presenti in S_k.
     */
    private List<ActionNode> addActionLevel(int level) {
        Map<Literal, LiteralNode> previous = literalLevels.get(level);
        List<ActionNode> actions = new ArrayList<>();

        for (Action action : allActions) {
            ActionNode node = new ActionNode(action, level);
            if (!previous.keySet().containsAll(node.getPreconditionLiterals())) {
                continue;
            }
            if (options.getConnectionPolicy() == ConnectionPolicy.ALL_LITERALS) {
                for (LiteralNode literal : previous.values()) {
                    connect(literal, node);
                }
            } else {
                for (Literal precondition : node.getPreconditionLiterals()) {
                    connect(previous.get(precondition), node);
                }
            }
            actions.add(node);
        }

        actionLevels.add(actions);
        return actions;
    }

    /**
     * Livello S_k+1: un nodo per ogni letterale prodotto da A_k, con tutti i produttori come genitori.
     */
    private Map<Literal, LiteralNode> addLiteralLevel(int level) {
        Map<Literal, LiteralNode> literals = new LinkedHashMap<>();
        for (ActionNode action : actionLevels.get(level - 1)) {
            for (Literal effect : action.getEffectLiterals()) {
                LiteralNode node = literals.computeIfAbsent(effect, literal -> new LiteralNode(literal, level));
                node.addParent(action);
                action.addChild(node);
            }
        }
        literalLevels.add(literals);
        return literals;
    }

    private static void connect(LiteralNode literal, ActionNode action) {
        literal.addChild(action);
        action.addParent(literal);
    }

    /**
     * Valuta la regola su ogni coppia non ordinata e applica i mutex trovati su questo thread.
     *
     * @return numero di coppie mutex del livello
     */
    private <N extends PlanningGraphNode> int applyMutex(List<N> nodes, BiFunction<N, N, MutexReason> rule,
                                                         ParallelMutexEvaluator evaluator) {
        List<MutexPair<N>> pairs = evaluator != null
                ? evaluator.evaluate(nodes, rule)
                : ParallelMutexEvaluator.evaluateSequential(nodes, rule);
        for (MutexPair<N> pair : pairs) {
            PlanningGraphNode.mutexify(pair.first(), pair.second());
            statistics.recordMutex(pair.reason());
        }
        return pairs.size();
    }

    //endregion

    //region ACCESSORS

    /** @return nodi del livello S indicato, in ordine di inserimento */
    public List<LiteralNode> getLiteralLevel(int level) {
        return List.copyOf(literalLevels.get(level).values());
    }

    /** @return nodo del letterale al livello indicato, null se assente */
    public LiteralNode getLiteralNode(int level, Literal literal) {
        return literalLevels.get(level).get(literal);
    }

    public List<ActionNode> getActionLevel(int level) {
        return Collections.unmodifiableList(actionLevels.get(level));
    }

    /**
     * Cerca un nodo azione per nome e argomenti. Le azioni di persistenza si trovano
     * con {@link Action#NOOP_POS} o {@link Action#NOOP_NEG} e il fluente come argomento.
     *
     * @return nodo trovato, null se l'azione non è nel livello
     */
    public ActionNode findActionNode(int level, String name, List<String> args) {
        for (ActionNode node : actionLevels.get(level)) {
            if (node.getAction().getName().equals(name) && node.getAction().getArgs().equals(args)) {
                return node;
            }
        }
        return null;
    }

    public int getLiteralLevelCount() {
        return literalLevels.size();
    }

    public int getActionLevelCount() {
        return actionLevels.size();
    }

    public boolean isLeveled() {
        return leveled;
    }

    public List<Action> getCandidateActions() {
        return allActions;
    }

    public GraphStatistics getStatistics() {
        return statistics;
    }

    public PlanningProblem getProblem() {
        return problem;
    }

    public GraphOptions getOptions() {
        return options;
    }

    //endregion
}
