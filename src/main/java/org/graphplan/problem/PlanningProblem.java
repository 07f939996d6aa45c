package org.graphplan.problem;

import org.graphplan.graph.LevelSumHeuristic;
import org.graphplan.graph.PlanningGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * PROBLEMA DI PIANIFICAZIONE - Problema STRIPS ground completo
 *
 * COMPONENTI:
 * • Mappa di stato: lista ordinata posizione -> fluente, usata per codificare gli stati
 * • Stato iniziale: stringa "TF..." allineata alla mappa di stato
 * • Azioni: lista ordinata di azioni ground del dominio
 * • Obiettivo: collezione non ordinata di letterali da raggiungere
 *
 * VALIDAZIONI ALLA COSTRUZIONE:
 * • Fluenti della mappa distinti
 * • Precondizioni ed effetti definiti solo su fluenti dichiarati
 * • Obiettivi definiti solo su fluenti dichiarati
 * • Stato iniziale decodificabile con la mappa
 */
public class PlanningProblem {

    private static final Logger LOGGER = Logger.getLogger(PlanningProblem.class.getName());

    private final String name;
    private final List<String> stateMap;
    private final String initialState;
    private final List<Action> actions;
    private final List<Literal> goal;

    /**
     * Costruisce il problema validandone la coerenza interna.
     *
     * @param name nome del problema
     * @param stateMap fluenti ordinati per posizione
     * @param initialState stato iniziale codificato
     * @param actions azioni ground del dominio
     * @param goal letterali obiettivo (duplicati rimossi, ordine preservato)
     * @throws IllegalArgumentException se il problema non è coerente
     */
    public PlanningProblem(String name, List<String> stateMap, String initialState,
                           List<Action> actions, List<Literal> goal) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome problema non può essere null o vuoto");
        }
        if (stateMap == null || actions == null || goal == null) {
            throw new IllegalArgumentException("Mappa di stato, azioni e obiettivo sono obbligatori");
        }

        this.name = name.trim();
        this.stateMap = Collections.unmodifiableList(new ArrayList<>(stateMap));
        this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
        this.goal = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(goal)));

        Set<String> declared = validateStateMap(this.stateMap);
        validateActions(this.actions, declared);
        validateGoal(this.goal, declared);

        // Decodifica di prova: solleva eccezione se lo stato non è allineato alla mappa
        StateCodec.decode(initialState, this.stateMap);
        this.initialState = initialState.toUpperCase();

        LOGGER.fine("Problema " + this.name + " costruito: " + this.stateMap.size() + " fluenti, "
                + this.actions.size() + " azioni, " + this.goal.size() + " obiettivi");
    }

    //region VALIDAZIONE

    private Set<String> validateStateMap(List<String> fluents) {
        Set<String> declared = new HashSet<>();
        for (String fluent : fluents) {
            if (fluent == null || fluent.trim().isEmpty()) {
                throw new IllegalArgumentException("Fluente null o vuoto nella mappa di stato");
            }
            if (!declared.add(fluent)) {
                throw new IllegalArgumentException("Fluente duplicato nella mappa di stato: " + fluent);
            }
        }
        return declared;
    }

    private void validateActions(List<Action> domainActions, Set<String> declared) {
        Set<Action> seen = new HashSet<>();
        for (Action action : domainActions) {
            if (action == null) {
                throw new IllegalArgumentException("Azione null nella lista delle azioni");
            }
            if (!seen.add(action)) {
                throw new IllegalArgumentException("Azione duplicata: " + action);
            }
            requireDeclared(action.getPrecondPos(), declared, action);
            requireDeclared(action.getPrecondNeg(), declared, action);
            requireDeclared(action.getEffectAdd(), declared, action);
            requireDeclared(action.getEffectRem(), declared, action);
        }
    }

    private void requireDeclared(List<String> fluents, Set<String> declared, Action action) {
        for (String fluent : fluents) {
            if (!declared.contains(fluent)) {
                throw new IllegalArgumentException("Azione " + action + " usa il fluente non dichiarato " + fluent);
            }
        }
    }

    private void validateGoal(List<Literal> goalLiterals, Set<String> declared) {
        for (Literal literal : goalLiterals) {
            if (literal == null) {
                throw new IllegalArgumentException("Letterale obiettivo null");
            }
            if (!declared.contains(literal.getSymbol())) {
                throw new IllegalArgumentException("Obiettivo su fluente non dichiarato: " + literal);
            }
        }
    }

    //endregion

    //region EURISTICA

    /**
     * Euristica level-sum per uno stato: costruisce un grafo di pianificazione seriale
     * a partire dallo stato e somma i livelli di comparsa degli obiettivi.
     *
     * @param state stato codificato "TF..."
     * @return stima non negativa del costo per raggiungere l'obiettivo
     */
    public int levelSumHeuristic(String state) {
        PlanningGraph graph = new PlanningGraph(this, state, true);
        return LevelSumHeuristic.levelSum(graph);
    }

    //endregion

    public String getName() {
        return name;
    }

    public List<String> getStateMap() {
        return stateMap;
    }

    public String getInitialState() {
        return initialState;
    }

    public FluentState getInitialFluentState() {
        return StateCodec.decode(initialState, stateMap);
    }

    public List<Action> getActions() {
        return actions;
    }

    public List<Literal> getGoal() {
        return goal;
    }

    @Override
    public String toString() {
        return String.format("PlanningProblem[%s, fluenti=%d, azioni=%d, obiettivi=%d]",
                name, stateMap.size(), actions.size(), goal.size());
    }
}
