package org.graphplan.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * NODO DEL GRAFO DI PIANIFICAZIONE - Base comune per nodi letterale e nodi azione
 *
 * Ogni nodo appartiene a un solo livello del grafo e mantiene tre relazioni:
 * • genitori: nodi del livello precedente collegati a questo nodo
 * • figli: nodi del livello successivo collegati a questo nodo
 * • mutex: nodi fratelli (stesso tipo, stesso livello) mutuamente esclusivi
 *
 * Le relazioni sono archi non proprietari: i nodi sono posseduti dal livello del
 * grafo che li contiene, gli insiemi qui memorizzano solo riferimenti.
 */
public abstract class PlanningGraphNode {

    /** Indice del livello a cui appartiene il nodo (S_i oppure A_i) */
    private final int level;

    /** Fratelli mutuamente esclusivi, relazione simmetrica */
    private final Set<PlanningGraphNode> mutex = new LinkedHashSet<>();

    protected PlanningGraphNode(int level) {
        if (level < 0) {
            throw new IllegalArgumentException("Indice di livello non può essere negativo: " + level);
        }
        this.level = level;
    }

    //region RELAZIONE MUTEX

    /**
     * Rende due nodi fratelli mutuamente esclusivi aggiungendo ciascuno all'insieme
     * mutex dell'altro.
     *
     * VINCOLI:
     * • stesso tipo concreto (letterale con letterale, azione con azione)
     * • stesso indice di livello
     *
     * @param first primo nodo
     * @param second secondo nodo
     * @throws IllegalArgumentException se i nodi non sono fratelli legittimi
     */
    public static void mutexify(PlanningGraphNode first, PlanningGraphNode second) {
        if (first == null || second == null) {
            throw new IllegalArgumentException("Nodi mutex non possono essere null");
        }
        if (first.getClass() != second.getClass()) {
            throw new IllegalArgumentException("Tentativo di mutex fra nodi di tipo diverso: "
                    + first.getClass().getSimpleName() + " e " + second.getClass().getSimpleName());
        }
        if (first.level != second.level) {
            throw new IllegalArgumentException("Tentativo di mutex fra nodi di livelli diversi: "
                    + first.level + " e " + second.level);
        }
        first.mutex.add(second);
        second.mutex.add(first);
    }

    /**
     * @param other nodo fratello
     * @return true se i due nodi sono marcati mutuamente esclusivi
     */
    public boolean isMutex(PlanningGraphNode other) {
        return mutex.contains(other);
    }

    /** @return vista non modificabile dei fratelli mutex */
    public Set<PlanningGraphNode> getMutex() {
        return Collections.unmodifiableSet(mutex);
    }

    //endregion

    public int getLevel() {
        return level;
    }

    /** @return nodi del livello precedente collegati a questo nodo */
    public abstract Set<? extends PlanningGraphNode> getParents();

    /** @return nodi del livello successivo collegati a questo nodo */
    public abstract Set<? extends PlanningGraphNode> getChildren();

    /**
     * Riepilogo compatto per debugging: conteggi di genitori, figli e fratelli mutex.
     */
    public String describe() {
        return String.format("%s [livello %d] genitori=%d figli=%d mutex=%d",
                this, level, getParents().size(), getChildren().size(), mutex.size());
    }
}
