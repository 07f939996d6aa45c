package org.graphplan.graph;

/**
 * Regola che ha reso mutuamente esclusiva una coppia di nodi fratelli.
 * Le prime quattro riguardano i livelli A, le ultime due i livelli S.
 */
public enum MutexReason {

    /** Pianificazione seriale: due azioni reali non possono avvenire nello stesso passo */
    SERIAL,

    /** Un'azione rimuove un effetto aggiunto dall'altra */
    INCONSISTENT_EFFECTS,

    /** Un'azione rimuove una precondizione positiva dell'altra */
    INTERFERENCE,

    /** Precondizioni mutuamente esclusive al livello precedente */
    COMPETING_NEEDS,

    /** Stesso fluente con polarità opposta */
    NEGATION,

    /** Nessuna coppia di azioni produttrici compatibile */
    INCONSISTENT_SUPPORT;

    /**
     * @return true se la regola si applica ai nodi azione
     */
    public boolean isActionRule() {
        return this == SERIAL || this == INCONSISTENT_EFFECTS || this == INTERFERENCE || this == COMPETING_NEEDS;
    }
}
