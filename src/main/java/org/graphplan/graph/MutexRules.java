package org.graphplan.graph;

import org.graphplan.graph.GraphOptions.SupportCounting;
import org.graphplan.problem.Action;

import java.util.List;

/**
 * REGOLE MUTEX - Test booleani di mutua esclusione fra nodi fratelli
 *
 * LIVELLI A (coppie di azioni), mutex se almeno una regola vale:
 * - Seriale: grafo seriale e nessuna delle due azioni è di persistenza
 * - Effetti inconsistenti: un'azione rimuove ciò che l'altra aggiunge
 * - Interferenza: un'azione rimuove una precondizione positiva dell'altra
 * - Bisogni concorrenti: un genitore dell'una è mutex con un genitore dell'altra
 *
 * LIVELLI S (coppie di letterali), mutex se almeno una regola vale:
 * - Negazione: stesso simbolo, polarità opposta
 * - Supporto inconsistente: le azioni produttrici non possono coesistere
 *
 * Tutti i test sono in sola lettura sul grafo: leggono le relazioni mutex del
 * livello precedente e non modificano alcun nodo.
 */
public class MutexRules {

    private final boolean serialPlanning;
    private final SupportCounting supportCounting;

    public MutexRules(boolean serialPlanning, SupportCounting supportCounting) {
        if (supportCounting == null) {
            throw new IllegalArgumentException("Politica di conteggio del supporto non può essere null");
        }
        this.serialPlanning = serialPlanning;
        this.supportCounting = supportCounting;
    }

    //region COPPIE DI AZIONI

    /**
     * Valuta le regole per una coppia di azioni nell'ordine seriale, effetti inconsistenti,
     * interferenza, bisogni concorrenti.
     *
     * @return prima regola soddisfatta, null se le azioni non sono mutex
     */
    public MutexReason actionMutexReason(ActionNode first, ActionNode second) {
        if (serializeActions(first, second)) return MutexReason.SERIAL;
        if (inconsistentEffects(first, second)) return MutexReason.INCONSISTENT_EFFECTS;
        if (interference(first, second)) return MutexReason.INTERFERENCE;
        if (competingNeeds(first, second)) return MutexReason.COMPETING_NEEDS;
        return null;
    }

    /**
     * In un grafo seriale al più un'azione reale per passo: due azioni distinte non di
     * persistenza sono sempre mutex.
     */
    public boolean serializeActions(ActionNode first, ActionNode second) {
        if (!serialPlanning) {
            return false;
        }
        return !first.isPersistent() && !second.isPersistent();
    }

    /**
     * Un effetto di aggiunta di un'azione compare fra gli effetti di rimozione dell'altra.
     */
    public boolean inconsistentEffects(ActionNode first, ActionNode second) {
        Action a1 = first.getAction();
        Action a2 = second.getAction();
        return intersects(a1.getEffectAdd(), a2.getEffectRem())
                || intersects(a2.getEffectAdd(), a1.getEffectRem());
    }

    /**
     * Un effetto di rimozione di un'azione compare fra le precondizioni positive dell'altra.
     */
    public boolean interference(ActionNode first, ActionNode second) {
        Action a1 = first.getAction();
        Action a2 = second.getAction();
        return intersects(a1.getEffectRem(), a2.getPrecondPos())
                || intersects(a2.getEffectRem(), a1.getPrecondPos());
    }

    /**
     * Un letterale genitore della prima azione è mutex con un letterale genitore della seconda.
     */
    public boolean competingNeeds(ActionNode first, ActionNode second) {
        for (LiteralNode parent1 : first.getParents()) {
            for (LiteralNode parent2 : second.getParents()) {
                if (parent1.isMutex(parent2)) {
                    return true;
                }
            }
        }
        return false;
    }

    //endregion

    //region COPPIE DI LETTERALI

    /**
     * Valuta le regole per una coppia di letterali nell'ordine negazione, supporto inconsistente.
     *
     * @return prima regola soddisfatta, null se i letterali non sono mutex
     */
    public MutexReason literalMutexReason(LiteralNode first, LiteralNode second) {
        if (negation(first, second)) return MutexReason.NEGATION;
        if (inconsistentSupport(first, second)) return MutexReason.INCONSISTENT_SUPPORT;
        return null;
    }

    /**
     * Stesso simbolo e polarità opposta: un fluente non può essere vero e falso insieme.
     */
    public boolean negation(LiteralNode first, LiteralNode second) {
        return first.isPositive() != second.isPositive()
                && first.getSymbol().equals(second.getSymbol());
    }

    /**
     * Supporto inconsistente fra due letterali.
     *
     * REFERENCE: conta le coppie mutex sul prodotto cartesiano dei produttori e dichiara
     * mutex se il conteggio è uguale al numero di produttori del primo letterale. Con il
     * primo insieme vuoto il conteggio (0) coincide e la coppia risulta mutex.
     *
     * ALL_PAIRS: mutex se entrambi gli insiemi di produttori sono non vuoti e ogni coppia
     * del prodotto cartesiano è mutex.
     */
    public boolean inconsistentSupport(LiteralNode first, LiteralNode second) {
        if (supportCounting == SupportCounting.ALL_PAIRS) {
            return allProducerPairsMutex(first, second);
        }

        int mutexPairs = 0;
        for (ActionNode parent1 : first.getParents()) {
            for (ActionNode parent2 : second.getParents()) {
                if (parent1.isMutex(parent2)) {
                    mutexPairs++;
                }
            }
        }
        return mutexPairs == first.getParents().size();
    }

    private boolean allProducerPairsMutex(LiteralNode first, LiteralNode second) {
        if (first.getParents().isEmpty() || second.getParents().isEmpty()) {
            return false;
        }
        for (ActionNode parent1 : first.getParents()) {
            for (ActionNode parent2 : second.getParents()) {
                if (!parent1.isMutex(parent2)) {
                    return false;
                }
            }
        }
        return true;
    }

    //endregion

    private static boolean intersects(List<String> left, List<String> right) {
        for (String fluent : left) {
            if (right.contains(fluent)) {
                return true;
            }
        }
        return false;
    }
}
