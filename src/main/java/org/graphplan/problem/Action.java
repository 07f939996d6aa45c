package org.graphplan.problem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AZIONE GROUND - Azione STRIPS con tutte le variabili legate a oggetti concreti
 *
 * Ogni azione espone quattro collezioni di fluenti:
 * • precondizioni positive: fluenti che devono essere veri
 * • precondizioni negative: fluenti che devono essere falsi
 * • effetti di aggiunta: fluenti resi veri
 * • effetti di rimozione: fluenti resi falsi
 *
 * IDENTITÀ:
 * • Coppia (nome, tupla argomenti), es. Fly(P1, SFO, JFK) -> ("Fly", [P1, SFO, JFK])
 * • Le azioni no-op sintetizzate dal grafo seguono la stessa convenzione:
 *   Noop_pos(F) e Noop_neg(F)
 */
public final class Action {

    /** Prefisso nome per le azioni di persistenza positive */
    public static final String NOOP_POS = "Noop_pos";

    /** Prefisso nome per le azioni di persistenza negative */
    public static final String NOOP_NEG = "Noop_neg";

    private final String name;
    private final List<String> args;
    private final List<String> precondPos;
    private final List<String> precondNeg;
    private final List<String> effectAdd;
    private final List<String> effectRem;

    /**
     * Costruisce un'azione ground con copie difensive immutabili delle collezioni.
     *
     * @param name nome dell'azione (non vuoto)
     * @param args argomenti ground (può essere vuota)
     * @param precondPos fluenti richiesti veri
     * @param precondNeg fluenti richiesti falsi
     * @param effectAdd fluenti aggiunti
     * @param effectRem fluenti rimossi
     * @throws IllegalArgumentException se il nome è vuoto o una collezione è null
     */
    public Action(String name, List<String> args,
                  List<String> precondPos, List<String> precondNeg,
                  List<String> effectAdd, List<String> effectRem) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome azione non può essere null o vuoto");
        }
        this.name = name.trim();
        this.args = immutableCopy(args, "args");
        this.precondPos = immutableCopy(precondPos, "precondPos");
        this.precondNeg = immutableCopy(precondNeg, "precondNeg");
        this.effectAdd = immutableCopy(effectAdd, "effectAdd");
        this.effectRem = immutableCopy(effectRem, "effectRem");
    }

    private static List<String> immutableCopy(List<String> source, String field) {
        if (source == null) {
            throw new IllegalArgumentException("Collezione " + field + " non può essere null");
        }
        List<String> copy = new ArrayList<>(source);
        for (String element : copy) {
            if (element == null) {
                throw new IllegalArgumentException("Collezione " + field + " contiene elementi null");
            }
        }
        return Collections.unmodifiableList(copy);
    }

    //region AZIONI DI PERSISTENZA

    /**
     * No-op positivo: richiede il fluente vero e lo mantiene vero.
     *
     * @param fluent simbolo del fluente
     * @return azione Noop_pos(fluent)
     */
    public static Action positiveNoop(String fluent) {
        return new Action(NOOP_POS, List.of(fluent),
                List.of(fluent), List.of(),
                List.of(fluent), List.of());
    }

    /**
     * No-op negativo: richiede il fluente falso e lo mantiene falso.
     *
     * @param fluent simbolo del fluente
     * @return azione Noop_neg(fluent)
     */
    public static Action negativeNoop(String fluent) {
        return new Action(NOOP_NEG, List.of(fluent),
                List.of(), List.of(fluent),
                List.of(), List.of(fluent));
    }

    //endregion

    public String getName() {
        return name;
    }

    public List<String> getArgs() {
        return args;
    }

    public List<String> getPrecondPos() {
        return precondPos;
    }

    public List<String> getPrecondNeg() {
        return precondNeg;
    }

    public List<String> getEffectAdd() {
        return effectAdd;
    }

    public List<String> getEffectRem() {
        return effectRem;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Action)) return false;
        Action other = (Action) obj;
        return name.equals(other.name) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    /**
     * Forma testuale "Nome(a,b)" oppure "Nome" senza argomenti.
     */
    @Override
    public String toString() {
        return args.isEmpty() ? name : name + "(" + String.join(",", args) + ")";
    }
}
