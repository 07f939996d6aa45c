package org.graphplan.problem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * STATO A FLUENTI - Coppia di liste (fluenti veri, fluenti noti falsi)
 *
 * Forma decodificata di una stringa di stato "TFTF...": ogni fluente della mappa
 * di stato compare esattamente in una delle due liste.
 */
public final class FluentState {

    private final List<String> pos;
    private final List<String> neg;

    public FluentState(List<String> pos, List<String> neg) {
        if (pos == null || neg == null) {
            throw new IllegalArgumentException("Liste di fluenti non possono essere null");
        }
        this.pos = Collections.unmodifiableList(new ArrayList<>(pos));
        this.neg = Collections.unmodifiableList(new ArrayList<>(neg));
    }

    /** @return fluenti veri nello stato */
    public List<String> getPos() {
        return pos;
    }

    /** @return fluenti falsi nello stato */
    public List<String> getNeg() {
        return neg;
    }

    /**
     * Letterali dello stato: un positivo per ogni fluente vero, un negativo per ogni fluente falso.
     *
     * @return lista ordinata (prima i positivi, poi i negativi)
     */
    public List<Literal> toLiterals() {
        List<Literal> literals = new ArrayList<>(pos.size() + neg.size());
        for (String fluent : pos) {
            literals.add(Literal.positive(fluent));
        }
        for (String fluent : neg) {
            literals.add(Literal.negative(fluent));
        }
        return literals;
    }

    @Override
    public String toString() {
        return "FluentState[pos=" + pos + ", neg=" + neg + "]";
    }
}
