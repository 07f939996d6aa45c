package org.graphplan.problem;

import java.util.Objects;

/**
 * LETTERALE - Fluente ground accompagnato dalla sua polarità
 *
 * Rappresenta una proposizione atomica del mondo (es. "At(C1,SFO)") asserita vera
 * (letterale positivo) oppure asserita falsa (letterale negativo).
 *
 * INVARIANTI:
 * • Simbolo non null e non vuoto
 * • Uguaglianza e hash derivati da simbolo e polarità
 * • Immutabile: sicuro come chiave di insiemi e mappe
 */
public final class Literal {

    /** Testo del fluente, es. "Have(Cake)" */
    private final String symbol;

    /** true se il fluente è asserito vero, false se asserito falso */
    private final boolean positive;

    /**
     * Costruisce un letterale validando il simbolo.
     *
     * @param symbol testo del fluente (non null, non vuoto)
     * @param positive polarità del letterale
     * @throws IllegalArgumentException se il simbolo è null o vuoto
     */
    public Literal(String symbol, boolean positive) {
        if (symbol == null || symbol.trim().isEmpty()) {
            throw new IllegalArgumentException("Simbolo del letterale non può essere null o vuoto");
        }
        this.symbol = symbol.trim();
        this.positive = positive;
    }

    /** Letterale positivo per il fluente indicato. */
    public static Literal positive(String symbol) {
        return new Literal(symbol, true);
    }

    /** Letterale negativo per il fluente indicato. */
    public static Literal negative(String symbol) {
        return new Literal(symbol, false);
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isPositive() {
        return positive;
    }

    /**
     * @return letterale con stesso simbolo e polarità opposta
     */
    public Literal negate() {
        return new Literal(symbol, !positive);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal other = (Literal) obj;
        return positive == other.positive && symbol.equals(other.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, positive);
    }

    /**
     * Forma testuale: "Sym" per i positivi, "~Sym" per i negativi.
     */
    @Override
    public String toString() {
        return positive ? symbol : "~" + symbol;
    }
}
