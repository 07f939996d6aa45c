package org.graphplan.problem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * CODIFICA STATI - Conversione tra stringhe "TF..." e {@link FluentState}
 *
 * FORMATO STRINGA:
 * • Un carattere per posizione della mappa di stato, stesso ordine
 * • 'T' (o 't') = fluente vero, 'F' (o 'f') = fluente falso
 * • Lunghezza identica alla mappa di stato
 *
 * Funzioni pure, senza stato: classe utility non istanziabile.
 */
public final class StateCodec {

    private static final char TRUE_CHAR = 'T';
    private static final char FALSE_CHAR = 'F';

    private StateCodec() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Decodifica una stringa di stato nelle liste di fluenti veri e falsi.
     *
     * @param state stringa "TF..." della stessa lunghezza della mappa
     * @param stateMap fluenti ordinati per posizione
     * @return stato decodificato
     * @throws IllegalArgumentException se lunghezza o caratteri non sono validi
     */
    public static FluentState decode(String state, List<String> stateMap) {
        if (state == null || stateMap == null) {
            throw new IllegalArgumentException("Stato e mappa di stato non possono essere null");
        }
        if (state.length() != stateMap.size()) {
            throw new IllegalArgumentException("Lunghezza stato " + state.length()
                    + " diversa dal numero di fluenti " + stateMap.size());
        }

        List<String> pos = new ArrayList<>();
        List<String> neg = new ArrayList<>();

        for (int i = 0; i < state.length(); i++) {
            char value = Character.toUpperCase(state.charAt(i));
            if (value == TRUE_CHAR) {
                pos.add(stateMap.get(i));
            } else if (value == FALSE_CHAR) {
                neg.add(stateMap.get(i));
            } else {
                throw new IllegalArgumentException("Carattere di stato non valido '" + state.charAt(i)
                        + "' in posizione " + i + " (ammessi: T, F)");
            }
        }

        return new FluentState(pos, neg);
    }

    /**
     * Codifica uno stato nella stringa "TF..." secondo la mappa di stato.
     * Ogni fluente non presente fra i veri viene codificato come falso.
     *
     * @param fluentState stato da codificare
     * @param stateMap fluenti ordinati per posizione
     * @return stringa di stato
     */
    public static String encode(FluentState fluentState, List<String> stateMap) {
        if (fluentState == null || stateMap == null) {
            throw new IllegalArgumentException("Stato e mappa di stato non possono essere null");
        }

        Set<String> trueFluents = new HashSet<>(fluentState.getPos());
        StringBuilder encoded = new StringBuilder(stateMap.size());
        for (String fluent : stateMap) {
            encoded.append(trueFluents.contains(fluent) ? TRUE_CHAR : FALSE_CHAR);
        }
        return encoded.toString();
    }
}
