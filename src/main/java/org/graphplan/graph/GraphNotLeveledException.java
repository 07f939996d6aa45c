package org.graphplan.graph;

/**
 * Il grafo ha raggiunto il limite di livelli configurato senza stabilizzarsi.
 */
public class GraphNotLeveledException extends IllegalStateException {

    private final int levels;

    public GraphNotLeveledException(int levels) {
        super("Il grafo non si è livellato entro " + levels + " livelli");
        this.levels = levels;
    }

    /** @return numero di livelli azione costruiti prima dell'interruzione */
    public int getLevels() {
        return levels;
    }
}
