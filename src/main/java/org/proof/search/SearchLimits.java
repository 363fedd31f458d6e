package org.proof.search;

/**
 * LIMITI DI RICERCA - Parametri immutabili che garantiscono la terminazione
 *
 * Lo spazio delle riscritture non è limitato: riassociazione e distributività
 * possono far crescere le formule senza fine. I limiti sono quindi obbligatori e
 * approssimano la ricerca: una prova reale che li supera viene riportata come
 * "non trovata".
 *
 * LIMITI:
 * - maxSize: formule più grandi non vengono espanse
 * - maxDepth: numero massimo di passi di riscrittura dalla formula iniziale
 * - maxStates: numero massimo di formule espanse (budget di lavoro)
 */
public final class SearchLimits {

    /** Dimensione massima di una formula espandibile */
    public static final int DEFAULT_MAX_SIZE = 15;

    /** Numero massimo di passi dalla formula iniziale */
    public static final int DEFAULT_MAX_DEPTH = 15;

    /** Nessun budget sugli stati espansi */
    public static final int UNLIMITED_STATES = Integer.MAX_VALUE;

    private final int maxSize;
    private final int maxDepth;
    private final int maxStates;

    private SearchLimits(int maxSize, int maxDepth, int maxStates) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize non può essere negativo: " + maxSize);
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth non può essere negativo: " + maxDepth);
        }
        if (maxStates <= 0) {
            throw new IllegalArgumentException("maxStates deve essere positivo: " + maxStates);
        }
        this.maxSize = maxSize;
        this.maxDepth = maxDepth;
        this.maxStates = maxStates;
    }

    public static SearchLimits defaults() {
        return new SearchLimits(DEFAULT_MAX_SIZE, DEFAULT_MAX_DEPTH, UNLIMITED_STATES);
    }

    public static SearchLimits of(int maxSize, int maxDepth) {
        return new SearchLimits(maxSize, maxDepth, UNLIMITED_STATES);
    }

    /**
     * Solo limite di dimensione, profondità illimitata.
     */
    public static SearchLimits sizeOnly(int maxSize) {
        return new SearchLimits(maxSize, Integer.MAX_VALUE, UNLIMITED_STATES);
    }

    public SearchLimits withMaxSize(int maxSize) {
        return new SearchLimits(maxSize, maxDepth, maxStates);
    }

    public SearchLimits withMaxDepth(int maxDepth) {
        return new SearchLimits(maxSize, maxDepth, maxStates);
    }

    public SearchLimits withMaxStates(int maxStates) {
        return new SearchLimits(maxSize, maxDepth, maxStates);
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxStates() {
        return maxStates;
    }

    @Override
    public String toString() {
        return String.format("Limiti[maxSize=%d, maxDepth=%s, maxStates=%s]", maxSize,
                maxDepth == Integer.MAX_VALUE ? "illimitata" : String.valueOf(maxDepth),
                maxStates == UNLIMITED_STATES ? "illimitati" : String.valueOf(maxStates));
    }
}
