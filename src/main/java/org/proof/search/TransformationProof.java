package org.proof.search;

import org.proof.formula.Formula;

import java.util.List;

/**
 * RISULTATO DELLA RICERCA DI PROVA - Contenitore immutabile dell'esito
 *
 * Rappresenta l'esito di una ricerca tra formula iniziale e formula obiettivo:
 * - trovata: sequenza ordinata di riscritture (vuota se iniziale = obiettivo)
 * - non trovata: esito normale quando i limiti non permettono di collegare le formule
 *
 * Le statistiche di esecuzione sono sempre disponibili.
 */
public final class TransformationProof {

    private final Formula start;
    private final Formula goal;
    private final boolean found;
    private final List<Rewrite> steps;
    private final SearchStatistics statistics;

    private TransformationProof(Formula start, Formula goal, boolean found,
                                List<Rewrite> steps, SearchStatistics statistics) {
        this.start = start;
        this.goal = goal;
        this.found = found;
        this.steps = List.copyOf(steps);
        this.statistics = statistics != null ? statistics : new SearchStatistics();
    }

    //region FACTORY METHODS

    /**
     * Prova trovata con i passi nell'ordine di applicazione.
     *
     * @throws IllegalArgumentException se steps è null
     */
    public static TransformationProof found(Formula start, Formula goal, List<Rewrite> steps,
                                            SearchStatistics statistics) {
        if (steps == null) {
            throw new IllegalArgumentException("Sequenza di passi null per una prova trovata");
        }
        return new TransformationProof(start, goal, true, steps, statistics);
    }

    public static TransformationProof notFound(Formula start, Formula goal, SearchStatistics statistics) {
        return new TransformationProof(start, goal, false, List.of(), statistics);
    }

    //endregion

    //region ACCESSO

    public boolean isFound() {
        return found;
    }

    public Formula getStart() {
        return start;
    }

    public Formula getGoal() {
        return goal;
    }

    /**
     * Passi della prova, il primo è la prima riscrittura della formula iniziale.
     * Vuota se la prova non è stata trovata o se iniziale e obiettivo coincidono.
     */
    public List<Rewrite> getSteps() {
        return steps;
    }

    public int length() {
        return steps.size();
    }

    public SearchStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region VERIFICA E FORMATTAZIONE

    /**
     * Riapplica in sequenza le riscritture registrate alla formula iniziale.
     * Per una prova trovata il risultato coincide con l'obiettivo.
     *
     * @throws IllegalStateException se la prova non è stata trovata o un passo non è riapplicabile
     */
    public Formula replay() {
        if (!found) {
            throw new IllegalStateException("Nessuna prova da riapplicare tra " + start + " e " + goal);
        }
        Formula current = start;
        for (Rewrite step : steps) {
            current = step.replayOn(current);
        }
        return current;
    }

    /**
     * Formato leggibile della prova con i tag allineati:
     *
     * A => B  <->  !A | B
     *
     * 1) A => B
     * 2) !A | B    by imp_elim
     */
    public String format() {
        if (!found) {
            return String.format("Nessuna trasformazione trovata da %s a %s%n"
                            + "Esplorati %d stati fino alla profondità %d",
                    start, goal, statistics.getStatesExplored(), statistics.getMaxDepthReached());
        }

        String[] prefixes = new String[steps.size() + 1];
        prefixes[0] = "1) " + start;
        int width = prefixes[0].length();
        for (int i = 0; i < steps.size(); i++) {
            prefixes[i + 1] = (i + 2) + ") " + steps.get(i).getResult();
            width = Math.max(width, prefixes[i + 1].length());
        }

        StringBuilder sb = new StringBuilder();
        sb.append(start).append("  <->  ").append(goal).append("\n\n");
        sb.append(prefixes[0]).append('\n');
        for (int i = 0; i < steps.size(); i++) {
            String prefix = prefixes[i + 1];
            sb.append(prefix)
                    .append(" ".repeat(width + 3 - prefix.length()))
                    .append("by ").append(steps.get(i).getRuleTag())
                    .append('\n');
        }
        return sb.toString();
    }

    //endregion

    @Override
    public String toString() {
        return found
                ? "Prova[" + start + " -> " + goal + ", passi=" + steps.size() + "]"
                : "Prova[" + start + " -> " + goal + ", non trovata]";
    }
}
