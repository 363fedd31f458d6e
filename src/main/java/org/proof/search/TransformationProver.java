package org.proof.search;

import org.proof.formula.Formula;
import org.proof.rules.RuleCatalog;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * DIMOSTRATORE TRASFORMAZIONALE - Ricerca in ampiezza del percorso di riscrittura più corto
 *
 * Esplora il grafo implicito i cui nodi sono formule e i cui archi sono singoli
 * passi della chiusura di riscrittura, fino a raggiungere la formula obiettivo.
 *
 * ALGORITMO:
 * 1. Insieme visitati inizializzato con la formula iniziale
 * 2. Frontiera FIFO di nodi di prova, inizialmente la sola radice
 * 3. Estrazione dalla testa: se la formula è l'obiettivo si ricostruisce il percorso
 * 4. Formule oltre il limite di dimensione (o di profondità) non vengono espanse
 * 5. Le formule nuove della chiusura vengono marcate visitate e accodate
 * 6. Frontiera vuota: nessun percorso entro i limiti (esito normale, non un errore)
 *
 * GARANZIE:
 * - Il percorso restituito ha il minimo numero di passi tra quelli scopribili entro i limiti
 * - Spareggio deterministico: ordine del catalogo, poi radice, sinistra, destra
 *
 * INTERRUZIONE:
 * - Cooperativa, controllata tra due estrazioni: flag interno (interrupt()) o
 *   stato di interruzione del thread, oltre al budget opzionale di stati
 */
public class TransformationProver {

    private static final Logger LOGGER = Logger.getLogger(TransformationProver.class.getName());

    private final RewriteClosure closure;
    private final SearchLimits limits;

    /** Flag thread-safe per interruzione controllata da timeout esterni */
    private volatile boolean interrupted = false;

    public TransformationProver(RuleCatalog catalog, SearchLimits limits) {
        if (limits == null) {
            throw new IllegalArgumentException("Limiti di ricerca non possono essere null");
        }
        this.closure = new RewriteClosure(catalog);
        this.limits = limits;
    }

    public TransformationProver() {
        this(RuleCatalog.standard(), SearchLimits.defaults());
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Percorso più corto tra due formule con il solo limite di dimensione.
     *
     * @return passi della prova, oppure Optional vuoto se nessun percorso esiste entro il limite
     */
    public static Optional<List<Rewrite>> findPath(Formula start, Formula goal, RuleCatalog catalog, int maxSize) {
        TransformationProof proof = new TransformationProver(catalog, SearchLimits.sizeOnly(maxSize))
                .findPath(start, goal);
        return proof.isFound() ? Optional.of(proof.getSteps()) : Optional.empty();
    }

    /**
     * METODO PRINCIPALE - Cerca la sequenza di riscritture più corta da start a goal.
     *
     * @param start formula iniziale
     * @param goal formula obiettivo
     * @return prova trovata (eventualmente vuota) oppure esito "non trovata"
     * @throws IllegalArgumentException se una delle formule è null
     */
    public TransformationProof findPath(Formula start, Formula goal) {
        if (start == null || goal == null) {
            throw new IllegalArgumentException("Formula iniziale e obiettivo non possono essere null");
        }

        LOGGER.fine("Ricerca prova da [" + start + "] a [" + goal + "] con " + limits);
        SearchStatistics statistics = new SearchStatistics();

        Set<Formula> visited = new HashSet<>();
        visited.add(start);
        Queue<ProofNode> frontier = new ArrayDeque<>();
        frontier.add(ProofNode.root(start));

        while (!frontier.isEmpty()) {
            if (shouldStop(statistics)) {
                break;
            }

            ProofNode current = frontier.poll();
            Formula formula = current.getFormula();
            statistics.incrementStatesExplored();
            statistics.updateDepth(current.getDepth());

            if (formula.equals(goal)) {
                statistics.stopTimer();
                List<Rewrite> steps = current.backtrack();
                LOGGER.info("Prova trovata in " + steps.size() + " passi dopo "
                        + statistics.getStatesExplored() + " stati");
                return TransformationProof.found(start, goal, steps, statistics);
            }

            if (formula.size() > limits.getMaxSize() || current.getDepth() >= limits.getMaxDepth()) {
                statistics.incrementStatesPruned();
                continue;
            }

            expand(current, visited, frontier, statistics);
        }

        statistics.stopTimer();
        LOGGER.info("Nessuna prova trovata da [" + start + "] a [" + goal + "] dopo "
                + statistics.getStatesExplored() + " stati");
        return TransformationProof.notFound(start, goal, statistics);
    }

    /**
     * Richiede l'interruzione della ricerca in corso (o della prossima, se nessuna è attiva),
     * verificata prima della prossima estrazione. La richiesta viene consumata dalla ricerca
     * che la osserva: le ricerche successive sulla stessa istanza procedono normalmente.
     */
    public void interrupt() {
        interrupted = true;
    }

    public SearchLimits getLimits() {
        return limits;
    }

    //endregion

    //region ESPANSIONE E CONTROLLO

    private void expand(ProofNode current, Set<Formula> visited, Queue<ProofNode> frontier,
                        SearchStatistics statistics) {
        for (Rewrite rewrite : closure.rewrites(current.getFormula())) {
            if (visited.add(rewrite.getResult())) {
                frontier.add(current.child(rewrite));
                statistics.incrementStatesGenerated();

                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.finest(String.format("Accodata [%s] by %s (profondità %d)",
                            rewrite.getResult(), rewrite.getRuleTag(), current.getDepth() + 1));
                }
            }
        }
    }

    private boolean shouldStop(SearchStatistics statistics) {
        if (interrupted || Thread.currentThread().isInterrupted()) {
            LOGGER.warning("Ricerca della prova interrotta");
            statistics.markInterrupted();
            interrupted = false;
            return true;
        }
        if (statistics.getStatesExplored() >= limits.getMaxStates()) {
            LOGGER.warning("Budget di " + limits.getMaxStates() + " stati esaurito");
            statistics.markBudgetExhausted();
            return true;
        }
        return false;
    }

    //endregion
}
