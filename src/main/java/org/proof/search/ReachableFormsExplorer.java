package org.proof.search;

import org.proof.formula.Formula;
import org.proof.rules.RuleCatalog;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ESPLORATORE DELLE FORME RAGGIUNGIBILI - Enumerazione esaustiva limitata
 *
 * Visita in profondità tutte le formule raggiungibili dalla formula iniziale con
 * passi ripetuti della chiusura di riscrittura, senza obiettivo, e le raccoglie.
 *
 * LIMITI:
 * - Profondità: una formula a maxDepth passi non viene espansa
 * - Dimensione: una formula oltre maxSize viene raccolta ma non espansa
 *
 * Una formula raggiunta di nuovo con meno passi viene riespansa, così il risultato
 * è esattamente l'insieme delle formule raggiungibili entro maxDepth passi.
 * La formula iniziale compare nel risultato solo se viene ri-derivata.
 */
public class ReachableFormsExplorer {

    private static final Logger LOGGER = Logger.getLogger(ReachableFormsExplorer.class.getName());

    private final RewriteClosure closure;
    private final SearchLimits limits;

    private volatile boolean interrupted = false;

    private SearchStatistics statistics = new SearchStatistics();

    public ReachableFormsExplorer(RuleCatalog catalog, SearchLimits limits) {
        if (limits == null) {
            throw new IllegalArgumentException("Limiti di ricerca non possono essere null");
        }
        this.closure = new RewriteClosure(catalog);
        this.limits = limits;
    }

    /**
     * Forme raggiungibili entro maxDepth passi, espandendo solo formule di dimensione al più maxSize.
     */
    public static Set<Formula> reachableForms(Formula start, RuleCatalog catalog, int maxDepth, int maxSize) {
        return new ReachableFormsExplorer(catalog, SearchLimits.of(maxSize, maxDepth)).explore(start);
    }

    /**
     * METODO PRINCIPALE - Enumera le forme raggiungibili da start.
     *
     * @param start formula di partenza
     * @return insieme delle formule distinte incontrate, nell'ordine di scoperta
     * @throws IllegalArgumentException se start è null
     */
    public Set<Formula> explore(Formula start) {
        if (start == null) {
            throw new IllegalArgumentException("Formula iniziale non può essere null");
        }

        LOGGER.fine("Enumerazione forme di [" + start + "] con " + limits);
        statistics = new SearchStatistics();

        Set<Formula> forms = new LinkedHashSet<>();
        Map<Formula, Integer> shallowestDepth = new HashMap<>();
        shallowestDepth.put(start, 0);

        visit(start, 0, forms, shallowestDepth);

        statistics.stopTimer();
        LOGGER.info("Trovate " + forms.size() + " forme raggiungibili da [" + start + "]");
        return Collections.unmodifiableSet(forms);
    }

    private void visit(Formula formula, int depth, Set<Formula> forms, Map<Formula, Integer> shallowestDepth) {
        if (shouldStop()) {
            return;
        }
        if (depth >= limits.getMaxDepth() || formula.size() > limits.getMaxSize()) {
            statistics.incrementStatesPruned();
            return;
        }

        statistics.incrementStatesExplored();
        statistics.updateDepth(depth);

        for (Formula next : closure.closure(formula)) {
            if (forms.add(next)) {
                statistics.incrementStatesGenerated();
            }

            Integer known = shallowestDepth.get(next);
            if (known == null || known > depth + 1) {
                shallowestDepth.put(next, depth + 1);
                visit(next, depth + 1, forms, shallowestDepth);
            }
        }
    }

    private boolean shouldStop() {
        if (statistics.isInterrupted() || statistics.isBudgetExhausted()) {
            return true;
        }
        if (interrupted || Thread.currentThread().isInterrupted()) {
            LOGGER.warning("Enumerazione delle forme interrotta");
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

    /**
     * Interrompe l'enumerazione in corso o la prossima; la richiesta vale per una sola enumerazione.
     */
    public void interrupt() {
        interrupted = true;
    }

    /**
     * Statistiche dell'ultima enumerazione.
     */
    public SearchStatistics getStatistics() {
        return statistics;
    }
}
