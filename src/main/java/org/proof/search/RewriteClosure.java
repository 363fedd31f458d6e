package org.proof.search;

import org.proof.formula.Formula;
import org.proof.rules.RewriteRule;
import org.proof.rules.RuleCatalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CHIUSURA DI RISCRITTURA A UN PASSO
 *
 * Calcola tutte le formule ottenibili applicando esattamente una regola in
 * esattamente una posizione dell'albero, lasciando invariato il resto.
 *
 * ORDINE DI VISITA (determina lo spareggio della ricerca):
 * 1. Regole applicabili alla radice, nell'ordine del catalogo
 * 2. Per NOT: riscritture dell'operando, riavvolte nella negazione
 * 3. Per i binari: riscritture del sinistro, poi del destro
 *
 * I duplicati (stesso risultato strutturale) collassano nella prima occorrenza.
 * La chiusura è pura: non modifica l'input e dà sempre lo stesso risultato.
 */
public class RewriteClosure {

    private static final Logger LOGGER = Logger.getLogger(RewriteClosure.class.getName());

    private final RuleCatalog catalog;

    public RewriteClosure(RuleCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalogo regole non può essere null");
        }
        this.catalog = catalog;
    }

    /**
     * Insieme ordinato delle formule raggiungibili con una riscrittura.
     */
    public Set<Formula> closure(Formula formula) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(collect(formula).keySet()));
    }

    /**
     * Riscritture a un passo con regola, posizione e sottoformula riscritta.
     * Un elemento per ciascun risultato distinto, nell'ordine di visita.
     */
    public List<Rewrite> rewrites(Formula formula) {
        List<Rewrite> rewrites = new ArrayList<>(collect(formula).values());

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(String.format("Chiusura di [%s]: %d riscritture", formula, rewrites.size()));
        }
        return rewrites;
    }

    private Map<Formula, Rewrite> collect(Formula formula) {
        Map<Formula, Rewrite> results = new LinkedHashMap<>();

        // Radice
        for (RewriteRule rule : catalog) {
            if (rule.canApply(formula)) {
                Formula replacement = rule.apply(formula);
                results.putIfAbsent(replacement,
                        new Rewrite(rule, Formula.ROOT, formula, replacement, replacement));
            }
        }

        // Sottoformule
        switch (formula.type()) {
            case CONSTANT, VARIABLE -> { /* foglie: nessuna sottoformula */ }
            case NOT -> collectNested(formula, 0, formula.operand(), results);
            case AND, OR, IMPLIES, IFF -> {
                collectNested(formula, 0, formula.left(), results);
                collectNested(formula, 1, formula.right(), results);
            }
        }

        return results;
    }

    private void collectNested(Formula parent, int childIndex, Formula child, Map<Formula, Rewrite> results) {
        for (Rewrite nested : collect(child).values()) {
            Formula rebuilt = parent.withChild(childIndex, nested.getResult());
            results.putIfAbsent(rebuilt, nested.nestedIn(childIndex, rebuilt));
        }
    }
}
