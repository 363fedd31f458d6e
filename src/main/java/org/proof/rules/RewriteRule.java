package org.proof.rules;

import org.proof.formula.Formula;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * LEGGE DI RISCRITTURA - Coppia immutabile guardia + trasformazione
 *
 * Ogni regola riconosce una forma strutturale (guardia) e produce una formula
 * logicamente equivalente (trasformazione). Le regole sono pure e senza stato.
 *
 * CONTRATTO:
 * - canApply: totale su qualunque formula, senza effetti collaterali
 * - apply: richiede canApply vero; altrimenti è un errore di programmazione
 *
 * IDENTIFICAZIONE:
 * - name: nome univoco nel catalogo (es. DeMorganAnd)
 * - tag: famiglia usata per etichettare i passi di prova (es. dm)
 * - law: descrizione leggibile della legge
 */
public final class RewriteRule {

    private final String name;
    private final String tag;
    private final String law;
    private final Predicate<Formula> guard;
    private final UnaryOperator<Formula> transform;

    RewriteRule(String name, String tag, String law,
                Predicate<Formula> guard, UnaryOperator<Formula> transform) {
        if (name == null || tag == null || guard == null || transform == null) {
            throw new IllegalArgumentException("Regola incompleta: " + name);
        }
        this.name = name;
        this.tag = tag;
        this.law = law;
        this.guard = guard;
        this.transform = transform;
    }

    /**
     * Verifica strutturale della forma riconosciuta dalla regola.
     */
    public boolean canApply(Formula formula) {
        return guard.test(formula);
    }

    /**
     * Applica la regola alla radice della formula.
     *
     * @param formula formula su cui la guardia è vera
     * @return nuova formula equivalente
     * @throws IllegalStateException se la guardia è falsa (uso improprio della regola)
     */
    public Formula apply(Formula formula) {
        if (!guard.test(formula)) {
            throw new IllegalStateException("Regola " + name + " non applicabile a: " + formula);
        }
        return transform.apply(formula);
    }

    public String getName() {
        return name;
    }

    public String getTag() {
        return tag;
    }

    public String getLaw() {
        return law;
    }

    @Override
    public String toString() {
        return name + " [" + tag + "] " + law;
    }
}
