package org.proof.search;

import org.proof.formula.Formula;
import org.proof.rules.RewriteRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Singola riscrittura: una regola applicata a una sottoformula in una posizione.
 *
 * È l'elemento prodotto dalla chiusura a un passo e, nella prova ricostruita,
 * un passo della dimostrazione. Contiene:
 * - la regola applicata (e quindi il suo tag)
 * - la posizione della sottoformula riscritta (indici figlio dalla radice)
 * - la sottoformula prima e dopo la riscrittura
 * - la formula completa risultante
 */
public final class Rewrite {

    private final RewriteRule rule;
    private final List<Integer> position;
    private final Formula rewritten;
    private final Formula replacement;
    private final Formula result;

    Rewrite(RewriteRule rule, List<Integer> position, Formula rewritten, Formula replacement, Formula result) {
        this.rule = rule;
        this.position = List.copyOf(position);
        this.rewritten = rewritten;
        this.replacement = replacement;
        this.result = result;
    }

    /**
     * Stessa riscrittura vista dal nodo padre: la posizione guadagna l'indice
     * del figlio in testa e il risultato diventa la formula del padre ricostruita.
     */
    Rewrite nestedIn(int childIndex, Formula parentResult) {
        List<Integer> nestedPosition = new ArrayList<>(position.size() + 1);
        nestedPosition.add(childIndex);
        nestedPosition.addAll(position);
        return new Rewrite(rule, nestedPosition, rewritten, replacement, parentResult);
    }

    /**
     * Riapplica la riscrittura a una formula: verifica che nella posizione registrata
     * ci sia la sottoformula attesa e la sostituisce con il risultato della regola.
     *
     * @throws IllegalStateException se la formula non contiene la sottoformula attesa
     */
    public Formula replayOn(Formula formula) {
        Formula target = formula.subformulaAt(position);
        if (!target.equals(rewritten)) {
            throw new IllegalStateException("Sottoformula inattesa in " + position + ": " + target
                    + " (attesa " + rewritten + ")");
        }
        return formula.replaceAt(position, rule.apply(target));
    }

    public RewriteRule getRule() {
        return rule;
    }

    public String getRuleTag() {
        return rule.getTag();
    }

    public List<Integer> getPosition() {
        return position;
    }

    public Formula getRewritten() {
        return rewritten;
    }

    public Formula getReplacement() {
        return replacement;
    }

    public Formula getResult() {
        return result;
    }

    @Override
    public String toString() {
        return result + " by " + rule.getTag();
    }
}
