package org.proof.search;

import org.proof.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Nodo dell'albero di ricerca: formula raggiunta, riscrittura che l'ha prodotta
 * e collegamento al nodo padre. La radice non ha né riscrittura né padre.
 */
final class ProofNode {

    private final Formula formula;
    private final Rewrite rewrite;
    private final ProofNode parent;
    private final int depth;

    private ProofNode(Formula formula, Rewrite rewrite, ProofNode parent, int depth) {
        this.formula = formula;
        this.rewrite = rewrite;
        this.parent = parent;
        this.depth = depth;
    }

    static ProofNode root(Formula start) {
        return new ProofNode(start, null, null, 0);
    }

    ProofNode child(Rewrite rewrite) {
        return new ProofNode(rewrite.getResult(), rewrite, this, depth + 1);
    }

    Formula getFormula() {
        return formula;
    }

    int getDepth() {
        return depth;
    }

    /**
     * Ricostruisce il percorso risalendo i padri fino alla radice e invertendo
     * l'ordine: il primo elemento è la prima riscrittura applicata alla formula iniziale.
     */
    List<Rewrite> backtrack() {
        List<Rewrite> path = new ArrayList<>(depth);
        for (ProofNode current = this; current.parent != null; current = current.parent) {
            path.add(current.rewrite);
        }
        Collections.reverse(path);
        return path;
    }
}
