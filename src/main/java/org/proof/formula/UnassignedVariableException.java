package org.proof.formula;

/**
 * Sollevata quando la valutazione incontra una variabile assente dall'assegnamento.
 * Errore del chiamante: l'assegnamento non viene mai completato con valori di default.
 */
public class UnassignedVariableException extends IllegalArgumentException {

    private final String variable;

    public UnassignedVariableException(String variable) {
        super("Variabile non assegnata: " + variable);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
