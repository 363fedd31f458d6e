package org.proof.parser;

/**
 * Errore sintattico nel testo di una formula (parentesi sbilanciate,
 * operando mancante, simbolo sconosciuto, formula vuota).
 */
public class FormulaSyntaxException extends RuntimeException {

    private final int line;
    private final int column;

    public FormulaSyntaxException(String message, int line, int column, Throwable cause) {
        super(String.format("Errore sintattico (riga %d, colonna %d): %s", line, column, message), cause);
        this.line = line;
        this.column = column;
    }

    public FormulaSyntaxException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
