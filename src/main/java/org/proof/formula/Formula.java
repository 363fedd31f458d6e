package org.proof.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile con uguaglianza strutturale
 *
 * Rappresenta formule della logica proposizionale come albero di nodi tipizzati.
 * Ogni nodo è immutabile: le trasformazioni producono sempre un nuovo albero che
 * condivide con l'originale i sottoalberi non modificati.
 *
 * VARIANTI SUPPORTATE:
 * - CONSTANT: costante logica (true / false)
 * - VARIABLE: variabile proposizionale (A, B, P, ...)
 * - NOT: negazione unaria (!A)
 * - AND, OR, IMPLIES, IFF: connettivi binari (A & B, A | B, A => B, A <=> B)
 *
 * UGUAGLIANZA E HASH:
 * - Due formule sono uguali se hanno stessa variante e figli ricorsivamente uguali
 * - Nessuna rinomina: Variable(A) e Variable(B) non sono mai uguali
 * - equals/hashCode sono calcolati in modo uniforme sugli stessi campi per ogni
 *   variante, e l'hash è memorizzato alla costruzione (usato dagli insiemi visitati)
 *
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Varianti chiuse dell'albero. Ogni switch sulle varianti è esaustivo.
     */
    public enum Type {
        CONSTANT,   // Costante logica: true, false
        VARIABLE,   // Variabile atomica: P, Q, R, ...
        NOT,        // Negazione: !A
        AND,        // Congiunzione: A & B
        OR,         // Disgiunzione: A | B
        IMPLIES,    // Implicazione: A => B
        IFF         // Biimplicazione: A <=> B
    }

    public static final Formula TRUE = new Formula(Type.CONSTANT, null, Boolean.TRUE, null, null);
    public static final Formula FALSE = new Formula(Type.CONSTANT, null, Boolean.FALSE, null, null);

    /** Posizione della radice: lista vuota di indici figlio */
    public static final List<Integer> ROOT = List.of();

    private final Type type;

    /** Nome della variabile (solo VARIABLE) */
    private final String name;

    /** Valore della costante (solo CONSTANT) */
    private final Boolean value;

    /** Operando di NOT oppure operando sinistro dei connettivi binari */
    private final Formula left;

    /** Operando destro (solo connettivi binari) */
    private final Formula right;

    private final int size;
    private final int hash;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String name, Boolean value, Formula left, Formula right) {
        this.type = type;
        this.name = name;
        this.value = value;
        this.left = left;
        this.right = right;
        this.size = computeSize();
        this.hash = Objects.hash(type, name, value, left, right);
    }

    /**
     * Restituisce la costante logica corrispondente al valore.
     */
    public static Formula constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Costruisce una variabile proposizionale.
     *
     * @param name nome della variabile (non null, non vuoto)
     * @throws IllegalArgumentException se il nome è null o vuoto
     */
    public static Formula variable(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
        return new Formula(Type.VARIABLE, name.trim(), null, null, null);
    }

    public static Formula not(Formula operand) {
        requireOperand(operand, Type.NOT);
        return new Formula(Type.NOT, null, null, operand, null);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Type.IMPLIES, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Type.IFF, left, right);
    }

    /**
     * Costruisce un nodo binario del tipo indicato.
     *
     * @param type uno tra AND, OR, IMPLIES, IFF
     * @throws IllegalArgumentException se il tipo non è binario o un operando è null
     */
    public static Formula binary(Type type, Formula left, Formula right) {
        if (!isBinary(type)) {
            throw new IllegalArgumentException("Tipo non binario: " + type);
        }
        requireOperand(left, type);
        requireOperand(right, type);
        return new Formula(type, null, null, left, right);
    }

    private static void requireOperand(Formula operand, Type type) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando null per il connettivo " + type);
        }
    }

    private static boolean isBinary(Type type) {
        return switch (type) {
            case AND, OR, IMPLIES, IFF -> true;
            case CONSTANT, VARIABLE, NOT -> false;
        };
    }

    //endregion

    //region ACCESSO AI CAMPI

    public Type type() {
        return type;
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    public boolean isBinary() {
        return isBinary(type);
    }

    public boolean isConstant(boolean expected) {
        return type == Type.CONSTANT && value == expected;
    }

    /**
     * Nome della variabile.
     *
     * @throws IllegalStateException se il nodo non è una variabile
     */
    public String name() {
        requireType(Type.VARIABLE);
        return name;
    }

    public boolean value() {
        requireType(Type.CONSTANT);
        return value;
    }

    /** Operando della negazione */
    public Formula operand() {
        requireType(Type.NOT);
        return left;
    }

    public Formula left() {
        requireBinary();
        return left;
    }

    public Formula right() {
        requireBinary();
        return right;
    }

    private void requireType(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Atteso nodo " + expected + ", trovato " + type);
        }
    }

    private void requireBinary() {
        if (!isBinary()) {
            throw new IllegalStateException("Atteso connettivo binario, trovato " + type);
        }
    }

    //endregion

    //region METRICHE STRUTTURALI

    private int computeSize() {
        return switch (type) {
            case CONSTANT, VARIABLE -> 1;
            case NOT -> left.size + 1;
            case AND, OR, IMPLIES, IFF -> left.size + right.size + 1;
        };
    }

    /**
     * Numero di nodi dell'albero. Costanti e variabili valgono 1.
     * Usato come limite di terminazione dalla ricerca.
     */
    public int size() {
        return size;
    }

    /**
     * Profondità massima dell'albero (foglie a profondità 0).
     */
    public int depth() {
        return switch (type) {
            case CONSTANT, VARIABLE -> 0;
            case NOT -> 1 + left.depth();
            case AND, OR, IMPLIES, IFF -> 1 + Math.max(left.depth(), right.depth());
        };
    }

    /**
     * Variabili libere della formula in ordine alfabetico.
     */
    public Set<String> variables() {
        Set<String> variables = new TreeSet<>();
        collectVariables(variables);
        return Collections.unmodifiableSet(variables);
    }

    private void collectVariables(Set<String> variables) {
        switch (type) {
            case CONSTANT -> { /* nessuna variabile */ }
            case VARIABLE -> variables.add(name);
            case NOT -> left.collectVariables(variables);
            case AND, OR, IMPLIES, IFF -> {
                left.collectVariables(variables);
                right.collectVariables(variables);
            }
        }
    }

    //endregion

    //region NAVIGAZIONE PER POSIZIONE

    /**
     * Restituisce la sottoformula alla posizione indicata.
     *
     * Una posizione è la lista degli indici figlio dalla radice:
     * 0 = operando di NOT o operando sinistro, 1 = operando destro.
     *
     * @param position percorso dalla radice (lista vuota = radice)
     * @throws IllegalArgumentException se la posizione non esiste nell'albero
     */
    public Formula subformulaAt(List<Integer> position) {
        Formula current = this;
        for (int index : position) {
            current = current.child(index);
        }
        return current;
    }

    /**
     * Sostituisce la sottoformula alla posizione indicata, ricostruendo solo
     * i nodi lungo il percorso. Il resto dell'albero è condiviso.
     */
    public Formula replaceAt(List<Integer> position, Formula replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("Sostituto null per la posizione " + position);
        }
        return replaceAt(position, 0, replacement);
    }

    private Formula replaceAt(List<Integer> position, int offset, Formula replacement) {
        if (offset == position.size()) {
            return replacement;
        }
        int index = position.get(offset);
        Formula rebuiltChild = child(index).replaceAt(position, offset + 1, replacement);
        return withChild(index, rebuiltChild);
    }

    private Formula child(int index) {
        return switch (type) {
            case CONSTANT, VARIABLE ->
                    throw new IllegalArgumentException("Il nodo " + type + " non ha figli");
            case NOT -> {
                if (index != 0) {
                    throw new IllegalArgumentException("Indice figlio non valido per NOT: " + index);
                }
                yield left;
            }
            case AND, OR, IMPLIES, IFF -> switch (index) {
                case 0 -> left;
                case 1 -> right;
                default -> throw new IllegalArgumentException("Indice figlio non valido: " + index);
            };
        };
    }

    /**
     * Copia del nodo con il figlio indicato sostituito.
     */
    public Formula withChild(int index, Formula child) {
        if (type == Type.NOT) {
            child(index);
            return not(child);
        }
        requireBinary();
        return index == 0 ? binary(type, child, right) : binary(type, left, child);
    }

    /**
     * Tutte le posizioni dell'albero in pre-ordine (radice, sinistra, destra).
     */
    public List<List<Integer>> positions() {
        List<List<Integer>> positions = new ArrayList<>();
        collectPositions(new ArrayList<>(), positions);
        return positions;
    }

    private void collectPositions(List<Integer> prefix, List<List<Integer>> positions) {
        positions.add(List.copyOf(prefix));
        int children = switch (type) {
            case CONSTANT, VARIABLE -> 0;
            case NOT -> 1;
            case AND, OR, IMPLIES, IFF -> 2;
        };
        for (int i = 0; i < children; i++) {
            prefix.add(i);
            child(i).collectPositions(prefix, positions);
            prefix.remove(prefix.size() - 1);
        }
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valuta la formula rispetto a un assegnamento delle variabili.
     *
     * @param assignment mappa nome variabile -> valore di verità
     * @return valore di verità della formula
     * @throws UnassignedVariableException se una variabile della formula non è assegnata
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        return switch (type) {
            case CONSTANT -> value;
            case VARIABLE -> {
                Boolean assigned = assignment.get(name);
                if (assigned == null) {
                    throw new UnassignedVariableException(name);
                }
                yield assigned;
            }
            case NOT -> !left.evaluate(assignment);
            case AND -> left.evaluate(assignment) && right.evaluate(assignment);
            case OR -> left.evaluate(assignment) || right.evaluate(assignment);
            case IMPLIES -> !left.evaluate(assignment) || right.evaluate(assignment);
            case IFF -> left.evaluate(assignment) == right.evaluate(assignment);
        };
    }

    //endregion

    //region UGUAGLIANZA E HASH

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Formula)) return false;

        Formula other = (Formula) obj;
        return hash == other.hash
                && type == other.type
                && Objects.equals(name, other.name)
                && Objects.equals(value, other.value)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Notazione infissa con simboli !, &, |, =>, <=>.
     *
     * FORMATO OUTPUT:
     * - Foglie: nome variabile oppure true / false
     * - Negazioni: !A, !!A, !(A & B)
     * - Binari: operandi binari annidati tra parentesi, radice senza parentesi
     *   (A & (B | C), (A => B) & (B => A))
     */
    @Override
    public String toString() {
        return switch (type) {
            case CONSTANT, VARIABLE, NOT -> toOperandString();
            case AND, OR, IMPLIES, IFF ->
                    left.toOperandString() + " " + symbol(type) + " " + right.toOperandString();
        };
    }

    private String toOperandString() {
        return switch (type) {
            case CONSTANT -> value.toString();
            case VARIABLE -> name;
            case NOT -> "!" + left.toOperandString();
            case AND, OR, IMPLIES, IFF -> "(" + this + ")";
        };
    }

    /**
     * Forma canonica di debug che nomina ogni variante e i suoi figli,
     * es. And(Variable(A), Not(Variable(B))).
     */
    public String toDebugString() {
        return switch (type) {
            case CONSTANT -> "Constant(" + value + ")";
            case VARIABLE -> "Variable(" + name + ")";
            case NOT -> "Not(" + left.toDebugString() + ")";
            case AND -> "And(" + left.toDebugString() + ", " + right.toDebugString() + ")";
            case OR -> "Or(" + left.toDebugString() + ", " + right.toDebugString() + ")";
            case IMPLIES -> "Implies(" + left.toDebugString() + ", " + right.toDebugString() + ")";
            case IFF -> "Iff(" + left.toDebugString() + ", " + right.toDebugString() + ")";
        };
    }

    /**
     * Simbolo infisso del connettivo.
     */
    public static String symbol(Type type) {
        return switch (type) {
            case NOT -> "!";
            case AND -> "&";
            case OR -> "|";
            case IMPLIES -> "=>";
            case IFF -> "<=>";
            case CONSTANT, VARIABLE -> "";
        };
    }

    //endregion
}
