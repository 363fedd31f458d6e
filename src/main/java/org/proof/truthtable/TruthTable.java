package org.proof.truthtable;

import org.proof.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * TAVOLA DI VERITÀ - Valutazione di una formula su tutti gli assegnamenti
 *
 * Le variabili sono ordinate alfabeticamente; le righe enumerano gli assegnamenti
 * in ordine binario, con la prima riga tutta falsa e l'ultima tutta vera.
 *
 * FORMATO OUTPUT:
 * A B OUT
 * F F F
 * F T F
 * T F F
 * T T T
 */
public final class TruthTable {

    private static final Logger LOGGER = Logger.getLogger(TruthTable.class.getName());

    /** Oltre questo numero di variabili la tavola non viene generata */
    public static final int MAX_VARIABLES = 15;

    /**
     * Classificazione semantica della formula.
     */
    public enum Classification {
        TAUTOLOGY,      // vera in ogni riga
        CONTRADICTION,  // falsa in ogni riga
        CONTINGENT      // né l'una né l'altra
    }

    /**
     * Riga della tavola: assegnamento e valore della formula.
     */
    public static final class Row {
        private final Map<String, Boolean> assignment;
        private final boolean result;

        Row(Map<String, Boolean> assignment, boolean result) {
            this.assignment = Collections.unmodifiableMap(assignment);
            this.result = result;
        }

        public Map<String, Boolean> getAssignment() {
            return assignment;
        }

        public boolean getResult() {
            return result;
        }
    }

    private final Formula formula;
    private final List<String> variables;
    private final List<Row> rows;

    private TruthTable(Formula formula, List<String> variables, List<Row> rows) {
        this.formula = formula;
        this.variables = List.copyOf(variables);
        this.rows = List.copyOf(rows);
    }

    //region COSTRUZIONE

    /**
     * Genera la tavola di verità della formula.
     *
     * @throws IllegalArgumentException se la formula ha più di MAX_VARIABLES variabili
     */
    public static TruthTable of(Formula formula) {
        return over(formula, formula.variables());
    }

    private static TruthTable over(Formula formula, Set<String> variableSet) {
        List<String> variables = new ArrayList<>(variableSet);
        if (variables.size() > MAX_VARIABLES) {
            throw new IllegalArgumentException("Troppe variabili per la tavola di verità: "
                    + variables.size() + " (massimo " + MAX_VARIABLES + ")");
        }

        int rowCount = 1 << variables.size();
        List<Row> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            Map<String, Boolean> assignment = assignmentFor(variables, i);
            rows.add(new Row(assignment, formula.evaluate(assignment)));
        }

        LOGGER.fine("Tavola di verità generata: " + variables.size() + " variabili, " + rowCount + " righe");
        return new TruthTable(formula, variables, rows);
    }

    /**
     * Assegnamento della riga: la prima variabile è il bit più significativo.
     */
    private static Map<String, Boolean> assignmentFor(List<String> variables, int row) {
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (int j = 0; j < variables.size(); j++) {
            int bit = variables.size() - 1 - j;
            assignment.put(variables.get(j), ((row >> bit) & 1) == 1);
        }
        return assignment;
    }

    //endregion

    //region ANALISI

    public Classification classification() {
        long satisfied = rows.stream().filter(Row::getResult).count();
        if (satisfied == rows.size()) return Classification.TAUTOLOGY;
        if (satisfied == 0) return Classification.CONTRADICTION;
        return Classification.CONTINGENT;
    }

    public List<Map<String, Boolean>> satisfyingAssignments() {
        return rows.stream()
                .filter(Row::getResult)
                .map(Row::getAssignment)
                .collect(Collectors.toList());
    }

    /**
     * Equivalenza semantica: stesso valore su ogni assegnamento dell'unione delle variabili.
     */
    public static boolean equivalent(Formula first, Formula second) {
        Set<String> variables = sharedVariables(first, second);

        TruthTable firstTable = over(first, variables);
        TruthTable secondTable = over(second, variables);
        for (int i = 0; i < firstTable.rows.size(); i++) {
            if (firstTable.rows.get(i).result != secondTable.rows.get(i).result) {
                return false;
            }
        }
        return true;
    }

    /**
     * Vero se la tavola congiunta delle due formule resta entro MAX_VARIABLES,
     * cioè se {@link #equivalent} può essere calcolata.
     */
    public static boolean isTabulable(Formula first, Formula second) {
        return sharedVariables(first, second).size() <= MAX_VARIABLES;
    }

    private static Set<String> sharedVariables(Formula first, Formula second) {
        Set<String> variables = new TreeSet<>(first.variables());
        variables.addAll(second.variables());
        return variables;
    }

    //endregion

    //region ACCESSO E FORMATTAZIONE

    public Formula getFormula() {
        return formula;
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<Row> getRows() {
        return rows;
    }

    /**
     * Intestazione con le variabili e OUT, poi una riga T/F per assegnamento.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();

        List<String> header = new ArrayList<>(variables);
        header.add("OUT");
        sb.append(String.join(" ", header)).append('\n');

        for (Row row : rows) {
            List<String> cells = new ArrayList<>();
            for (String variable : variables) {
                cells.add(symbol(row.assignment.get(variable)));
            }
            cells.add(symbol(row.result));
            sb.append(String.join(" ", cells)).append('\n');
        }
        return sb.toString();
    }

    private static String symbol(boolean value) {
        return value ? "T" : "F";
    }

    //endregion
}
