package org.proof.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.proof.formula.Formula;
import org.proof.rules.RuleCatalog;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.proof.formula.Formula.and;
import static org.proof.formula.Formula.or;
import static org.proof.formula.Formula.variable;

class ReachableFormsExplorerTest {

    private static final Formula A = variable("A");
    private static final Formula B = variable("B");
    private static final Formula C = variable("C");
    private static final Formula P = variable("P");

    private static final RuleCatalog CATALOG = RuleCatalog.standard();

    @Test
    @DisplayName("P & P raggiunge P per idempotenza")
    void testReachableForms_Idempotence() {
        Set<Formula> forms = ReachableFormsExplorer.reachableForms(and(P, P), CATALOG, 3, 10);

        assertTrue(forms.contains(P));
    }

    @Test
    @DisplayName("Profondità zero: nessuna forma")
    void testReachableForms_ZeroDepth_ShouldBeEmpty() {
        assertTrue(ReachableFormsExplorer.reachableForms(and(A, B), CATALOG, 0, 10).isEmpty());
    }

    @Test
    @DisplayName("La formula iniziale compare solo se ri-derivata")
    void testReachableForms_StartOnlyWhenRederived() {
        Set<Formula> oneStep = ReachableFormsExplorer.reachableForms(and(A, B), CATALOG, 1, 10);
        Set<Formula> twoSteps = ReachableFormsExplorer.reachableForms(and(A, B), CATALOG, 2, 10);

        assertAll("Start formula",
                () -> assertEquals(Set.of(and(B, A)), oneStep),
                () -> assertEquals(Set.of(and(B, A), and(A, B)), twoSteps)
        );
    }

    @Test
    @DisplayName("Formule oltre maxSize vengono raccolte ma non espanse")
    void testReachableForms_SizeBound() {
        Formula start = and(A, or(B, C));
        Formula distributed = or(and(A, B), and(A, C));
        Formula onlyThroughDistributed = or(and(B, A), and(A, C));

        Set<Formula> bounded = ReachableFormsExplorer.reachableForms(start, CATALOG, 2, 5);
        Set<Formula> wider = ReachableFormsExplorer.reachableForms(start, CATALOG, 2, 7);

        assertAll("Size bound",
                () -> assertTrue(bounded.contains(distributed)),
                () -> assertFalse(bounded.contains(onlyThroughDistributed)),
                () -> assertTrue(wider.contains(onlyThroughDistributed))
        );
    }

    @Test
    @DisplayName("Una forma raggiunta prima in profondità viene riespansa dal percorso più corto")
    void testReachableForms_MatchesBreadthFirstReachability() {
        Formula start = and(and(A, B), C);
        Set<Formula> forms = ReachableFormsExplorer.reachableForms(start, CATALOG, 3, 10);

        // ogni forma a distanza al più 2 deve essere stata espansa fino a distanza 3
        for (Formula form : ReachableFormsExplorer.reachableForms(start, CATALOG, 2, 10)) {
            assertTrue(forms.containsAll(new RewriteClosure(CATALOG).closure(form)),
                    () -> "Forma non espansa: " + form);
        }
    }

    @Test
    @DisplayName("Budget di stati: si espande solo la formula iniziale")
    void testExplore_StateBudget() {
        Formula start = and(A, or(B, C));
        ReachableFormsExplorer explorer = new ReachableFormsExplorer(CATALOG,
                SearchLimits.of(10, 3).withMaxStates(1));

        Set<Formula> forms = explorer.explore(start);

        assertAll("Budget",
                () -> assertEquals(new RewriteClosure(CATALOG).closure(start), forms),
                () -> assertTrue(explorer.getStatistics().isBudgetExhausted()),
                () -> assertEquals(1, explorer.getStatistics().getStatesExplored())
        );
    }

    @Test
    @DisplayName("L'interruzione vale per una sola enumerazione")
    void testInterrupt_ConsumedByExplore() {
        ReachableFormsExplorer explorer = new ReachableFormsExplorer(CATALOG, SearchLimits.of(10, 2));
        explorer.interrupt();

        Set<Formula> interrupted = explorer.explore(and(A, B));
        boolean firstInterrupted = explorer.getStatistics().isInterrupted();
        Set<Formula> next = explorer.explore(and(A, B));

        assertAll("Interrupt consumed",
                () -> assertTrue(firstInterrupted),
                () -> assertTrue(interrupted.isEmpty()),
                () -> assertEquals(Set.of(and(B, A), and(A, B)), next),
                () -> assertFalse(explorer.getStatistics().isInterrupted())
        );
    }

    @Test
    @DisplayName("Il risultato non è modificabile")
    void testExplore_Unmodifiable() {
        Set<Formula> forms = ReachableFormsExplorer.reachableForms(and(A, B), CATALOG, 1, 10);

        assertThrows(UnsupportedOperationException.class, () -> forms.add(A));
    }
}
