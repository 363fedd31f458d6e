package org.proof.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.proof.formula.Formula;
import org.proof.rules.RuleCatalog;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.proof.formula.Formula.and;
import static org.proof.formula.Formula.iff;
import static org.proof.formula.Formula.implies;
import static org.proof.formula.Formula.not;
import static org.proof.formula.Formula.or;
import static org.proof.formula.Formula.variable;

class TransformationProverTest {

    private static final Formula A = variable("A");
    private static final Formula B = variable("B");
    private static final Formula C = variable("C");
    private static final Formula P = variable("P");

    private static final RuleCatalog CATALOG = RuleCatalog.standard();

    private static List<String> tags(List<Rewrite> steps) {
        return steps.stream().map(Rewrite::getRuleTag).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Prove in un passo")
    class SingleStepTests {

        @Test
        @DisplayName("!(A & B) diventa !A | !B con De Morgan")
        void testFindPath_DeMorgan() {
            Optional<List<Rewrite>> path = TransformationProver.findPath(
                    not(and(A, B)), or(not(A), not(B)), CATALOG, 15);

            assertAll("De Morgan",
                    () -> assertTrue(path.isPresent()),
                    () -> assertEquals(List.of("dm"), tags(path.get())),
                    () -> assertEquals(or(not(A), not(B)), path.get().get(0).getResult())
            );
        }

        @Test
        @DisplayName("P & !P diventa false per contraddizione")
        void testFindPath_Contradiction() {
            Optional<List<Rewrite>> path = TransformationProver.findPath(
                    and(P, not(P)), Formula.FALSE, CATALOG, 15);

            assertAll("Contradiction",
                    () -> assertTrue(path.isPresent()),
                    () -> assertEquals(List.of("contr"), tags(path.get())),
                    () -> assertSame(Formula.FALSE, path.get().get(0).getResult())
            );
        }

        @Test
        @DisplayName("A <=> B diventa (A => B) & (B => A) per biimplicazione")
        void testFindPath_Equivalence() {
            Optional<List<Rewrite>> path = TransformationProver.findPath(
                    iff(A, B), and(implies(A, B), implies(B, A)), CATALOG, 15);

            assertAll("Equivalence",
                    () -> assertTrue(path.isPresent()),
                    () -> assertEquals(List.of("equiv"), tags(path.get()))
            );
        }

        @Test
        @DisplayName("Formula iniziale uguale all'obiettivo: prova vuota")
        void testFindPath_SameFormula_ShouldBeEmpty() {
            Formula formula = implies(and(A, B), C);
            TransformationProof proof = new TransformationProver().findPath(formula, formula);

            assertAll("Empty proof",
                    () -> assertTrue(proof.isFound()),
                    () -> assertEquals(0, proof.length()),
                    () -> assertEquals(formula, proof.replay()),
                    () -> assertEquals(Optional.of(List.of()),
                            TransformationProver.findPath(A, A, CATALOG, 1))
            );
        }
    }

    @Nested
    @DisplayName("Prove in più passi")
    class MultiStepTests {

        @Test
        @DisplayName("Spareggio deterministico: radice prima delle sottoformule, poi ordine del catalogo")
        void testFindPath_TieBreaking() {
            TransformationProof proof = new TransformationProver().findPath(not(and(A, B)), or(not(B), not(A)));

            assertAll("Two-step proof",
                    () -> assertTrue(proof.isFound()),
                    () -> assertEquals(List.of("dm", "comm_assoc"), tags(proof.getSteps())),
                    () -> assertEquals(List.of(), proof.getSteps().get(0).getPosition()),
                    () -> assertEquals(or(not(B), not(A)), proof.replay())
            );
        }

        @Test
        @DisplayName("La riapplicazione dei passi riproduce l'obiettivo")
        void testReplay_ReproducesGoal() {
            Formula start = and(A, or(B, C));
            Formula goal = or(and(A, C), and(A, B));
            TransformationProof proof = new TransformationProver().findPath(start, goal);

            assertAll("Replay",
                    () -> assertTrue(proof.isFound()),
                    () -> assertEquals(2, proof.length()),
                    () -> assertEquals(goal, proof.replay()),
                    () -> assertEquals(goal, proof.getSteps().get(1).getResult())
            );
        }

        @Test
        @DisplayName("Passi annidati registrano la posizione della sottoformula")
        void testFindPath_NestedRewrite() {
            Formula start = implies(A, not(not(B)));
            TransformationProof proof = new TransformationProver().findPath(start, implies(A, B));
            Rewrite step = proof.getSteps().get(0);

            assertAll("Nested step",
                    () -> assertEquals(1, proof.length()),
                    () -> assertEquals("neg", step.getRuleTag()),
                    () -> assertEquals(List.of(1), step.getPosition()),
                    () -> assertEquals(not(not(B)), step.getRewritten()),
                    () -> assertEquals(B, step.getReplacement())
            );
        }
    }

    @Nested
    @DisplayName("Limiti ed esiti negativi")
    class BoundsTests {

        @Test
        @DisplayName("Nessuna legge collega A a false: non trovata")
        void testFindPath_NoConnectingLaw() {
            TransformationProof proof = new TransformationProver().findPath(A, Formula.FALSE);

            assertAll("Not found",
                    () -> assertFalse(proof.isFound()),
                    () -> assertTrue(proof.getSteps().isEmpty()),
                    () -> assertEquals(1, proof.getStatistics().getStatesExplored()),
                    () -> assertEquals(Optional.empty(),
                            TransformationProver.findPath(A, Formula.FALSE, CATALOG, 15)),
                    () -> assertThrows(IllegalStateException.class, proof::replay)
            );
        }

        @Test
        @DisplayName("maxSize minore della formula iniziale: nessuna espansione")
        void testFindPath_StartLargerThanMaxSize() {
            TransformationProver prover = new TransformationProver(CATALOG, SearchLimits.sizeOnly(3));
            TransformationProof proof = prover.findPath(not(and(A, B)), or(not(A), not(B)));
            SearchStatistics statistics = proof.getStatistics();

            assertAll("Pruned start",
                    () -> assertFalse(proof.isFound()),
                    () -> assertEquals(1, statistics.getStatesExplored()),
                    () -> assertEquals(1, statistics.getStatesPruned()),
                    () -> assertEquals(0, statistics.getStatesGenerated())
            );
        }

        @Test
        @DisplayName("Limite di profondità sotto la lunghezza della prova")
        void testFindPath_DepthLimit() {
            TransformationProver shallow = new TransformationProver(CATALOG, SearchLimits.of(15, 1));
            TransformationProver deep = new TransformationProver(CATALOG, SearchLimits.of(15, 2));

            assertAll("Depth limit",
                    () -> assertFalse(shallow.findPath(not(and(A, B)), or(not(B), not(A))).isFound()),
                    () -> assertTrue(deep.findPath(not(and(A, B)), or(not(B), not(A))).isFound())
            );
        }

        @Test
        @DisplayName("Budget di stati esaurito")
        void testFindPath_StateBudget() {
            SearchLimits limits = SearchLimits.defaults().withMaxStates(1);
            TransformationProof proof = new TransformationProver(CATALOG, limits)
                    .findPath(not(and(A, B)), or(not(B), not(A)));

            assertAll("Budget",
                    () -> assertFalse(proof.isFound()),
                    () -> assertTrue(proof.getStatistics().isBudgetExhausted()),
                    () -> assertEquals(1, proof.getStatistics().getStatesExplored())
            );
        }

        @Test
        @DisplayName("Interruzione richiesta prima della ricerca")
        void testFindPath_Interrupted() {
            TransformationProver prover = new TransformationProver();
            prover.interrupt();
            TransformationProof proof = prover.findPath(iff(A, B), and(implies(A, B), implies(B, A)));

            assertAll("Interrupted",
                    () -> assertFalse(proof.isFound()),
                    () -> assertTrue(proof.getStatistics().isInterrupted()),
                    () -> assertEquals(0, proof.getStatistics().getStatesExplored())
            );
        }

        @Test
        @DisplayName("L'interruzione vale per una sola ricerca")
        void testInterrupt_ConsumedBySearch() {
            TransformationProver prover = new TransformationProver();
            prover.interrupt();
            TransformationProof interrupted = prover.findPath(A, A);
            TransformationProof next = prover.findPath(A, A);

            assertAll("Interrupt consumed",
                    () -> assertTrue(interrupted.getStatistics().isInterrupted()),
                    () -> assertFalse(interrupted.isFound()),
                    () -> assertTrue(next.isFound()),
                    () -> assertFalse(next.getStatistics().isInterrupted())
            );
        }

        @Test
        @DisplayName("Limiti non validi e formule null rifiutati")
        void testInvalidArguments() {
            assertAll("Invalid arguments",
                    () -> assertThrows(IllegalArgumentException.class, () -> SearchLimits.of(-1, 5)),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> SearchLimits.defaults().withMaxStates(0)),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> new TransformationProver(CATALOG, null)),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> new TransformationProver().findPath(null, A))
            );
        }
    }

    @Nested
    @DisplayName("Cataloghi personalizzati")
    class CustomCatalogTests {

        @Test
        @DisplayName("Solo le leggi scelte partecipano alla ricerca")
        void testFindPath_HandPickedCatalog() {
            RuleCatalog deMorganOnly = RuleCatalog.of(List.of(CATALOG.byName("DeMorganAnd")));
            RuleCatalog deMorganAndSwap = RuleCatalog.of(List.of(
                    CATALOG.byName("DeMorganAnd"), CATALOG.byName("CommutativityOr")));

            Optional<List<Rewrite>> direct = TransformationProver.findPath(
                    not(and(A, B)), or(not(A), not(B)), deMorganOnly, 15);
            Optional<List<Rewrite>> swapped = TransformationProver.findPath(
                    not(and(A, B)), or(not(B), not(A)), deMorganOnly, 15);
            Optional<List<Rewrite>> withSwap = TransformationProver.findPath(
                    not(and(A, B)), or(not(B), not(A)), deMorganAndSwap, 15);

            assertAll("Hand-picked catalog",
                    () -> assertEquals(List.of("dm"), tags(direct.orElseThrow())),
                    () -> assertTrue(swapped.isEmpty()),
                    () -> assertEquals(List.of("dm", "comm_assoc"), tags(withSwap.orElseThrow()))
            );
        }

        @Test
        @DisplayName("Il prover espone i limiti con cui è stato creato")
        void testGetLimits() {
            SearchLimits limits = SearchLimits.of(9, 4).withMaxStates(100);
            TransformationProver prover = new TransformationProver(CATALOG, limits);

            assertAll("Limits",
                    () -> assertSame(limits, prover.getLimits()),
                    () -> assertEquals(SearchLimits.DEFAULT_MAX_DEPTH,
                            new TransformationProver().getLimits().getMaxDepth())
            );
        }
    }

    @Nested
    @DisplayName("Formato della prova")
    class FormatTests {

        @Test
        @DisplayName("Righe numerate con il tag allineato")
        void testFormat_Found() {
            TransformationProof proof = new TransformationProver().findPath(not(and(A, B)), or(not(A), not(B)));

            String expected = "!(A & B)  <->  !A | !B\n\n"
                    + "1) !(A & B)\n"
                    + "2) !A | !B    by dm\n";
            assertEquals(expected, proof.format());
        }

        @Test
        @DisplayName("Messaggio per prova non trovata")
        void testFormat_NotFound() {
            TransformationProof proof = new TransformationProver().findPath(A, Formula.FALSE);

            assertTrue(proof.format().startsWith("Nessuna trasformazione trovata da A a false"));
        }
    }
}
