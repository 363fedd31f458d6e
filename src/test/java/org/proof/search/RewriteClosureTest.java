package org.proof.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.proof.formula.Formula;
import org.proof.rules.RuleCatalog;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.proof.formula.Formula.and;
import static org.proof.formula.Formula.implies;
import static org.proof.formula.Formula.not;
import static org.proof.formula.Formula.or;
import static org.proof.formula.Formula.variable;

class RewriteClosureTest {

    private static final Formula A = variable("A");
    private static final Formula B = variable("B");
    private static final Formula C = variable("C");

    private final RewriteClosure closure = new RewriteClosure(RuleCatalog.standard());

    @Test
    @DisplayName("Radice prima, poi le sottoformule riavvolte nel padre")
    void testClosure_RootThenNested() {
        Formula start = not(and(A, B));

        assertEquals(List.of(or(not(A), not(B)), not(and(B, A))), List.copyOf(closure.closure(start)));
    }

    @Test
    @DisplayName("Le riscritture registrano regola, posizione e sottoformula riscritta")
    void testRewrites_RecordPosition() {
        List<Rewrite> rewrites = closure.rewrites(not(and(A, B)));
        Rewrite nested = rewrites.get(1);

        assertAll("Nested rewrite",
                () -> assertEquals(2, rewrites.size()),
                () -> assertEquals("DeMorganAnd", rewrites.get(0).getRule().getName()),
                () -> assertEquals(Formula.ROOT, rewrites.get(0).getPosition()),
                () -> assertEquals("CommutativityAnd", nested.getRule().getName()),
                () -> assertEquals(List.of(0), nested.getPosition()),
                () -> assertEquals(and(A, B), nested.getRewritten()),
                () -> assertEquals(and(B, A), nested.getReplacement()),
                () -> assertEquals(not(and(B, A)), nested.getResult())
        );
    }

    @Test
    @DisplayName("Le foglie non hanno riscritture")
    void testClosure_Leaves_ShouldBeEmpty() {
        assertAll("Leaves",
                () -> assertTrue(closure.closure(A).isEmpty()),
                () -> assertTrue(closure.closure(Formula.TRUE).isEmpty()),
                () -> assertTrue(closure.closure(not(A)).isEmpty())
        );
    }

    @Test
    @DisplayName("Risultati uguali prodotti in modi diversi collassano in uno")
    void testClosure_Deduplicates() {
        // (A | A) | A: commutatività e riassociazione danno entrambe A | (A | A)
        Formula start = or(or(A, A), A);
        List<Rewrite> rewrites = closure.rewrites(start);

        assertAll("Deduplication",
                () -> assertEquals(List.of(or(A, or(A, A)), or(A, A)), List.copyOf(closure.closure(start))),
                () -> assertEquals(2, rewrites.size()),
                () -> assertEquals("CommutativityOr", rewrites.get(0).getRule().getName()),
                () -> assertEquals("Idempotence", rewrites.get(1).getRule().getName())
        );
    }

    @Test
    @DisplayName("Nessun elemento della chiusura coincide con la formula di partenza")
    void testClosure_NeverContainsInput() {
        List<Formula> samples = List.of(
                and(A, B), or(or(A, B), C), implies(A, B), implies(not(B), not(A)),
                and(implies(A, B), implies(B, A)), or(and(A, B), and(A, C)), not(not(or(A, not(A)))));

        for (Formula sample : samples) {
            assertFalse(closure.closure(sample).contains(sample), () -> "Identità su " + sample);
        }
    }

    @Test
    @DisplayName("La chiusura è pura e ripetibile")
    void testClosure_IsPure() {
        Formula start = and(or(A, B), not(not(C)));
        Formula copy = and(or(A, B), not(not(C)));

        List<Formula> first = List.copyOf(closure.closure(start));
        List<Formula> second = List.copyOf(closure.closure(start));

        assertAll("Purity",
                () -> assertEquals(first, second),
                () -> assertEquals(copy, start)
        );
    }

    @Test
    @DisplayName("Ogni riscrittura si riapplica alla formula di partenza")
    void testRewrites_ReplayOnStart() {
        Formula start = implies(and(A, not(not(B))), or(A, C));

        for (Rewrite rewrite : closure.rewrites(start)) {
            assertEquals(rewrite.getResult(), rewrite.replayOn(start));
        }
        assertThrows(IllegalStateException.class, () -> closure.rewrites(start).get(0).replayOn(and(A, B)));
    }

    @Test
    @DisplayName("Catalogo null rifiutato")
    void testConstructor_NullCatalog_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new RewriteClosure(null));
    }
}
