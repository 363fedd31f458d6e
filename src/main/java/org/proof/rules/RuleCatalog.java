package org.proof.rules;

import org.proof.formula.Formula;
import org.proof.formula.Formula.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static org.proof.formula.Formula.and;
import static org.proof.formula.Formula.iff;
import static org.proof.formula.Formula.implies;
import static org.proof.formula.Formula.not;
import static org.proof.formula.Formula.or;

/**
 * CATALOGO DELLE LEGGI DI RISCRITTURA - Tabella dichiarativa ordinata e immutabile
 *
 * Il catalogo è costruito una sola volta da una tabella (nome, tag, legge, guardia,
 * trasformazione) e non viene più modificato. L'ordine delle regole è significativo:
 * a parità di lunghezza, la ricerca preferisce le riscritture prodotte dalle regole
 * che compaiono prima.
 *
 * FAMIGLIE (tag):
 * - comm_assoc: commutatività e riassociazione
 * - neg: doppia negazione
 * - lem / contr: terzo escluso e contraddizione
 * - dm: leggi di De Morgan (entrambe le direzioni)
 * - imp_elim: eliminazione dell'implicazione (entrambe le direzioni)
 * - distr: distributività (entrambe le direzioni)
 * - contrapos: contrapposizione
 * - idemp: idempotenza
 * - equiv: espansione della biimplicazione (entrambe le direzioni)
 * - simp1: identità e dominazione con costanti
 * - simp2: assorbimento
 *
 * CATALOGHI DISPONIBILI:
 * - standard(): leggi che non aumentano indefinitamente la formula
 * - extended(): standard più le inverse di idempotenza e identità (A => A & A, ...),
 *   applicabili a quasi ogni sottoformula e quindi molto più costose da esplorare
 */
public final class RuleCatalog implements Iterable<RewriteRule> {

    private static final Logger LOGGER = Logger.getLogger(RuleCatalog.class.getName());

    private static final RuleCatalog STANDARD = new RuleCatalog(standardRules());
    private static final RuleCatalog EXTENDED = new RuleCatalog(extendedRules());

    private final List<RewriteRule> rules;
    private final Map<String, RewriteRule> rulesByName;

    private RuleCatalog(List<RewriteRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));

        Map<String, RewriteRule> byName = new LinkedHashMap<>();
        for (RewriteRule rule : rules) {
            if (byName.put(rule.getName(), rule) != null) {
                throw new IllegalStateException("Nome regola duplicato nel catalogo: " + rule.getName());
            }
        }
        this.rulesByName = Collections.unmodifiableMap(byName);

        LOGGER.fine("Catalogo regole inizializzato con " + rules.size() + " leggi");
    }

    //region ACCESSO AL CATALOGO

    /**
     * Catalogo predefinito usato dalla ricerca.
     */
    public static RuleCatalog standard() {
        return STANDARD;
    }

    /**
     * Catalogo standard seguito dalle leggi inverse che fanno crescere la formula.
     */
    public static RuleCatalog extended() {
        return EXTENDED;
    }

    /**
     * Catalogo personalizzato con un sottoinsieme ordinato di regole.
     *
     * @throws IllegalArgumentException se la lista è null o contiene null
     */
    public static RuleCatalog of(List<RewriteRule> rules) {
        if (rules == null || rules.contains(null)) {
            throw new IllegalArgumentException("Lista regole null o con elementi null");
        }
        return new RuleCatalog(rules);
    }

    public List<RewriteRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    /**
     * Regola con il nome indicato.
     *
     * @throws IllegalArgumentException se il nome non è nel catalogo
     */
    public RewriteRule byName(String name) {
        RewriteRule rule = rulesByName.get(name);
        if (rule == null) {
            throw new IllegalArgumentException("Regola sconosciuta: " + name);
        }
        return rule;
    }

    /**
     * Regole della famiglia indicata, nell'ordine del catalogo.
     */
    public List<RewriteRule> byTag(String tag) {
        return rules.stream()
                .filter(rule -> rule.getTag().equals(tag))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Sottocatalogo con le sole famiglie indicate, preservando l'ordine.
     */
    public RuleCatalog restrictedTo(List<String> tags) {
        return new RuleCatalog(rules.stream()
                .filter(rule -> tags.contains(rule.getTag()))
                .collect(Collectors.toList()));
    }

    @Override
    public Iterator<RewriteRule> iterator() {
        return rules.iterator();
    }

    //endregion

    //region TABELLA DELLE LEGGI

    private static List<RewriteRule> standardRules() {
        List<RewriteRule> table = new ArrayList<>();

        // Commutatività e riassociazione
        table.add(rule("CommutativityAnd", "comm_assoc", "A & B <=> B & A",
                f -> f.is(Type.AND) && !f.left().equals(f.right()),
                f -> and(f.right(), f.left())));
        table.add(rule("CommutativityOr", "comm_assoc", "A | B <=> B | A",
                f -> f.is(Type.OR) && !f.left().equals(f.right()),
                f -> or(f.right(), f.left())));
        table.add(rule("CommutativityIff", "comm_assoc", "(A <=> B) <=> (B <=> A)",
                f -> f.is(Type.IFF) && !f.left().equals(f.right()),
                f -> iff(f.right(), f.left())));
        table.add(rule("AssociativityAnd", "comm_assoc", "(A & B) & C <=> B & (A & C)",
                f -> f.is(Type.AND) && f.left().is(Type.AND),
                f -> and(f.left().right(), and(f.left().left(), f.right()))));
        table.add(rule("AssociativityOr", "comm_assoc", "(A | B) | C <=> B | (A | C)",
                f -> f.is(Type.OR) && f.left().is(Type.OR),
                f -> or(f.left().right(), or(f.left().left(), f.right()))));

        // Doppia negazione
        table.add(rule("DoubleNegation", "neg", "!!A <=> A",
                f -> f.is(Type.NOT) && f.operand().is(Type.NOT),
                f -> f.operand().operand()));

        // Terzo escluso e contraddizione
        table.add(rule("ExcludedMiddle", "lem", "A | !A <=> true",
                f -> f.is(Type.OR) && complementary(f.left(), f.right()),
                f -> Formula.TRUE));
        table.add(rule("Contradiction", "contr", "A & !A <=> false",
                f -> f.is(Type.AND) && complementary(f.left(), f.right()),
                f -> Formula.FALSE));

        // Leggi di De Morgan
        table.add(rule("DeMorganAnd", "dm", "!(A & B) <=> !A | !B",
                f -> f.is(Type.NOT) && f.operand().is(Type.AND),
                f -> or(not(f.operand().left()), not(f.operand().right()))));
        table.add(rule("DeMorganOr", "dm", "!(A | B) <=> !A & !B",
                f -> f.is(Type.NOT) && f.operand().is(Type.OR),
                f -> and(not(f.operand().left()), not(f.operand().right()))));
        table.add(rule("DeMorganAndReverse", "dm", "!A | !B <=> !(A & B)",
                f -> f.is(Type.OR) && f.left().is(Type.NOT) && f.right().is(Type.NOT),
                f -> not(and(f.left().operand(), f.right().operand()))));
        table.add(rule("DeMorganOrReverse", "dm", "!A & !B <=> !(A | B)",
                f -> f.is(Type.AND) && f.left().is(Type.NOT) && f.right().is(Type.NOT),
                f -> not(or(f.left().operand(), f.right().operand()))));

        // Eliminazione dell'implicazione
        table.add(rule("ImplicationElimination", "imp_elim", "A => B <=> !A | B",
                f -> f.is(Type.IMPLIES),
                f -> or(not(f.left()), f.right())));
        table.add(rule("ImplicationEliminationReverse", "imp_elim", "!A | B <=> A => B",
                f -> f.is(Type.OR) && f.left().is(Type.NOT),
                f -> implies(f.left().operand(), f.right())));

        // Distributività
        table.add(rule("DistributivityAnd", "distr", "A & (B | C) <=> (A & B) | (A & C)",
                f -> f.is(Type.AND) && f.right().is(Type.OR),
                f -> or(and(f.left(), f.right().left()), and(f.left(), f.right().right()))));
        table.add(rule("DistributivityOr", "distr", "A | (B & C) <=> (A | B) & (A | C)",
                f -> f.is(Type.OR) && f.right().is(Type.AND),
                f -> and(or(f.left(), f.right().left()), or(f.left(), f.right().right()))));
        table.add(rule("DistributivityAndReverse", "distr", "(A & B) | (A & C) <=> A & (B | C)",
                f -> f.is(Type.OR) && sharedLeftOperand(f, Type.AND),
                f -> and(f.left().left(), or(f.left().right(), f.right().right()))));
        table.add(rule("DistributivityOrReverse", "distr", "(A | B) & (A | C) <=> A | (B & C)",
                f -> f.is(Type.AND) && sharedLeftOperand(f, Type.OR),
                f -> or(f.left().left(), and(f.left().right(), f.right().right()))));

        // Contrapposizione: non si applica a forme già contrapposte (!B => !A)
        table.add(rule("Contrapositive", "contrapos", "A => B <=> !B => !A",
                f -> f.is(Type.IMPLIES) && !(f.left().is(Type.NOT) && f.right().is(Type.NOT)),
                f -> implies(not(f.right()), not(f.left()))));

        // Idempotenza
        table.add(rule("Idempotence", "idemp", "A & A <=> A, A | A <=> A",
                f -> (f.is(Type.AND) || f.is(Type.OR)) && f.left().equals(f.right()),
                Formula::left));

        // Biimplicazione
        table.add(rule("Equivalence", "equiv", "A <=> B <=> (A => B) & (B => A)",
                f -> f.is(Type.IFF),
                f -> and(implies(f.left(), f.right()), implies(f.right(), f.left()))));
        table.add(rule("EquivalenceReverse", "equiv", "(A => B) & (B => A) <=> A <=> B",
                f -> f.is(Type.AND) && f.left().is(Type.IMPLIES) && f.right().is(Type.IMPLIES)
                        && f.left().left().equals(f.right().right())
                        && f.left().right().equals(f.right().left()),
                f -> iff(f.left().left(), f.left().right())));

        // Identità e dominazione con costanti
        table.add(rule("IdentityLaw", "simp1", "A & true <=> A, A | false <=> A",
                RuleCatalog::isIdentityShape,
                RuleCatalog::dropNeutralConstant));
        table.add(rule("DominationTrue", "simp1", "A | true <=> true",
                f -> f.is(Type.OR) && (f.left().isConstant(true) || f.right().isConstant(true)),
                f -> Formula.TRUE));
        table.add(rule("DominationFalse", "simp1", "A & false <=> false",
                f -> f.is(Type.AND) && (f.left().isConstant(false) || f.right().isConstant(false)),
                f -> Formula.FALSE));

        // Assorbimento
        table.add(rule("AbsorptionOr", "simp2", "A | (A & B) <=> A",
                f -> f.is(Type.OR) && absorbs(f, Type.AND),
                f -> absorbingOperand(f, Type.AND)));
        table.add(rule("AbsorptionAnd", "simp2", "A & (A | B) <=> A",
                f -> f.is(Type.AND) && absorbs(f, Type.OR),
                f -> absorbingOperand(f, Type.OR)));

        return table;
    }

    private static List<RewriteRule> extendedRules() {
        List<RewriteRule> table = new ArrayList<>(standardRules());

        table.add(rule("IdempotenceReverseOr", "idemp", "A <=> A | A",
                f -> !isIdempotentShape(f),
                f -> or(f, f)));
        table.add(rule("IdempotenceReverseAnd", "idemp", "A <=> A & A",
                f -> !isIdempotentShape(f),
                f -> and(f, f)));
        table.add(rule("IdentityReverseAnd", "simp1", "A <=> A & true",
                f -> !isIdentityShape(f),
                f -> and(f, Formula.TRUE)));
        table.add(rule("IdentityReverseOr", "simp1", "A <=> A | false",
                f -> !isIdentityShape(f),
                f -> or(f, Formula.FALSE)));

        return table;
    }

    private static RewriteRule rule(String name, String tag, String law,
                                    Predicate<Formula> guard, UnaryOperator<Formula> transform) {
        return new RewriteRule(name, tag, law, guard, transform);
    }

    //endregion

    //region GUARDIE DI SUPPORTO

    /**
     * Vero se uno dei due operandi è la negazione dell'altro, in entrambi gli ordini.
     */
    private static boolean complementary(Formula left, Formula right) {
        return (right.is(Type.NOT) && right.operand().equals(left))
                || (left.is(Type.NOT) && left.operand().equals(right));
    }

    /**
     * Vero per (A inner B) op (A inner C): entrambi gli operandi del tipo
     * indicato con lo stesso operando sinistro.
     */
    private static boolean sharedLeftOperand(Formula f, Type inner) {
        return f.left().is(inner) && f.right().is(inner)
                && f.left().left().equals(f.right().left());
    }

    private static boolean isIdempotentShape(Formula f) {
        return (f.is(Type.AND) || f.is(Type.OR)) && f.left().equals(f.right());
    }

    private static boolean isIdentityShape(Formula f) {
        return (f.is(Type.AND) && (f.left().isConstant(true) || f.right().isConstant(true)))
                || (f.is(Type.OR) && (f.left().isConstant(false) || f.right().isConstant(false)));
    }

    private static Formula dropNeutralConstant(Formula f) {
        boolean neutral = f.is(Type.AND);
        return f.left().isConstant(neutral) ? f.right() : f.left();
    }

    /**
     * Vero per A op (A inner B), A op (B inner A) e le forme simmetriche.
     */
    private static boolean absorbs(Formula f, Type inner) {
        Formula left = f.left();
        Formula right = f.right();
        return (right.is(inner) && (left.equals(right.left()) || left.equals(right.right())))
                || (left.is(inner) && (right.equals(left.left()) || right.equals(left.right())));
    }

    private static Formula absorbingOperand(Formula f, Type inner) {
        Formula left = f.left();
        Formula right = f.right();
        if (right.is(inner) && (left.equals(right.left()) || left.equals(right.right()))) {
            return left;
        }
        return right;
    }

    //endregion
}
