package org.proof.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.proof.antlr.LogicFormulaBaseVisitor;
import org.proof.antlr.LogicFormulaLexer;
import org.proof.antlr.LogicFormulaParser;
import org.proof.antlr.LogicFormulaParser.AndContext;
import org.proof.antlr.LogicFormulaParser.FalseContext;
import org.proof.antlr.LogicFormulaParser.FormulaContext;
import org.proof.antlr.LogicFormulaParser.IdContext;
import org.proof.antlr.LogicFormulaParser.IffContext;
import org.proof.antlr.LogicFormulaParser.ImpliesContext;
import org.proof.antlr.LogicFormulaParser.NotContext;
import org.proof.antlr.LogicFormulaParser.OrContext;
import org.proof.antlr.LogicFormulaParser.ParContext;
import org.proof.antlr.LogicFormulaParser.TrueContext;
import org.proof.antlr.LogicFormulaParser.VarContext;
import org.proof.formula.Formula;

import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Convertitore da albero sintattico ANTLR a Formula
 *
 * Implementa un visitor sull'albero di parsing generato dalla grammatica
 * LogicFormula e costruisce l'albero immutabile {@link Formula}, senza alcuna
 * trasformazione semantica: implicazioni e biimplicazioni restano tali.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Biimplicazione (<=>, <->, iff, ...)
 * - Implicazione (=>, ->, implies, ...)
 * - Disgiunzione (|, ||, or, ...)
 * - Congiunzione (&, &&, ^, and, ...)
 * - Negazione (!, ~, not, ...)
 * - Variabili atomiche e costanti true / false
 *
 * Le catene dello stesso connettivo binario sono associative a sinistra:
 * A => B => C diventa (A => B) => C.
 */
public class FormulaParser extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Analizza il testo di una formula e restituisce l'albero corrispondente.
     *
     * PIPELINE:
     * 1. Lexer ANTLR con riconoscimento delle notazioni alternative
     * 2. Parser ANTLR con errori trasformati in FormulaSyntaxException
     * 3. Visita dell'albero sintattico e costruzione della Formula
     *
     * @param text formula in notazione infissa
     * @return formula costruita
     * @throws FormulaSyntaxException se il testo è vuoto o non ben formato
     */
    public static Formula parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new FormulaSyntaxException("La formula non può essere vuota");
        }

        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        LogicFormulaParser parser = new LogicFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        ParseTree tree = parser.formula();
        Formula formula = new FormulaParser().visit(tree);

        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.biconditional());
    }

    //endregion

    //region CONNETTIVI BINARI

    @Override
    public Formula visitIff(IffContext ctx) {
        return foldLeft(Formula.Type.IFF, ctx.implication());
    }

    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        return foldLeft(Formula.Type.IMPLIES, ctx.disjunction());
    }

    @Override
    public Formula visitOr(OrContext ctx) {
        return foldLeft(Formula.Type.OR, ctx.conjunction());
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        return foldLeft(Formula.Type.AND, ctx.negation());
    }

    /**
     * Costruisce la catena associativa a sinistra: ((o1 op o2) op o3) ...
     * Con un solo operando restituisce l'operando senza nodo aggiuntivo.
     */
    private Formula foldLeft(Formula.Type type, List<? extends ParseTree> operands) {
        Formula result = visit(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            result = Formula.binary(type, result, visit(operands.get(i)));
        }
        return result;
    }

    //endregion

    //region NEGAZIONI, PARENTESI E ATOMI

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.negation()));
    }

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    @Override
    public Formula visitId(IdContext ctx) {
        String variableName = ctx.IDENTIFIER().getText();
        LOGGER.finest("Variabile atomica: " + variableName);
        return Formula.variable(variableName);
    }

    @Override
    public Formula visitTrue(TrueContext ctx) {
        return Formula.TRUE;
    }

    @Override
    public Formula visitFalse(FalseContext ctx) {
        return Formula.FALSE;
    }

    //endregion

    /**
     * Listener che interrompe il parsing al primo errore lessicale o sintattico.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new FormulaSyntaxException(msg, line, charPositionInLine, e);
        }
    }
}
