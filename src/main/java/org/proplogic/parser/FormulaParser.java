package org.proplogic.parser;

import org.proplogic.support.FormulaNode;
import org.proplogic.support.Token;
import org.proplogic.support.TreeElement;

import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Punto di ingresso della pipeline di parsing
 *
 * Trasforma il testo di una formula proposizionale nell'albero sintattico
 * immutabile usato da valutatore e generatore di tabelle di verità.
 *
 * PIPELINE:
 * 1. {@link FormulaTokenizer}: testo → token, risoluzione alias
 * 2. {@link ParenthesisGrouper}: token → struttura annidata per parentesi
 * 3. {@link UnaryFuser}: fusione delle negazioni con il loro operando
 * 4. {@link PrecedenceSplitter}: quattro passate ↔, → ←, ∨, ∧
 * 5. {@link TreeReformatter}: validazione e costruzione dei nodi
 *
 * PRECEDENZE (dalla più alta alla più bassa):
 * ¬, ∧, ∨, → e ←, ↔. Gli operatori della stessa classe associano a sinistra:
 * a → b → c equivale a (a → b) → c.
 *
 * Le fasi 1-4 accettano qualsiasi testo; solo la fase 5 può fallire.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PARSING

    /**
     * METODO PRINCIPALE - Analizza il testo di una formula.
     *
     * @param text formula con connettivi simbolici o alias testuali (non null)
     * @return albero sintattico validato
     * @throws FormulaParseException se operatori e operandi non formano una formula valida
     */
    public static FormulaNode parse(String text) throws FormulaParseException {
        LOGGER.fine(() -> "Inizio parsing formula: " + text);

        List<Token> tokens = FormulaTokenizer.tokenize(text);
        TreeElement tree = ParenthesisGrouper.group(tokens);
        tree = UnaryFuser.fuse(tree);
        tree = PrecedenceSplitter.splitAll(tree);

        TreeElement finalTree = tree;
        LOGGER.finest(() -> "Struttura dopo le passate di precedenza: " + finalTree);

        FormulaNode formula = TreeReformatter.reformat(tree);
        LOGGER.fine(() -> "Formula analizzata: " + formula);
        return formula;
    }

    //endregion

    //region FORMA LINEARE

    /**
     * Rappresentazione postfissa compatta: per ogni nodo gli operandi seguiti
     * dal simbolo dell'operatore, senza separatori.
     *
     * Esempio: (a ∧ b) ∨ ¬c → ab∧c¬∨
     *
     * Forma solo di visualizzazione e debugging: senza separatori non può
     * essere ritokenizzata in modo univoco.
     *
     * @param formula albero sintattico
     * @return forma lineare
     */
    public static String toLinearForm(FormulaNode formula) {
        if (formula.isLeaf()) {
            return formula.getName();
        }

        StringBuilder result = new StringBuilder();
        for (FormulaNode operand : formula.getOperands()) {
            result.append(toLinearForm(operand));
        }
        result.append(formula.getOperator().getSymbol());
        return result.toString();
    }

    //endregion
}
