package org.proplogic.evaluation;

import org.proplogic.support.FormulaNode;

import java.util.Collections;
import java.util.Map;

/**
 * VALUTATORE - Calcolo del valore di verità di una formula sotto un assegnamento
 *
 * SEMANTICA DEGLI OPERATORI (L e R valori degli operandi):
 * • ¬ → !L
 * • ∧ → L && R
 * • ∨ → L || R
 * • → → !L || R
 * • ← → !R || L
 * • ↔ → L == R
 *
 * FOGLIE:
 * • simbolo presente nell'assegnamento → valore assegnato
 * • altrimenti "1" → vero
 * • altrimenti (incluso "0" e ogni simbolo non assegnato) → falso
 *
 * Funzione totale: non fallisce su nessun albero valido.
 */
public final class FormulaEvaluator {

    private FormulaEvaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Valuta la formula con tutti i simboli a falso.
     */
    public static boolean evaluate(FormulaNode formula) {
        return evaluate(formula, Collections.emptyMap());
    }

    /**
     * Valuta la formula sotto l'assegnamento indicato.
     *
     * @param formula albero sintattico
     * @param assignment valori dei simboli; i simboli assenti valgono falso
     * @return valore di verità della formula
     */
    public static boolean evaluate(FormulaNode formula, Map<String, Boolean> assignment) {
        Map<String, Boolean> context = assignment != null ? assignment : Collections.emptyMap();

        if (formula.isLeaf()) {
            return evaluateLeaf(formula.getName(), context);
        }

        boolean left = evaluate(formula.getOperand(0), context);

        return switch (formula.getOperator()) {
            case NOT -> !left;
            case AND -> left && evaluate(formula.getOperand(1), context);
            case OR -> left || evaluate(formula.getOperand(1), context);
            case IMPLIES -> !left || evaluate(formula.getOperand(1), context);
            case CONVERSE_IMPLIES -> !evaluate(formula.getOperand(1), context) || left;
            case IFF -> left == evaluate(formula.getOperand(1), context);
            case OPEN_PAREN, CLOSE_PAREN ->
                    throw new IllegalStateException("Parentesi non ammesse nell'albero: " + formula);
        };
    }

    private static boolean evaluateLeaf(String name, Map<String, Boolean> context) {
        Boolean assigned = context.get(name);
        if (assigned != null) {
            return assigned;
        }
        return FormulaNode.TRUE_LITERAL.equals(name);
    }
}
