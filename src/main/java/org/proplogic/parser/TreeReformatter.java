package org.proplogic.parser;

import org.proplogic.support.FormulaNode;
import org.proplogic.support.Operator;
import org.proplogic.support.Token;
import org.proplogic.support.TreeElement;

import java.util.logging.Logger;

/**
 * RIFORMATTATORE - Da struttura annidata ad albero sintattico validato
 *
 * Unico punto in cui la forma della formula viene verificata.
 *
 * CASI GESTITI:
 * • token identificatore isolato → foglia
 * • token operatore isolato → "operator has no operand"
 * • gruppo vuoto → "empty expression"
 * • gruppo di 1 elemento → riformattazione dell'elemento
 * • gruppo di 2 elementi [op, operando] → nodo unario, altrimenti "malformed unary operator"
 * • gruppo di 3 elementi [a, op, b] → nodo binario, altrimenti "malformed binary operator"
 * • qualsiasi altra lunghezza → "malformed expression"
 *
 * Un operando mancante (gruppo vuoto lasciato dalla divisione per precedenza,
 * come in "∧ a") è trattato come forma malformata dell'operatore.
 */
public final class TreeReformatter {

    private static final Logger LOGGER = Logger.getLogger(TreeReformatter.class.getName());

    private TreeReformatter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Converte ricorsivamente la struttura nell'albero sintattico.
     *
     * @param tree struttura prodotta dalla divisione per precedenza
     * @return radice dell'albero
     * @throws FormulaParseException se la struttura non rappresenta una formula valida
     */
    public static FormulaNode reformat(TreeElement tree) throws FormulaParseException {
        if (tree.isToken()) {
            Token token = tree.getToken();
            if (token.isIdentifier()) {
                return FormulaNode.leaf(token.getText());
            }
            throw fail(ParseError.OPERATOR_WITHOUT_OPERAND, token.getOffset());
        }

        return switch (tree.size()) {
            case 0 -> throw fail(ParseError.EMPTY_EXPRESSION, -1);
            case 1 -> reformat(tree.get(0));
            case 2 -> reformatUnary(tree);
            case 3 -> reformatBinary(tree);
            default -> throw fail(ParseError.MALFORMED_EXPRESSION, firstOffset(tree));
        };
    }

    private static FormulaNode reformatUnary(TreeElement tree) throws FormulaParseException {
        TreeElement operatorElement = tree.get(0);
        TreeElement operand = tree.get(1);

        if (!operatorElement.isBareOperator()
                || operatorElement.getToken().getOperator().getArity() != 1
                || !isOperand(operand)) {
            throw fail(ParseError.MALFORMED_UNARY_OPERATOR, firstOffset(tree));
        }

        Operator operator = operatorElement.getToken().getOperator();
        return FormulaNode.unary(operator, reformat(operand));
    }

    private static FormulaNode reformatBinary(TreeElement tree) throws FormulaParseException {
        TreeElement left = tree.get(0);
        TreeElement operatorElement = tree.get(1);
        TreeElement right = tree.get(2);

        if (!operatorElement.isBareOperator()
                || operatorElement.getToken().getOperator().getArity() != 2
                || !isOperand(left)
                || !isOperand(right)) {
            int offset = operatorElement.isToken() ? operatorElement.getToken().getOffset() : firstOffset(tree);
            throw fail(ParseError.MALFORMED_BINARY_OPERATOR, offset);
        }

        Operator operator = operatorElement.getToken().getOperator();
        return FormulaNode.binary(operator, reformat(left), reformat(right));
    }

    /** Un operando non può essere un operatore isolato né un gruppo vuoto */
    private static boolean isOperand(TreeElement element) {
        if (element.isToken()) {
            return element.getToken().isIdentifier();
        }
        return element.size() > 0;
    }

    /** Posizione del primo token contenuto nell'elemento, -1 se non ce ne sono */
    private static int firstOffset(TreeElement element) {
        if (element.isToken()) {
            return element.getToken().getOffset();
        }
        for (TreeElement child : element.getChildren()) {
            int offset = firstOffset(child);
            if (offset >= 0) {
                return offset;
            }
        }
        return -1;
    }

    private static FormulaParseException fail(ParseError error, int offset) {
        LOGGER.fine(() -> "Formula non valida: " + error.getMessage() + (offset >= 0 ? " (posizione " + offset + ")" : ""));
        return new FormulaParseException(error, offset);
    }
}
