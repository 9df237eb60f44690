package org.proplogic.support;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * NODO DELL'ALBERO SINTATTICO - Formula proposizionale validata
 *
 * Rappresenta l'albero prodotto dal parser: una foglia (simbolo proposizionale
 * oppure una delle costanti riservate "1" e "0") o un nodo operatore con il suo
 * connettivo e la lista ordinata degli operandi.
 *
 * INVARIANTI:
 * • Il numero di operandi coincide sempre con l'arità del connettivo
 * • I nodi sono immutabili dopo la costruzione e possono essere condivisi
 *   tra più valutazioni, anche concorrenti
 * • La struttura è un albero: nessun ciclo è costruibile
 */
public final class FormulaNode {

    /** Costante riservata vera */
    public static final String TRUE_LITERAL = "1";

    /** Costante riservata falsa */
    public static final String FALSE_LITERAL = "0";

    public enum Type {
        LEAF,       // Simbolo o costante: p, q, 1, 0
        OPERATOR    // Connettivo con operandi: ¬p, p ∧ q, ...
    }

    private final Type type;
    private final String name;
    private final Operator operator;
    private final List<FormulaNode> operands;

    //region COSTRUZIONE

    private FormulaNode(Type type, String name, Operator operator, List<FormulaNode> operands) {
        this.type = type;
        this.name = name;
        this.operator = operator;
        this.operands = operands;
    }

    /**
     * Costruisce una foglia.
     *
     * @param name nome del simbolo o costante riservata (non null, non vuoto)
     * @throws IllegalArgumentException se name null o vuoto
     */
    public static FormulaNode leaf(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome della foglia non può essere null o vuoto");
        }
        return new FormulaNode(Type.LEAF, name, null, Collections.emptyList());
    }

    /**
     * Costruisce un nodo operatore validando l'arità.
     *
     * @param operator connettivo logico (parentesi escluse)
     * @param operands operandi in ordine, tanti quanti l'arità del connettivo
     * @throws IllegalArgumentException se il connettivo non è valido o l'arità non corrisponde
     */
    public static FormulaNode operator(Operator operator, List<FormulaNode> operands) {
        if (operator == null || !operator.isConnective()) {
            throw new IllegalArgumentException("Operatore non valido per un nodo: " + operator);
        }
        if (operands == null || operands.contains(null)) {
            throw new IllegalArgumentException("Operandi di " + operator.getSymbol() + " non possono essere null");
        }
        if (operands.size() != operator.getArity()) {
            throw new IllegalArgumentException("Operatore " + operator.getSymbol() + " richiede "
                    + operator.getArity() + " operandi, ricevuti: " + operands.size());
        }
        return new FormulaNode(Type.OPERATOR, null, operator,
                Collections.unmodifiableList(new ArrayList<>(operands)));
    }

    public static FormulaNode unary(Operator operator, FormulaNode operand) {
        return operator(operator, Collections.singletonList(operand));
    }

    public static FormulaNode binary(Operator operator, FormulaNode left, FormulaNode right) {
        return operator(operator, Arrays.asList(left, right));
    }

    //endregion

    //region ACCESSO

    public Type getType() {
        return type;
    }

    public boolean isLeaf() {
        return type == Type.LEAF;
    }

    /** @return true per le foglie "1" e "0" */
    public boolean isConstant() {
        return type == Type.LEAF && (TRUE_LITERAL.equals(name) || FALSE_LITERAL.equals(name));
    }

    /** Nome della foglia, null per i nodi operatore */
    public String getName() {
        return name;
    }

    /** Connettivo del nodo, null per le foglie */
    public Operator getOperator() {
        return operator;
    }

    /** Operandi in ordine (lista immutabile), vuota per le foglie */
    public List<FormulaNode> getOperands() {
        return operands;
    }

    public FormulaNode getOperand(int index) {
        return operands.get(index);
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FormulaNode)) return false;
        FormulaNode other = (FormulaNode) obj;
        return type == other.type
                && Objects.equals(name, other.name)
                && operator == other.operator
                && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, operator, operands);
    }

    /**
     * Forma infissa completamente parentesizzata, per visualizzazione.
     * Esempio: ((a → b) → ¬c)
     */
    @Override
    public String toString() {
        if (type == Type.LEAF) {
            return name;
        }
        if (operator.getArity() == 1) {
            return operator.getSymbol() + operands.get(0);
        }
        return "(" + operands.get(0) + " " + operator.getSymbol() + " " + operands.get(1) + ")";
    }
}
