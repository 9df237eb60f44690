package org.proplogic.evaluation;

import org.proplogic.support.FormulaNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Raccoglie le variabili libere di una formula: i nomi delle foglie diverse
 * dalle costanti "1" e "0", in ordine di prima occorrenza da sinistra a destra
 * e senza duplicati.
 */
public final class SymbolCollector {

    private SymbolCollector() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static List<String> collect(FormulaNode formula) {
        Set<String> symbols = new LinkedHashSet<>();
        collectInto(formula, symbols);
        return new ArrayList<>(symbols);
    }

    private static void collectInto(FormulaNode node, Set<String> symbols) {
        if (node.isLeaf()) {
            if (!node.isConstant()) {
                symbols.add(node.getName());
            }
            return;
        }
        for (FormulaNode operand : node.getOperands()) {
            collectInto(operand, symbols);
        }
    }
}
