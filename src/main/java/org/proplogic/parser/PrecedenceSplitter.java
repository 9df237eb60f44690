package org.proplogic.parser;

import org.proplogic.support.Operator;
import org.proplogic.support.TreeElement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * DIVISIONE PER PRECEDENZA - Costruzione dei raggruppamenti binari
 *
 * Ogni passata riceve una classe di precedenza e, per ciascun gruppo, cerca
 * da destra il primo operatore di primo livello appartenente alla classe.
 * Se lo trova il gruppo diventa [sinistra, operatore, destra]: la parte
 * sinistra viene ridivisa con la stessa classe (associatività a sinistra),
 * la parte destra è già elaborata. I sottogruppi vengono elaborati
 * ricorsivamente ma mai divisi al livello corrente.
 *
 * ORDINE DELLE PASSATE (dalla precedenza più bassa alla più alta):
 * 1. ↔
 * 2. → e ← (stessa precedenza)
 * 3. ∨
 * 4. ∧
 *
 * Le passate sono funzioni pure: ogni chiamata restituisce una nuova struttura.
 */
public final class PrecedenceSplitter {

    /** Classi di precedenza nell'ordine in cui vengono applicate */
    public static final List<Set<Operator>> PRECEDENCE_CLASSES = List.of(
            Collections.unmodifiableSet(EnumSet.of(Operator.IFF)),
            Collections.unmodifiableSet(EnumSet.of(Operator.IMPLIES, Operator.CONVERSE_IMPLIES)),
            Collections.unmodifiableSet(EnumSet.of(Operator.OR)),
            Collections.unmodifiableSet(EnumSet.of(Operator.AND))
    );

    private PrecedenceSplitter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Applica tutte le classi di precedenza nell'ordine previsto.
     *
     * @param tree struttura con le negazioni già fuse
     * @return struttura con ogni operatore binario in un gruppo [sinistra, op, destra]
     */
    public static TreeElement splitAll(TreeElement tree) {
        TreeElement result = tree;
        for (Set<Operator> operators : PRECEDENCE_CLASSES) {
            result = split(result, operators);
        }
        return result;
    }

    /**
     * Singola passata per una classe di precedenza.
     *
     * @param tree struttura da dividere
     * @param operators operatori della classe corrente
     * @return nuova struttura
     */
    public static TreeElement split(TreeElement tree, Set<Operator> operators) {
        if (tree.isToken()) {
            return tree;
        }
        return splitSequence(tree.getChildren(), operators);
    }

    private static TreeElement splitSequence(List<TreeElement> elements, Set<Operator> operators) {
        Deque<TreeElement> right = new ArrayDeque<>();

        for (int i = elements.size() - 1; i >= 0; i--) {
            TreeElement node = elements.get(i);

            if (node.isGroup()) {
                right.addFirst(splitSequence(node.getChildren(), operators));
            } else if (node.isBareOperator() && operators.contains(node.getToken().getOperator())) {
                TreeElement left = splitSequence(elements.subList(0, i), operators);
                return TreeElement.group(left, node, TreeElement.group(new ArrayList<>(right)));
            } else {
                right.addFirst(node);
            }
        }

        return TreeElement.group(new ArrayList<>(right));
    }
}
