package org.proplogic.parser;

import org.proplogic.support.Operator;
import org.proplogic.support.TreeElement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * FUSIONE DEGLI OPERATORI UNARI
 *
 * Scorre ogni gruppo da destra verso sinistra, elaborando prima i sottogruppi.
 * Ogni ¬ viene fuso con l'elemento immediatamente alla sua destra (già
 * elaborato) nel gruppo di due elementi [¬, operando], che da quel momento
 * si comporta come un'unità. In questo modo la negazione lega più di ogni
 * connettivo binario prima della divisione per precedenza.
 *
 * Un ¬ senza elementi alla sua destra resta un token isolato e viene
 * segnalato dal riformattatore.
 */
public final class UnaryFuser {

    private UnaryFuser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param tree struttura prodotta dal raggruppamento per parentesi
     * @return nuova struttura con le negazioni fuse
     */
    public static TreeElement fuse(TreeElement tree) {
        if (tree.isToken()) {
            return tree;
        }

        Deque<TreeElement> result = new ArrayDeque<>();

        for (int i = tree.size() - 1; i >= 0; i--) {
            TreeElement node = tree.get(i);

            if (node.isGroup()) {
                result.addFirst(fuse(node));
            } else if (node.getToken().is(Operator.NOT) && !result.isEmpty()) {
                result.addFirst(TreeElement.group(node, result.pollFirst()));
            } else {
                result.addFirst(node);
            }
        }

        return TreeElement.group(new ArrayList<>(result));
    }
}
