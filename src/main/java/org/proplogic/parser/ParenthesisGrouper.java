package org.proplogic.parser;

import org.proplogic.support.Operator;
import org.proplogic.support.Token;
import org.proplogic.support.TreeElement;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * RAGGRUPPAMENTO PER PARENTESI - Da sequenza piatta di token a struttura annidata
 *
 * Macchina a stati con un contesto corrente e un contatore di profondità:
 *
 * • '(' incrementa la profondità; se la struttura costruita finora è un unico
 *   gruppo, il contesto scende al suo interno decrementando la profondità
 *   (appiattimento dei gruppi ridondanti), finché la profondità resta positiva
 * • ')' decrementa la profondità; se diventa negativa tutta la struttura
 *   costruita finora viene racchiusa in un nuovo gruppo esterno e la profondità
 *   torna a zero (recupero delle parentesi chiuse in eccesso)
 * • ogni altro token viene inserito esattamente a 'profondità' livelli dalla
 *   radice, creando i gruppi intermedi necessari
 *
 * Le parentesi non bilanciate non sono mai un errore: la validità della
 * struttura risultante viene verificata solo dal riformattatore.
 */
public final class ParenthesisGrouper {

    private static final Logger LOGGER = Logger.getLogger(ParenthesisGrouper.class.getName());

    private ParenthesisGrouper() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Costruisce la struttura annidata dai token.
     *
     * @param tokens sequenza prodotta dal tokenizer (non null)
     * @return gruppo radice
     */
    public static TreeElement group(List<Token> tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("Sequenza di token non può essere null");
        }

        Level tree = new Level();
        int depth = 0;
        int recoveredClosings = 0;

        for (Token token : tokens) {
            if (token.is(Operator.OPEN_PAREN)) {
                depth++;

                // Appiattimento: "(x)(" non crea un livello in più
                while (depth > 0 && tree.isSingleGroup()) {
                    tree = tree.onlyGroup();
                    depth--;
                }
            } else if (token.is(Operator.CLOSE_PAREN)) {
                depth--;

                while (depth < 0) {
                    tree = tree.wrap();
                    depth++;
                    recoveredClosings++;
                }
            } else {
                pushWithDepth(tree, token, depth);
            }
        }

        if (recoveredClosings > 0 || depth > 0) {
            int unclosed = depth;
            int extraClosings = recoveredClosings;
            LOGGER.warning(() -> "Parentesi non bilanciate assorbite: " + extraClosings
                    + " chiusure in eccesso, " + unclosed + " aperture non chiuse");
        }

        TreeElement result = tree.freeze();
        LOGGER.finest(() -> "Struttura per parentesi: " + result);
        return result;
    }

    /**
     * Inserisce il token a 'depth' livelli di profondità, seguendo sempre l'ultimo
     * gruppo di ogni livello o creandone uno nuovo se l'ultimo elemento non è un gruppo.
     */
    private static void pushWithDepth(Level tree, Token token, int depth) {
        Level target = tree;
        for (int level = depth; level > 0; level--) {
            target = target.lastGroupOrNew();
        }
        target.entries.add(new Entry(token, null));
    }

    //region STRUTTURA MUTABILE DI COSTRUZIONE

    /**
     * Livello in costruzione: sequenza di token o di sottolivelli.
     * Esiste solo durante una chiamata a {@link #group(List)}.
     */
    private static final class Level {
        private final List<Entry> entries = new ArrayList<>();

        boolean isSingleGroup() {
            return entries.size() == 1 && entries.get(0).level != null;
        }

        Level onlyGroup() {
            return entries.get(0).level;
        }

        Level lastGroupOrNew() {
            if (entries.isEmpty() || entries.get(entries.size() - 1).level == null) {
                entries.add(new Entry(null, new Level()));
            }
            return entries.get(entries.size() - 1).level;
        }

        Level wrap() {
            Level wrapper = new Level();
            wrapper.entries.add(new Entry(null, this));
            return wrapper;
        }

        TreeElement freeze() {
            List<TreeElement> children = new ArrayList<>(entries.size());
            for (Entry entry : entries) {
                children.add(entry.level != null ? entry.level.freeze() : TreeElement.of(entry.token));
            }
            return TreeElement.group(children);
        }
    }

    /** Token oppure sottolivello, mai entrambi */
    private static final class Entry {
        private final Token token;
        private final Level level;

        Entry(Token token, Level level) {
            this.token = token;
            this.level = level;
        }
    }

    //endregion
}
