package org.proplogic.support;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * OPERATORI DEL LINGUAGGIO - Connettivi logici e parentesi riconosciuti dal tokenizer
 *
 * Ogni costante porta il proprio simbolo canonico e l'arità fissa usata dal
 * riformattatore per validare la forma dell'albero.
 *
 * TABELLA ALIAS (case-insensitive):
 * • or → ∨, and → ∧, not → ¬
 * • implies, impl, -> → →
 * • <->, == → ↔
 * • <- → ←
 *
 * I simboli base sono riconosciuti solo in forma esatta e non passano mai
 * dalla tabella alias.
 */
public enum Operator {

    OR("∨", 2),
    AND("∧", 2),
    NOT("¬", 1),
    IMPLIES("→", 2),
    CONVERSE_IMPLIES("←", 2),
    IFF("↔", 2),
    OPEN_PAREN("(", 0),
    CLOSE_PAREN(")", 0);

    private static final Map<String, Operator> BY_SYMBOL = new HashMap<>();
    private static final Map<String, Operator> BY_ALIAS = new HashMap<>();

    static {
        for (Operator operator : values()) {
            BY_SYMBOL.put(operator.symbol, operator);
        }

        BY_ALIAS.put("or", OR);
        BY_ALIAS.put("and", AND);
        BY_ALIAS.put("not", NOT);
        BY_ALIAS.put("implies", IMPLIES);
        BY_ALIAS.put("impl", IMPLIES);
        BY_ALIAS.put("->", IMPLIES);
        BY_ALIAS.put("<->", IFF);
        BY_ALIAS.put("==", IFF);
        BY_ALIAS.put("<-", CONVERSE_IMPLIES);
    }

    private final String symbol;
    private final int arity;

    Operator(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    /** Simbolo canonico (∨ ∧ ¬ → ← ↔ ( )) */
    public String getSymbol() {
        return symbol;
    }

    /** Numero di operandi richiesti: 1 per NOT, 2 per i binari, 0 per le parentesi */
    public int getArity() {
        return arity;
    }

    public boolean isConnective() {
        return arity > 0;
    }

    /**
     * Cerca l'operatore con il simbolo base indicato.
     *
     * @param symbol simbolo esatto
     * @return operatore corrispondente o null
     */
    public static Operator fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }

    /**
     * Cerca l'operatore corrispondente a un alias testuale, ignorando maiuscole e minuscole.
     *
     * @param word sequenza completa di caratteri dell'identificatore
     * @return operatore corrispondente o null se la parola non è un alias
     */
    public static Operator fromAlias(String word) {
        if (word == null) {
            return null;
        }
        return BY_ALIAS.get(word.toLowerCase(Locale.ROOT));
    }
}
