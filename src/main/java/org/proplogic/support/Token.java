package org.proplogic.support;

import java.util.Objects;

/**
 * TOKEN - Unità lessicale prodotta dal tokenizer
 *
 * Un token è un operatore (connettivo o parentesi) oppure un identificatore,
 * cioè una sequenza di caratteri che non sono né spazi né simboli base.
 * La posizione nel testo sorgente viene conservata solo per la diagnostica.
 *
 * Invarianti:
 * • OPERATOR ha operator non null e text uguale al simbolo canonico
 * • IDENTIFIER ha operator null e text non vuoto
 */
public final class Token {

    public enum Kind {
        OPERATOR,
        IDENTIFIER
    }

    private final Kind kind;
    private final Operator operator;
    private final String text;
    private final int offset;

    private Token(Kind kind, Operator operator, String text, int offset) {
        this.kind = kind;
        this.operator = operator;
        this.text = text;
        this.offset = offset;
    }

    /**
     * Crea un token operatore.
     *
     * @param operator operatore riconosciuto (non null)
     * @param offset posizione del primo carattere nel testo, -1 se sconosciuta
     */
    public static Token operator(Operator operator, int offset) {
        if (operator == null) {
            throw new IllegalArgumentException("Operatore del token non può essere null");
        }
        return new Token(Kind.OPERATOR, operator, operator.getSymbol(), offset);
    }

    /**
     * Crea un token identificatore.
     *
     * @param text sequenza di caratteri (non null, non vuota)
     * @param offset posizione del primo carattere nel testo, -1 se sconosciuta
     */
    public static Token identifier(String text, int offset) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Testo dell'identificatore non può essere null o vuoto");
        }
        return new Token(Kind.IDENTIFIER, null, text, offset);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isOperator() {
        return kind == Kind.OPERATOR;
    }

    public boolean isIdentifier() {
        return kind == Kind.IDENTIFIER;
    }

    /** @return true se il token è l'operatore indicato */
    public boolean is(Operator candidate) {
        return operator == candidate && kind == Kind.OPERATOR;
    }

    /** Operatore del token, null per gli identificatori */
    public Operator getOperator() {
        return operator;
    }

    public String getText() {
        return text;
    }

    public int getOffset() {
        return offset;
    }

    // La posizione non partecipa all'uguaglianza
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Token)) return false;
        Token other = (Token) obj;
        return kind == other.kind && operator == other.operator && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, operator, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
