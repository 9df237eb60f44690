package org.proplogic.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.proplogic.antlr.FormulaLexer;
import org.proplogic.support.Operator;
import org.proplogic.support.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * TOKENIZER - Conversione del testo in sequenza piatta di token
 *
 * Il lexer ANTLR separa i simboli base (∨ ∧ ¬ → ↔ ← ( )) dalle sequenze di
 * altri caratteri e scarta gli spazi. Ogni sequenza viene poi confrontata,
 * per intero e senza distinzione di maiuscole, con la tabella alias di
 * {@link Operator}: se corrisponde diventa un operatore, altrimenti resta
 * un identificatore.
 *
 * GARANZIE:
 * • Nessun testo produce errori in questa fase
 * • Due identificatori non sono mai adiacenti (il lexer li unisce)
 * • Gli spazi non producono token
 */
public final class FormulaTokenizer {

    private static final Logger LOGGER = Logger.getLogger(FormulaTokenizer.class.getName());

    private FormulaTokenizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Tokenizza il testo di una formula.
     *
     * @param text formula come digitata dall'utente (non null)
     * @return token in ordine di apparizione
     * @throws IllegalArgumentException se text null
     */
    public static List<Token> tokenize(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }

        CharStream input = CharStreams.fromString(text);
        FormulaLexer lexer = new FormulaLexer(input);
        lexer.removeErrorListeners();

        List<Token> tokens = new ArrayList<>();
        for (org.antlr.v4.runtime.Token lexeme : lexer.getAllTokens()) {
            tokens.add(convert(lexeme));
        }

        LOGGER.finest(() -> "Token riconosciuti: " + tokens);
        return tokens;
    }

    /**
     * Converte un token ANTLR nel token del dominio, risolvendo gli alias.
     */
    private static Token convert(org.antlr.v4.runtime.Token lexeme) {
        int offset = lexeme.getStartIndex();

        return switch (lexeme.getType()) {
            case FormulaLexer.OR -> Token.operator(Operator.OR, offset);
            case FormulaLexer.AND -> Token.operator(Operator.AND, offset);
            case FormulaLexer.NOT -> Token.operator(Operator.NOT, offset);
            case FormulaLexer.IMPLIES -> Token.operator(Operator.IMPLIES, offset);
            case FormulaLexer.IFF -> Token.operator(Operator.IFF, offset);
            case FormulaLexer.CONVERSE -> Token.operator(Operator.CONVERSE_IMPLIES, offset);
            case FormulaLexer.LPAR -> Token.operator(Operator.OPEN_PAREN, offset);
            case FormulaLexer.RPAR -> Token.operator(Operator.CLOSE_PAREN, offset);
            default -> {
                String word = lexeme.getText();
                Operator alias = Operator.fromAlias(word);
                yield alias != null ? Token.operator(alias, offset) : Token.identifier(word, offset);
            }
        };
    }
}
