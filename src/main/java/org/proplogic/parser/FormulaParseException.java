package org.proplogic.parser;

/**
 * Formula sintatticamente non valida.
 *
 * Porta la tipologia di errore e, quando disponibile, la posizione nel testo
 * sorgente del token che ha causato il fallimento (-1 altrimenti).
 */
public class FormulaParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ParseError error;
    private final int offset;

    public FormulaParseException(ParseError error, int offset) {
        super(error.getMessage());
        this.error = error;
        this.offset = offset;
    }

    public FormulaParseException(ParseError error) {
        this(error, -1);
    }

    public ParseError getError() {
        return error;
    }

    /** Posizione nel testo sorgente, -1 se non applicabile */
    public int getOffset() {
        return offset;
    }

    public boolean hasOffset() {
        return offset >= 0;
    }
}
