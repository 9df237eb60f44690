package org.proplogic.parser;

/**
 * Tipologie di errore sintattico rilevate dal riformattatore.
 * Sono le uniche cause di fallimento del parsing: tokenizzazione e
 * raggruppamento accettano qualsiasi testo.
 */
public enum ParseError {

    EMPTY_EXPRESSION("empty expression"),
    OPERATOR_WITHOUT_OPERAND("operator has no operand"),
    MALFORMED_UNARY_OPERATOR("malformed unary operator"),
    MALFORMED_BINARY_OPERATOR("malformed binary operator"),
    MALFORMED_EXPRESSION("malformed expression");

    private final String message;

    ParseError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
