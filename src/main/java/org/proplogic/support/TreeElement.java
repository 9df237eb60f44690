package org.proplogic.support;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ELEMENTO DELLA STRUTTURA ANNIDATA - Variante TOKEN | GROUP usata durante il parsing
 *
 * Rappresenta la struttura intermedia prodotta dal raggruppamento per parentesi
 * e trasformata dalla fusione degli unari e dalla divisione per precedenza.
 * Un gruppo contiene una sequenza ordinata di altri elementi: un livello di
 * parentesi, un costrutto unario fuso oppure una suddivisione binaria.
 *
 * Gli elementi sono immutabili: ogni fase del parsing produce una nuova struttura.
 */
public final class TreeElement {

    public enum Type {
        TOKEN,
        GROUP
    }

    private static final TreeElement EMPTY_GROUP = new TreeElement(Type.GROUP, null, Collections.emptyList());

    private final Type type;
    private final Token token;
    private final List<TreeElement> children;

    private TreeElement(Type type, Token token, List<TreeElement> children) {
        this.type = type;
        this.token = token;
        this.children = children;
    }

    /**
     * Crea un elemento foglia per un token.
     *
     * @param token token da incapsulare (non null)
     */
    public static TreeElement of(Token token) {
        if (token == null) {
            throw new IllegalArgumentException("Token dell'elemento non può essere null");
        }
        return new TreeElement(Type.TOKEN, token, null);
    }

    /**
     * Crea un gruppo con gli elementi indicati, in ordine.
     *
     * @param children elementi del gruppo (non null, senza elementi null)
     */
    public static TreeElement group(List<TreeElement> children) {
        if (children == null) {
            throw new IllegalArgumentException("Lista elementi del gruppo non può essere null");
        }
        if (children.isEmpty()) {
            return EMPTY_GROUP;
        }
        if (children.contains(null)) {
            throw new IllegalArgumentException("Gruppo non può contenere elementi null");
        }
        return new TreeElement(Type.GROUP, null, Collections.unmodifiableList(new ArrayList<>(children)));
    }

    public static TreeElement group(TreeElement... children) {
        return group(Arrays.asList(children));
    }

    public static TreeElement emptyGroup() {
        return EMPTY_GROUP;
    }

    public Type getType() {
        return type;
    }

    public boolean isToken() {
        return type == Type.TOKEN;
    }

    public boolean isGroup() {
        return type == Type.GROUP;
    }

    /** @return true se l'elemento è un token operatore non racchiuso in un gruppo */
    public boolean isBareOperator() {
        return type == Type.TOKEN && token.isOperator();
    }

    /** Token incapsulato, null per i gruppi */
    public Token getToken() {
        return token;
    }

    /** Elementi del gruppo (lista immutabile), vuota per i token */
    public List<TreeElement> getChildren() {
        return type == Type.GROUP ? children : Collections.emptyList();
    }

    public int size() {
        return getChildren().size();
    }

    public TreeElement get(int index) {
        return getChildren().get(index);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TreeElement)) return false;
        TreeElement other = (TreeElement) obj;
        return type == other.type
                && Objects.equals(token, other.token)
                && Objects.equals(children, other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, token, children);
    }

    /**
     * Forma compatta per debugging: i gruppi tra parentesi quadre, i token con il loro testo.
     * Esempio: [[a], ∧, [b]]
     */
    @Override
    public String toString() {
        return switch (type) {
            case TOKEN -> token.getText();
            case GROUP -> children.toString();
        };
    }
}
