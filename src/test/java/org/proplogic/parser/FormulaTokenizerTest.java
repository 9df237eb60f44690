package org.proplogic.parser;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.proplogic.support.Operator;
import org.proplogic.support.Token;

class FormulaTokenizerTest {
  static List<String> texts(String source) {
    return FormulaTokenizer.tokenize(source).stream().map(Token::getText).collect(Collectors.toList());
  }

  @Test
  void splitsBaseSymbolsFromIdentifiers() {
    assertThat(texts("¬(a∧b)∨c"), contains("¬", "(", "a", "∧", "b", ")", "∨", "c"));
  }

  @Test
  void collapsesWhitespace() {
    List<Token> tokens = FormulaTokenizer.tokenize("  alpha \t\n beta  ");
    assertThat(tokens, hasSize(2));
    assertTrue(tokens.get(0).isIdentifier());
    assertEquals("alpha", tokens.get(0).getText());
    assertEquals("beta", tokens.get(1).getText());
  }

  @Test
  void unicodeSpacesSeparateIdentifiers() {
    assertThat(texts("x\u00A0y\u3000z"), contains("x", "y", "z"));
  }

  @Test
  void resolvesAliasesCaseInsensitively() {
    List<Token> tokens = FormulaTokenizer.tokenize("A AND B Or NOT c IMPL d implies e -> f <-> g == h <- i");
    List<Operator> operators = tokens.stream()
        .filter(Token::isOperator)
        .map(Token::getOperator)
        .collect(Collectors.toList());

    assertThat(operators, contains(
        Operator.AND, Operator.OR, Operator.NOT, Operator.IMPLIES, Operator.IMPLIES,
        Operator.IMPLIES, Operator.IFF, Operator.IFF, Operator.CONVERSE_IMPLIES));
    assertThat(texts("A AND B"), contains("A", "∧", "B"));
  }

  @Test
  void aliasMustMatchTheWholeRun() {
    List<Token> tokens = FormulaTokenizer.tokenize("p->q android");
    assertThat(tokens, hasSize(2));
    assertTrue(tokens.get(0).isIdentifier());
    assertEquals("p->q", tokens.get(0).getText());
    assertEquals("android", tokens.get(1).getText());
  }

  @Test
  void baseSymbolsBreakIdentifiers() {
    assertThat(texts("p→q←r↔s"), contains("p", "→", "q", "←", "r", "↔", "s"));
  }

  @Test
  void recordsSourceOffsets() {
    List<Token> tokens = FormulaTokenizer.tokenize("ab ∧  c");
    assertThat(tokens.stream().map(Token::getOffset).collect(Collectors.toList()), contains(0, 3, 6));
  }

  @Test
  void emptyAndBlankTextHaveNoTokens() {
    assertThat(FormulaTokenizer.tokenize(""), is(empty()));
    assertThat(FormulaTokenizer.tokenize("   "), is(empty()));
  }

  @Test
  void rejectsNullText() {
    assertThrows(IllegalArgumentException.class, () -> FormulaTokenizer.tokenize(null));
  }
}
