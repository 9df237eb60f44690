package org.proplogic.evaluation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import org.junit.jupiter.api.Test;
import org.proplogic.parser.FormulaParseException;
import org.proplogic.parser.FormulaParser;

class SymbolCollectorTest {
  @Test
  void symbolsInFirstOccurrenceOrder() throws FormulaParseException {
    assertThat(SymbolCollector.collect(FormulaParser.parse("(c → a) ↔ ¬b ∧ c")), contains("c", "a", "b"));
  }

  @Test
  void duplicatesAndConstantsAreSkipped() throws FormulaParseException {
    assertThat(SymbolCollector.collect(FormulaParser.parse("b ∧ a ∨ b ∧ 1")), contains("b", "a"));
    assertThat(SymbolCollector.collect(FormulaParser.parse("1 ∨ 0")), is(empty()));
  }

  @Test
  void symbolNamesAreCaseSensitive() throws FormulaParseException {
    assertThat(SymbolCollector.collect(FormulaParser.parse("p ∨ P")), contains("p", "P"));
  }
}
