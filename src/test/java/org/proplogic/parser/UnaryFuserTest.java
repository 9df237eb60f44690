package org.proplogic.parser;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class UnaryFuserTest {
  static String fused(String source) {
    return UnaryFuser.fuse(ParenthesisGrouper.group(FormulaTokenizer.tokenize(source))).toString();
  }

  @Test
  void negationFusesWithRightNeighbour() {
    assertEquals("[[¬, a]]", fused("¬a"));
    assertEquals("[a, ∧, [¬, b]]", fused("a ∧ ¬b"));
  }

  @Test
  void repeatedNegationsNest() {
    assertEquals("[[¬, [¬, a]]]", fused("¬¬a"));
  }

  @Test
  void negationTakesAWholeGroup() {
    assertEquals("[[¬, [a, ∨, b]], ∧, c]", fused("¬(a ∨ b) ∧ c"));
  }

  @Test
  void negationsInsideGroupsAreFused() {
    assertEquals("[a, ∨, [[¬, b], ∧, c]]", fused("a ∨ (¬b ∧ c)"));
  }

  @Test
  void trailingNegationStaysBare() {
    assertEquals("[a, ¬]", fused("a ¬"));
  }
}
