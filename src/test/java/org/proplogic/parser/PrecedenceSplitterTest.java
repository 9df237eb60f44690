package org.proplogic.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.proplogic.support.Operator;
import org.proplogic.support.TreeElement;

class PrecedenceSplitterTest {
  static TreeElement prepared(String source) {
    return UnaryFuser.fuse(ParenthesisGrouper.group(FormulaTokenizer.tokenize(source)));
  }

  static String split(String source, Set<Operator> operators) {
    return PrecedenceSplitter.split(prepared(source), operators).toString();
  }

  @Test
  void splitsAtOperatorOfTheClass() {
    assertEquals("[[a], ∧, [b]]", split("a ∧ b", EnumSet.of(Operator.AND)));
  }

  @Test
  void chainsAssociateToTheLeft() {
    assertEquals("[[[a], ∧, [b]], ∧, [c]]", split("a ∧ b ∧ c", EnumSet.of(Operator.AND)));
  }

  @Test
  void implicationAndConverseShareAClass() {
    assertEquals("[[[a], ←, [b]], →, [c]]",
        split("a ← b → c", EnumSet.of(Operator.IMPLIES, Operator.CONVERSE_IMPLIES)));
  }

  @Test
  void nestedGroupsAreProcessedButNotSplitAtThisLevel() {
    assertEquals("[[[a], ∧, [b]], ∨, c]", split("(a ∧ b) ∨ c", EnumSet.of(Operator.AND)));
  }

  @Test
  void sequenceWithoutOperatorIsUnchanged() {
    assertEquals("[a, ∨, b]", split("a ∨ b", EnumSet.of(Operator.IFF)));
  }

  @Test
  void missingLeftOperandLeavesEmptyGroup() {
    assertEquals("[[], ∧, [a]]", split("∧ a", EnumSet.of(Operator.AND)));
  }

  @Test
  void allPassesApplyPrecedenceLadder() {
    assertEquals("[[a], ∨, [[[b], ∧, [c]]]]", PrecedenceSplitter.splitAll(prepared("a ∨ b ∧ c")).toString());
  }

  @Test
  void splitDoesNotModifyItsInput() {
    TreeElement input = prepared("a ∧ b");
    String before = input.toString();
    PrecedenceSplitter.split(input, EnumSet.of(Operator.AND));
    assertEquals(before, input.toString());
  }
}
