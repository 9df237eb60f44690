package org.proplogic.parser;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.proplogic.support.FormulaNode;
import org.proplogic.support.Operator;
import org.proplogic.support.Token;
import org.proplogic.support.TreeElement;

class TreeReformatterTest {
  static TreeElement id(String name) {
    return TreeElement.of(Token.identifier(name, -1));
  }

  static TreeElement op(Operator operator) {
    return TreeElement.of(Token.operator(operator, -1));
  }

  static ParseError failure(TreeElement tree) {
    return assertThrows(FormulaParseException.class, () -> TreeReformatter.reformat(tree)).getError();
  }

  @Test
  void identifierBecomesLeaf() throws FormulaParseException {
    assertEquals(FormulaNode.leaf("p"), TreeReformatter.reformat(id("p")));
    assertEquals(FormulaNode.leaf("p"), TreeReformatter.reformat(TreeElement.group(TreeElement.group(id("p")))));
  }

  @Test
  void unaryShapeBecomesUnaryNode() throws FormulaParseException {
    FormulaNode node = TreeReformatter.reformat(TreeElement.group(op(Operator.NOT), id("p")));
    assertEquals(FormulaNode.unary(Operator.NOT, FormulaNode.leaf("p")), node);
  }

  @Test
  void binaryShapeBecomesBinaryNode() throws FormulaParseException {
    FormulaNode node = TreeReformatter.reformat(
        TreeElement.group(TreeElement.group(id("a")), op(Operator.IFF), TreeElement.group(id("b"))));
    assertEquals(FormulaNode.binary(Operator.IFF, FormulaNode.leaf("a"), FormulaNode.leaf("b")), node);
  }

  @Test
  void emptyGroupIsEmptyExpression() {
    assertEquals(ParseError.EMPTY_EXPRESSION, failure(TreeElement.emptyGroup()));
  }

  @Test
  void loneOperatorHasNoOperand() {
    assertEquals(ParseError.OPERATOR_WITHOUT_OPERAND, failure(op(Operator.AND)));
    assertEquals(ParseError.OPERATOR_WITHOUT_OPERAND, failure(TreeElement.group(op(Operator.NOT))));
  }

  @Test
  void malformedUnaryShapes() {
    assertEquals(ParseError.MALFORMED_UNARY_OPERATOR, failure(TreeElement.group(id("a"), id("b"))));
    assertEquals(ParseError.MALFORMED_UNARY_OPERATOR, failure(TreeElement.group(op(Operator.NOT), op(Operator.NOT))));
    assertEquals(ParseError.MALFORMED_UNARY_OPERATOR, failure(TreeElement.group(op(Operator.AND), id("b"))));
  }

  @Test
  void malformedBinaryShapes() {
    assertEquals(ParseError.MALFORMED_BINARY_OPERATOR, failure(TreeElement.group(id("a"), id("b"), id("c"))));
    assertEquals(ParseError.MALFORMED_BINARY_OPERATOR,
        failure(TreeElement.group(op(Operator.OR), op(Operator.AND), id("c"))));
    assertEquals(ParseError.MALFORMED_BINARY_OPERATOR,
        failure(TreeElement.group(TreeElement.emptyGroup(), op(Operator.AND), id("c"))));
    assertEquals(ParseError.MALFORMED_BINARY_OPERATOR, failure(TreeElement.group(id("a"), op(Operator.NOT), id("c"))));
  }

  @Test
  void otherLengthsAreMalformedExpressions() {
    assertEquals(ParseError.MALFORMED_EXPRESSION, failure(TreeElement.group(id("a"), id("b"), id("c"), id("d"))));
  }
}
