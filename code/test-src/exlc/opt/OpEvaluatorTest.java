/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exlc.opt;

import static exlc.tree.Trees.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;

import org.junit.Test;

import exlc.tree.Node;
import exlc.tree.Operators.BinaryOperator;
import exlc.tree.Operators.UnaryOperator;

public class OpEvaluatorTest {

  @Test
  public void testIntArithmetic() {
    assertEquals(intLit(5),
        OpEvaluator.eval(BinaryOperator.PLUS, intLit(2), intLit(3)));
    assertEquals(intLit(3),
        OpEvaluator.eval(BinaryOperator.DIV, intLit(7), intLit(2)));
    // Division floors
    assertEquals(intLit(-4),
        OpEvaluator.eval(BinaryOperator.DIV, intLit(-7), intLit(2)));
  }

  @Test
  public void testTruncatingDivision() {
    assertEquals(intLit(-3),
        OpEvaluator.eval(BinaryOperator.INT_DIV, intLit(-7), intLit(2)));
    assertEquals(intLit(-1),
        OpEvaluator.eval(BinaryOperator.REM, intLit(-7), intLit(2)));
  }

  @Test
  public void testRuntimeFailuresNotFolded() {
    assertNull(OpEvaluator.eval(BinaryOperator.DIV, intLit(1), intLit(0)));
    assertNull(OpEvaluator.eval(BinaryOperator.REM, intLit(1), intLit(0)));
    assertNull(OpEvaluator.eval(BinaryOperator.PLUS,
                                intLit(Long.MAX_VALUE), intLit(1)));
    assertNull(OpEvaluator.eval(UnaryOperator.NEGATE,
                                intLit(Long.MIN_VALUE)));
    assertNull(OpEvaluator.eval(BinaryOperator.PLUS, intLit(1), str("a")));
  }

  @Test
  public void testStrings() {
    assertEquals(str("ab"),
        OpEvaluator.eval(BinaryOperator.CONCAT, str("a"), str("b")));
    // Would create an interpolation slot
    assertNull(OpEvaluator.eval(BinaryOperator.CONCAT, str("#"), str("{x}")));
  }

  @Test
  public void testUnary() {
    assertEquals(bool(false), OpEvaluator.eval(UnaryOperator.NOT, bool(true)));
    assertEquals(bool(true), OpEvaluator.eval(UnaryOperator.BANG, nil()));
    assertEquals(bool(false), OpEvaluator.eval(UnaryOperator.BANG, intLit(0)));
    assertNull(OpEvaluator.eval(UnaryOperator.BANG, var("x")));
    assertNull(OpEvaluator.eval(UnaryOperator.NOT, nil()));
  }

  @Test
  public void testShortCircuit() {
    Node x = var("x");
    assertEquals(x, OpEvaluator.eval(BinaryOperator.AND, bool(true), x));
    assertEquals(bool(false),
                 OpEvaluator.eval(BinaryOperator.AND, bool(false), x));
    assertNull(OpEvaluator.eval(BinaryOperator.AND, x, bool(true)));
    assertEquals(x, OpEvaluator.eval(BinaryOperator.BOOL_OR, nil(), x));
    assertEquals(intLit(1),
                 OpEvaluator.eval(BinaryOperator.BOOL_OR, intLit(1), x));
  }

  @Test
  public void testMixedEquality() {
    assertEquals(bool(true),
        OpEvaluator.eval(BinaryOperator.EQ, atom("true"), bool(true)));
    assertEquals(bool(false),
        OpEvaluator.eval(BinaryOperator.EQ, intLit(1), str("1")));
    assertNull(OpEvaluator.eval(BinaryOperator.LT, intLit(1), str("1")));
  }

  @Test
  public void testListConcat() {
    assertEquals(list(intLit(1), var("y")),
        OpEvaluator.eval(BinaryOperator.LIST_CONCAT,
                         list(intLit(1)), list(var("y"))));
  }

  @Test
  public void testInterpolation() {
    assertEquals(str("n=3"), OpEvaluator.evalInterpolation(
                    Arrays.<Node>asList(str("n="), intLit(3))));
    assertEquals(str("a:b"), OpEvaluator.evalInterpolation(
                    Arrays.<Node>asList(atom("a"), str(":"), atom("b"), nil())));
    assertNull(OpEvaluator.evalInterpolation(
                    Arrays.<Node>asList(str("n="), var("n"))));
  }
}
