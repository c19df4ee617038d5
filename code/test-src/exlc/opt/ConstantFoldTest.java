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
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Logger;
import org.junit.Test;

import exlc.tree.Node;
import exlc.tree.Operators.BinaryOperator;
import exlc.tree.Operators.UnaryOperator;

public class ConstantFoldTest {
  private static final Logger logger = Logger.getLogger(ConstantFoldTest.class);

  private static Node fold(Node tree) {
    return new ConstantFold().apply(logger, tree);
  }

  @Test
  public void testNestedExpression() {
    Node tree = binary(BinaryOperator.PLUS,
        paren(binary(BinaryOperator.MULT, intLit(2), intLit(3))), intLit(1));
    assertEquals(intLit(7), fold(tree));
  }

  @Test
  public void testPartialFold() {
    Node tree = call("f", binary(BinaryOperator.MINUS, intLit(5), intLit(2)),
                     binary(BinaryOperator.PLUS, var("x"), intLit(1)));
    Node expected = call("f", intLit(3),
                         binary(BinaryOperator.PLUS, var("x"), intLit(1)));
    assertEquals(expected, fold(tree));
  }

  @Test
  public void testRuntimeErrorKept() {
    Node tree = call("f", binary(BinaryOperator.DIV, intLit(1), intLit(0)));
    assertEquals(tree, fold(tree));
  }

  @Test
  public void testInterpolation() {
    Node tree = interpolation(str("x="),
                    binary(BinaryOperator.PLUS, intLit(1), intLit(1)));
    assertEquals(str("x=2"), fold(tree));
  }

  @Test
  public void testConditionFolds() {
    Node tree = ifNode(unary(UnaryOperator.NOT, bool(false)),
                       call("f"), call("g"));
    assertEquals(ifNode(bool(true), call("f"), call("g")), fold(tree));
  }

  @Test
  public void testPostconditions() {
    Node tree = block(
        match(pvar("a"), paren(binary(BinaryOperator.LT, intLit(1), intLit(2)))),
        interpolation(str("a="), var("a"), str(" "), intLit(4)));
    Node result = fold(tree);
    for (TreeCondition cond: new ConstantFold().getPostconditions()) {
      assertTrue(cond.getName(), cond.holds(result));
    }
  }
}
