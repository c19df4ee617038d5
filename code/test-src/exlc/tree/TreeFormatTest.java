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

package exlc.tree;

import static exlc.tree.Trees.*;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exlc.tree.Operators.BinaryOperator;
import exlc.tree.Operators.UnaryOperator;

public class TreeFormatTest {

  @Test
  public void testStatements() {
    Node tree = block(match(pvar("x"), intLit(1)), call("f", var("x")));
    assertEquals("x = 1\nf(x)", TreeFormat.format(tree));
  }

  @Test
  public void testOperators() {
    assertEquals("(1 + 2)", TreeFormat.format(
        binary(BinaryOperator.PLUS, intLit(1), intLit(2))));
    assertEquals("div(7, 2)", TreeFormat.format(
        binary(BinaryOperator.INT_DIV, intLit(7), intLit(2))));
    assertEquals("not true", TreeFormat.format(
        unary(UnaryOperator.NOT, bool(true))));
    assertEquals("-x", TreeFormat.format(
        unary(UnaryOperator.NEGATE, var("x"))));
  }

  @Test
  public void testInlineBlock() {
    Node tree = binary(BinaryOperator.PLUS, block(var("a"), var("b")),
                       var("c"));
    assertEquals("((a; b) + c)", TreeFormat.format(tree));
  }

  @Test
  public void testInterpolation() {
    Node tree = interpolation(str("Hi "), var("name"));
    assertEquals("\"Hi #{name}\"", TreeFormat.format(tree));
  }

  @Test
  public void testConditional() {
    Node tree = ifNode(var("c"), intLit(1), intLit(2));
    assertEquals("if c do\n  1\nelse\n  2\nend", TreeFormat.format(tree));
  }

  @Test
  public void testClosure() {
    Node tree = fn(clause(params(pvar("a")), null, var("a")));
    assertEquals("fn a -> a end", TreeFormat.format(tree));
  }

  @Test
  public void testPatterns() {
    assertEquals("{:ok, v}",
        TreeFormat.format(ptuple(plit(atom("ok")), pvar("v"))));
    assertEquals("^x", TreeFormat.format(pin("x")));
    assertEquals("[a] = all",
        TreeFormat.format(palias(plist(pvar("a")), "all")));
    assertEquals("_", TreeFormat.format(wildcard()));
  }

  @Test
  public void testToStringUsesFormat() {
    Node tree = match(pvar("y"), var("x"));
    assertEquals("y = x", tree.toString());
  }
}
