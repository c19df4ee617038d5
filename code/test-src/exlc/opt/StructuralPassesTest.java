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

/**
 * Flattening, parenthesis removal, branch selection and removal of
 * pure statements
 */
public class StructuralPassesTest {
  private static final Logger logger =
                  Logger.getLogger(StructuralPassesTest.class);

  @Test
  public void testFlattenNested() {
    Node tree = block(call("a"),
        block(call("b"), paren(block(call("c")))), call("d"));
    Node result = new FlattenNested().apply(logger, tree);
    assertEquals(block(call("a"), call("b"), call("c"), call("d")), result);
    assertTrue(Conditions.NO_NESTED_BLOCKS.holds(result));
  }

  @Test
  public void testFlattenTrailingEmptyBlock() {
    Node tree = block(call("a"), block());
    assertEquals(block(call("a"), nil()),
                 new FlattenNested().apply(logger, tree));
  }

  @Test
  public void testFlattenLeavesSlotBlocks() {
    Node tree = call("f", block(call("a"), call("b")));
    assertEquals(tree, new FlattenNested().apply(logger, tree));
  }

  @Test
  public void testUnwrapParens() {
    UnwrapRedundantParens pass = new UnwrapRedundantParens();
    assertEquals(var("x"), pass.apply(logger, paren(paren(var("x")))));
    assertEquals(call("g", call("f")),
                 pass.apply(logger, call("g", block(call("f")))));
    Node sum = paren(binary(BinaryOperator.PLUS, var("x"), var("y")));
    assertEquals(sum, pass.apply(logger, paren(sum)));
  }

  @Test
  public void testSelectConstantBranch() {
    SimplifyConditionals pass = new SimplifyConditionals();
    assertEquals(call("f"), pass.apply(logger,
                 ifNode(bool(true), call("f"), call("g"))));
    assertEquals(call("g"), pass.apply(logger,
                 ifNode(nil(), call("f"), call("g"))));
    assertEquals(nil(), pass.apply(logger,
                 ifNode(bool(false), call("f"), null)));
  }

  @Test
  public void testSelectedBlockSpliced() {
    Node tree = block(call("a"),
        ifNode(bool(true), block(call("f"), call("g")), nil()),
        call("h"));
    assertEquals(block(call("a"), call("f"), call("g"), call("h")),
                 new SimplifyConditionals().apply(logger, tree));
  }

  @Test
  public void testBranchBindingSelectedAsClosure() {
    Node branch = block(match(pvar("y"), intLit(1)), var("y"));
    Node tree = block(ifNode(bool(true), branch, intLit(2)), call("h"));
    assertEquals(block(iife(branch), call("h")),
                 new SimplifyConditionals().apply(logger, tree));

    Node leading = cond(branch(bool(true), match(pvar("z"), call("f"))),
                        branch(var("c"), intLit(2)));
    assertEquals(iife(match(pvar("z"), call("f"))),
                 new SimplifyConditionals().apply(logger, leading));
  }

  @Test
  public void testCondPruning() {
    Node tree = cond(branch(bool(false), intLit(1)),
                     branch(var("c"), intLit(2)),
                     branch(bool(true), intLit(3)),
                     branch(var("d"), intLit(4)));
    Node expected = cond(branch(var("c"), intLit(2)),
                         branch(bool(true), intLit(3)));
    assertEquals(expected, new SimplifyConditionals().apply(logger, tree));
  }

  @Test
  public void testCondNoBranchMatches() {
    Node tree = cond(branch(bool(false), intLit(1)),
                     branch(nil(), intLit(2)));
    assertEquals(tree, new SimplifyConditionals().apply(logger, tree));
  }

  @Test
  public void testSelectedOperandFolds() {
    Node tree = binary(BinaryOperator.PLUS,
                       ifNode(bool(true), intLit(1), intLit(2)), intLit(3));
    assertEquals(intLit(4), new SimplifyConditionals().apply(logger, tree));
  }

  @Test
  public void testDropPureStatements() {
    Node tree = block(var("x"), intLit(1), call("f"),
                      list(var("y"), atom("ok")), var("z"));
    Node result = new DropPureStatements().apply(logger, tree);
    assertEquals(block(call("f"), var("z")), result);
    assertTrue(Conditions.NO_PURE_STATEMENTS.holds(result));
  }

  @Test
  public void testDropKeepsFinalValue() {
    assertEquals(call("f"), new DropPureStatements().apply(logger,
                 block(var("x"), call("f"))));
    Node tree = block(call("f"), intLit(1));
    assertEquals(tree, new DropPureStatements().apply(logger, tree));
  }
}
