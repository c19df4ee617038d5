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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Logger;
import org.junit.Test;

import exlc.opt.WrapCompoundSlots.SlotKind;
import exlc.tree.Node;
import exlc.tree.NodeMeta;
import exlc.tree.Operators.BinaryOperator;
import exlc.tree.Operators.UnaryOperator;

public class WrapCompoundSlotsTest {
  private static final Logger logger =
                  Logger.getLogger(WrapCompoundSlotsTest.class);

  /** a = g(); a */
  private static Node compound() {
    return block(match(pvar("a"), call("g")), var("a"));
  }

  @Test
  public void testArguments() {
    Node tree = call("f", compound(), var("y"));
    Node result = WrapCompoundSlots.arguments().apply(logger, tree);
    assertEquals(call("f", iife(compound()), var("y")), result);
    assertTrue(Conditions.noCompoundSlots(SlotKind.ARGUMENT).holds(result));
  }

  @Test
  public void testParenthesizedArgument() {
    Node tree = apply(var("fun"), paren(compound()));
    assertEquals(apply(var("fun"), iife(compound())),
                 WrapCompoundSlots.arguments().apply(logger, tree));
  }

  @Test
  public void testOperands() {
    Node tree = binary(BinaryOperator.PLUS, compound(),
                       unary(UnaryOperator.NEGATE, paren(compound())));
    Node expected = binary(BinaryOperator.PLUS, iife(compound()),
                       unary(UnaryOperator.NEGATE, iife(compound())));
    assertEquals(expected, WrapCompoundSlots.operands().apply(logger, tree));
    // Other slot families are left alone
    assertEquals(tree, WrapCompoundSlots.arguments().apply(logger, tree));
  }

  @Test
  public void testInterpolations() {
    Node tree = interpolation(str("v="), compound());
    assertEquals(interpolation(str("v="), iife(compound())),
                 WrapCompoundSlots.interpolations().apply(logger, tree));
  }

  @Test
  public void testElements() {
    Node tree = tuple(intLit(1), list(compound()));
    assertEquals(tuple(intLit(1), list(iife(compound()))),
                 WrapCompoundSlots.elements().apply(logger, tree));
  }

  @Test
  public void testNestedCompounds() {
    Node tree = call("f", block(call("h"), call("g", compound())));
    Node expected = call("f", iife(block(call("h"),
                                         call("g", iife(compound())))));
    assertEquals(expected, WrapCompoundSlots.arguments().apply(logger, tree));
  }

  @Test
  public void testEmptyBlockNotCompound() {
    assertFalse(WrapCompoundSlots.isCompound(block()));
    assertFalse(WrapCompoundSlots.isCompound(var("x")));
    assertTrue(WrapCompoundSlots.isCompound(paren(compound())));
    Node tree = call("f", block());
    assertEquals(tree, WrapCompoundSlots.arguments().apply(logger, tree));
  }

  @Test
  public void testWrappedClosureFlagged() {
    Node result = WrapCompoundSlots.wrap(compound());
    assertTrue(result.meta().hasFlag(NodeMeta.Flag.LEGALIZED_IIFE));
  }
}
