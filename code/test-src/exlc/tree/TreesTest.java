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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import exlc.common.exceptions.LegalizerRuntimeError;
import exlc.tree.Control.Fn;
import exlc.tree.Exprs.Apply;
import exlc.tree.Operators.BinaryOperator;

public class TreesTest {

  @Test
  public void testEqualityIgnoresMeta() {
    Node plain = var("x");
    Node positioned = plain.withMeta(
                  NodeMeta.at(new FilePosition("test.src", 3, 7)));
    assertEquals(plain, positioned);
    assertEquals(plain.hashCode(), positioned.hashCode());
  }

  @Test
  public void testMapChildrenKeepsIdentity() {
    Node tree = binary(BinaryOperator.PLUS, var("a"), intLit(1));
    Node same = tree.mapChildren(new Node.Rewriter() {
      @Override
      public Node rewrite(Node node) {
        return node;
      }
    });
    assertSame(tree, same);
  }

  @Test
  public void testChildrenInEvaluationOrder() {
    Node tree = call("f", var("a"), var("b"), var("c"));
    assertEquals(Arrays.<Node>asList(var("a"), var("b"), var("c")),
                 tree.children());
  }

  @Test
  public void testReplaceKeepsMeta() {
    FilePosition pos = new FilePosition("test.src", 10);
    Node old = binary(BinaryOperator.PLUS, intLit(1), intLit(2))
                    .withMeta(NodeMeta.at(pos).withFlag(NodeMeta.Flag.PRESERVE_NAMES));
    Node replaced = Trees.replace(old, intLit(3));
    assertEquals(pos, replaced.meta().getPosition());
    assertTrue(replaced.meta().hasFlag(NodeMeta.Flag.PRESERVE_NAMES));
  }

  @Test
  public void testReplaceWithoutMeta() {
    Node replacement = intLit(3);
    assertSame(replacement, Trees.replace(intLit(4), replacement));
  }

  @Test
  public void testIife() {
    Apply iife = Trees.iife(block(var("a"), var("b")));
    assertTrue(iife.meta().hasFlag(NodeMeta.Flag.LEGALIZED_IIFE));
    assertTrue(iife.args().isEmpty());
    Fn fn = (Fn)iife.function();
    assertEquals(1, fn.clauses().size());
    assertTrue(fn.clauses().get(0).patterns().isEmpty());
    assertNull(fn.clauses().get(0).guard());
  }

  @Test
  public void testUnparen() {
    assertEquals(var("x"), Trees.unparen(paren(paren(var("x")))));
  }

  @Test
  public void testTruthiness() {
    assertEquals(Boolean.FALSE, Literals.truthiness(nil()));
    assertEquals(Boolean.FALSE, Literals.truthiness(bool(false)));
    assertEquals(Boolean.TRUE, Literals.truthiness(intLit(0)));
    assertEquals(Boolean.TRUE, Literals.truthiness(str("")));
    assertNull(Literals.truthiness(var("x")));
  }

  @Test(expected=LegalizerRuntimeError.class)
  public void testSinglePatternOfMultiPatternClause() {
    clause(params(pvar("a"), pvar("b")), null, nil()).pattern();
  }
}
