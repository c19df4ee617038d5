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

import org.apache.log4j.Logger;
import org.junit.Test;

import exlc.tree.Node;
import exlc.tree.Operators.BinaryOperator;

/**
 * Dead store elimination and the two collapsing passes
 */
public class BindingPassesTest {
  private static final Logger logger =
                  Logger.getLogger(BindingPassesTest.class);

  private static Node dse(Node tree) {
    return new DeadStoreElimination().apply(logger, tree);
  }

  @Test
  public void testLiveStoreKept() {
    Node tree = block(match(pvar("a"), call("compute")),
                      match(pvar("b"), call("use", var("a"))));
    assertEquals(tree, dse(tree));
  }

  @Test
  public void testDeadStore() {
    Node tree = block(match(pvar("a"), call("compute")),
                      match(pvar("b"), intLit(1)));
    Node expected = block(match(wildcard(), call("compute")),
                          match(pvar("b"), intLit(1)));
    assertEquals(expected, dse(tree));
  }

  @Test
  public void testOverwrittenStore() {
    Node tree = block(match(pvar("a"), call("f")),
                      match(pvar("a"), call("g")), var("a"));
    Node expected = block(match(wildcard(), call("f")),
                          match(pvar("a"), call("g")), var("a"));
    assertEquals(expected, dse(tree));
  }

  @Test
  public void testReadInLaterBranch() {
    Node tree = block(match(pvar("a"), call("f")),
                      ifNode(var("c"), call("g", var("a")), nil()),
                      nil());
    assertEquals(tree, dse(tree));
  }

  @Test
  public void testUnderscoredStoreKept() {
    Node tree = block(match(pvar("_a"), call("f")), intLit(1));
    assertEquals(tree, dse(tree));
  }

  @Test
  public void testClosureBody() {
    Node tree = fn(clause(params(), null,
                  block(match(pvar("x"), call("f")), nil())));
    Node expected = fn(clause(params(), null,
                  block(match(wildcard(), call("f")), nil())));
    assertEquals(expected, dse(tree));
  }

  @Test
  public void testReadByClosure() {
    Node tree = block(match(pvar("x"), call("f")),
        call("run", fn(clause(params(), null, var("x")))));
    assertEquals(tree, dse(tree));
  }

  @Test
  public void testCollapseNestedMatch() {
    Node tree = block(match(pvar("a"), paren(match(pvar("b"), call("f")))),
                      var("a"));
    assertEquals(block(match(pvar("a"), call("f")), var("a")),
                 new CollapseNestedMatches().apply(logger, tree));
  }

  @Test
  public void testInnerBindingRead() {
    Node tree = block(match(pvar("a"), paren(match(pvar("b"), call("f")))),
                      call("g", var("a"), var("b")));
    assertEquals(tree, new CollapseNestedMatches().apply(logger, tree));
  }

  @Test
  public void testRefutableInnerPatternKept() {
    Node tree = block(
        match(pvar("a"), match(ptuple(plit(atom("ok")), pvar("v")),
                               call("f"))),
        var("a"));
    assertEquals(tree, new CollapseNestedMatches().apply(logger, tree));
  }

  @Test
  public void testCollapseAlias() {
    Node tree = block(match(pvar("t"), call("f")),
                      match(pvar("v"), var("t")), var("v"));
    assertEquals(block(match(pvar("v"), call("f")), var("v")),
                 new CollapseTempAliases().apply(logger, tree));
  }

  @Test
  public void testAliasChain() {
    Node tree = block(match(pvar("t1"), call("f")),
                      match(pvar("t2"), var("t1")),
                      match(pvar("x"), var("t2")),
                      binary(BinaryOperator.PLUS, var("x"), intLit(1)));
    Node expected = block(match(pvar("x"), call("f")),
                      binary(BinaryOperator.PLUS, var("x"), intLit(1)));
    assertEquals(expected, new CollapseTempAliases().apply(logger, tree));
  }

  @Test
  public void testAliasReadLater() {
    Node tree = block(match(pvar("t"), call("f")),
                      match(pvar("v"), var("t")),
                      call("g", var("t"), var("v")));
    assertEquals(tree, new CollapseTempAliases().apply(logger, tree));
  }
}
