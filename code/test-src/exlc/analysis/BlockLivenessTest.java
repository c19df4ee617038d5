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

package exlc.analysis;

import static exlc.tree.Trees.*;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exlc.tree.Node;
import exlc.tree.Operators.BinaryOperator;

public class BlockLivenessTest {

  // a = 1; b = a; a = 2; c(a)
  private static final List<Node> STMTS = Arrays.<Node>asList(
      match(pvar("a"), intLit(1)),
      match(pvar("b"), var("a")),
      match(pvar("a"), intLit(2)),
      call("c", var("a")));

  @Test
  public void testLiveAfter() {
    BlockLiveness l = BlockLiveness.analyze(STMTS);
    assertTrue(l.isLiveAfter("a", 0));
    assertFalse(l.isLiveAfter("b", 1));
    assertTrue(l.isLiveAfter("a", 2));
  }

  @Test
  public void testOverwrittenBeforeRead() {
    // a = 1; a = 2; a
    BlockLiveness l = BlockLiveness.analyze(Arrays.<Node>asList(
        match(pvar("a"), intLit(1)),
        match(pvar("a"), intLit(2)),
        var("a")));
    assertFalse(l.isLiveAfter("a", 0));
    assertTrue(l.isLiveAfter("a", 1));
  }

  @Test
  public void testReadInRebindingStatement() {
    // a = 1; a = a + 1
    BlockLiveness l = BlockLiveness.analyze(Arrays.<Node>asList(
        match(pvar("a"), intLit(1)),
        match(pvar("a"), binary(BinaryOperator.PLUS, var("a"), intLit(1)))));
    assertTrue(l.isLiveAfter("a", 0));
    assertFalse(l.isLiveAfter("a", 1));
  }

  @Test
  public void testLiveOut() {
    List<Node> stmts = Arrays.<Node>asList(match(pvar("a"), intLit(1)));
    assertFalse(BlockLiveness.analyze(stmts).isLiveAfter("a", 0));
    assertTrue(BlockLiveness.analyze(stmts, Collections.singleton("a"))
                            .isLiveAfter("a", 0));
  }

  @Test
  public void testReferenceQueries() {
    BlockLiveness l = BlockLiveness.analyze(STMTS);
    assertTrue(l.referencedAtOrAfter("a", 3));
    assertFalse(l.referencedAtOrAfter("b", 0));
  }

  @Test
  public void testBoundElsewhere() {
    BlockLiveness l = BlockLiveness.analyze(STMTS);
    assertTrue(l.boundElsewhere("a", 0));
    assertFalse(l.boundElsewhere("b", 1));
    assertTrue(l.boundElsewhere("b", -1));
    assertFalse(l.boundElsewhere("c", -1));
  }
}
