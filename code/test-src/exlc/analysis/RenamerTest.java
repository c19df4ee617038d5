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
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exlc.common.exceptions.LegalizerRuntimeError;
import exlc.tree.Clause;
import exlc.tree.Node;
import exlc.tree.Operators.BinaryOperator;

public class RenamerTest {

  @Test
  public void testRenameInUnit() {
    Clause clause = clause(params(pvar("x")), null,
        binary(BinaryOperator.PLUS, var("x"), var("y")));
    Clause expected = clause(params(pvar("z")), null,
        binary(BinaryOperator.PLUS, var("z"), var("y")));
    assertEquals(expected, Renamer.renameInUnit(clause, "x", "z"));
  }

  @Test
  public void testStopsAtShadowingClosure() {
    Node tree = block(var("x"), fn(clause(params(pvar("x")), null, var("x"))));
    Node expected = block(var("z"),
                          fn(clause(params(pvar("x")), null, var("x"))));
    assertEquals(expected, Renamer.rename(tree, "x", "z"));
  }

  @Test
  public void testPinsReadOuterBinding() {
    Node tree = fn(clause(params(pin("x")), null, var("x")));
    Node expected = fn(clause(params(pin("z")), null, var("z")));
    assertEquals(expected, Renamer.rename(tree, "x", "z"));
  }

  @Test
  public void testReferencesOnly() {
    Node tree = match(pvar("x"), var("x"));
    assertEquals(match(pvar("x"), var("z")),
                 Renamer.renameReferences(tree, "x", "z"));
    assertEquals(match(pvar("z"), var("z")), Renamer.rename(tree, "x", "z"));
  }

  @Test
  public void testInterpolationSlots() {
    assertEquals(str("Hi #{z}"), Renamer.rename(str("Hi #{x}"), "x", "z"));
  }

  @Test
  public void testBindersOnly() {
    assertEquals(ptuple(pvar("z"), pin("x")),
        Renamer.renameBinders(ptuple(pvar("x"), pin("x")), "x", "z"));
  }

  @Test(expected=LegalizerRuntimeError.class)
  public void testRenameToModuleNameRejected() {
    Renamer.rename(var("x"), "x", "Foo");
  }
}
