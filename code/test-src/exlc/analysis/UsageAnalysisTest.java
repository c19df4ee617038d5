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
import static org.junit.Assert.assertTrue;

import java.util.Set;

import org.junit.Test;

import com.google.common.collect.ImmutableSet;

import exlc.tree.Node;
import exlc.tree.Operators.BinaryOperator;

public class UsageAnalysisTest {

  private static Node closureProgram() {
    // a = 1; fn x -> y = x + z end
    return block(match(pvar("a"), intLit(1)),
        fn(clause(params(pvar("x")), null,
            match(pvar("y"),
                  binary(BinaryOperator.PLUS, var("x"), var("z"))))));
  }

  @Test
  public void testDeclared() {
    assertEquals(ImmutableSet.of("a", "x", "y"),
                 UsageAnalysis.declared(closureProgram()));
    assertEquals(ImmutableSet.of("a"),
                 UsageAnalysis.declaredLocal(closureProgram()));
  }

  @Test
  public void testReferenced() {
    assertEquals(ImmutableSet.of("x", "z"),
                 UsageAnalysis.referenced(closureProgram()));
    // x is bound by the closure head
    assertEquals(ImmutableSet.of("z"),
                 UsageAnalysis.referencedClosureAware(closureProgram()));
  }

  @Test
  public void testFreeVariablesBlocksDoNotScope() {
    Node tree = block(match(pvar("a"), var("b")), var("a"));
    assertEquals(ImmutableSet.of("b"), UsageAnalysis.freeVariables(tree));
    assertEquals(ImmutableSet.of("b", "a"),
                 UsageAnalysis.referencedClosureAware(tree));
  }

  @Test
  public void testFreeVariablesBranchesScope() {
    Node tree = block(
        ifNode(var("c"), match(pvar("a"), intLit(1)), nil()),
        var("a"));
    assertEquals(ImmutableSet.of("c", "a"),
                 UsageAnalysis.freeVariables(tree));
  }

  @Test
  public void testStatementBinders() {
    Node chain = match(pvar("a"), paren(match(pvar("b"), intLit(1))));
    assertEquals(ImmutableSet.of("a", "b"),
                 UsageAnalysis.statementBinders(chain));
    assertTrue(UsageAnalysis.statementBinders(
                        call("f", var("a"))).isEmpty());
  }

  @Test
  public void testModuleReferencesIgnored() {
    Node tree = apply(field(var("Enum"), "map"), var("xs"));
    assertEquals(ImmutableSet.of("xs"), UsageAnalysis.referenced(tree));
  }

  @Test
  public void testInterpolatedStrings() {
    Set<String> refs = UsageAnalysis.referenced(str("Hello #{name}"));
    assertEquals(ImmutableSet.of("name"), refs);
  }

  @Test
  public void testPatterns() {
    assertEquals(ImmutableSet.of("a", "all"), UsageAnalysis.patternBinders(
                    palias(ptuple(pvar("a"), wildcard()), "all")));
    assertEquals(ImmutableSet.of("x"), UsageAnalysis.patternReferences(
                    ptuple(pin("x"), pvar("y"))));
    assertEquals(ImmutableSet.of("y"), UsageAnalysis.patternBinders(
                    ptuple(pin("x"), pvar("y"))));
  }

  @Test
  public void testCaseClausesBindTheirPatterns() {
    // case v do {:ok, r} -> r end
    Node tree = caseOf(var("v"),
        caseClause(ptuple(plit(atom("ok")), pvar("r")), var("r")));
    assertEquals(ImmutableSet.of("v"), UsageAnalysis.freeVariables(tree));
    assertEquals(ImmutableSet.of("v"),
                 UsageAnalysis.referencedClosureAware(tree));
  }
}
