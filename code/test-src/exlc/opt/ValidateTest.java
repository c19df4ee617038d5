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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Test;

import exlc.common.exceptions.LegalizerRuntimeError;
import exlc.tree.Node;

public class ValidateTest {
  private static final Logger logger = Logger.getLogger(ValidateTest.class);

  private static List<String> violations(Node tree) {
    List<String> result = new ArrayList<String>();
    Validate.checkWellFormed(tree, result);
    return result;
  }

  @Test
  public void testWellFormed() {
    Node tree = block(match(pvar("a"), call("f")),
        caseOf(var("a"), caseClause(pin("a"), nil()),
                         caseClause(wildcard(), var("a"))));
    assertTrue(violations(tree).isEmpty());
    assertSame(tree, Validate.standardValidator().apply(logger, tree));
  }

  @Test
  public void testCaseClauseArity() {
    Node tree = caseOf(var("x"),
        clause(params(pvar("a"), pvar("b")), null, var("a")));
    assertEquals(1, violations(tree).size());
  }

  @Test
  public void testClosureArity() {
    Node tree = fn(clause(params(pvar("a")), null, var("a")),
                   clause(params(), null, nil()));
    assertEquals(1, violations(tree).size());
  }

  @Test
  public void testBadNames() {
    assertEquals(1, violations(var("_")).size());
    assertEquals(1, violations(match(pvar("Mod"), intLit(1))).size());
    assertEquals(1, violations(cond()).size());
  }

  @Test
  public void testStandardValidatorThrows() {
    try {
      Validate.standardValidator().apply(logger, call("f", var("_")));
      fail("Expected error");
    } catch (LegalizerRuntimeError e) {
      assertTrue(e.getMessage(), e.getMessage().contains("validate"));
    }
  }

  @Test
  public void testFinalValidator() {
    Node tree = call("f", block(call("g"), var("x")));
    assertSame(tree, Validate.standardValidator().apply(logger, tree));
    try {
      Validate.finalValidator().apply(logger, tree);
      fail("Expected error");
    } catch (LegalizerRuntimeError e) {
      assertTrue(e.getMessage(), e.getMessage().contains("validate-final"));
    }
  }
}
