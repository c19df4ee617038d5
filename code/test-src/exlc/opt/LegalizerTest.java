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

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.base.Charsets;
import com.google.common.io.Files;

import exlc.common.Settings;
import exlc.tree.Node;
import exlc.tree.Operators.BinaryOperator;

public class LegalizerTest {
  private static final Logger logger = Logger.getLogger(LegalizerTest.class);

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @After
  public void resetSettings() {
    Settings.reset();
  }

  private static Node legalize(Node tree) {
    return Legalizer.legalize(logger, null, tree);
  }

  @Test
  public void testPassOrder() {
    List<String> names = new ArrayList<String>();
    List<String> keys = new ArrayList<String>();
    for (LegalizationPass pass: Legalizer.standardPasses()) {
      names.add(pass.getPassName());
      keys.add(pass.getConfigEnabledKey());
    }
    assertEquals(Arrays.asList(
        "flatten-nested", "unwrap-redundant-parens", "constant-fold",
        "simplify-conditionals", "wrap-compound-arguments",
        "wrap-compound-operands", "wrap-compound-interpolations",
        "wrap-compound-elements", "drop-pure-statements",
        "collapse-nested-matches", "collapse-temp-aliases",
        "dead-store-elimination", "align-clause-payloads",
        "normalize-flattened-names", "promote-underscore-binders",
        "suppress-unused-binders"), names);
    assertEquals(Settings.getPassKeys(), keys);
  }

  @Test
  public void testDeadStore() {
    Node tree = block(match(pvar("a"), call("compute")),
                      match(pvar("b"), intLit(1)));
    Node expected = block(match(wildcard(), call("compute")),
                          match(pvar("_b"), intLit(1)));
    assertEquals(expected, legalize(tree));
  }

  @Test
  public void testPayloadAlignment() {
    Node body = binary(BinaryOperator.CONCAT, str("Task: "), var("todo"));
    Node tree = fn(clause(params(pvar("task")), null,
        caseOf(var("task"),
            caseClause(ptuple(plit(atom("tag")), pvar("payload")), body))));
    Node expected = fn(clause(params(pvar("task")), null,
        caseOf(var("task"),
            caseClause(ptuple(plit(atom("tag")), pvar("todo")), body))));
    assertEquals(expected, legalize(tree));
  }

  @Test
  public void testCompoundArgument() {
    // f((x = g(); x + 1))
    Node compound = block(match(pvar("x"), call("g")),
                          binary(BinaryOperator.PLUS, var("x"), intLit(1)));
    Node tree = call("f", paren(compound));
    assertEquals(call("f", iife(compound)), legalize(tree));
  }

  @Test
  public void testConditionChecking() {
    Settings.set(Settings.CHECK_CONDITIONS, "true");
    Node tree = block(
        match(pvar("t"), binary(BinaryOperator.MULT, intLit(6), intLit(7))),
        match(pvar("v"), var("t")),
        ifNode(bool(true), call("f", block(call("g"), var("v"))), nil()));
    Node expected = block(
        match(pvar("v"), intLit(42)),
        call("f", iife(block(call("g"), var("v")))));
    assertEquals(expected, legalize(tree));
  }

  @Test
  public void testDisabledPass() {
    Settings.set(Settings.PASS_WRAP_ARGUMENTS, "false");
    Node compound = block(match(pvar("a"), call("g")), var("a"));
    Node tree = call("f", compound);
    assertEquals(tree, legalize(tree));
  }

  @Test
  public void testIROutputFile() throws Exception {
    File out = tmp.newFile("ir.txt");
    Settings.set(Settings.IR_OUTPUT_FILE, out.getPath());
    Node result = Legalizer.legalize(
        binary(BinaryOperator.PLUS, intLit(1), intLit(2)));
    assertEquals(intLit(3), result);
    String text = Files.asCharSource(out, Charsets.UTF_8).read();
    assertTrue(text, text.startsWith("// Initial tree"));
    assertTrue(text, text.contains("// Tree after suppress-unused-binders"));
  }

  @Test
  public void testDescribePasses() {
    Settings.set(Settings.PASS_CONSTANT_FOLD, "false");
    String[] lines = Legalizer.describePasses().split("\n");
    assertEquals(16, lines.length);
    for (String line: lines) {
      if (line.startsWith("constant-fold ")) {
        assertTrue(line, line.contains("disabled"));
      } else {
        assertTrue(line, line.contains("enabled"));
      }
    }
  }

  @Test
  public void testConstantBranchWithDeadBindingStable() {
    Node tree = block(
        ifNode(bool(true), block(match(pvar("x"), call("f")), call("g")),
               nil()),
        call("h"));
    Node once = legalize(tree);
    assertEquals(block(iife(block(match(wildcard(), call("f")), call("g"))),
                       call("h")), once);
    assertEquals(once, legalize(once));

    Node leading = block(
        cond(branch(bool(true), block(match(pvar("y"), call("f")),
                                      call("g"))),
             branch(var("c"), intLit(1))),
        call("h"));
    Node leadingOnce = legalize(leading);
    assertEquals(leadingOnce, legalize(leadingOnce));
  }

  @Test
  public void testStandardPipelineValidators() {
    List<LegalizationPass> passes =
              Legalizer.standardPipeline(null, false, true).getPasses();
    assertEquals(18, passes.size());
    assertEquals("validate", passes.get(0).getPassName());
    assertEquals("flatten-nested", passes.get(1).getPassName());
    assertEquals("validate-final", passes.get(17).getPassName());

    assertEquals(16,
        Legalizer.standardPipeline(null, false, false).getPasses().size());

    // Without every pass, only well-formedness is checked at the end
    Settings.set(Settings.PASS_CONSTANT_FOLD, "false");
    passes = Legalizer.standardPipeline(null, false, true).getPasses();
    assertEquals("validate", passes.get(17).getPassName());
  }
}
