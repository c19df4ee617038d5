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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import exlc.analysis.BlockLiveness;
import exlc.analysis.Names;
import exlc.analysis.ScopeUnit;
import exlc.analysis.ScopeUnit.UnitKind;
import exlc.analysis.UsageAnalysis;
import exlc.common.Settings;
import exlc.opt.TreeWalk.TreeWalker;
import exlc.tree.Clause;
import exlc.tree.Control.Block;
import exlc.tree.Control.Case;
import exlc.tree.Control.Fn;
import exlc.tree.Node;

/**
 * Run the whole pipeline over generated programs and check that they
 * still compute the same value with the same effects, that a second run
 * changes nothing, and that underscored names introduced by the
 * pipeline are never read
 */
public class SemanticsPreservationTest {
  private static final Logger logger =
                  Logger.getLogger(SemanticsPreservationTest.class);

  private static final int PROGRAMS = 200;

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @Test
  public void testValuePreserved() {
    for (int seed = 0; seed < PROGRAMS; seed++) {
      Node tree = new RandomTrees(seed).program();
      ReferenceInterpreter before = new ReferenceInterpreter();
      Object expected = before.evaluate(tree);
      Node legalized = Legalizer.legalize(logger, null, tree);
      ReferenceInterpreter after = new ReferenceInterpreter();
      String msg = "seed " + seed + ": " + tree + "\n=>\n" + legalized;
      assertEquals(msg, expected, after.evaluate(legalized));
      assertEquals(msg, before.effects(), after.effects());
    }
  }

  @Test
  public void testIdempotent() {
    for (int seed = 0; seed < PROGRAMS; seed++) {
      Node once = Legalizer.legalize(logger, null,
                                     new RandomTrees(seed, true).program());
      Node twice = Legalizer.legalize(logger, null, once);
      assertEquals("seed " + seed + ": " + once, once, twice);
    }
  }

  @Test
  public void testUnderscoredNamesNotRead() {
    for (int seed = 0; seed < PROGRAMS; seed++) {
      Node tree = new RandomTrees(seed).program();
      checkUnderscoredNames("seed " + seed, tree,
                            Legalizer.legalize(logger, null, tree));
    }
  }

  @Test
  public void testUnderscoredNamesNotReadWithStrayReads() {
    for (int seed = 0; seed < PROGRAMS; seed++) {
      Node tree = new RandomTrees(seed, true).program();
      checkUnderscoredNames("seed " + seed, tree,
                            Legalizer.legalize(logger, null, tree));
    }
  }

  @Test
  public void testWithConditionChecks() {
    Settings.set(Settings.CHECK_CONDITIONS, "true");
    for (int seed = 0; seed < PROGRAMS / 4; seed++) {
      Legalizer.legalize(logger, null, new RandomTrees(seed).program());
      Legalizer.legalize(logger, null, new RandomTrees(seed, true).program());
    }
  }

  /**
   * No closure or case clause both binds and reads an underscored name,
   * and no underscored name that the input did not bind is read after
   * the statement binding it
   */
  private static void checkUnderscoredNames(final String msg, Node input,
                                            final Node output) {
    final Set<String> inputBinders = new HashSet<String>();
    TreeWalk.walk(input, new TreeWalker() {
      @Override
      public void visit(Node node) {
        inputBinders.addAll(UsageAnalysis.statementBinders(node));
      }

      @Override
      public void visit(Clause clause) {
        inputBinders.addAll(UsageAnalysis.patternBinders(clause.patterns()));
      }
    });

    TreeWalk.walk(output, new TreeWalker() {
      @Override
      public void visit(Node node) {
        switch (node.kind()) {
          case FN:
            for (Clause c: ((Fn)node).clauses()) {
              checkUnit(new ScopeUnit(UnitKind.CLOSURE, c));
            }
            break;
          case CASE:
            for (Clause c: ((Case)node).clauses()) {
              checkUnit(new ScopeUnit(UnitKind.CASE_CLAUSE, c));
            }
            break;
          case BLOCK:
            checkBlock(((Block)node).statements());
            break;
          default:
            break;
        }
      }

      private void checkUnit(ScopeUnit unit) {
        for (String name: unit.declared()) {
          if (Names.isUnderscored(name)) {
            assertFalse(msg + ": " + name + " read in " + unit + "\n" + output,
                        unit.referenced().contains(name));
          }
        }
      }

      private void checkBlock(List<Node> stmts) {
        BlockLiveness liveness = BlockLiveness.analyze(stmts);
        for (int i = 0; i < stmts.size(); i++) {
          for (String name: UsageAnalysis.statementBinders(stmts.get(i))) {
            if (Names.isUnderscored(name) && !inputBinders.contains(name)) {
              assertFalse(msg + ": " + name + " read after " + stmts.get(i)
                          + "\n" + output,
                          liveness.referencedAtOrAfter(name, i + 1));
            }
          }
        }
      }
    });
  }
}
