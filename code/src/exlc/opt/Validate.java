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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exlc.analysis.Names;
import exlc.common.exceptions.LegalizerRuntimeError;
import exlc.opt.TreeWalk.TreeWalker;
import exlc.tree.Clause;
import exlc.tree.Control.Case;
import exlc.tree.Control.Cond;
import exlc.tree.Control.Fn;
import exlc.tree.Exprs.Var;
import exlc.tree.Node;
import exlc.tree.Pattern;
import exlc.tree.Pattern.PAlias;
import exlc.tree.Pattern.PPin;
import exlc.tree.Pattern.PVar;

/**
 * Perform some sanity checks on the tree:
 * - Case clauses have exactly one pattern
 * - Closures have at least one clause, all of the same arity
 * - Cond has at least one branch
 * - Variables, binders and pins have usable names
 * The final validator additionally checks the shape the printer expects.
 */
public class Validate implements LegalizationPass {
  private final boolean checkFinalForm;

  private Validate(boolean checkFinalForm) {
    this.checkFinalForm = checkFinalForm;
  }

  public static Validate standardValidator() {
    return new Validate(false);
  }

  /**
   * @return validator for the pipeline output, which also checks that
   *          no nested blocks or compound slots remain
   */
  public static Validate finalValidator() {
    return new Validate(true);
  }

  @Override
  public String getPassName() {
    return checkFinalForm ? "validate-final" : "validate";
  }

  @Override
  public String getDescription() {
    return "Check tree well-formedness";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public List<TreeCondition> getPreconditions() {
    return Collections.emptyList();
  }

  @Override
  public List<TreeCondition> getPostconditions() {
    return Collections.emptyList();
  }

  @Override
  public Node apply(Logger logger, Node tree) {
    List<String> violations = new ArrayList<String>();
    checkWellFormed(tree, violations);
    if (checkFinalForm) {
      for (TreeCondition cond: finalForm()) {
        violations.addAll(cond.violations(tree));
      }
    }
    if (!violations.isEmpty()) {
      throw new LegalizerRuntimeError("Invalid tree in " + getPassName()
                                      + ": " + violations);
    }
    return tree;
  }

  private static List<TreeCondition> finalForm() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.NO_NESTED_BLOCKS);
    for (WrapCompoundSlots.SlotKind slotKind:
                            WrapCompoundSlots.SlotKind.values()) {
      result.add(Conditions.noCompoundSlots(slotKind));
    }
    return result;
  }

  /**
   * Append a message for each structural defect in the tree
   */
  public static void checkWellFormed(Node tree, final List<String> violations) {
    TreeWalk.walk(tree, new TreeWalker() {
      @Override
      public void visit(Node node) {
        switch (node.kind()) {
          case VAR: {
            String name = ((Var)node).name();
            if (Names.isWildcard(name)) {
              violations.add("Read of wildcard " + name);
            }
            break;
          }
          case FN:
            checkClauses(((Fn)node).clauses(), -1, violations);
            break;
          case CASE:
            checkClauses(((Case)node).clauses(), 1, violations);
            break;
          case COND:
            if (((Cond)node).branches().isEmpty()) {
              violations.add("Cond without branches");
            }
            break;
          default:
            break;
        }
      }

      @Override
      public void visit(Pattern pattern) {
        String name;
        switch (pattern.kind()) {
          case VAR:
            name = ((PVar)pattern).name();
            break;
          case ALIAS:
            name = ((PAlias)pattern).name();
            break;
          case PIN:
            name = ((PPin)pattern).name();
            break;
          default:
            return;
        }
        if (Names.isWildcard(name) || Names.isModuleReference(name)) {
          violations.add("Bad name in pattern " + pattern);
        }
      }
    });
  }

  /**
   * @param arity required number of patterns, or -1 if all clauses
   *              only need to agree
   */
  private static void checkClauses(List<Clause> clauses, int arity,
                                   List<String> violations) {
    if (clauses.isEmpty()) {
      violations.add("No clauses");
      return;
    }
    int expected = arity >= 0 ? arity : clauses.get(0).patterns().size();
    for (Clause c: clauses) {
      if (c.patterns().size() != expected) {
        violations.add("Expected " + expected + " patterns in clause: " + c);
      }
    }
  }
}
