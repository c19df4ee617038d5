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
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exlc.analysis.ScopeUnit;
import exlc.analysis.ScopeUnit.UnitKind;
import exlc.analysis.UsageAnalysis;
import exlc.common.util.HierarchicalSet;
import exlc.opt.LegalizationPass.AbstractPass;
import exlc.tree.Clause;
import exlc.tree.Control.Case;
import exlc.tree.Control.Fn;
import exlc.tree.Decls.FunctionDef;
import exlc.tree.Node;
import exlc.tree.NodeMeta;

/**
 * Base for passes that rewrite one scope unit at a time, top-down:
 * a unit is processed before the units nested in it, and sees the
 * names declared by every enclosing unit.
 */
public abstract class ScopeUnitPass extends AbstractPass {

  /**
   * @param enclosing names declared by enclosing units
   * @return unit itself, or a rewritten unit
   */
  protected abstract ScopeUnit processUnit(Logger logger, ScopeUnit unit,
                                           Set<String> enclosing);

  @Override
  public Node apply(Logger logger, Node tree) {
    // Bindings of a top-level block enclose every unit in it
    HierarchicalSet<String> top = new HierarchicalSet<String>();
    top.addAll(UsageAnalysis.declaredLocal(tree));
    return visit(logger, tree, top);
  }

  private Node visit(final Logger logger, Node node,
                     final HierarchicalSet<String> scope) {
    switch (node.kind()) {
      case FUNCTION_DEF: {
        FunctionDef def = (FunctionDef)node;
        Clause orig = def.asClause();
        Clause clause = visitUnit(logger, UnitKind.FUNCTION, orig, scope,
                                  preserveNames(def));
        return clause == orig ? def : def.withClause(clause);
      }
      case FN: {
        Fn fn = (Fn)node;
        List<Clause> clauses = visitUnits(logger, UnitKind.CLOSURE,
                                    fn.clauses(), scope, preserveNames(fn));
        return clauses == null ? fn : fn.withClauses(clauses);
      }
      case CASE: {
        Case c = (Case)node;
        Node scrutinee = visit(logger, c.scrutinee(), scope);
        List<Clause> clauses = visitUnits(logger, UnitKind.CASE_CLAUSE,
                                     c.clauses(), scope, preserveNames(c));
        if (scrutinee == c.scrutinee() && clauses == null) {
          return c;
        }
        return new Case(scrutinee, clauses == null ? c.clauses() : clauses,
                        c.meta());
      }
      default:
        return node.mapChildren(new Node.Rewriter() {
          @Override
          public Node rewrite(Node child) {
            return visit(logger, child, scope);
          }
        });
    }
  }

  /**
   * @return null if no clause changed
   */
  private List<Clause> visitUnits(Logger logger, UnitKind kind,
                     List<Clause> clauses, HierarchicalSet<String> scope,
                     boolean preserve) {
    boolean changed = false;
    List<Clause> result = new ArrayList<Clause>(clauses.size());
    for (Clause c: clauses) {
      Clause updated = visitUnit(logger, kind, c, scope, preserve);
      changed = changed || updated != c;
      result.add(updated);
    }
    return changed ? result : null;
  }

  private Clause visitUnit(final Logger logger, UnitKind kind, Clause clause,
                           HierarchicalSet<String> scope, boolean preserve) {
    ScopeUnit unit = new ScopeUnit(kind, clause);
    if (!preserve) {
      unit = processUnit(logger, unit, scope);
    }
    final HierarchicalSet<String> inner = scope.makeChild(unit.declared());
    Clause result = unit.clause().mapNodes(new Node.Rewriter() {
      @Override
      public Node rewrite(Node node) {
        return visit(logger, node, inner);
      }
    });
    // Keep identity when neither the unit nor anything nested changed
    return result.equals(clause) ? clause : result;
  }

  /**
   * Units of a node flagged PRESERVE_NAMES are not processed, though
   * units nested in them are
   */
  private static boolean preserveNames(Node node) {
    return node.meta().hasFlag(NodeMeta.Flag.PRESERVE_NAMES);
  }
}
