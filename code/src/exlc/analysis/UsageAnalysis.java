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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import exlc.common.util.HierarchicalSet;
import exlc.common.util.Pair;
import exlc.tree.Clause;
import exlc.tree.Control.Block;
import exlc.tree.Control.Case;
import exlc.tree.Control.Cond;
import exlc.tree.Control.Fn;
import exlc.tree.Control.If;
import exlc.tree.Control.Match;
import exlc.tree.Decls.FunctionDef;
import exlc.tree.Exprs.Paren;
import exlc.tree.Exprs.Raw;
import exlc.tree.Exprs.Var;
import exlc.tree.Literals.StringLit;
import exlc.tree.Node;
import exlc.tree.Pattern;
import exlc.tree.Pattern.PAlias;
import exlc.tree.Pattern.PMap;
import exlc.tree.Pattern.PPin;
import exlc.tree.Pattern.PVar;

/**
 * Declared and referenced names of a scope.
 *
 * All result sets iterate in traversal order.  Module references
 * and the bare wildcard never appear in any result.
 */
public class UsageAnalysis {

  /**
   * @return names bound by any pattern anywhere in the subtree
   */
  public static Set<String> declared(Node scope) {
    Set<String> result = new LinkedHashSet<String>();
    addDeclared(scope, result, true);
    return result;
  }

  /**
   * Names bound by matches in a unit body, not counting bindings
   * inside nested closures or case clauses
   */
  public static Set<String> declaredLocal(Node body) {
    Set<String> result = new LinkedHashSet<String>();
    addDeclared(body, result, false);
    return result;
  }

  private static void addDeclared(Node node, Set<String> result,
                                  boolean intoUnits) {
    switch (node.kind()) {
      case MATCH:
        addPatternBinders(((Match)node).pattern(), result);
        break;
      case FN:
        if (!intoUnits) {
          return;
        }
        for (Clause c: ((Fn)node).clauses()) {
          addPatternBinders(c.patterns(), result);
        }
        break;
      case CASE:
        if (!intoUnits) {
          addDeclared(((Case)node).scrutinee(), result, intoUnits);
          return;
        }
        for (Clause c: ((Case)node).clauses()) {
          addPatternBinders(c.patterns(), result);
        }
        break;
      case FUNCTION_DEF:
        if (!intoUnits) {
          return;
        }
        addPatternBinders(((FunctionDef)node).params(), result);
        break;
      default:
        break;
    }
    for (Node child: node.children()) {
      addDeclared(child, result, intoUnits);
    }
  }

  /**
   * @return all names read anywhere in the subtree, whether or not a
   *        nested closure rebinds them
   */
  public static Set<String> referenced(Node scope) {
    Set<String> result = new LinkedHashSet<String>();
    addReferenced(scope, result);
    return result;
  }

  private static void addReferenced(Node node, Set<String> result) {
    switch (node.kind()) {
      case VAR:
        addIfTracked(((Var)node).name(), result);
        break;
      case STRING:
        for (String tok: Names.interpolationTokens(((StringLit)node).value())) {
          result.add(tok);
        }
        break;
      case RAW:
        result.addAll(Names.rawTokens(((Raw)node).text()));
        break;
      case MATCH:
        result.addAll(patternReferences(((Match)node).pattern()));
        break;
      case FN:
        for (Clause c: ((Fn)node).clauses()) {
          result.addAll(patternReferences(c.patterns()));
        }
        break;
      case CASE:
        for (Clause c: ((Case)node).clauses()) {
          result.addAll(patternReferences(c.patterns()));
        }
        break;
      case FUNCTION_DEF:
        result.addAll(patternReferences(((FunctionDef)node).params()));
        break;
      default:
        break;
    }
    for (Node child: node.children()) {
      addReferenced(child, result);
    }
  }

  /**
   * Names read in a scope.  A name read inside a nested closure or case
   * clause counts only if that clause does not bind it itself.
   */
  public static Set<String> referencedClosureAware(Node scope) {
    Set<String> result = new LinkedHashSet<String>();
    new RefCollector(result, false).visit(scope,
                            new HierarchicalSet<String>(), false);
    return result;
  }

  /**
   * Names read in a clause's patterns, guard and body, where the clause
   * is the scope: reads of its own head binders count.
   */
  public static Set<String> referencedClosureAware(Clause clause) {
    Set<String> result = new LinkedHashSet<String>();
    RefCollector collector = new RefCollector(result, false);
    HierarchicalSet<String> bound = new HierarchicalSet<String>();
    result.addAll(patternReferences(clause.patterns()));
    if (clause.guard() != null) {
      collector.visit(clause.guard(), bound, false);
    }
    collector.visit(clause.body(), bound, false);
    return result;
  }

  /**
   * Free variables: names read before any binding visible at the read.
   */
  public static Set<String> freeVariables(Node node) {
    Set<String> result = new LinkedHashSet<String>();
    new RefCollector(result, true).visit(node,
                          new HierarchicalSet<String>(), false);
    return result;
  }

  /**
   * Free variables of a clause, with its head binders bound
   */
  public static Set<String> freeVariables(Clause clause) {
    Set<String> result = new LinkedHashSet<String>();
    RefCollector collector = new RefCollector(result, true);
    HierarchicalSet<String> bound = new HierarchicalSet<String>();
    collector.visitClause(clause, bound);
    return result;
  }

  /**
   * Names bound by a statement itself: the patterns of a match, the
   * patterns of a chain of matches a = b = expr, and the same for the
   * statements of an inline block.
   */
  public static Set<String> statementBinders(Node stmt) {
    Set<String> result = new LinkedHashSet<String>();
    addStatementBinders(stmt, result);
    return result;
  }

  private static void addStatementBinders(Node stmt, Set<String> result) {
    switch (stmt.kind()) {
      case MATCH: {
        Match m = (Match)stmt;
        addPatternBinders(m.pattern(), result);
        addStatementBinders(m.value(), result);
        break;
      }
      case PAREN:
        addStatementBinders(((Paren)stmt).inner(), result);
        break;
      case BLOCK:
        for (Node s: ((Block)stmt).statements()) {
          addStatementBinders(s, result);
        }
        break;
      default:
        break;
    }
  }

  public static Set<String> patternBinders(Pattern pattern) {
    Set<String> result = new LinkedHashSet<String>();
    addPatternBinders(pattern, result);
    return result;
  }

  public static Set<String> patternBinders(List<Pattern> patterns) {
    Set<String> result = new LinkedHashSet<String>();
    addPatternBinders(patterns, result);
    return result;
  }

  private static void addPatternBinders(List<Pattern> patterns,
                                        Set<String> result) {
    for (Pattern p: patterns) {
      addPatternBinders(p, result);
    }
  }

  private static void addPatternBinders(Pattern pattern, Set<String> result) {
    switch (pattern.kind()) {
      case VAR:
        addIfTracked(((PVar)pattern).name(), result);
        break;
      case ALIAS:
        addPatternBinders(((PAlias)pattern).inner(), result);
        addIfTracked(((PAlias)pattern).name(), result);
        return;
      default:
        break;
    }
    for (Pattern sub: pattern.subPatterns()) {
      addPatternBinders(sub, result);
    }
  }

  /**
   * @return names a pattern reads rather than binds: pinned names and
   *          names used in map keys
   */
  public static Set<String> patternReferences(Pattern pattern) {
    Set<String> result = new LinkedHashSet<String>();
    addPatternReferences(pattern, result);
    return result;
  }

  public static Set<String> patternReferences(List<Pattern> patterns) {
    Set<String> result = new LinkedHashSet<String>();
    for (Pattern p: patterns) {
      addPatternReferences(p, result);
    }
    return result;
  }

  private static void addPatternReferences(Pattern pattern,
                                           Set<String> result) {
    switch (pattern.kind()) {
      case PIN:
        addIfTracked(((PPin)pattern).name(), result);
        break;
      case MAP:
        for (Pair<Node, Pattern> e: ((PMap)pattern).entries()) {
          addReferenced(e.val1, result);
        }
        break;
      default:
        break;
    }
    for (Pattern sub: pattern.subPatterns()) {
      addPatternReferences(sub, result);
    }
  }

  private static void addIfTracked(String name, Set<String> result) {
    if (Names.isTracked(name)) {
      result.add(name);
    }
  }

  /**
   * Collects reads not bound by an enclosing binder.  Closure and case
   * clauses always bind their heads and body matches; with hideTopLevel
   * set, matches outside any clause hide later reads too.
   */
  private static class RefCollector {
    private final Set<String> out;
    private final boolean hideTopLevel;

    RefCollector(Set<String> out, boolean hideTopLevel) {
      this.out = out;
      this.hideTopLevel = hideTopLevel;
    }

    private void read(String name, Set<String> bound) {
      if (Names.isTracked(name) && !bound.contains(name)) {
        out.add(name);
      }
    }

    private void readPattern(Pattern pattern, Set<String> bound) {
      for (String name: patternReferences(pattern)) {
        read(name, bound);
      }
    }

    void visitClause(Clause clause, HierarchicalSet<String> bound) {
      HierarchicalSet<String> inner = bound.makeChild();
      for (Pattern p: clause.patterns()) {
        readPattern(p, bound);
      }
      inner.addAll(patternBinders(clause.patterns()));
      if (clause.guard() != null) {
        visit(clause.guard(), inner, true);
      }
      visit(clause.body(), inner, true);
    }

    void visit(Node node, HierarchicalSet<String> bound, boolean nested) {
      switch (node.kind()) {
        case VAR:
          read(((Var)node).name(), bound);
          return;
        case STRING:
          for (String tok:
                  Names.interpolationTokens(((StringLit)node).value())) {
            read(tok, bound);
          }
          return;
        case RAW:
          for (String tok: Names.rawTokens(((Raw)node).text())) {
            read(tok, bound);
          }
          return;
        case MATCH: {
          Match m = (Match)node;
          visit(m.value(), bound, nested);
          readPattern(m.pattern(), bound);
          if (nested || hideTopLevel) {
            bound.addAll(patternBinders(m.pattern()));
          }
          return;
        }
        case IF: {
          If i = (If)node;
          visit(i.condition(), bound, nested);
          visit(i.thenBranch(), bound.makeChild(), nested);
          if (i.elseBranch() != null) {
            visit(i.elseBranch(), bound.makeChild(), nested);
          }
          return;
        }
        case COND:
          for (Cond.Branch b: ((Cond)node).branches()) {
            HierarchicalSet<String> branchScope = bound.makeChild();
            visit(b.condition, branchScope, nested);
            visit(b.body, branchScope, nested);
          }
          return;
        case CASE: {
          Case c = (Case)node;
          visit(c.scrutinee(), bound, nested);
          for (Clause clause: c.clauses()) {
            visitClause(clause, bound);
          }
          return;
        }
        case FN:
          for (Clause clause: ((Fn)node).clauses()) {
            visitClause(clause, bound);
          }
          return;
        case FUNCTION_DEF:
          visitClause(((FunctionDef)node).asClause(), bound);
          return;
        default:
          // Blocks do not scope: bindings stay visible to later siblings
          for (Node child: node.children()) {
            visit(child, bound, nested);
          }
      }
    }
  }
}
