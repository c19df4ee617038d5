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

import java.util.ArrayList;
import java.util.List;

import exlc.common.exceptions.LegalizerRuntimeError;
import exlc.tree.Clause;
import exlc.tree.Control.Case;
import exlc.tree.Control.Fn;
import exlc.tree.Control.Match;
import exlc.tree.Decls.FunctionDef;
import exlc.tree.Exprs.Raw;
import exlc.tree.Exprs.Var;
import exlc.tree.Literals.StringLit;
import exlc.tree.Node;
import exlc.tree.Pattern;
import exlc.tree.Pattern.PAlias;
import exlc.tree.Pattern.PPin;
import exlc.tree.Pattern.PVar;

/**
 * Consistent renaming of a name within one scope unit.
 *
 * A binder and the reads it reaches are always renamed together.
 * Renaming stops at a nested closure or case clause whose head binds
 * the same name, apart from pins in that head, which still read the
 * outer binding.  Identifier tokens in interpolation slots and raw
 * text are renamed with the structural reads.
 */
public class Renamer {
  private final String from;
  private final String to;
  private final boolean renameBinders;

  private Renamer(String from, String to, boolean renameBinders) {
    if (!Names.isTracked(from) || !Names.isTracked(to)) {
      throw new LegalizerRuntimeError("Cannot rename " + from + " to " + to);
    }
    this.from = from;
    this.to = to;
    this.renameBinders = renameBinders;
  }

  /**
   * Rename the head binders of a unit and everything they reach.
   * Pins in the unit's own head read the enclosing scope and are
   * left alone.
   */
  public static Clause renameInUnit(Clause clause, String from, String to) {
    Renamer r = new Renamer(from, to, true);
    List<Pattern> patterns = new ArrayList<Pattern>();
    for (Pattern p: clause.patterns()) {
      patterns.add(r.pattern(p, false));
    }
    return r.clauseNodes(clause).withPatterns(patterns);
  }

  /**
   * Rename binders and reads of name within a subtree
   */
  public static Node rename(Node node, String from, String to) {
    return new Renamer(from, to, true).node(node);
  }

  /**
   * Rename only reads of a name, leaving any binders alone
   */
  public static Node renameReferences(Node node, String from, String to) {
    return new Renamer(from, to, false).node(node);
  }

  /**
   * Rename only binders of a name within one pattern
   */
  public static Pattern renameBinders(Pattern pattern, String from,
                                      String to) {
    return new Renamer(from, to, true).pattern(pattern, false);
  }

  private Clause clauseNodes(Clause clause) {
    return clause.mapNodes(new Node.Rewriter() {
      @Override
      public Node rewrite(Node node) {
        return node(node);
      }
    });
  }

  private Clause nestedClause(Clause clause) {
    boolean shadows = UsageAnalysis.patternBinders(clause.patterns())
                                   .contains(from);
    List<Pattern> patterns = new ArrayList<Pattern>();
    for (Pattern p: clause.patterns()) {
      patterns.add(shadows ? pattern(p, true, false) : pattern(p, true));
    }
    Clause result = shadows ? clause : clauseNodes(clause);
    return result.withPatterns(patterns);
  }

  private List<Clause> nestedClauses(List<Clause> clauses) {
    List<Clause> result = new ArrayList<Clause>(clauses.size());
    for (Clause c: clauses) {
      result.add(nestedClause(c));
    }
    return result;
  }

  private Node node(Node node) {
    switch (node.kind()) {
      case VAR: {
        Var v = (Var)node;
        return v.name().equals(from) ? v.rename(to) : v;
      }
      case STRING: {
        StringLit s = (StringLit)node;
        String text = Names.renameInterpolationTokens(s.value(), from, to);
        return text.equals(s.value()) ? s : new StringLit(text, s.meta());
      }
      case RAW: {
        Raw r = (Raw)node;
        String text = Names.renameRawTokens(r.text(), from, to);
        return text.equals(r.text()) ? r : new Raw(text, r.meta());
      }
      case MATCH: {
        Match m = (Match)node;
        Node value = node(m.value());
        return m.withValue(value).withPattern(pattern(m.pattern(), true));
      }
      case FN: {
        Fn fn = (Fn)node;
        return fn.withClauses(nestedClauses(fn.clauses()));
      }
      case CASE: {
        Case c = (Case)node;
        Node scrutinee = node(c.scrutinee());
        return new Case(scrutinee, nestedClauses(c.clauses()), c.meta());
      }
      case FUNCTION_DEF: {
        FunctionDef def = (FunctionDef)node;
        return def.withClause(nestedClause(def.asClause()));
      }
      default:
        return node.mapChildren(new Node.Rewriter() {
          @Override
          public Node rewrite(Node child) {
            return node(child);
          }
        });
    }
  }

  private Pattern pattern(Pattern pattern, boolean pins) {
    return pattern(pattern, pins, renameBinders);
  }

  private Pattern pattern(Pattern pattern, final boolean pins,
                          final boolean binders) {
    switch (pattern.kind()) {
      case VAR:
        if (binders && ((PVar)pattern).name().equals(from)) {
          return new PVar(to);
        }
        return pattern;
      case PIN:
        if (pins && ((PPin)pattern).name().equals(from)) {
          return new PPin(to);
        }
        return pattern;
      case ALIAS: {
        PAlias alias = (PAlias)pattern;
        Pattern inner = pattern(alias.inner(), pins, binders);
        String name = binders && alias.name().equals(from) ? to : alias.name();
        if (inner == alias.inner() && name.equals(alias.name())) {
          return alias;
        }
        return new PAlias(inner, name);
      }
      default:
        return pattern.mapSubPatterns(new Pattern.Rewriter() {
          @Override
          public Pattern rewrite(Pattern sub) {
            return pattern(sub, pins, binders);
          }
        });
    }
  }
}
