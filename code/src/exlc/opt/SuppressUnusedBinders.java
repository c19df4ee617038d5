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

import exlc.analysis.BlockLiveness;
import exlc.analysis.Names;
import exlc.analysis.Renamer;
import exlc.analysis.ScopeUnit;
import exlc.analysis.UsageAnalysis;
import exlc.opt.LegalizationPass.AbstractPass;
import exlc.tree.Control.Match;
import exlc.tree.Exprs.Paren;
import exlc.tree.Node;
import exlc.tree.Pattern;
import exlc.tree.Trees;

/**
 * Underscore binders whose value is never read, so that the target
 * compiler does not warn about them:
 * <ul>
 * <li>parameters and clause patterns not read anywhere in their unit</li>
 * <li>match binders in a body not read by any later statement</li>
 * </ul>
 * Only the binder is renamed.  A binder is left alone when the
 * underscored name is already in use nearby.
 */
public class SuppressUnusedBinders extends AbstractPass {

  private final HeadBinders heads = new HeadBinders();
  private final MatchBinders matches = new MatchBinders();

  @Override
  public String getPassName() {
    return "suppress-unused-binders";
  }

  @Override
  public String getDescription() {
    return "Underscore binders that are never read";
  }

  @Override
  public List<TreeCondition> getPostconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.stableUnder(this));
    return result;
  }

  @Override
  public Node apply(Logger logger, Node tree) {
    return matches.apply(logger, heads.apply(logger, tree));
  }

  private static boolean candidate(String name) {
    return Names.isTracked(name) && !Names.isUnderscored(name);
  }

  private class HeadBinders extends ScopeUnitPass {
    @Override
    public String getPassName() {
      return SuppressUnusedBinders.this.getPassName();
    }

    @Override
    public String getDescription() {
      return SuppressUnusedBinders.this.getDescription();
    }

    @Override
    protected ScopeUnit processUnit(Logger logger, ScopeUnit unit,
                                    Set<String> enclosing) {
      List<Pattern> patterns = null;
      for (String name: unit.headBinders()) {
        if (!candidate(name) || unit.referenced().contains(name)) {
          continue;
        }
        String suppressed = Names.underscored(name);
        if (unit.declared().contains(suppressed) ||
            unit.referenced().contains(suppressed)) {
          logger.trace("Not suppressing " + name + ": " + suppressed +
                       " in use");
          continue;
        }
        if (logger.isDebugEnabled()) {
          logger.debug("Suppressing unused parameter " + name);
        }
        if (patterns == null) {
          patterns = new ArrayList<Pattern>(unit.patterns());
        }
        for (int i = 0; i < patterns.size(); i++) {
          patterns.set(i, Renamer.renameBinders(patterns.get(i), name,
                                                suppressed));
        }
      }
      if (patterns == null) {
        return unit;
      }
      return unit.withClause(unit.clause().withPatterns(patterns));
    }
  }

  private class MatchBinders extends ScopeBodyPass {
    @Override
    public String getPassName() {
      return SuppressUnusedBinders.this.getPassName();
    }

    @Override
    public String getDescription() {
      return SuppressUnusedBinders.this.getDescription();
    }

    @Override
    protected List<Node> processStatements(Logger logger, List<Node> stmts) {
      BlockLiveness liveness = null;
      List<Node> result = null;
      for (int i = 0; i < stmts.size(); i++) {
        Node stmt = stmts.get(i);
        if (Trees.unparen(stmt).kind() != Node.Kind.MATCH) {
          continue;
        }
        if (liveness == null) {
          liveness = BlockLiveness.analyze(stmts);
        }
        for (String name: UsageAnalysis.statementBinders(stmt)) {
          if (!candidate(name) || liveness.isLiveAfter(name, i)) {
            continue;
          }
          String suppressed = Names.underscored(name);
          if (liveness.boundElsewhere(suppressed, -1) ||
              liveness.referencedAtOrAfter(suppressed, 0)) {
            logger.trace("Not suppressing " + name + ": " + suppressed +
                         " in use");
            continue;
          }
          if (logger.isDebugEnabled()) {
            logger.debug("Suppressing unused binder " + name);
          }
          stmt = renameChain(stmt, name, suppressed);
        }
        if (stmt != stmts.get(i)) {
          if (result == null) {
            result = new ArrayList<Node>(stmts);
          }
          result.set(i, stmt);
        }
      }
      return result == null ? stmts : result;
    }
  }

  /**
   * Rename binders in the patterns of a chain a = (b = expr), leaving
   * the final value alone
   */
  static Node renameChain(Node stmt, String from, String to) {
    switch (stmt.kind()) {
      case MATCH: {
        Match m = (Match)stmt;
        return m.withPattern(Renamer.renameBinders(m.pattern(), from, to))
                .withValue(renameChain(m.value(), from, to));
      }
      case PAREN: {
        Paren p = (Paren)stmt;
        Node inner = renameChain(p.inner(), from, to);
        return inner == p.inner() ? p : new Paren(inner, p.meta());
      }
      default:
        return stmt;
    }
  }
}
