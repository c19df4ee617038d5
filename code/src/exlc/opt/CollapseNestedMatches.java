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
import exlc.analysis.UsageAnalysis;
import exlc.tree.Control.Match;
import exlc.tree.Node;
import exlc.tree.Pattern;
import exlc.tree.Pattern.PVar;
import exlc.tree.Trees;

/**
 * outer = (inner = expr) becomes outer = expr when nothing reads inner
 * afterwards.  Chains collapse transitively.
 */
public class CollapseNestedMatches extends ScopeBodyPass {

  @Override
  public String getPassName() {
    return "collapse-nested-matches";
  }

  @Override
  public String getDescription() {
    return "Drop inner bindings of chained matches that are never read";
  }

  @Override
  public List<TreeCondition> getPreconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.NO_NESTED_BLOCKS);
    return result;
  }

  @Override
  protected List<Node> processStatements(Logger logger, List<Node> stmts) {
    BlockLiveness liveness = null;
    List<Node> result = null;
    for (int i = 0; i < stmts.size(); i++) {
      Node stmt = stmts.get(i);
      if (!isChain(stmt)) {
        continue;
      }
      if (liveness == null) {
        liveness = BlockLiveness.analyze(stmts);
      }
      Node collapsed = collapse(logger, (Match)stmt, i, liveness);
      if (collapsed != stmt) {
        if (result == null) {
          result = new ArrayList<Node>(stmts);
        }
        result.set(i, collapsed);
      }
    }
    return result == null ? stmts : result;
  }

  private static boolean isChain(Node stmt) {
    return stmt.kind() == Node.Kind.MATCH &&
        Trees.unparen(((Match)stmt).value()).kind() == Node.Kind.MATCH;
  }

  private Node collapse(Logger logger, Match outer, int i,
                        BlockLiveness liveness) {
    Set<String> pinned = UsageAnalysis.patternReferences(outer.pattern());
    Node value = Trees.unparen(outer.value());
    boolean changed = false;
    while (value.kind() == Node.Kind.MATCH) {
      Match inner = (Match)value;
      if (!isDroppable(inner.pattern(), i, liveness, pinned)) {
        break;
      }
      if (logger.isDebugEnabled()) {
        logger.debug("Dropping unread binding " + inner.pattern() +
                     " in " + outer);
      }
      value = Trees.unparen(inner.value());
      changed = true;
    }
    return changed ? outer.withValue(value) : outer;
  }

  /**
   * A wildcard, or a variable nothing reads after statement i
   */
  private static boolean isDroppable(Pattern pattern, int i,
                          BlockLiveness liveness, Set<String> pinned) {
    if (pattern.kind() == Pattern.Kind.WILDCARD) {
      return true;
    }
    if (pattern.kind() != Pattern.Kind.VAR) {
      // Other patterns may fail to match
      return false;
    }
    String name = ((PVar)pattern).name();
    if (!Names.isTracked(name)) {
      return false;
    }
    return !pinned.contains(name) && !liveness.isLiveAfter(name, i);
  }
}
