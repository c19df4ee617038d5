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

import org.apache.log4j.Logger;

import exlc.analysis.BlockLiveness;
import exlc.analysis.Names;
import exlc.tree.Control.Match;
import exlc.tree.Node;
import exlc.tree.Pattern;
import exlc.tree.Pattern.PVar;
import exlc.tree.Trees;

/**
 * x = rhs, where no later statement of the block reads this value of x,
 * becomes _ = rhs.  The right-hand side is kept since it may have
 * effects.
 *
 * The final statement of a block is left alone: its value is the
 * block's value, and an unread binder there is underscored by
 * {@link SuppressUnusedBinders} instead.
 */
public class DeadStoreElimination extends ScopeBodyPass {

  @Override
  public String getPassName() {
    return "dead-store-elimination";
  }

  @Override
  public String getDescription() {
    return "Discard bindings that are never read";
  }

  @Override
  public List<TreeCondition> getPreconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.NO_NESTED_BLOCKS);
    return result;
  }

  @Override
  public List<TreeCondition> getPostconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.stableUnder(this));
    return result;
  }

  @Override
  protected List<Node> processStatements(Logger logger, List<Node> stmts) {
    BlockLiveness liveness = null;
    List<Node> result = null;
    for (int i = 0; i < stmts.size() - 1; i++) {
      String target = storeTarget(stmts.get(i));
      if (target == null) {
        continue;
      }
      if (liveness == null) {
        liveness = BlockLiveness.analyze(stmts);
      }
      if (liveness.isLiveAfter(target, i)) {
        continue;
      }
      if (logger.isDebugEnabled()) {
        logger.debug("Dead store to " + target + ": " + stmts.get(i));
      }
      if (result == null) {
        result = new ArrayList<Node>(stmts);
      }
      Match store = (Match)stmts.get(i);
      result.set(i, store.withPattern(Trees.wildcard()));
    }
    return result == null ? stmts : result;
  }

  /**
   * @return name bound by a plain x = rhs statement, or null
   */
  private static String storeTarget(Node stmt) {
    if (stmt.kind() != Node.Kind.MATCH) {
      return null;
    }
    Pattern target = ((Match)stmt).pattern();
    if (target.kind() != Pattern.Kind.VAR) {
      return null;
    }
    String name = ((PVar)target).name();
    if (!Names.isTracked(name) || Names.isUnderscored(name)) {
      return null;
    }
    return name;
  }
}
