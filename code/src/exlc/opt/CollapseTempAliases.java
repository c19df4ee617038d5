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
import exlc.analysis.UsageAnalysis;
import exlc.tree.Control.Match;
import exlc.tree.Exprs.Var;
import exlc.tree.Node;
import exlc.tree.Pattern;
import exlc.tree.Pattern.PVar;
import exlc.tree.Trees;

/**
 * t = e; p = t  becomes  p = e  when nothing else reads t.
 * Chains of aliases t1 = e; t2 = t1; x = t2 collapse to x = e.
 */
public class CollapseTempAliases extends ScopeBodyPass {

  @Override
  public String getPassName() {
    return "collapse-temp-aliases";
  }

  @Override
  public String getDescription() {
    return "Merge a binding into the next statement when that statement " +
           "only copies it";
  }

  @Override
  public List<TreeCondition> getPreconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.NO_NESTED_BLOCKS);
    return result;
  }

  @Override
  protected List<Node> processStatements(Logger logger, List<Node> stmts) {
    if (stmts.size() < 2) {
      return stmts;
    }
    // Indices below refer to the original statements
    BlockLiveness liveness = BlockLiveness.analyze(stmts);
    List<Node> result = new ArrayList<Node>(stmts.size());
    boolean changed = false;
    Node current = stmts.get(0);
    for (int next = 1; next < stmts.size(); next++) {
      Node merged = merge(current, stmts.get(next), next, liveness);
      if (merged != null) {
        if (logger.isDebugEnabled()) {
          logger.debug("Collapsed alias " + current + "; " + stmts.get(next));
        }
        current = merged;
        changed = true;
      } else {
        result.add(current);
        current = stmts.get(next);
      }
    }
    result.add(current);
    return changed ? result : stmts;
  }

  /**
   * @param next index of second statement
   * @return merged statement, or null if they can't be merged
   */
  private static Node merge(Node first, Node second, int next,
                            BlockLiveness liveness) {
    if (first.kind() != Node.Kind.MATCH || second.kind() != Node.Kind.MATCH) {
      return null;
    }
    Match def = (Match)first;
    Match copy = (Match)second;
    if (def.pattern().kind() != Pattern.Kind.VAR ||
        Trees.unparen(def.value()).kind() == Node.Kind.MATCH) {
      // Chains are left to collapse-nested-matches
      return null;
    }
    String temp = ((PVar)def.pattern()).name();
    Node copied = Trees.unparen(copy.value());
    if (!Names.isTracked(temp) || copied.kind() != Node.Kind.VAR ||
        !((Var)copied).name().equals(temp)) {
      return null;
    }
    if (UsageAnalysis.patternReferences(copy.pattern()).contains(temp) ||
        liveness.referencedAtOrAfter(temp, next + 1)) {
      return null;
    }
    return copy.withValue(def.value());
  }
}
