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

import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.TreeMultimap;

import exlc.tree.Node;

/**
 * Liveness of names across the statements of one block.
 *
 * Built once per block: for each name, the sorted indices of the
 * statements that read it and of the statements that rebind it.
 * Every query is then a sorted-set lookup rather than a rescan of
 * the remaining statements.
 */
public class BlockLiveness {
  private final ImmutableList<Node> statements;
  private final TreeMultimap<String, Integer> readAt;
  private final TreeMultimap<String, Integer> boundAt;
  private final Set<String> liveOut;

  private BlockLiveness(List<Node> statements, Set<String> liveOut) {
    this.statements = ImmutableList.copyOf(statements);
    this.readAt = TreeMultimap.create();
    this.boundAt = TreeMultimap.create();
    this.liveOut = ImmutableSet.copyOf(liveOut);
  }

  /**
   * @param statements statements of the block
   * @param liveOut names read after the block ends
   */
  public static BlockLiveness analyze(List<Node> statements,
                                      Set<String> liveOut) {
    BlockLiveness result = new BlockLiveness(statements, liveOut);
    for (int i = 0; i < statements.size(); i++) {
      Node stmt = statements.get(i);
      for (String name: UsageAnalysis.referencedClosureAware(stmt)) {
        result.readAt.put(name, i);
      }
      for (String name: UsageAnalysis.statementBinders(stmt)) {
        result.boundAt.put(name, i);
      }
    }
    return result;
  }

  /**
   * Analyze the body of a function or clause: nothing is live after it.
   */
  public static BlockLiveness analyze(List<Node> statements) {
    return analyze(statements, Collections.<String>emptySet());
  }

  public List<Node> statements() {
    return statements;
  }

  /**
   * @return true if any statement with index >= i reads name
   */
  public boolean referencedAtOrAfter(String name, int i) {
    return readAt.get(name).ceiling(i) != null;
  }

  /**
   * Whether the value bound to name by statement i can be read later.
   * A read in the same statement as a later rebinding sees the old
   * value, so it counts.
   */
  public boolean isLiveAfter(String name, int i) {
    Integer nextRead = readAt.get(name).ceiling(i + 1);
    Integer nextBind = boundAt.get(name).ceiling(i + 1);
    if (nextBind == null) {
      return nextRead != null || liveOut.contains(name);
    }
    return nextRead != null && nextRead <= nextBind;
  }

  /**
   * @return true if some statement other than i binds name
   */
  public boolean boundElsewhere(String name, int i) {
    for (Integer j: boundAt.get(name)) {
      if (j != i) {
        return true;
      }
    }
    return false;
  }
}
