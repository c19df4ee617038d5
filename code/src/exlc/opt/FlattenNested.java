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

import exlc.opt.LegalizationPass.RewritePass;
import exlc.tree.Control.Block;
import exlc.tree.Node;
import exlc.tree.Trees;

public class FlattenNested extends RewritePass {
  @Override
  public String getPassName() {
    return "flatten-nested";
  }

  @Override
  public String getDescription() {
    return "Splice blocks nested directly in blocks into their parent";
  }

  @Override
  public List<TreeCondition> getPostconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.NO_NESTED_BLOCKS);
    return result;
  }

  /**
   * Remove all nested blocks from the tree.  Blocks do not introduce a
   * scope in the target, so splicing never changes which binding a
   * name refers to.
   */
  @Override
  protected Node rewrite(Logger logger, Node node) {
    if (node.kind() != Node.Kind.BLOCK) {
      return node;
    }
    Block block = (Block)node;
    List<Node> flattened = flattenStatements(block.statements());
    if (flattened == block.statements()) {
      return block;
    }
    logger.trace("Flattened block with " + flattened.size() + " statements");
    return block.withStatements(flattened);
  }

  /**
   * A statement that is itself a sequence of statements
   */
  public static boolean isInlineBlock(Node stmt) {
    return Trees.unparen(stmt).kind() == Node.Kind.BLOCK;
  }

  /**
   * Splice inline blocks, recursively, into the statement list.
   * An empty inline block in final position becomes nil so that the
   * value of the enclosing block is unchanged.
   * @return the original list if there was nothing to splice
   */
  public static List<Node> flattenStatements(List<Node> stmts) {
    boolean any = false;
    for (Node stmt: stmts) {
      any = any || isInlineBlock(stmt);
    }
    if (!any) {
      return stmts;
    }
    List<Node> result = new ArrayList<Node>();
    for (int i = 0; i < stmts.size(); i++) {
      Node stmt = stmts.get(i);
      if (!isInlineBlock(stmt)) {
        result.add(stmt);
        continue;
      }
      Block inner = (Block)Trees.unparen(stmt);
      List<Node> innerStmts = flattenStatements(inner.statements());
      if (innerStmts.isEmpty() && i == stmts.size() - 1) {
        result.add(Trees.replace(stmt, Trees.nil()));
      } else {
        result.addAll(innerStmts);
      }
    }
    return result;
  }
}
