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
import exlc.tree.Containers.Sequence;
import exlc.tree.Control.Block;
import exlc.tree.Exprs.Paren;
import exlc.tree.Node;
import exlc.tree.Trees;

public class DropPureStatements extends RewritePass {

  @Override
  public String getPassName() {
    return "drop-pure-statements";
  }

  @Override
  public String getDescription() {
    return "Remove statements other than the last that have no effect";
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
    result.add(Conditions.NO_PURE_STATEMENTS);
    return result;
  }

  @Override
  protected Node rewrite(Logger logger, Node node) {
    if (node.kind() == Node.Kind.PAREN) {
      // May hold a block that was reduced to a single variable
      return UnwrapRedundantParens.unwrap((Paren)node);
    } else if (node.kind() != Node.Kind.BLOCK) {
      return node;
    }
    Block block = (Block)node;
    List<Node> stmts = block.statements();
    List<Node> kept = new ArrayList<Node>(stmts.size());
    for (int i = 0; i < stmts.size(); i++) {
      Node stmt = stmts.get(i);
      if (i < stmts.size() - 1 && isPure(stmt)) {
        logger.trace("Dropping pure statement " + stmt);
      } else {
        kept.add(stmt);
      }
    }
    if (kept.size() == stmts.size()) {
      return block;
    } else if (kept.size() == 1) {
      return Trees.replace(block, kept.get(0));
    }
    return block.withStatements(kept);
  }

  /**
   * Literals, variable reads, closures and tuples or lists of these can
   * neither fail nor have effects, and bind nothing.
   */
  public static boolean isPure(Node node) {
    switch (node.kind()) {
      case VAR:
      case FN:
        return true;
      case PAREN:
        return isPure(((Paren)node).inner());
      case LIST:
      case TUPLE:
        for (Node elem: ((Sequence)node).elements()) {
          if (!isPure(elem)) {
            return false;
          }
        }
        return true;
      default:
        return node.isLiteral();
    }
  }
}
