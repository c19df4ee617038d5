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
import exlc.tree.Exprs.Paren;
import exlc.tree.Node;
import exlc.tree.Trees;

public class UnwrapRedundantParens extends RewritePass {

  @Override
  public String getPassName() {
    return "unwrap-redundant-parens";
  }

  @Override
  public String getDescription() {
    return "Remove doubled parentheses, parentheses around variables and " +
           "literals, and single-statement blocks";
  }

  @Override
  public List<TreeCondition> getPostconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.NO_REDUNDANT_PARENS);
    return result;
  }

  @Override
  protected Node rewrite(Logger logger, Node node) {
    switch (node.kind()) {
      case PAREN:
        return unwrap((Paren)node);
      case BLOCK: {
        List<Node> stmts = ((Block)node).statements();
        if (stmts.isEmpty()) {
          return Trees.replace(node, Trees.nil());
        } else if (stmts.size() == 1) {
          return Trees.replace(node, stmts.get(0));
        }
        return node;
      }
      default:
        return node;
    }
  }

  /**
   * @return inner node if the parentheses are redundant, otherwise paren
   */
  public static Node unwrap(Paren paren) {
    Node inner = paren.inner();
    if (inner.kind() == Node.Kind.PAREN || inner.isTrivial()) {
      return Trees.replace(paren, inner);
    }
    return paren;
  }
}
