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
import exlc.tree.Exprs.BinaryOp;
import exlc.tree.Exprs.Interpolation;
import exlc.tree.Exprs.Paren;
import exlc.tree.Exprs.UnaryOp;
import exlc.tree.Node;
import exlc.tree.Trees;

/**
 * Evaluate operators whose operands are known at compile time.
 * Since the rewrite is bottom-up, whole constant expressions collapse
 * in one pass.
 */
public class ConstantFold extends RewritePass {

  @Override
  public String getPassName() {
    return "constant-fold";
  }

  @Override
  public String getDescription() {
    return "Evaluate operators and interpolations over literals";
  }

  @Override
  public List<TreeCondition> getPostconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.NO_FOLDABLE_OPERATIONS);
    result.add(Conditions.NO_REDUNDANT_PARENS);
    return result;
  }

  @Override
  protected Node rewrite(Logger logger, Node node) {
    return fold(logger, node);
  }

  /**
   * Fold a single node whose children are already folded.  Parentheses
   * left around a folded literal are removed so that the enclosing
   * operation can fold too.
   * @return node, or its folded replacement
   */
  public static Node fold(Logger logger, Node node) {
    Node folded;
    switch (node.kind()) {
      case PAREN:
        return UnwrapRedundantParens.unwrap((Paren)node);
      case BINARY: {
        BinaryOp b = (BinaryOp)node;
        folded = OpEvaluator.eval(b.op(), b.left(), b.right());
        break;
      }
      case UNARY: {
        UnaryOp u = (UnaryOp)node;
        folded = OpEvaluator.eval(u.op(), u.operand());
        break;
      }
      case INTERPOLATION:
        folded = OpEvaluator.evalInterpolation(((Interpolation)node).parts());
        break;
      default:
        folded = null;
        break;
    }
    if (folded == null) {
      return node;
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Folded " + node + " => " + folded);
    }
    return Trees.replace(node, folded);
  }
}
