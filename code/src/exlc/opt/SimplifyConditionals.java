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

import exlc.analysis.UsageAnalysis;
import exlc.opt.LegalizationPass.RewritePass;
import exlc.tree.Control.Block;
import exlc.tree.Control.Cond;
import exlc.tree.Control.If;
import exlc.tree.Literals;
import exlc.tree.Node;
import exlc.tree.Trees;

/**
 * Replace conditionals on constant conditions by the branch taken.
 *
 * Bindings made in a branch are not visible after the conditional, but
 * would be after splicing the branch into the enclosing block.  A
 * branch that binds names is applied as a zero-argument closure in
 * place of the conditional instead, which keeps its bindings local.
 * Whether the later dead-store passes discard those bindings does not
 * matter: the conditional is gone either way.
 */
public class SimplifyConditionals extends RewritePass {

  @Override
  public String getPassName() {
    return "simplify-conditionals";
  }

  @Override
  public String getDescription() {
    return "Select the branch of conditionals with constant conditions";
  }

  @Override
  public List<TreeCondition> getPreconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.NO_FOLDABLE_OPERATIONS);
    return result;
  }

  @Override
  public List<TreeCondition> getPostconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.NO_NESTED_BLOCKS);
    result.add(Conditions.NO_FOLDABLE_OPERATIONS);
    return result;
  }

  @Override
  protected Node rewrite(Logger logger, Node node) {
    switch (node.kind()) {
      case IF:
        return simplifyIf(logger, (If)node);
      case COND:
        return simplifyCond(logger, (Cond)node);
      case BLOCK: {
        // Selected branches may have left blocks inside blocks
        Block block = (Block)node;
        List<Node> stmts = FlattenNested.flattenStatements(block.statements());
        if (stmts == block.statements()) {
          return block;
        } else if (stmts.size() == 1) {
          return Trees.replace(block, stmts.get(0));
        }
        return block.withStatements(stmts);
      }
      default:
        // A selected branch may be an operand that now folds
        return ConstantFold.fold(logger, node);
    }
  }

  private Node simplifyIf(Logger logger, If ifNode) {
    Boolean truthy = Literals.truthiness(Trees.unparen(ifNode.condition()));
    if (truthy == null) {
      return ifNode;
    }
    Node chosen = truthy ? ifNode.thenBranch() : ifNode.elseBranch();
    if (chosen == null) {
      chosen = Trees.nil();
    }
    return select(logger, ifNode, chosen);
  }

  private Node simplifyCond(Logger logger, Cond cond) {
    List<Cond.Branch> kept = new ArrayList<Cond.Branch>();
    for (Cond.Branch b: cond.branches()) {
      Boolean truthy = Literals.truthiness(Trees.unparen(b.condition));
      if (truthy == null) {
        kept.add(b);
      } else if (truthy) {
        if (kept.isEmpty()) {
          return select(logger, cond, b.body);
        }
        // Later branches are unreachable
        kept.add(b);
        break;
      }
      // Constant false branch is never taken
    }
    if (kept.isEmpty()) {
      // No branch matches: keep the runtime error
      return cond;
    }
    if (kept.size() == cond.branches().size()) {
      return cond;
    }
    logger.debug("Pruned " + (cond.branches().size() - kept.size()) +
                 " cond branches");
    return cond.withBranches(kept);
  }

  private Node select(Logger logger, Node conditional, Node chosen) {
    if (!UsageAnalysis.declaredLocal(chosen).isEmpty()) {
      if (logger.isDebugEnabled()) {
        logger.debug("Selected constant branch of " + conditional.kind() +
                     " as a closure, since it binds names");
      }
      return Trees.replace(conditional, Trees.iife(chosen));
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Selected constant branch of " + conditional.kind());
    }
    if (chosen.kind() == Node.Kind.BLOCK) {
      List<Node> stmts = ((Block)chosen).statements();
      if (stmts.isEmpty()) {
        chosen = Trees.nil();
      } else if (stmts.size() == 1) {
        chosen = stmts.get(0);
      }
    }
    return Trees.replace(conditional, chosen);
  }
}
