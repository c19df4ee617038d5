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
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exlc.opt.LegalizationPass.AbstractPass;
import exlc.tree.Clause;
import exlc.tree.Control.Block;
import exlc.tree.Control.Case;
import exlc.tree.Control.Cond;
import exlc.tree.Control.Fn;
import exlc.tree.Control.If;
import exlc.tree.Decls.FunctionDef;
import exlc.tree.Node;
import exlc.tree.NodeMeta;
import exlc.tree.Trees;

/**
 * Base for passes that rewrite the statement list of each scope body:
 * function and clause bodies and conditional branches.  Nothing bound
 * in such a body is visible after it, so liveness within the body is
 * exact.  A block at the root of the tree is treated the same way.
 * Bodies are processed innermost first.
 */
public abstract class ScopeBodyPass extends AbstractPass {

  /**
   * @return stmts itself if nothing changed, otherwise the new list
   */
  protected abstract List<Node> processStatements(Logger logger,
                                                  List<Node> stmts);

  @Override
  public Node apply(final Logger logger, Node tree) {
    Node result = TreeRewrite.transform(tree, new Node.Rewriter() {
      @Override
      public Node rewrite(Node node) {
        return processBodies(logger, node);
      }
    });
    if (result.kind() == Node.Kind.BLOCK) {
      result = processBody(logger, result);
    }
    return result;
  }

  private Node processBodies(Logger logger, Node node) {
    switch (node.kind()) {
      case FUNCTION_DEF: {
        FunctionDef def = (FunctionDef)node;
        return def.withBody(processBody(logger, def.body()));
      }
      case FN: {
        Fn fn = (Fn)node;
        List<Clause> clauses = processClauses(logger, fn.clauses());
        return clauses == null ? fn : fn.withClauses(clauses);
      }
      case CASE: {
        Case c = (Case)node;
        List<Clause> clauses = processClauses(logger, c.clauses());
        return clauses == null ? c : c.withClauses(clauses);
      }
      case IF: {
        If i = (If)node;
        Node elseBranch = i.elseBranch() == null ? null :
                          processBody(logger, i.elseBranch());
        return i.withBranches(processBody(logger, i.thenBranch()), elseBranch);
      }
      case COND: {
        Cond c = (Cond)node;
        boolean changed = false;
        List<Cond.Branch> branches = new ArrayList<Cond.Branch>();
        for (Cond.Branch b: c.branches()) {
          Cond.Branch updated = b.withBody(processBody(logger, b.body));
          changed = changed || updated != b;
          branches.add(updated);
        }
        return changed ? c.withBranches(branches) : c;
      }
      default:
        return node;
    }
  }

  /**
   * @return null if no clause changed
   */
  private List<Clause> processClauses(Logger logger, List<Clause> clauses) {
    boolean changed = false;
    List<Clause> result = new ArrayList<Clause>(clauses.size());
    for (Clause c: clauses) {
      Clause updated = c.withBody(processBody(logger, c.body()));
      changed = changed || updated != c;
      result.add(updated);
    }
    return changed ? result : null;
  }

  private Node processBody(Logger logger, Node body) {
    if (body.kind() == Node.Kind.BLOCK) {
      Block block = (Block)body;
      List<Node> stmts = processStatements(logger, block.statements());
      if (stmts == block.statements()) {
        return block;
      } else if (stmts.size() == 1) {
        return Trees.replace(block, stmts.get(0));
      }
      return block.withStatements(stmts);
    }
    List<Node> single = Collections.singletonList(body);
    List<Node> stmts = processStatements(logger, single);
    if (stmts == single) {
      return body;
    } else if (stmts.size() == 1) {
      return stmts.get(0);
    } else {
      return new Block(stmts, NodeMeta.EMPTY);
    }
  }
}
