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

import java.util.List;

import org.apache.log4j.Logger;

import exlc.opt.TreeWalk.TreeWalker;
import exlc.opt.WrapCompoundSlots.SlotKind;
import exlc.tree.Control.Block;
import exlc.tree.Exprs.BinaryOp;
import exlc.tree.Exprs.Interpolation;
import exlc.tree.Exprs.Paren;
import exlc.tree.Exprs.UnaryOp;
import exlc.tree.Node;

/**
 * Tree conditions that passes establish and rely on
 */
public class Conditions {

  /** Structural sanity, see {@link Validate} */
  public static final TreeCondition WELL_FORMED =
      new TreeCondition("well-formed") {
    @Override
    protected void check(Node tree, List<String> violations) {
      Validate.checkWellFormed(tree, violations);
    }
  };

  /** No block is a statement of another block */
  public static final TreeCondition NO_NESTED_BLOCKS =
      new TreeCondition("no-nested-blocks") {
    @Override
    protected void check(Node tree, final List<String> violations) {
      TreeWalk.walk(tree, new TreeWalker() {
        @Override
        public void visit(Node node) {
          if (node.kind() != Node.Kind.BLOCK) {
            return;
          }
          for (Node stmt: ((Block)node).statements()) {
            if (FlattenNested.isInlineBlock(stmt)) {
              violations.add("Nested block " + stmt);
            }
          }
        }
      });
    }
  };

  /** No doubled parentheses, no parentheses around trivial nodes */
  public static final TreeCondition NO_REDUNDANT_PARENS =
      new TreeCondition("no-redundant-parens") {
    @Override
    protected void check(Node tree, final List<String> violations) {
      TreeWalk.walk(tree, new TreeWalker() {
        @Override
        public void visit(Node node) {
          if (node.kind() == Node.Kind.PAREN) {
            Node inner = ((Paren)node).inner();
            if (inner.kind() == Node.Kind.PAREN || inner.isTrivial()) {
              violations.add("Redundant parentheses " + node);
            }
          }
        }
      });
    }
  };

  /** No operation left that could be evaluated at compile time */
  public static final TreeCondition NO_FOLDABLE_OPERATIONS =
      new TreeCondition("no-foldable-operations") {
    @Override
    protected void check(Node tree, final List<String> violations) {
      TreeWalk.walk(tree, new TreeWalker() {
        @Override
        public void visit(Node node) {
          Node folded = null;
          if (node.kind() == Node.Kind.BINARY) {
            BinaryOp b = (BinaryOp)node;
            folded = OpEvaluator.eval(b.op(), b.left(), b.right());
          } else if (node.kind() == Node.Kind.UNARY) {
            UnaryOp u = (UnaryOp)node;
            folded = OpEvaluator.eval(u.op(), u.operand());
          } else if (node.kind() == Node.Kind.INTERPOLATION) {
            folded = OpEvaluator.evalInterpolation(
                                    ((Interpolation)node).parts());
          }
          if (folded != null) {
            violations.add("Foldable operation " + node);
          }
        }
      });
    }
  };

  /** Only the final statement of a block may be free of effects */
  public static final TreeCondition NO_PURE_STATEMENTS =
      new TreeCondition("no-pure-statements") {
    @Override
    protected void check(Node tree, final List<String> violations) {
      TreeWalk.walk(tree, new TreeWalker() {
        @Override
        public void visit(Node node) {
          if (node.kind() != Node.Kind.BLOCK) {
            return;
          }
          List<Node> stmts = ((Block)node).statements();
          for (int i = 0; i < stmts.size() - 1; i++) {
            if (DropPureStatements.isPure(stmts.get(i))) {
              violations.add("Pure statement " + stmts.get(i));
            }
          }
        }
      });
    }
  };

  /**
   * @return condition that no slot of the given kind holds a compound
   */
  public static TreeCondition noCompoundSlots(final SlotKind slotKind) {
    return new TreeCondition("no-compound-" + slotKind.name().toLowerCase()
                             + "-slots") {
      @Override
      protected void check(Node tree, final List<String> violations) {
        TreeWalk.walk(tree, new TreeWalker() {
          @Override
          public void visit(Node node) {
            for (Node slot: slotKind.slots(node)) {
              if (WrapCompoundSlots.isCompound(slot)) {
                violations.add("Compound in " + node.kind() + ": " + slot);
              }
            }
          }
        });
      }
    };
  }

  /**
   * @return condition that running the pass again changes nothing
   */
  public static TreeCondition stableUnder(final LegalizationPass pass) {
    return new TreeCondition("stable-under-" + pass.getPassName()) {
      @Override
      protected void check(Node tree, List<String> violations) {
        Logger logger = Logger.getLogger(Conditions.class);
        Node again = pass.apply(logger, tree);
        if (!again.equals(tree)) {
          violations.add("Re-running " + pass.getPassName() + " gives "
                          + again);
        }
      }
    };
  }
}
