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

import exlc.tree.Clause;
import exlc.tree.Control.Case;
import exlc.tree.Control.Fn;
import exlc.tree.Control.Match;
import exlc.tree.Decls.FunctionDef;
import exlc.tree.Node;
import exlc.tree.Pattern;

public class TreeWalk {

  /**
   * Walk pre-order.  Patterns owned by a node are visited after the
   * node and before its children.
   * @param tree
   * @param walker
   */
  public static void walk(Node tree, TreeWalker walker) {
    walker.visit(tree);
    switch (tree.kind()) {
      case MATCH:
        walkPattern(((Match)tree).pattern(), walker);
        break;
      case FN:
        for (Clause c: ((Fn)tree).clauses()) {
          walkHead(c, walker);
        }
        break;
      case CASE:
        for (Clause c: ((Case)tree).clauses()) {
          walkHead(c, walker);
        }
        break;
      case FUNCTION_DEF:
        for (Pattern p: ((FunctionDef)tree).params()) {
          walkPattern(p, walker);
        }
        break;
      default:
        break;
    }
    for (Node child: tree.children()) {
      walk(child, walker);
    }
  }

  private static void walkHead(Clause clause, TreeWalker walker) {
    walker.visit(clause);
    for (Pattern p: clause.patterns()) {
      walkPattern(p, walker);
    }
  }

  public static void walkPattern(Pattern pattern, TreeWalker walker) {
    walker.visit(pattern);
    for (Pattern sub: pattern.subPatterns()) {
      walkPattern(sub, walker);
    }
  }

  public static abstract class TreeWalker {
    public void visit(Node node) {
      // Nothing
    }

    public void visit(Clause clause) {
      // Nothing
    }

    public void visit(Pattern pattern) {
      // nothing
    }
  }
}
