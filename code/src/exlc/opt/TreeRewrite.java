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

import exlc.tree.Node;

/**
 * The rewrite primitive shared by all passes.
 */
public class TreeRewrite {

  /**
   * Bottom-up rewrite: the children of each node are transformed
   * before the visitor sees the node.  Every child slot of every
   * variant is visited; patterns are not.  Exceptions thrown by the
   * visitor propagate to the caller.
   */
  public static Node transform(Node tree, Node.Rewriter visitor) {
    return new BottomUp(visitor).rewrite(tree);
  }

  private static class BottomUp implements Node.Rewriter {
    private final Node.Rewriter visitor;

    BottomUp(Node.Rewriter visitor) {
      this.visitor = visitor;
    }

    @Override
    public Node rewrite(Node node) {
      return visitor.rewrite(node.mapChildren(this));
    }
  }
}
