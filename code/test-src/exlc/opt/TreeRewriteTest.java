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

import static exlc.tree.Trees.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exlc.tree.Node;

public class TreeRewriteTest {

  /** a = 1; f(a) */
  private static Node program() {
    return block(match(pvar("a"), intLit(1)), call("f", var("a")));
  }

  @Test
  public void testBottomUpOrder() {
    final List<Node.Kind> visited = new ArrayList<Node.Kind>();
    TreeRewrite.transform(program(), new Node.Rewriter() {
      @Override
      public Node rewrite(Node node) {
        visited.add(node.kind());
        return node;
      }
    });
    assertEquals(Arrays.asList(Node.Kind.INTEGER, Node.Kind.MATCH,
                               Node.Kind.VAR, Node.Kind.CALL, Node.Kind.BLOCK),
                 visited);
  }

  @Test
  public void testUnchangedTreeKeepsIdentity() {
    Node tree = program();
    Node result = TreeRewrite.transform(tree, new Node.Rewriter() {
      @Override
      public Node rewrite(Node node) {
        return node;
      }
    });
    assertSame(tree, result);
  }

  @Test
  public void testPatternsNotVisited() {
    Node result = TreeRewrite.transform(program(), new Node.Rewriter() {
      @Override
      public Node rewrite(Node node) {
        if (node.kind() == Node.Kind.VAR) {
          return var("b");
        }
        return node;
      }
    });
    assertEquals(block(match(pvar("a"), intLit(1)), call("f", var("b"))),
                 result);
  }

  @Test
  public void testClauseBodiesVisited() {
    Node tree = caseOf(var("x"),
        caseClause(pvar("y"), ifNode(var("y"), var("z"), null)));
    Node result = TreeRewrite.transform(tree, new Node.Rewriter() {
      @Override
      public Node rewrite(Node node) {
        if (node.kind() == Node.Kind.VAR) {
          return paren(node);
        }
        return node;
      }
    });
    Node expected = caseOf(paren(var("x")),
        caseClause(pvar("y"), ifNode(paren(var("y")), paren(var("z")), null)));
    assertEquals(expected, result);
  }

  @Test
  public void testExceptionsPropagate() {
    try {
      TreeRewrite.transform(program(), new Node.Rewriter() {
        @Override
        public Node rewrite(Node node) {
          if (node.kind() == Node.Kind.CALL) {
            throw new IllegalStateException("unexpected call");
          }
          return node;
        }
      });
      fail("Expected exception");
    } catch (IllegalStateException e) {
      assertEquals("unexpected call", e.getMessage());
    }
  }
}
