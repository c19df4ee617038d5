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

import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exlc.common.Settings;
import exlc.tree.Node;

/**
 * A legalization pass: a pure, total function from tree to tree.
 * Shapes a pass has no rule for are returned unchanged.
 */
public interface LegalizationPass {
  /**
   * @return stable kebab-case name, used for the enable key and for
   *         disabling the pass by name
   */
  public abstract String getPassName();
  public abstract String getDescription();
  /**
   * @return Key indicating whether pass is enabled.  If null, always enabled
   */
  public abstract String getConfigEnabledKey();
  /**
   * @return conditions the input tree must satisfy
   */
  public abstract List<TreeCondition> getPreconditions();
  /**
   * @return conditions the output tree satisfies
   */
  public abstract List<TreeCondition> getPostconditions();
  public abstract Node apply(Logger logger, Node tree);

  /**
   * Pass enabled by exlc.pass.&lt;name&gt;, with no conditions
   * unless overridden
   */
  public static abstract class AbstractPass implements LegalizationPass {

    @Override
    public String getConfigEnabledKey() {
      return Settings.passKey(getPassName());
    }

    @Override
    public List<TreeCondition> getPreconditions() {
      return Collections.emptyList();
    }

    @Override
    public List<TreeCondition> getPostconditions() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return getPassName();
    }
  }

  /**
   * Pass that rewrites nodes one at a time, bottom-up
   */
  public static abstract class RewritePass extends AbstractPass {

    @Override
    public Node apply(final Logger logger, Node tree) {
      return TreeRewrite.transform(tree, new Node.Rewriter() {
        @Override
        public Node rewrite(Node node) {
          return RewritePass.this.rewrite(logger, node);
        }
      });
    }

    /**
     * Called on each node after its children were rewritten
     * @return node itself, or its replacement
     */
    protected abstract Node rewrite(Logger logger, Node node);
  }
}
