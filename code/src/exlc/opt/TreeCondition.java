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

import exlc.tree.Node;

/**
 * A checkable property of a whole tree, used to document what a pass
 * requires on entry and guarantees on exit.
 */
public abstract class TreeCondition {
  private final String name;

  protected TreeCondition(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /**
   * Append a description of each violation found to violations
   */
  protected abstract void check(Node tree, List<String> violations);

  /**
   * @return descriptions of violations, empty if the tree satisfies
   *         the condition
   */
  public List<String> violations(Node tree) {
    List<String> result = new ArrayList<String>();
    check(tree, result);
    return result;
  }

  public boolean holds(Node tree) {
    return violations(tree).isEmpty();
  }

  @Override
  public String toString() {
    return name;
  }
}
