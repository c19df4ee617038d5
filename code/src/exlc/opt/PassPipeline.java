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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exlc.common.Settings;
import exlc.common.exceptions.InvalidOptionException;
import exlc.common.exceptions.InvariantViolationError;
import exlc.common.exceptions.LegalizerRuntimeError;
import exlc.tree.Node;
import exlc.tree.TreeFormat;

public class PassPipeline {

  public PassPipeline(PrintStream irOutput, boolean checkConditions) {
    this.irOutput = irOutput;
    this.checkConditions = checkConditions;
  }

  public PassPipeline(PrintStream irOutput) {
    this(irOutput, false);
  }

  private final List<LegalizationPass> passes =
                                    new ArrayList<LegalizationPass>();
  private final Set<String> disabled = new HashSet<String>();
  private final PrintStream irOutput;
  private final boolean checkConditions;

  public void addPass(LegalizationPass pass) {
    passes.add(pass);
  }

  public List<LegalizationPass> getPasses() {
    return Collections.unmodifiableList(passes);
  }

  /**
   * Skip a pass on this pipeline only, regardless of settings
   */
  public void disable(String passName) {
    disabled.add(passName);
  }

  public boolean isDisabled(String passName) {
    return disabled.contains(passName);
  }

  public boolean isCheckingConditions() {
    return checkConditions;
  }

  /**
   * Run enabled passes in order
   * @return the legalized tree
   */
  public Node runPipeline(Logger logger, Node tree) {
    for (LegalizationPass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Pass: " + pass.getPassName());
        if (checkConditions) {
          checkConditions(pass, pass.getPreconditions(), tree);
        }
        tree = pass.apply(logger, tree);
        if (checkConditions) {
          checkConditions(pass, pass.getPostconditions(), tree);
        }
        if (irOutput != null) {
          irOutput.println("// Tree after " + pass.getPassName());
          irOutput.println(TreeFormat.format(tree));
        }
      } else {
        logger.debug("Skipping disabled pass: " + pass.getPassName());
      }
    }
    return tree;
  }

  public boolean passEnabled(LegalizationPass pass) {
    if (disabled.contains(pass.getPassName())) {
      return false;
    }
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new LegalizerRuntimeError("Expected config key " +
          pass.getConfigEnabledKey() + " to exist: " + e.getMessage());
    }
  }

  private static void checkConditions(LegalizationPass pass,
                            List<TreeCondition> conditions, Node tree) {
    for (TreeCondition condition: conditions) {
      List<String> violations = condition.violations(tree);
      if (!violations.isEmpty()) {
        throw new InvariantViolationError(pass.getPassName(),
                                          condition.getName(), violations);
      }
    }
  }
}
