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

package exlc.common.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised when a tree fails a pass precondition or postcondition
 * while condition checking is enabled.
 */
public class InvariantViolationError extends LegalizerRuntimeError {

  private final String passName;
  private final List<String> violations;

  public InvariantViolationError(String passName, String condition,
                                 List<String> violations) {
    super(passName + ": condition " + condition + " violated: " + violations);
    this.passName = passName;
    this.violations = new ArrayList<String>(violations);
  }

  public String getPassName() {
    return passName;
  }

  public List<String> getViolations() {
    return Collections.unmodifiableList(violations);
  }

  private static final long serialVersionUID = 1L;
}
