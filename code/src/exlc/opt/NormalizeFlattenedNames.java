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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exlc.analysis.Names;
import exlc.analysis.Renamer;
import exlc.analysis.ScopeUnit;
import exlc.analysis.UsageAnalysis;
import exlc.tree.Clause;
import exlc.tree.Node;

/**
 * Unify reads that differ from a binder of the unit only in underscores,
 * e.g. a read of userid or _user_id where only user_id is bound.
 * Only reads of names bound nowhere in the unit or around it change.
 */
public class NormalizeFlattenedNames extends ScopeUnitPass {

  @Override
  public String getPassName() {
    return "normalize-flattened-names";
  }

  @Override
  public String getDescription() {
    return "Point reads of names that differ from a binder only in " +
           "underscores at that binder";
  }

  @Override
  public List<TreeCondition> getPostconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.stableUnder(this));
    return result;
  }

  @Override
  protected ScopeUnit processUnit(Logger logger, ScopeUnit unit,
                                  Set<String> enclosing) {
    Map<String, String> binders = bindersByKey(unit.declared());
    if (binders.isEmpty()) {
      return unit;
    }
    Set<String> boundAnywhere = UsageAnalysis.declared(unit.body());
    if (unit.clause().guard() != null) {
      boundAnywhere.addAll(UsageAnalysis.declared(unit.clause().guard()));
    }
    Clause clause = unit.clause();
    for (final String read: unit.undeclaredReferences()) {
      if (enclosing.contains(read) || boundAnywhere.contains(read)) {
        continue;
      }
      final String binder = binders.get(Names.stripUnderscores(read));
      if (binder == null || binder.equals(read)) {
        continue;
      }
      if (logger.isDebugEnabled()) {
        logger.debug("Normalizing read " + read + " to binder " + binder);
      }
      clause = clause.mapNodes(new Node.Rewriter() {
        @Override
        public Node rewrite(Node node) {
          return Renamer.renameReferences(node, read, binder);
        }
      });
    }
    return unit.withClause(clause);
  }

  /**
   * @return binders keyed by name without underscores, leaving out keys
   *        shared by more than one binder
   */
  private static Map<String, String> bindersByKey(Set<String> declared) {
    Map<String, String> result = new HashMap<String, String>();
    Set<String> ambiguous = new HashSet<String>();
    for (String name: declared) {
      String key = Names.stripUnderscores(name);
      if (key.isEmpty()) {
        continue;
      }
      if (result.containsKey(key)) {
        ambiguous.add(key);
      } else {
        result.put(key, name);
      }
    }
    for (String key: ambiguous) {
      result.remove(key);
    }
    return result;
  }
}
