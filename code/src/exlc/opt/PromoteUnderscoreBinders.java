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
import java.util.Set;

import org.apache.log4j.Logger;

import exlc.analysis.Names;
import exlc.analysis.Renamer;
import exlc.analysis.ScopeUnit;
import exlc.analysis.UsageAnalysis;

/**
 * A binder _x whose value is read, either as _x or as x, is renamed to
 * x along with its reads.  Reading an underscored variable draws a
 * compiler warning on the target.
 *
 * Not done when x is bound anywhere in the unit, including nested
 * units, or in an enclosing unit: the rename would capture it.  Nor
 * when _x is also bound around the unit, since some reads of _x in the
 * unit may see that binding.
 */
public class PromoteUnderscoreBinders extends ScopeUnitPass {

  @Override
  public String getPassName() {
    return "promote-underscore-binders";
  }

  @Override
  public String getDescription() {
    return "Drop the underscore prefix of binders that are read";
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
    for (String name: new ArrayList<String>(unit.declared())) {
      if (!Names.isUnderscored(name)) {
        continue;
      }
      String bare = Names.bare(name);
      if (!Names.isTracked(bare)) {
        continue;
      }
      Set<String> referenced = unit.referenced();
      if (!referenced.contains(name) && !referenced.contains(bare)) {
        continue;
      }
      if (unit.declared().contains(bare) || enclosing.contains(bare) ||
          boundInUnit(unit, bare)) {
        logger.trace("Not promoting " + name + ": " + bare + " is bound");
        continue;
      }
      if (enclosing.contains(name)) {
        logger.trace("Not promoting " + name + ": also bound outside");
        continue;
      }
      if (logger.isDebugEnabled()) {
        logger.debug("Promoting " + name + " to " + bare);
      }
      unit = unit.withClause(Renamer.renameInUnit(unit.clause(), name, bare));
    }
    return unit;
  }

  private static boolean boundInUnit(ScopeUnit unit, String name) {
    if (UsageAnalysis.declared(unit.body()).contains(name)) {
      return true;
    }
    return unit.clause().guard() != null &&
           UsageAnalysis.declared(unit.clause().guard()).contains(name);
  }
}
