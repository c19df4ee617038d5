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

package exlc.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashSet;

import org.junit.Test;

import exlc.common.exceptions.LegalizerRuntimeError;

public class HierarchicalSetTest {

  @Test
  public void testChildSeesParent() {
    HierarchicalSet<String> root = new HierarchicalSet<String>();
    root.add("a");
    HierarchicalSet<String> child = root.makeChild(Arrays.asList("b"));

    assertTrue(child.contains("a"));
    assertTrue(child.contains("b"));
    assertFalse(child.containsLocal("a"));
    assertTrue(child.containsLocal("b"));

    // Parent doesn't see child additions
    assertFalse(root.contains("b"));
  }

  @Test
  public void testIterationIsDistinct() {
    HierarchicalSet<String> root = new HierarchicalSet<String>();
    root.add("a");
    root.add("b");
    HierarchicalSet<String> child = root.makeChild();
    child.add("a");
    child.add("c");

    assertEquals(3, child.size());
    assertEquals(new HashSet<String>(Arrays.asList("a", "b", "c")),
                 new HashSet<String>(child));
  }

  @Test(expected=LegalizerRuntimeError.class)
  public void testNoRemove() {
    HierarchicalSet<String> root = new HierarchicalSet<String>();
    root.add("a");
    root.remove("a");
  }
}
