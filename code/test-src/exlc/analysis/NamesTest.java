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

package exlc.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class NamesTest {

  @Test
  public void testIdentifiers() {
    assertTrue(Names.isIdentifier("foo"));
    assertTrue(Names.isIdentifier("valid?"));
    assertTrue(Names.isIdentifier("_acc"));
    assertFalse(Names.isIdentifier("Foo"));
    assertFalse(Names.isIdentifier("do"));
    assertFalse(Names.isIdentifier("1x"));
    assertFalse(Names.isIdentifier(null));
  }

  @Test
  public void testModuleReferences() {
    assertTrue(Names.isModuleReference("Enum"));
    assertTrue(Names.isModuleReference("conn.assigns"));
    assertFalse(Names.isModuleReference("enum"));
    assertFalse(Names.isTracked("Enum"));
    assertFalse(Names.isTracked("_"));
    assertTrue(Names.isTracked("_x"));
  }

  @Test
  public void testUnderscores() {
    assertTrue(Names.isWildcard("_"));
    assertTrue(Names.isWildcard("__"));
    assertTrue(Names.isUnderscored("_x"));
    assertFalse(Names.isUnderscored("_"));
    assertFalse(Names.isUnderscored("x"));
    assertEquals("foo", Names.bare("__foo"));
    assertEquals("_foo", Names.underscored("foo"));
    assertEquals("_foo", Names.underscored("_foo"));
    assertEquals("userid", Names.stripUnderscores("_user_id"));
  }

  @Test
  public void testInterpolationTokens() {
    assertEquals(Arrays.asList("user", "count"),
        Names.interpolationTokens("Hi #{user.name}, you have #{count}"));
    assertTrue(Names.interpolationTokens("no slots here").isEmpty());
  }

  @Test
  public void testRawTokens() {
    assertEquals(Arrays.asList("x", "y"), Names.rawTokens("foo(x) + y"));
    assertEquals(Arrays.asList("v"), Names.rawTokens("[key: v, tag: :atom]"));
    assertTrue(Names.rawTokens("@attr").isEmpty());
  }

  @Test
  public void testRenameTokens() {
    assertEquals("z + max(z, xs)",
                 Names.renameRawTokens("x + max(x, xs)", "x", "z"));
    assertEquals("x = #{z}!",
                 Names.renameInterpolationTokens("x = #{x}!", "x", "z"));
  }
}
