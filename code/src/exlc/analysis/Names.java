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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableSet;

/**
 * Lexical rules for identifiers of the target language.
 *
 * A name with a leading uppercase letter or containing a dot is a
 * module or qualifier reference: it is never a binder and is never
 * renamed.  A name with a leading underscore is "underscored": the
 * target does not report it when unused, but reports it when read.
 */
public class Names {
  public static final String WILDCARD = "_";

  private static final java.util.regex.Pattern IDENTIFIER =
      java.util.regex.Pattern.compile("[a-z_][a-zA-Z0-9_]*[?!]?");

  /** Identifier tokens, with the preceding character captured */
  private static final java.util.regex.Pattern TOKEN =
      java.util.regex.Pattern.compile("(^|[^a-zA-Z0-9_.:@?!])([a-z_][a-zA-Z0-9_]*[?!]?)");

  private static final java.util.regex.Pattern INTERPOLATION_SLOT =
      java.util.regex.Pattern.compile("#\\{([^}]*)\\}");

  private static final Set<String> KEYWORDS = ImmutableSet.of(
      "do", "end", "fn", "if", "else", "unless", "case", "cond", "when",
      "and", "or", "not", "in", "true", "false", "nil", "after", "catch",
      "rescue", "try", "receive", "for", "with");

  public static boolean isIdentifier(String name) {
    return name != null && IDENTIFIER.matcher(name).matches() &&
           !KEYWORDS.contains(name);
  }

  public static boolean isModuleReference(String name) {
    return name.length() > 0 &&
        (Character.isUpperCase(name.charAt(0)) || name.indexOf('.') >= 0);
  }

  public static boolean isWildcard(String name) {
    return StringUtils.containsOnly(name, '_');
  }

  public static boolean isUnderscored(String name) {
    return name.startsWith(WILDCARD) && !isWildcard(name);
  }

  /**
   * Whether analyses should track this name at all
   */
  public static boolean isTracked(String name) {
    return name.length() > 0 && !isWildcard(name) &&
           !isModuleReference(name);
  }

  /**
   * _foo -> foo, __foo -> foo, foo -> foo
   */
  public static String bare(String name) {
    return StringUtils.stripStart(name, WILDCARD);
  }

  /**
   * foo -> _foo, _foo -> _foo
   */
  public static String underscored(String name) {
    return isUnderscored(name) ? name : WILDCARD + name;
  }

  /**
   * Key used to match names that differ only by underscores,
   * e.g. user_id, userid and _user_id
   */
  public static String stripUnderscores(String name) {
    return StringUtils.remove(name, '_');
  }

  /**
   * @return identifier tokens inside #{...} slots of literal text
   */
  public static List<String> interpolationTokens(String text) {
    List<String> result = new ArrayList<String>();
    if (text.indexOf("#{") < 0) {
      return result;
    }
    Matcher slot = INTERPOLATION_SLOT.matcher(text);
    while (slot.find()) {
      result.addAll(rawTokens(slot.group(1)));
    }
    return result;
  }

  /**
   * @return identifier tokens of unmodelled text, excluding keywords,
   *        field names, atoms and module attributes
   */
  public static List<String> rawTokens(String text) {
    List<String> result = new ArrayList<String>();
    Matcher m = TOKEN.matcher(text);
    while (m.find()) {
      String tok = m.group(2);
      if (!KEYWORDS.contains(tok) && isTracked(tok) &&
          !isCallSite(text, m.end(2))) {
        result.add(tok);
      }
    }
    return result;
  }

  /**
   * Rename identifier tokens in #{...} slots of literal text
   */
  public static String renameInterpolationTokens(String text, String from,
                                                 String to) {
    if (text.indexOf("#{") < 0) {
      return text;
    }
    Matcher slot = INTERPOLATION_SLOT.matcher(text);
    StringBuffer sb = new StringBuffer();
    while (slot.find()) {
      String renamed = "#{" + renameRawTokens(slot.group(1), from, to) + "}";
      slot.appendReplacement(sb, Matcher.quoteReplacement(renamed));
    }
    slot.appendTail(sb);
    return sb.toString();
  }

  /**
   * Rename identifier tokens in unmodelled text
   */
  public static String renameRawTokens(String text, String from, String to) {
    Matcher m = TOKEN.matcher(text);
    StringBuffer sb = new StringBuffer();
    while (m.find()) {
      String tok = m.group(2);
      String replacement = m.group(1);
      if (tok.equals(from) && !isCallSite(text, m.end(2))) {
        replacement += to;
      } else {
        replacement += tok;
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  /**
   * foo(...) and foo: are a local call and a keyword key, not variables
   */
  private static boolean isCallSite(String text, int tokenEnd) {
    return tokenEnd < text.length() &&
        (text.charAt(tokenEnd) == '(' || text.charAt(tokenEnd) == ':');
  }
}
