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

package exlc.common;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exlc.common.exceptions.InvalidOptionException;
import exlc.common.exceptions.LegalizerRuntimeError;

/**
 * General legalizer settings.
 *
 * Every pass has an enable key of the form exlc.pass.&lt;pass-name&gt;,
 * so that passes can be switched off by name for debugging without
 * changing the pipeline order.
 */
public class Settings
{
  public static final String PASS_PREFIX = "exlc.pass.";

  public static final String PASS_FLATTEN_NESTED = PASS_PREFIX + "flatten-nested";
  public static final String PASS_UNWRAP_PARENS =
                                PASS_PREFIX + "unwrap-redundant-parens";
  public static final String PASS_CONSTANT_FOLD = PASS_PREFIX + "constant-fold";
  public static final String PASS_SIMPLIFY_CONDITIONALS =
                                PASS_PREFIX + "simplify-conditionals";
  public static final String PASS_WRAP_ARGUMENTS =
                                PASS_PREFIX + "wrap-compound-arguments";
  public static final String PASS_WRAP_OPERANDS =
                                PASS_PREFIX + "wrap-compound-operands";
  public static final String PASS_WRAP_INTERPOLATIONS =
                                PASS_PREFIX + "wrap-compound-interpolations";
  public static final String PASS_WRAP_ELEMENTS =
                                PASS_PREFIX + "wrap-compound-elements";
  public static final String PASS_COLLAPSE_NESTED_MATCHES =
                                PASS_PREFIX + "collapse-nested-matches";
  public static final String PASS_COLLAPSE_TEMP_ALIASES =
                                PASS_PREFIX + "collapse-temp-aliases";
  public static final String PASS_DROP_PURE_STATEMENTS =
                                PASS_PREFIX + "drop-pure-statements";
  public static final String PASS_DEAD_STORE_ELIM =
                                PASS_PREFIX + "dead-store-elimination";
  public static final String PASS_ALIGN_PAYLOADS =
                                PASS_PREFIX + "align-clause-payloads";
  public static final String PASS_NORMALIZE_NAMES =
                                PASS_PREFIX + "normalize-flattened-names";
  public static final String PASS_PROMOTE_BINDERS =
                                PASS_PREFIX + "promote-underscore-binders";
  public static final String PASS_SUPPRESS_BINDERS =
                                PASS_PREFIX + "suppress-unused-binders";

  /** Check pass preconditions and postconditions while running */
  public static final String CHECK_CONDITIONS = "exlc.check-conditions";
  /** Validate tree structure before and after the pipeline */
  public static final String COMPILER_DEBUG = "exlc.compiler-debug";
  public static final String IR_OUTPUT_FILE = "exlc.ir.output-file";

  public static final String LOG_FILE = "exlc.log.file";
  public static final String LOG_TRACE = "exlc.log.trace";

  private static final List<String> PASS_KEYS = Collections.unmodifiableList(
      Arrays.asList(PASS_FLATTEN_NESTED, PASS_UNWRAP_PARENS,
          PASS_CONSTANT_FOLD, PASS_SIMPLIFY_CONDITIONALS, PASS_WRAP_ARGUMENTS,
          PASS_WRAP_OPERANDS, PASS_WRAP_INTERPOLATIONS, PASS_WRAP_ELEMENTS,
          PASS_DROP_PURE_STATEMENTS, PASS_COLLAPSE_NESTED_MATCHES,
          PASS_COLLAPSE_TEMP_ALIASES, PASS_DEAD_STORE_ELIM, PASS_ALIGN_PAYLOADS,
          PASS_NORMALIZE_NAMES, PASS_PROMOTE_BINDERS, PASS_SUPPRESS_BINDERS));

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    // Set defaults here
    for (String passKey: PASS_KEYS) {
      defaults.setProperty(passKey, "true");
    }
    defaults.setProperty(CHECK_CONDITIONS, "false");
    defaults.setProperty(COMPILER_DEBUG, "true");
    defaults.setProperty(IR_OUTPUT_FILE, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  /**
   * Load overrides from a properties stream, e.g. a file supplied
   * by the surrounding build tool.  Unknown keys are kept so that
   * they can be inspected, but only known keys are validated.
   */
  public static void loadProperties(InputStream in)
                        throws IOException, InvalidOptionException {
    Properties loaded = new Properties();
    loaded.load(in);
    for (String key: loaded.stringPropertyNames()) {
      properties.setProperty(key, loaded.getProperty(key).trim());
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop all overrides, going back to the built-in defaults
   */
  public static void reset() {
    properties.clear();
  }

  public static String passKey(String passName) {
    return PASS_PREFIX + passName;
  }

  public static List<String> getPassKeys() {
    return PASS_KEYS;
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    for (String passKey: PASS_KEYS) {
      getBoolean(passKey);
    }
    getBoolean(CHECK_CONDITIONS);
    getBoolean(COMPILER_DEBUG);
    getBoolean(LOG_TRACE);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key) throws InvalidOptionException
  {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    if (val.equalsIgnoreCase("true")) {
      return true;
    } else if (val.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for property "
                                        + key + ": " + val);
    }
  }

  /**
   * Boolean lookup for keys that must exist.  A missing or malformed
   * key here is a bug in the legalizer, not bad user input.
   */
  public static boolean getRequiredBoolean(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new LegalizerRuntimeError("Expected config key " + key
                                      + " to be a valid boolean", e);
    }
  }
}
