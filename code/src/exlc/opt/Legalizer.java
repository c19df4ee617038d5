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

import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exlc.common.Logging;
import exlc.common.Settings;
import exlc.common.exceptions.LegalizerRuntimeError;
import exlc.tree.Node;
import exlc.tree.TreeFormat;

/**
 * Entry point: takes the tree built by the frontend and returns a tree
 * the printer can emit as code the target compiler accepts.
 */
public class Legalizer {

  /**
   * @return a fresh instance of each pass, in pipeline order
   */
  public static List<LegalizationPass> standardPasses() {
    List<LegalizationPass> passes = new ArrayList<LegalizationPass>();
    // Structural cleanup first, so that later passes see flat blocks
    // and folded constants
    passes.add(new FlattenNested());
    passes.add(new UnwrapRedundantParens());
    passes.add(new ConstantFold());
    // Folding may have made conditions constant
    passes.add(new SimplifyConditionals());

    passes.add(WrapCompoundSlots.arguments());
    passes.add(WrapCompoundSlots.operands());
    passes.add(WrapCompoundSlots.interpolations());
    passes.add(WrapCompoundSlots.elements());

    // Dropping pure statements first removes reads that would keep
    // bindings alive
    passes.add(new DropPureStatements());
    passes.add(new CollapseNestedMatches());
    passes.add(new CollapseTempAliases());
    passes.add(new DeadStoreElimination());

    // Naming passes last: they rely on the final set of binders
    passes.add(new AlignClausePayloads());
    passes.add(new NormalizeFlattenedNames());
    passes.add(new PromoteUnderscoreBinders());
    // Must follow promotion, which may make binders read
    passes.add(new SuppressUnusedBinders());
    return passes;
  }

  /**
   * Build the standard pipeline.
   * @param validate if true, validate the tree before the first pass and
   *              after the last.  The final form is only checked if
   *              every pass is enabled.
   */
  public static PassPipeline standardPipeline(PrintStream irOutput,
                            boolean checkConditions, boolean validate) {
    PassPipeline pipe = new PassPipeline(irOutput, checkConditions);
    if (validate) {
      pipe.addPass(Validate.standardValidator());
    }
    boolean allEnabled = true;
    for (LegalizationPass pass: standardPasses()) {
      pipe.addPass(pass);
      if (!pipe.passEnabled(pass)) {
        allEnabled = false;
        Logging.uniqueWarn("Pass " + pass.getPassName() + " is disabled: " +
                           "output may not compile cleanly");
      }
    }
    if (validate) {
      pipe.addPass(allEnabled ? Validate.finalValidator() :
                                Validate.standardValidator());
    }
    return pipe;
  }

  /**
   * Legalize a tree using settings for logging, IR output and checks
   */
  public static Node legalize(Node tree) {
    Logger logger = Logging.setupLogging();
    String irFile = Settings.get(Settings.IR_OUTPUT_FILE);
    if (irFile == null || irFile.length() == 0) {
      return legalize(logger, null, tree);
    }
    PrintStream irOutput;
    try {
      irOutput = new PrintStream(new FileOutputStream(irFile));
    } catch (FileNotFoundException e) {
      throw new LegalizerRuntimeError("Could not open IR output file " +
                                      irFile, e);
    }
    try {
      return legalize(logger, irOutput, tree);
    } finally {
      irOutput.close();
    }
  }

  /**
   * Run the standard pipeline over the tree.
   * @param irOutput where to log the tree between passes.  Null for
   *              no output
   * @return the legalized tree.  The input is not modified.
   */
  public static Node legalize(Logger logger, PrintStream irOutput,
                              Node tree) {
    boolean debug = Settings.getRequiredBoolean(Settings.COMPILER_DEBUG);
    boolean check = Settings.getRequiredBoolean(Settings.CHECK_CONDITIONS);

    if (irOutput != null) {
      irOutput.println("// Initial tree");
      irOutput.println(TreeFormat.format(tree));
    }

    PassPipeline pipe = standardPipeline(irOutput, check, debug);
    return pipe.runPipeline(logger, tree);
  }

  /**
   * @return one line per pass: name, enabled flag and description
   */
  public static String describePasses() {
    PassPipeline pipe = new PassPipeline(null);
    StringBuilder sb = new StringBuilder();
    for (LegalizationPass pass: standardPasses()) {
      sb.append(String.format("%-30s %-8s %s%n", pass.getPassName(),
                pipe.passEnabled(pass) ? "enabled" : "disabled",
                pass.getDescription()));
    }
    return sb.toString();
  }
}
