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
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exlc.common.exceptions.LegalizerRuntimeError;
import exlc.common.util.Pair;

public class Logging
{
  private static final String LEGALIZER_LOGGER_NAME = "exlc";
  private static final String LOG_PATTERN = "%-5p %c{1}: %m%n";
  static final String FILE_APPENDER_NAME = "exlc-file";

  /**
   * Log file and trace flag of the current setup, null before the first.
   * Guarded by Logging.class
   */
  private static Pair<String, Boolean> configured = null;

  /**
   * Messages already emitted.
   */
  static final Set<Pair<Level, String>> emitted =
       new HashSet<Pair<Level, String>>();

  public static Logger getLegalizerLogger()
  {
    return Logger.getLogger(LEGALIZER_LOGGER_NAME);
  }

  /**
   * Direct legalizer log output to a file.  Repeating the current setup
   * leaves the logger alone; a different setup replaces the file
   * appender of the previous one, which is closed.
   * @param logfile file to log to, or null/empty for no file output
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the legalizer logger
   */
  public static synchronized Logger setupLogging(String logfile,
                                                 boolean trace)
  {
    Logger logger = getLegalizerLogger();
    if (logfile != null && logfile.length() == 0) {
      logfile = null;
    }
    Pair<String, Boolean> config = Pair.create(logfile,
                                        logfile != null && trace);
    if (config.equals(configured)) {
      return logger;
    }

    Appender previous = logger.getAppender(FILE_APPENDER_NAME);
    if (previous != null) {
      logger.removeAppender(previous);
      previous.close();
    }
    if (logfile != null) {
      try {
        FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                                 logfile, false);
        appender.setName(FILE_APPENDER_NAME);
        logger.addAppender(appender);
      } catch (IOException e) {
        throw new LegalizerRuntimeError("Could not open log file "
                                        + logfile, e);
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      // Even if logging is disabled, this must be valid:
      logger.setLevel(Level.WARN);
    }
    configured = config;
    return logger;
  }

  /**
   * Set up logging from exlc.log.file and exlc.log.trace
   */
  public static Logger setupLogging()
  {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getRequiredBoolean(Settings.LOG_TRACE);
    return setupLogging(logfile, trace);
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    synchronized (emitted) {
      return emitted.add(Pair.create(level, msg));
    }
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getLegalizerLogger().warn(msg);
    else
      getLegalizerLogger().debug("Duplicate Warning: " + msg);
  }
}
