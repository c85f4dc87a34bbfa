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
package exm.obli.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

import exm.obli.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String OBLI_LOGGER_NAME = "exm.obli";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  static final SetMultimap<Level, String> emitted = HashMultimap.create();

  public static Logger getObliLogger()
  {
    return Logger.getLogger(OBLI_LOGGER_NAME);
  }

  /**
   * Configure the obli logger.  With no log file only warnings reach the
   * console appender from log4j.properties.
   * @param logfile path of log file, or null/empty to disable file logging
   * @param trace if true, log at TRACE level rather than DEBUG
   * @return the configured logger
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException
  {
    Logger obliLogger = getObliLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
                new PatternLayout(LOG_PATTERN), logfile, false);
        obliLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file "
                                         + logfile + ": " + e.getMessage());
      }
      obliLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      obliLogger.setLevel(Level.WARN);
    }
    // Even if logging is disabled, this must be valid:
    return obliLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    synchronized (emitted) {
      return emitted.put(level, msg);
    }
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getObliLogger().warn(msg);
    else
      getObliLogger().debug("Duplicate Warning: " + msg);
  }
}
