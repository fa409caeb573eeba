/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.dotmath.common.log;

import java.util.Deque;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import com.google.common.collect.Lists;

/**
 * {@link Handler} that keeps the most recent formatted log lines in memory. Attach it to the
 * {@code java.util.logging} logger of a class to observe what that class reported, for example
 * a non-convergence warning from an iterative decomposition.
 */
public final class RecordingHandler extends Handler {

  private static final int DEFAULT_MAX_LINES = 1000;
  private static final String LOG_FORMAT_PROP = "java.util.logging.SimpleFormatter.format";

  private final Deque<String> lines;
  private final int maxLines;

  public RecordingHandler() {
    this(DEFAULT_MAX_LINES, Level.FINE);
  }

  /**
   * @param maxLines number of recent lines to retain
   * @param level minimum level recorded
   */
  public RecordingHandler(int maxLines, Level level) {
    this.lines = Lists.newLinkedList();
    this.maxLines = maxLines;
    setFormatter(new SimpleFormatter());
    setLevel(level);
  }

  /**
   * Creates a handler and adds it to the JUL logger named for {@code clazz}, which is where the
   * SLF4J JDK binding sends that class's events.
   *
   * @param clazz class whose log output should be recorded
   * @return the attached handler; call {@link #detachFrom(Class)} when done
   */
  public static RecordingHandler attachTo(Class<?> clazz) {
    RecordingHandler handler = new RecordingHandler();
    Logger logger = Logger.getLogger(clazz.getName());
    logger.addHandler(handler);
    return handler;
  }

  public void detachFrom(Class<?> clazz) {
    Logger.getLogger(clazz.getName()).removeHandler(this);
    close();
  }

  /**
   * @return copy of recently recorded lines, oldest first
   */
  public List<String> getLines() {
    synchronized (lines) {
      return Lists.newArrayList(lines);
    }
  }

  /**
   * @param fragment text to look for
   * @return true if any recorded line contains {@code fragment}
   */
  public boolean hasLineContaining(CharSequence fragment) {
    synchronized (lines) {
      for (String line : lines) {
        if (line.contains(fragment)) {
          return true;
        }
      }
    }
    return false;
  }

  @Override
  public void publish(LogRecord logRecord) {
    if (!isLoggable(logRecord)) {
      return;
    }
    String line = getFormatter().format(logRecord);
    synchronized (lines) {
      lines.addLast(line);
      while (lines.size() > maxLines) {
        lines.removeFirst();
      }
    }
  }

  @Override
  public void flush() {
  }

  @Override
  public void close() {
    synchronized (lines) {
      lines.clear();
    }
  }

  /**
   * <p>Sets the {@code java.util.logging} default output format to a single line per event, unless
   * it was already set on the command line. The format is like:</p>
   *
   * <p><pre>
   * Mon Nov 26 23:16:09 GMT 2012 WARNING Eigenvalue iteration did not converge
   * </pre></p>
   */
  public static void setSensibleLogFormat() {
    if (System.getProperty(LOG_FORMAT_PROP) == null) {
      System.setProperty(LOG_FORMAT_PROP, "%1$tc %4$s %5$s%6$s%n");
    }
  }

}
