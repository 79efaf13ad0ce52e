/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.realdata.log;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;

/**
 * Default logger that forwards to java.util.logging, one JUL logger per requester class.
 */
public class DefaultLogger implements Logger {
  private static final String                                          DEFAULT_LOG                  = "com.realdata";
  private static final String                                          ENV_INSTALL_CUSTOM_FORMATTER = "realdata.installCustomFormatter";
  private final        ConcurrentMap<String, java.util.logging.Logger> loggersCache                 = new ConcurrentHashMap<>();

  public DefaultLogger() {
    installCustomFormatter();
  }

  public void installCustomFormatter() {
    final String setting = System.getProperty(ENV_INSTALL_CUSTOM_FORMATTER, System.getenv(ENV_INSTALL_CUSTOM_FORMATTER));
    if (setting != null && !Boolean.parseBoolean(setting))
      return;

    try {
      // ASSURE TO HAVE THE LOG FORMATTER TO THE CONSOLE EVEN IF NO CONFIGURATION FILE IS TAKEN
      final java.util.logging.Logger log = java.util.logging.Logger.getLogger("");

      if (log.getHandlers().length == 0) {
        final Handler h = new ConsoleHandler();
        h.setFormatter(new LogFormatter());
        log.addHandler(h);
      } else {
        for (final Handler h : log.getHandlers()) {
          if (h instanceof ConsoleHandler && !(h.getFormatter() instanceof LogFormatter))
            h.setFormatter(new LogFormatter());
        }
      }
    } catch (final Exception e) {
      System.err.println("Error while installing custom formatter. Logging could be disabled. Cause: " + e);
    }
  }

  @Override
  public void log(final Object requester, final Level level, String message, final Throwable exception, final String context,
      final Object... args) {
    if (message == null)
      return;

    final java.util.logging.Logger log = getLogger(requester);
    if (!log.isLoggable(level))
      return;

    try {
      if (context != null)
        message = "<" + context + "> " + message;

      final String msg = args != null && args.length > 0 ? String.format(message, args) : message;

      if (exception != null)
        log.log(level, msg, exception);
      else
        log.log(level, msg);

      if (level == Level.SEVERE)
        flush();

    } catch (final Exception e) {
      System.err.print(String.format("Error on formatting message '%s'. Exception: %s", message, e));
      System.err.flush();
    }
  }

  @Override
  public void flush() {
    for (final Handler h : java.util.logging.Logger.getLogger("").getHandlers())
      h.flush();
  }

  private java.util.logging.Logger getLogger(final Object requester) {
    final String requesterName;
    if (requester instanceof String)
      requesterName = (String) requester;
    else if (requester instanceof Class<?>)
      requesterName = ((Class<?>) requester).getName();
    else if (requester != null)
      requesterName = requester.getClass().getName();
    else
      requesterName = DEFAULT_LOG;

    return loggersCache.computeIfAbsent(requesterName, java.util.logging.Logger::getLogger);
  }
}
