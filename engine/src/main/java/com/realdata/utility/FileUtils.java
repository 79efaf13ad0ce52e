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
package com.realdata.utility;

import com.realdata.log.LogManager;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.logging.Level;

public class FileUtils {
  public static final int  KILOBYTE = 1024;
  public static final int  MEGABYTE = 1048576;
  public static final int  GIGABYTE = 1073741824;
  public static final long TERABYTE = 1099511627776L;

  private FileUtils() {
  }

  public static String getSizeAsString(final long iSize) {
    final long[] dividers = { TERABYTE, GIGABYTE, MEGABYTE, KILOBYTE };
    final String[] units = { "TB", "GB", "MB", "KB" };
    for (int i = 0; i < dividers.length; i++) {
      if (iSize > dividers[i])
        return String.format(Locale.ENGLISH, "%2.2f%s", (float) iSize / dividers[i], units[i]);
    }
    return iSize + "b";
  }

  public static void deleteRecursively(final File rootFile) {
    for (int attempt = 0; attempt < 3; attempt++) {
      try {
        if (rootFile.exists()) {
          if (rootFile.isDirectory()) {
            final File[] files = rootFile.listFiles();
            if (files != null) {
              for (final File f : files) {
                if (f.isFile())
                  Files.delete(f.toPath());
                else
                  deleteRecursively(f);
              }
            }
          }

          Files.delete(rootFile.toPath());
        }

        break;

      } catch (final IOException e) {
        LogManager.instance().log(rootFile, Level.WARNING, "Cannot delete directory '%s'", e, rootFile);
      }
    }
  }

  /**
   * Writes the content to a temporary sibling file and then moves it over the target, so readers never see a half written file.
   */
  public static void writeContentAtomically(final Path target, final byte[] content) throws IOException {
    final Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    Files.write(temp, content);
    try {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (final AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
