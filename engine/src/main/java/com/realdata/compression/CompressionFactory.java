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
package com.realdata.compression;

import com.realdata.exception.ConfigurationException;

import java.util.Locale;

/**
 * Resolves the codec used for the record bodies. Every stored record carries the id of its codec, so records written with a different
 * setting stay readable.
 */
public class CompressionFactory {
  public static final byte NONE_ID = 0;
  public static final byte LZ4_ID  = 1;

  private static final Compression NONE = new NullCompression();
  private static final Compression LZ4  = new LZ4Compression();

  public static Compression getCompression(final byte id) {
    switch (id) {
    case NONE_ID:
      return NONE;
    case LZ4_ID:
      return LZ4;
    default:
      throw new ConfigurationException("Unknown compression id " + id);
    }
  }

  public static byte getId(final String name) {
    switch (name.toLowerCase(Locale.ENGLISH)) {
    case "none":
      return NONE_ID;
    case "lz4":
      return LZ4_ID;
    default:
      throw new ConfigurationException("Unknown compression '" + name + "', supported are 'lz4' and 'none'");
    }
  }
}
