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
package com.realdata.engine;

import com.realdata.compression.Compression;
import com.realdata.compression.CompressionFactory;
import com.realdata.exception.ErrorCode;
import com.realdata.exception.StorageException;
import com.realdata.log.LogManager;
import com.realdata.serializer.json.JSONArray;
import com.realdata.serializer.json.JSONObject;
import com.realdata.utility.FileUtils;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.logging.Level;

/**
 * Store saving one file per record under the store's directory. The file starts with an uncompressed header holding the primary key
 * and the index keys, followed by the compressed JSON body:
 * <pre>
 * [format:byte][codec:byte][headerLength:int][header:bytes][bodyLength:int][compressedLength:int][body:bytes]
 * </pre>
 * At open only the headers are read to rebuild the in-memory indexes. Files are replaced atomically.
 */
public class LocalObjectStore extends AbstractObjectStore {
  public static final  String FILE_EXT       = ".rec";
  private static final byte   FORMAT_VERSION = 1;
  private static final char[] HEX            = "0123456789abcdef".toCharArray();

  private final Path directory;
  private final byte codecId;

  public LocalObjectStore(final Path directory, final StoreDefinition definition, final byte codecId) {
    super(definition);
    this.directory = directory;
    this.codecId = codecId;
  }

  /**
   * Rebuilds the indexes from the record headers and removes the temporary files left by an interrupted write.
   */
  public void load() throws IOException {
    clearIndexes();
    Files.createDirectories(directory);

    try (final DirectoryStream<Path> temps = Files.newDirectoryStream(directory, "*.tmp")) {
      for (final Path temp : temps) {
        LogManager.instance().log(this, Level.WARNING, "Removing incomplete record file '%s' in store '%s'", temp.getFileName(), getName());
        Files.deleteIfExists(temp);
      }
    }

    int loaded = 0;
    long bytes = 0;
    try (final DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + FILE_EXT)) {
      for (final Path file : files) {
        try (final DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
          final JSONObject header = readHeader(in, file).content;
          final CompoundKey primaryKey = CompoundKey.fromJSON(header.getJSONArray("key"));
          final JSONArray indexes = header.getJSONArray("indexes");
          final CompoundKey[] indexKeys = new CompoundKey[indexes.length()];
          for (int i = 0; i < indexKeys.length; i++) {
            final Object indexKey = indexes.get(i);
            indexKeys[i] = indexKey instanceof JSONArray ? CompoundKey.fromJSON((JSONArray) indexKey) : null;
          }
          register(primaryKey, indexKeys);
          ++loaded;
        }
        bytes += Files.size(file);
      }
    }

    LogManager.instance().log(this, Level.FINE, "Loaded %d records (%s) from store '%s'", loaded, FileUtils.getSizeAsString(bytes),
        getName());
  }

  public Path getDirectory() {
    return directory;
  }

  @Override
  protected JSONObject loadRecord(final CompoundKey primaryKey) {
    final Path file = getFile(primaryKey);
    try (final InputStream raw = Files.newInputStream(file); final DataInputStream in = new DataInputStream(new BufferedInputStream(raw))) {
      final Compression compression = CompressionFactory.getCompression(readHeader(in, file).codec);
      final int bodyLength = in.readInt();
      final int compressedLength = in.readInt();
      final byte[] compressed = new byte[compressedLength];
      in.readFully(compressed);
      return new JSONObject(new String(compression.decompress(compressed, bodyLength), StandardCharsets.UTF_8));
    } catch (final NoSuchFileException e) {
      return null;
    } catch (final IOException e) {
      throw new StorageException(ErrorCode.IO_ERROR, "Error reading record " + primaryKey + " from store '" + getName() + "'", e);
    }
  }

  @Override
  protected void saveRecord(final CompoundKey primaryKey, final CompoundKey[] indexKeys, final JSONObject record) {
    final JSONArray indexes = new JSONArray();
    for (final CompoundKey indexKey : indexKeys)
      indexes.put(indexKey != null ? indexKey.toJSON() : null);
    final byte[] header = new JSONObject().put("key", primaryKey.toJSON()).put("indexes", indexes).toString()
        .getBytes(StandardCharsets.UTF_8);

    final byte[] body = record.toString().getBytes(StandardCharsets.UTF_8);
    final byte[] compressed = CompressionFactory.getCompression(codecId).compress(body);

    try {
      final ByteArrayOutputStream buffer = new ByteArrayOutputStream(header.length + compressed.length + 14);
      final DataOutputStream out = new DataOutputStream(buffer);
      out.writeByte(FORMAT_VERSION);
      out.writeByte(codecId);
      out.writeInt(header.length);
      out.write(header);
      out.writeInt(body.length);
      out.writeInt(compressed.length);
      out.write(compressed);
      out.flush();

      FileUtils.writeContentAtomically(getFile(primaryKey), buffer.toByteArray());
    } catch (final IOException e) {
      throw new StorageException(ErrorCode.IO_ERROR, "Error writing record " + primaryKey + " to store '" + getName() + "'", e);
    }
  }

  @Override
  protected void removeRecord(final CompoundKey primaryKey) {
    try {
      Files.deleteIfExists(getFile(primaryKey));
    } catch (final IOException e) {
      throw new StorageException(ErrorCode.IO_ERROR, "Error deleting record " + primaryKey + " from store '" + getName() + "'", e);
    }
  }

  private static RecordHeader readHeader(final DataInputStream in, final Path file) throws IOException {
    final byte format = in.readByte();
    if (format != FORMAT_VERSION)
      throw new StorageException(ErrorCode.SERIALIZATION_ERROR, "Unsupported record format " + format + " in file '" + file + "'", null);
    final byte codec = in.readByte();
    final byte[] header = new byte[in.readInt()];
    in.readFully(header);
    return new RecordHeader(codec, new JSONObject(new String(header, StandardCharsets.UTF_8)));
  }

  private Path getFile(final CompoundKey primaryKey) {
    try {
      final byte[] digest = MessageDigest.getInstance("SHA-256").digest(primaryKey.toJSON().toString().getBytes(StandardCharsets.UTF_8));
      final StringBuilder name = new StringBuilder(digest.length * 2 + FILE_EXT.length());
      for (final byte b : digest)
        name.append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
      return directory.resolve(name.append(FILE_EXT).toString());
    } catch (final NoSuchAlgorithmException e) {
      throw new StorageException("SHA-256 not available", e);
    }
  }

  private static final class RecordHeader {
    private final byte       codec;
    private final JSONObject content;

    private RecordHeader(final byte codec, final JSONObject content) {
      this.codec = codec;
      this.content = content;
    }
  }
}
