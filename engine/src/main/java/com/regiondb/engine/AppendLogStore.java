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
package com.regiondb.engine;

import com.regiondb.exception.ErrorCode;
import com.regiondb.exception.StorageException;
import com.regiondb.log.LogManager;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.zip.CRC32;

/**
 * Persistent {@link OrderedStore} made of an append-only log file and an in-memory ordered view. Every mutation is appended to the
 * log as a framed record and then applied to the view; opening an existing file replays the records through the same
 * {@link MergeOperator}, so the replayed view is byte-identical to the one before closing.
 * <p>
 * Record layout: {@code [op:1][keyLength:4][valueLength:4][headerCrc32:4][key][value][crc32:4]}. The header CRC covers the first 9
 * bytes, so the lengths are verified before they are trusted; the trailing CRC covers everything before it. The file starts with
 * {@link #MAGIC_NUMBER}. A truncated last record (crash during an append) is discarded at open; any other inconsistency is
 * reported as {@link ErrorCode#CORRUPTION_DETECTED}.
 * <p>
 * Appends and the matching update of the view happen under the store's append lock so that the log order and the view order of
 * concurrent merges on the same key are the same. Reads never lock.
 */
public class AppendLogStore implements OrderedStore {
  public static final  long   MAGIC_NUMBER   = 5277938473025536217L;
  public static final  String FILE_EXTENSION = "rlog";
  private static final byte   OP_PUT         = 1;
  private static final byte   OP_MERGE       = 2;
  private static final byte   OP_REMOVE      = 3;
  // OP (byte) + KEY LENGTH (int) + VALUE LENGTH (int) + HEADER CRC (int)
  private static final int    RECORD_HEADER  = 1 + 4 + 4 + 4;
  private static final int    HEADER_CRC_POS = 1 + 4 + 4;
  private static final int    RECORD_FOOTER  = 4;
  private static final int    FILE_HEADER    = 8;

  private final    File               file;
  private final    boolean            syncOnWrite;
  private final    MemoryOrderedStore view;
  private final    Object             appendLock = new Object();
  private          FileChannel        channel;
  private volatile boolean            open;
  private          long               statsBytesWritten;
  private          long               statsRecordsWritten;

  public AppendLogStore(final File file, final String name, final MergeOperator mergeOperator, final boolean syncOnWrite) {
    this.file = file;
    this.syncOnWrite = syncOnWrite;
    this.view = new MemoryOrderedStore(name, mergeOperator);

    try {
      final boolean exists = file.exists() && file.length() > 0;
      this.channel = new RandomAccessFile(file, "rw").getChannel();

      if (exists)
        replay();
      else
        writeFileHeader();

      this.open = true;
    } catch (IOException e) {
      closeChannelQuietly();
      throw new StorageException("Error on opening log file '" + file + "'", e);
    } catch (RuntimeException e) {
      closeChannelQuietly();
      throw e;
    }
  }

  @Override
  public String getName() {
    return view.getName();
  }

  @Override
  public MergeOperator getMergeOperator() {
    return view.getMergeOperator();
  }

  @Override
  public void merge(final byte[] key, final byte[] operand) {
    synchronized (appendLock) {
      append(OP_MERGE, key, operand);
      view.merge(key, operand);
    }
  }

  @Override
  public void put(final byte[] key, final byte[] value) {
    synchronized (appendLock) {
      append(OP_PUT, key, value);
      view.put(key, value);
    }
  }

  @Override
  public byte[] get(final byte[] key) {
    return view.get(key);
  }

  @Override
  public boolean remove(final byte[] key) {
    synchronized (appendLock) {
      if (view.get(key) == null)
        return false;
      append(OP_REMOVE, key, new byte[0]);
      return view.remove(key);
    }
  }

  @Override
  public Iterator<StoreEntry> range(final byte[] fromInclusive, final byte[] toExclusive) {
    return view.range(fromInclusive, toExclusive);
  }

  @Override
  public Iterator<StoreEntry> prefix(final byte[] prefix) {
    return view.prefix(prefix);
  }

  @Override
  public long size() {
    return view.size();
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  /**
   * Rewrites the log with one PUT record per live key, dropping the history of merges and removals. The new file replaces the old
   * one atomically.
   */
  public void compactLog() {
    synchronized (appendLock) {
      view.checkOpen();

      final File tmp = new File(file.getPath() + ".tmp");
      final long before = file.length();
      try {
        try (final FileChannel out = new RandomAccessFile(tmp, "rw").getChannel()) {
          out.truncate(0);
          writeFully(out, ByteBuffer.allocate(FILE_HEADER).putLong(0, MAGIC_NUMBER));
          for (final Iterator<StoreEntry> it = view.range(null, null); it.hasNext(); ) {
            final StoreEntry entry = it.next();
            writeFully(out, encode(OP_PUT, entry.key(), entry.value()));
          }
          out.force(true);
        }

        channel.close();
        Files.move(tmp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        channel = new RandomAccessFile(file, "rw").getChannel();
        channel.position(channel.size());

        LogManager.instance()
            .log(this, Level.INFO, "Compacted log '%s' from %d to %d bytes (keys=%d)", null, file.getName(), before, file.length(), view.size());
      } catch (IOException e) {
        throw new StorageException("Error on compacting log file '" + file + "'", e);
      }
    }
  }

  @Override
  public void close() {
    synchronized (appendLock) {
      if (!open)
        return;
      open = false;
      view.close();
      try {
        channel.force(true);
        channel.close();
      } catch (IOException e) {
        throw new StorageException("Error on closing log file '" + file + "'", e);
      }
    }
  }

  public long getBytesWritten() {
    return statsBytesWritten;
  }

  public long getRecordsWritten() {
    return statsRecordsWritten;
  }

  private void append(final byte op, final byte[] key, final byte[] value) {
    view.checkOpen();
    final ByteBuffer record = encode(op, key, value);
    long start = -1;
    try {
      start = channel.position();
      final int size = record.remaining();
      writeFully(channel, record);
      if (syncOnWrite)
        channel.force(false);

      statsBytesWritten += size;
      statsRecordsWritten++;
    } catch (IOException e) {
      final StorageException error = new StorageException("Error on appending to log file '" + file + "'", e);
      if (start >= 0)
        discardPartialAppend(start, error);
      throw error;
    }
  }

  /**
   * Cuts the log back to the end of the last complete record, so that a failed append leaves neither garbage in the middle of the
   * file nor a record the in-memory view does not have.
   */
  private void discardPartialAppend(final long start, final StorageException error) {
    try {
      channel.truncate(start);
      channel.position(start);
    } catch (IOException e) {
      error.addSuppressed(e);
      LogManager.instance().log(this, Level.SEVERE, "Cannot discard the partial record at position %d of log '%s'", e, start, file.getName());
    }
  }

  static ByteBuffer encode(final byte op, final byte[] key, final byte[] value) {
    final ByteBuffer buffer = ByteBuffer.allocate(RECORD_HEADER + key.length + value.length + RECORD_FOOTER);
    buffer.put(op);
    buffer.putInt(key.length);
    buffer.putInt(value.length);

    final CRC32 crc = new CRC32();
    crc.update(buffer.array(), 0, HEADER_CRC_POS);
    buffer.putInt((int) crc.getValue());

    buffer.put(key);
    buffer.put(value);

    crc.reset();
    crc.update(buffer.array(), 0, buffer.position());
    buffer.putInt((int) crc.getValue());

    buffer.flip();
    return buffer;
  }

  private void writeFileHeader() throws IOException {
    channel.truncate(0);
    writeFully(channel, ByteBuffer.allocate(FILE_HEADER).putLong(0, MAGIC_NUMBER));
    channel.force(true);
  }

  private void replay() throws IOException {
    final long fileSize = channel.size();
    if (fileSize < FILE_HEADER || readLong(0) != MAGIC_NUMBER)
      throw new StorageException(ErrorCode.CORRUPTION_DETECTED, "File '" + file + "' is not a valid region log");

    long pos = FILE_HEADER;
    long records = 0;
    final ByteBuffer header = ByteBuffer.allocate(RECORD_HEADER);

    while (pos < fileSize) {
      if (pos + RECORD_HEADER + RECORD_FOOTER > fileSize) {
        truncateTornTail(pos, fileSize);
        break;
      }

      header.clear();
      readFully(header, pos);
      header.flip();
      final byte op = header.get();
      final int keyLength = header.getInt();
      final int valueLength = header.getInt();
      final int storedHeaderCrc = header.getInt();

      final CRC32 headerCrc = new CRC32();
      headerCrc.update(header.array(), 0, HEADER_CRC_POS);
      if ((int) headerCrc.getValue() != storedHeaderCrc)
        throw corruption(pos, "header checksum mismatch");

      if (keyLength < 0 || valueLength < 0)
        throw corruption(pos, "negative length");

      final long recordSize = (long) RECORD_HEADER + keyLength + valueLength + RECORD_FOOTER;
      if (pos + recordSize > fileSize) {
        truncateTornTail(pos, fileSize);
        break;
      }

      final ByteBuffer record = ByteBuffer.allocate((int) recordSize);
      readFully(record, pos);
      final byte[] content = record.array();

      final CRC32 crc = new CRC32();
      crc.update(content, 0, content.length - RECORD_FOOTER);
      final int storedCrc = ByteBuffer.wrap(content, content.length - RECORD_FOOTER, RECORD_FOOTER).getInt();
      if ((int) crc.getValue() != storedCrc) {
        if (pos + recordSize == fileSize) {
          truncateTornTail(pos, fileSize);
          break;
        }
        throw corruption(pos, "checksum mismatch");
      }

      final byte[] key = new byte[keyLength];
      final byte[] value = new byte[valueLength];
      System.arraycopy(content, RECORD_HEADER, key, 0, keyLength);
      System.arraycopy(content, RECORD_HEADER + keyLength, value, 0, valueLength);

      switch (op) {
      case OP_PUT:
        view.put(key, value);
        break;
      case OP_MERGE:
        view.merge(key, value);
        break;
      case OP_REMOVE:
        view.remove(key);
        break;
      default:
        throw corruption(pos, "unknown operation " + op);
      }

      pos += recordSize;
      ++records;
    }

    channel.position(channel.size());

    LogManager.instance()
        .log(this, Level.FINE, "Replayed %d records from log '%s' (keys=%d)", null, records, file.getName(), view.size());
  }

  private void truncateTornTail(final long pos, final long fileSize) throws IOException {
    LogManager.instance()
        .log(this, Level.WARNING, "Discarding %d bytes of truncated record at the end of log '%s' (position=%d)", null, fileSize - pos, file.getName(),
            pos);
    channel.truncate(pos);
    channel.force(true);
  }

  /**
   * Replaces the channel the log is appended to, closing the previous one. Used by tests to inject I/O failures.
   */
  void replaceChannel(final FileChannel channel) throws IOException {
    synchronized (appendLock) {
      final FileChannel previous = this.channel;
      this.channel = channel;
      previous.close();
    }
  }

  private StorageException corruption(final long pos, final String reason) {
    return (StorageException) new StorageException(ErrorCode.CORRUPTION_DETECTED,
        "Corrupted record in log '" + file + "' at position " + pos + ": " + reason).addContext("file", file.getPath())
        .addContext("position", pos);
  }

  private long readLong(final long pos) throws IOException {
    final ByteBuffer buffer = ByteBuffer.allocate(8);
    readFully(buffer, pos);
    return buffer.getLong(0);
  }

  private void readFully(final ByteBuffer buffer, long pos) throws IOException {
    while (buffer.hasRemaining()) {
      final int read = channel.read(buffer, pos);
      if (read < 0)
        throw new StorageException(ErrorCode.IO_ERROR, "Unexpected end of log file '" + file + "' at position " + pos);
      pos += read;
    }
  }

  private static void writeFully(final FileChannel channel, final ByteBuffer buffer) throws IOException {
    while (buffer.hasRemaining())
      channel.write(buffer);
  }

  private void closeChannelQuietly() {
    if (channel != null)
      try {
        channel.close();
      } catch (IOException e) {
        LogManager.instance().log(this, Level.WARNING, "Error on closing log file '%s' after a failed open", e, file);
      }
  }

  @Override
  public String toString() {
    return file.getName();
  }
}
