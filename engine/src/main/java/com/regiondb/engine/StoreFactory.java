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

import com.regiondb.ContextConfiguration;
import com.regiondb.GlobalConfiguration;
import com.regiondb.exception.StorageException;
import com.regiondb.log.LogManager;

import java.io.File;
import java.util.logging.Level;

/**
 * Opens the named trees of one database according to the configured {@link StorageMode}. In {@link StorageMode#LOG} mode every tree
 * is a separate log file in the database directory.
 */
public class StoreFactory {
  private final StorageMode mode;
  private final File        directory;
  private final boolean     syncOnWrite;

  public StoreFactory(final ContextConfiguration configuration) {
    this.mode = configuration.getValueAsEnum(GlobalConfiguration.STORAGE_MODE, StorageMode.class);
    this.directory = new File(configuration.getValueAsString(GlobalConfiguration.DATABASE_DIRECTORY));
    this.syncOnWrite = configuration.getValueAsBoolean(GlobalConfiguration.LOG_SYNC_ON_WRITE);

    if (mode == StorageMode.LOG && !directory.exists() && !directory.mkdirs())
      throw new StorageException("Cannot create database directory '" + directory + "'");
  }

  public OrderedStore open(final String name, final MergeOperator mergeOperator) {
    final OrderedStore store;
    if (mode == StorageMode.LOG)
      store = new AppendLogStore(new File(directory, name + "." + AppendLogStore.FILE_EXTENSION), name, mergeOperator, syncOnWrite);
    else
      store = new MemoryOrderedStore(name, mergeOperator);

    LogManager.instance().log(this, Level.FINE, "Opened tree '%s' (mode=%s entries=%d)", null, name, mode, store.size());
    return store;
  }

  public StorageMode getMode() {
    return mode;
  }

  public File getDirectory() {
    return directory;
  }
}
