/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.rules;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.CharStreams;
import com.google.common.io.MoreFiles;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves rule file names (e.g. "gen_rules_any") to their text.
 *
 * <p>Rule files are UTF-8 text files with a ".txt" extension, held either as class resources or
 * in a directory on the file system.
 */
public abstract class RuleSource {
  static final String EXTENSION = ".txt";

  /** The resource path under which the bundled rule files are held. */
  public static final String BUNDLED_RESOURCE_ROOT = "/net/goui/phonetic/rules/";

  /** Returns a source for the rule files bundled with this library. */
  public static RuleSource bundled() {
    return fromResources(RuleSource.class, BUNDLED_RESOURCE_ROOT);
  }

  /** Returns a source for rule files held as resources of a class, under the given root path. */
  public static RuleSource fromResources(Class<?> anchor, String root) {
    return new RuleSource() {
      @Override
      public String read(String fileName) throws IOException {
        String path = root + fileName + EXTENSION;
        try (InputStream is = anchor.getResourceAsStream(path)) {
          if (is == null) {
            throw new FileNotFoundException("cannot find rule resource: " + path);
          }
          try (Reader reader = new InputStreamReader(is, UTF_8)) {
            return CharStreams.toString(reader);
          }
        }
      }

      @Override
      public String toString() {
        return "resources:" + root;
      }
    };
  }

  /** Returns a source for rule files held in a directory. */
  public static RuleSource fromDirectory(Path directory) {
    return new RuleSource() {
      @Override
      public String read(String fileName) throws IOException {
        Path path = directory.resolve(fileName + EXTENSION);
        if (!Files.isRegularFile(path)) {
          throw new FileNotFoundException("cannot find rule file: " + path);
        }
        return MoreFiles.asCharSource(path, UTF_8).read();
      }

      @Override
      public String toString() {
        return "directory:" + directory;
      }
    };
  }

  /**
   * Returns the text of the named rule file.
   *
   * @throws java.io.FileNotFoundException if no such file exists.
   */
  public abstract String read(String fileName) throws IOException;
}
