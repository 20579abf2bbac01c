/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.function.Function;

/**
 * The closed set of languages known to rule corpora.
 *
 * <p>{@link #ANY} is a sentinel rather than a language. It names the language-agnostic rule table
 * and, in rule files, tags phonemes which are valid for every language. A {@link LanguageSet}
 * containing {@code ANY} is the unrestricted set.
 */
public enum Language {
  ANY,
  ARABIC,
  CYRILLIC,
  CZECH,
  DUTCH,
  ENGLISH,
  FRENCH,
  GERMAN,
  GREEK,
  GREEKLATIN,
  HEBREW,
  HUNGARIAN,
  ITALIAN,
  POLISH,
  PORTUGUESE,
  ROMANIAN,
  RUSSIAN,
  SPANISH,
  TURKISH;

  private static final ImmutableMap<String, Language> ID_MAP =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(Language::id, Function.identity()));

  /** Returns the language for a lower-case identifier (e.g. "english"), as used in rule files. */
  public static Language of(String id) {
    Language language = ID_MAP.get(id);
    checkArgument(language != null, "unknown language identifier: '%s'", id);
    return language;
  }

  /** Returns the lower-case identifier of this language (e.g. "english"). */
  public String id() {
    return Ascii.toLowerCase(name());
  }

  @Override
  public String toString() {
    return id();
  }
}
