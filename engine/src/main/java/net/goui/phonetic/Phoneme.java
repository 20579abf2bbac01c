/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * A candidate pronunciation fragment, tagged with the languages for which it is valid.
 *
 * <p>Phonemes are ordered by their text alone (code unit by code unit, then by length), so the
 * ordering is not consistent with {@code equals()} for phonemes of different languages.
 */
@AutoValue
public abstract class Phoneme implements Comparable<Phoneme> {
  private static final Phoneme EMPTY_ANY = of("", LanguageSet.any());

  public static Phoneme of(String text, LanguageSet languages) {
    return new AutoValue_Phoneme(text, languages);
  }

  /** Returns a phoneme with the given text which is valid for any language. */
  public static Phoneme of(String text) {
    return text.isEmpty() ? EMPTY_ANY : of(text, LanguageSet.any());
  }

  /** Returns an empty phoneme for the given languages (the start of an encoding). */
  public static Phoneme empty(LanguageSet languages) {
    return languages.isAny() ? EMPTY_ANY : of("", languages);
  }

  public abstract String text();

  public abstract LanguageSet languages();

  /**
   * Joins this phoneme with a following one, keeping only the languages common to both. Returns
   * empty if the phonemes have no language in common.
   */
  Optional<Phoneme> join(Phoneme next) {
    return languages().restrictTo(next.languages()).map(langs -> of(text() + next.text(), langs));
  }

  /** Joins this phoneme with a following one, accepting the languages of either. */
  Phoneme joinUnfiltered(Phoneme next) {
    return of(text() + next.text(), languages().merge(next.languages()));
  }

  /** Returns a phoneme with the same text which is valid for the languages of both phonemes. */
  Phoneme mergeLanguages(LanguageSet other) {
    LanguageSet merged = languages().merge(other);
    return merged.equals(languages()) ? this : of(text(), merged);
  }

  @Override
  public int compareTo(Phoneme other) {
    String lhs = text();
    String rhs = other.text();
    int length = Math.min(lhs.length(), rhs.length());
    for (int n = 0; n < length; n++) {
      int c = Character.compare(lhs.charAt(n), rhs.charAt(n));
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(lhs.length(), rhs.length());
  }

  @Override
  public final String toString() {
    return text() + "[" + languages() + "]";
  }
}
