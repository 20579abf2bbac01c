/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Optional;

/**
 * An immutable set of languages for which a phonetic encoding is considered valid.
 *
 * <p>A language set is either the unrestricted set ({@link #any()}) or a non-empty set of concrete
 * languages. An empty set is never created; operations which could produce one (such as {@link
 * #restrictTo(LanguageSet)}) return {@link Optional#empty()} instead, since an empty intersection
 * means that no language can explain the text.
 */
public final class LanguageSet {
  private static final LanguageSet ANY_LANGUAGE = new LanguageSet(ImmutableSet.of());
  private static final Joiner JOINER = Joiner.on('+');
  private static final Splitter SPLITTER = Splitter.on('+').trimResults();

  /** Returns the unrestricted language set. */
  public static LanguageSet any() {
    return ANY_LANGUAGE;
  }

  /** Returns a set of the given languages, or {@link #any()} if {@link Language#ANY} is present. */
  public static LanguageSet of(Language first, Language... rest) {
    return copyOf(Sets.immutableEnumSet(first, rest));
  }

  /**
   * Returns a set of the given languages, or {@link #any()} if {@link Language#ANY} is present.
   *
   * @throws IllegalArgumentException if {@code languages} is empty.
   */
  public static LanguageSet copyOf(Iterable<Language> languages) {
    ImmutableSet<Language> set = Sets.immutableEnumSet(languages);
    checkArgument(!set.isEmpty(), "language sets must not be empty");
    return set.contains(Language.ANY) ? ANY_LANGUAGE : new LanguageSet(set);
  }

  /** Parses a language set of the form {@code "english+german"} (or {@code "any"}). */
  public static LanguageSet parse(String languages) {
    return copyOf(
        SPLITTER.splitToStream(languages).map(Language::of).collect(toImmutableList()));
  }

  // Empty only for ANY_LANGUAGE.
  private final ImmutableSet<Language> languages;

  private LanguageSet(ImmutableSet<Language> languages) {
    this.languages = languages;
  }

  /** Whether this is the unrestricted language set. */
  public boolean isAny() {
    return languages.isEmpty();
  }

  /** Whether this set permits the given language ({@link #any()} permits everything). */
  public boolean contains(Language language) {
    return isAny() || languages.contains(language);
  }

  /**
   * Returns the concrete languages of this set, in enum order.
   *
   * @throws IllegalStateException if this is the unrestricted set.
   */
  public ImmutableSet<Language> languages() {
    checkState(!isAny(), "cannot enumerate the unrestricted language set");
    return languages;
  }

  /**
   * Returns the intersection of this set with {@code other}, or empty if the sets are disjoint.
   * The unrestricted set is the identity for this operation.
   */
  public Optional<LanguageSet> restrictTo(LanguageSet other) {
    if (other.isAny()) {
      return Optional.of(this);
    }
    if (isAny()) {
      return Optional.of(other);
    }
    Sets.SetView<Language> common = Sets.intersection(languages, other.languages);
    return common.isEmpty()
        ? Optional.empty()
        : Optional.of(new LanguageSet(Sets.immutableEnumSet(common)));
  }

  /** Whether this set shares at least one language with {@code other}. */
  public boolean intersects(LanguageSet other) {
    return isAny() || other.isAny() || !Sets.intersection(languages, other.languages).isEmpty();
  }

  /** Returns the union of this set with {@code other}. The unrestricted set absorbs everything. */
  public LanguageSet merge(LanguageSet other) {
    if (isAny() || other.isAny()) {
      return ANY_LANGUAGE;
    }
    return other.languages.containsAll(languages)
        ? other
        : new LanguageSet(Sets.immutableEnumSet(Sets.union(languages, other.languages)));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof LanguageSet && languages.equals(((LanguageSet) obj).languages);
  }

  @Override
  public int hashCode() {
    return languages.hashCode();
  }

  @Override
  public String toString() {
    return isAny() ? Language.ANY.id() : JOINER.join(languages);
  }
}
