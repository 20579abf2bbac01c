/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Optional;

/**
 * An immutable, ordered collection of rules, indexed by the leading character of their patterns.
 *
 * <p>Lookup via {@link #match(CharSequence, int)} returns the applicable rule with the longest
 * pattern at a position, preferring the earliest declared rule if several patterns of the same
 * length apply. Only the rules whose pattern starts with the character at the position are
 * considered, so lookup does not scan the whole table.
 *
 * <p>Instances are created once per corpus and are safe to share between threads.
 */
public final class RuleTable {

  /**
   * Returns a table of the given rules, which must be in declaration order (i.e. their indices
   * must be strictly increasing).
   *
   * @param name a descriptive name for the table, used in error messages (e.g. "gen_rules_any").
   */
  public static RuleTable of(String name, List<Rule> rules) {
    ImmutableListMultimap.Builder<Character, Rule> index = ImmutableListMultimap.builder();
    int lastIndex = -1;
    for (Rule rule : rules) {
      checkArgument(
          rule.index() > lastIndex,
          "rules must be in declaration order in table '%s': %s",
          name,
          rule);
      lastIndex = rule.index();
      index.put(rule.pattern().charAt(0), rule.validate());
    }
    return new RuleTable(name, index.build(), rules.size());
  }

  private final String name;
  private final ImmutableListMultimap<Character, Rule> rulesByFirstChar;
  private final int size;

  private RuleTable(String name, ImmutableListMultimap<Character, Rule> rules, int size) {
    this.name = name;
    this.rulesByFirstChar = rules;
    this.size = size;
  }

  /** Returns the descriptive name of this table. */
  public String getName() {
    return name;
  }

  /** Returns the number of rules in this table. */
  public int size() {
    return size;
  }

  /** Returns the set of characters with which at least one rule pattern starts. */
  public ImmutableSet<Character> getLeadingCharacters() {
    return rulesByFirstChar.keySet();
  }

  /** Returns the rules whose patterns start with the given character, in declaration order. */
  public ImmutableList<Rule> getRules(char leadingChar) {
    return rulesByFirstChar.get(leadingChar);
  }

  /** Returns the best rule which applies at the given position of the text, for any language. */
  public Optional<Rule> match(CharSequence text, int position) {
    return match(text, position, LanguageSet.any());
  }

  /**
   * Returns the best rule which applies at the given position of the text, considering only rules
   * valid for at least one of the given languages. The best rule is the applicable rule with the
   * longest pattern, or the first declared of them if there is more than one.
   */
  public Optional<Rule> match(CharSequence text, int position, LanguageSet languages) {
    checkElementIndex(position, text.length());
    Rule best = null;
    // Candidates are in declaration order, so replacing only on a strictly longer pattern keeps
    // the first declared rule of any given length.
    for (Rule rule : rulesByFirstChar.get(text.charAt(position))) {
      if ((best == null || rule.pattern().length() > best.pattern().length())
          && rule.languages().intersects(languages)
          && rule.matches(text, position)) {
        best = rule;
      }
    }
    return Optional.ofNullable(best);
  }

  @Override
  public String toString() {
    return String.format("RuleTable{name=%s, size=%d}", name, size);
  }
}
