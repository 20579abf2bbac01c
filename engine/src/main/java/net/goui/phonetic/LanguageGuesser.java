/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import java.util.EnumSet;
import java.util.Optional;

/**
 * Narrows the set of languages to which a word might belong.
 *
 * <p>The guesser walks a word from left to right using the same longest-match semantics as a
 * {@link RuleTable}, but its rules produce no phonemes. Instead, each matched rule votes for the
 * languages it is tagged with (rules tagged "any" are not evidence of anything and do not vote).
 * Positions where no rule matches are skipped.
 *
 * <p>Every language with at least one vote is kept, since the guesser narrows the set of
 * languages and does not pick a winner. If no language received a vote, the word is
 * unrestricted.
 */
public final class LanguageGuesser {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Returns a guesser based on the given table of language rules. */
  public static LanguageGuesser of(RuleTable rules) {
    return new LanguageGuesser(rules);
  }

  private final RuleTable rules;

  private LanguageGuesser(RuleTable rules) {
    this.rules = rules;
  }

  /** Returns the rule table used by this guesser. */
  public RuleTable getRules() {
    return rules;
  }

  /** Returns the languages voted for by at least one rule of this guesser. */
  public ImmutableSet<Language> getVotingLanguages() {
    EnumSet<Language> languages = EnumSet.noneOf(Language.class);
    for (char c : rules.getLeadingCharacters()) {
      rules.getRules(c).stream()
          .map(Rule::languages)
          .filter(l -> !l.isAny())
          .forEach(l -> languages.addAll(l.languages()));
    }
    return Sets.immutableEnumSet(languages);
  }

  /** Returns the set of plausible languages for a (normalized) word. */
  public LanguageSet guess(String word) {
    Multiset<Language> votes = countVotes(word);
    LanguageSet guess =
        votes.isEmpty() ? LanguageSet.any() : LanguageSet.copyOf(votes.elementSet());
    logger.atFinest().log("guessed '%s' as %s (votes: %s)", word, guess, votes);
    return guess;
  }

  /**
   * Returns the plausible languages for a word, restricted to the given languages. If the guess
   * and the restriction have nothing in common, the result is unrestricted.
   */
  public LanguageSet guess(String word, LanguageSet restriction) {
    Optional<LanguageSet> restricted = guess(word).restrictTo(restriction);
    return restricted.orElse(LanguageSet.any());
  }

  /** Returns the number of votes for each language in a word (languages without votes absent). */
  public ImmutableMultiset<Language> countVotes(String word) {
    ImmutableMultiset.Builder<Language> votes = ImmutableMultiset.builder();
    int position = 0;
    while (position < word.length()) {
      Optional<Rule> rule = rules.match(word, position);
      if (rule.isPresent()) {
        LanguageSet languages = rule.get().languages();
        if (!languages.isAny()) {
          votes.addAll(languages.languages());
        }
        position += rule.get().pattern().length();
      } else {
        position++;
      }
    }
    return votes.build();
  }
}
