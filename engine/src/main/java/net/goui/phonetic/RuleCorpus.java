/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The complete set of rule tables for one name type.
 *
 * <p>A corpus holds a "rules" table for each of its languages (plus the language-agnostic table
 * for {@link Language#ANY}), the final "approx" and "exact" tables applied to the intermediate
 * phonemes, and the language guesser. Corpora are validated when built and are immutable.
 */
@AutoValue
public abstract class RuleCorpus {

  public static Builder builder(NameType nameType) {
    String guesserName = nameType.getLanguageRulesFileName();
    return new AutoValue_RuleCorpus.Builder()
        .setNameType(nameType)
        .setGuesser(LanguageGuesser.of(RuleTable.of(guesserName, ImmutableList.of())));
  }

  public abstract NameType nameType();

  /** The concrete languages supported by this corpus (excluding {@link Language#ANY}). */
  public abstract ImmutableSet<Language> languages();

  abstract ImmutableMap<Language, RuleTable> languageRules();

  abstract ImmutableMap<RuleType, RuleTable> finalRules();

  public abstract LanguageGuesser guesser();

  /**
   * Returns the "rules" table for a language of this corpus, or the language-agnostic table for
   * {@link Language#ANY}.
   */
  public RuleTable getRules(Language language) {
    RuleTable table = languageRules().get(language);
    checkArgument(table != null, "language '%s' is not supported by: %s", language, this);
    return table;
  }

  /** Whether this corpus has a final table for the given precision. */
  public boolean hasFinalRules(RuleType ruleType) {
    return finalRules().containsKey(ruleType);
  }

  /** Returns the final (language-agnostic) table for the given precision. */
  public RuleTable getFinalRules(RuleType ruleType) {
    RuleTable table = finalRules().get(ruleType);
    checkArgument(table != null, "no final '%s' rules in: %s", ruleType.id(), this);
    return table;
  }

  @Override
  public final String toString() {
    return String.format("RuleCorpus{%s, languages=%s}", nameType().id(), languages());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setNameType(NameType nameType);

    abstract NameType nameType();

    abstract ImmutableSet.Builder<Language> languagesBuilder();

    abstract ImmutableMap.Builder<Language, RuleTable> languageRulesBuilder();

    abstract ImmutableMap.Builder<RuleType, RuleTable> finalRulesBuilder();

    public abstract Builder setGuesser(LanguageGuesser guesser);

    /** Adds the "rules" table for a language (or {@link Language#ANY}). */
    @CanIgnoreReturnValue
    public Builder putRules(Language language, RuleTable table) {
      if (language != Language.ANY) {
        languagesBuilder().add(language);
      }
      languageRulesBuilder().put(language, table);
      return this;
    }

    /** Adds the final table for a precision mode ("approx" or "exact"). */
    @CanIgnoreReturnValue
    public Builder putFinalRules(RuleType ruleType, RuleTable table) {
      checkArgument(ruleType.isFinal(), "not a final rule type: %s", ruleType);
      finalRulesBuilder().put(ruleType, table);
      return this;
    }

    abstract RuleCorpus autoBuild();

    /**
     * Builds the corpus.
     *
     * @throws IllegalArgumentException if a table was added twice, the language-agnostic table or
     *     all final tables are missing, or the guesser votes for unsupported languages.
     */
    public RuleCorpus build() {
      RuleCorpus corpus = autoBuild();
      checkArgument(
          corpus.languageRules().containsKey(Language.ANY),
          "missing language-agnostic rules for: %s",
          nameType().id());
      checkArgument(
          !corpus.finalRules().isEmpty(), "missing final rules for: %s", nameType().id());
      Sets.SetView<Language> unsupported =
          Sets.difference(corpus.guesser().getVotingLanguages(), corpus.languages());
      checkArgument(
          unsupported.isEmpty(),
          "language guessing rules for '%s' refer to unsupported languages: %s",
          nameType().id(),
          unsupported);
      return corpus;
    }
  }
}
