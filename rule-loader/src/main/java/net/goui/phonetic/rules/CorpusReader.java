/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.rules;

import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.util.List;
import net.goui.phonetic.Language;
import net.goui.phonetic.LanguageGuesser;
import net.goui.phonetic.NameType;
import net.goui.phonetic.Rule;
import net.goui.phonetic.RuleCorpus;
import net.goui.phonetic.RuleTable;
import net.goui.phonetic.RuleType;

/**
 * Reads the complete rule corpus for a name type from a {@link RuleSource}.
 *
 * <p>For a name type with id {@code <nt>}, the following files are read:
 *
 * <ul>
 *   <li>{@code <nt>_languages}: the supported languages, one per line.
 *   <li>{@code <nt>_lang}: the language guessing rules.
 *   <li>{@code <nt>_rules_any} and {@code <nt>_rules_<lang>} for each supported language.
 *   <li>{@code <nt>_approx_common} and {@code <nt>_exact_common}: the final rules.
 * </ul>
 */
public final class CorpusReader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The name of the language-agnostic final tables. */
  static final String COMMON_TABLE = "common";

  public static CorpusReader of(RuleSource source) {
    return new CorpusReader(source);
  }

  private final RuleSource source;

  private CorpusReader(RuleSource source) {
    this.source = source;
  }

  /**
   * Reads and validates the corpus for a name type.
   *
   * @throws IOException if any rule file is missing or cannot be read.
   * @throws IllegalArgumentException if any rule file is malformed, or the corpus is invalid.
   */
  public RuleCorpus read(NameType nameType) throws IOException {
    logger.atInfo().log("loading '%s' rule corpus from %s", nameType.id(), source);
    // A new parser per corpus means rule indices are unique within the corpus.
    RuleFileParser parser = new RuleFileParser(source);
    ImmutableSet<Language> languages = parser.parseLanguages(nameType.getLanguagesFileName());

    RuleCorpus.Builder corpus = RuleCorpus.builder(nameType);
    String guesserFile = nameType.getLanguageRulesFileName();
    corpus.setGuesser(
        LanguageGuesser.of(table(guesserFile, parser.parseLanguageRules(guesserFile))));
    corpus.putRules(Language.ANY, readTable(parser, nameType, RuleType.RULES, Language.ANY.id()));
    for (Language language : languages) {
      corpus.putRules(language, readTable(parser, nameType, RuleType.RULES, language.id()));
    }
    for (RuleType ruleType : RuleType.values()) {
      if (ruleType.isFinal()) {
        corpus.putFinalRules(ruleType, readTable(parser, nameType, ruleType, COMMON_TABLE));
      }
    }
    return corpus.build();
  }

  private static RuleTable readTable(
      RuleFileParser parser, NameType nameType, RuleType ruleType, String tableName)
      throws IOException {
    String fileName = nameType.getRulesFileName(ruleType, tableName);
    return table(fileName, parser.parseRules(fileName));
  }

  private static RuleTable table(String name, List<Rule> rules) {
    RuleTable table = RuleTable.of(name, rules);
    logger.atFine().log("read %d rule(s) from '%s'", table.size(), name);
    return table;
  }
}
