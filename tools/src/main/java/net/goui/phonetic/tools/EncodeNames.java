/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.tools;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.google.common.flogger.FluentLogger;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import net.goui.phonetic.EncoderOptions;
import net.goui.phonetic.LanguageSet;
import net.goui.phonetic.NameType;
import net.goui.phonetic.PhonemeExpr;
import net.goui.phonetic.PhoneticEngine;
import net.goui.phonetic.RuleCorpus;
import net.goui.phonetic.RuleType;
import net.goui.phonetic.UncoveredInputException;
import net.goui.phonetic.corpus.CorpusLoader;
import net.goui.phonetic.rules.CorpusReader;
import net.goui.phonetic.rules.RuleSource;

/**
 * Encodes names given on the command line (or one per line from standard input) and writes each
 * name and its encoding, separated by a tab, to standard output.
 *
 * <pre>{@code
 * EncodeNames --name_type ash --rule_type exact "Moskowitz" "Rozenberg"
 * }</pre>
 *
 * By default the rule corpus bundled with the library is used, but a directory of rule files can
 * be given with {@code --rules_dir} to try out modified rules.
 */
public class EncodeNames {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final class Flags {
    @Parameter(names = "--name_type", description = "Name type of the rules (gen, ash or sep)")
    private String nameType = NameType.GENERIC.id();

    @Parameter(names = "--rule_type", description = "Precision of the encoding (approx or exact)")
    private String ruleType = RuleType.APPROX.id();

    @Parameter(
        names = "--languages",
        description = "Languages to restrict encoding to (e.g. 'german+polish', default any)")
    private String languages = "any";

    @Parameter(names = "--max_phonemes", description = "Maximum alternative encodings per word")
    private int maxPhonemes = EncoderOptions.DEFAULT_MAX_PHONEMES;

    @Parameter(names = "--separator", description = "Separator for the encodings of words")
    private String separator = EncoderOptions.DEFAULT_WORD_SEPARATOR;

    @Parameter(names = "--rules_dir", description = "Directory of rule files (optional)")
    private String rulesDir = "";

    @Parameter(
        names = "--alternatives",
        description = "Output the alternatives of each word with their languages")
    private boolean alternatives = false;

    @Parameter(names = "--log_level", description = "JDK log level name")
    private String logLevel = "INFO";

    @Parameter(description = "Names to encode (read from standard input if none are given)")
    private List<String> names = new ArrayList<>();
  }

  private static void setLogging(String levelName) {
    Level level = Level.parse(levelName);
    Arrays.stream(Logger.getLogger("").getHandlers()).forEach(h -> h.setLevel(level));
    Logger.getLogger("net.goui.phonetic").setLevel(level);
  }

  public static void main(String[] args) throws IOException {
    int failures =
        run(
            args,
            new InputStreamReader(System.in, UTF_8),
            new PrintWriter(System.out, true, UTF_8));
    if (failures > 0) {
      System.exit(1);
    }
  }

  /** Encodes the names given by the flags, returning the number of names which failed. */
  static int run(String[] args, Reader in, Writer out) throws IOException {
    Flags flags = new Flags();
    JCommander.newBuilder().addObject(flags).build().parse(args);
    setLogging(flags.logLevel);

    NameType nameType = NameType.of(flags.nameType);
    EncoderOptions options =
        EncoderOptions.builder(nameType)
            .setRuleType(RuleType.of(flags.ruleType))
            .setLanguages(LanguageSet.parse(flags.languages))
            .setMaxPhonemes(flags.maxPhonemes)
            .setWordSeparator(flags.separator)
            .build();
    PhoneticEngine engine = PhoneticEngine.create(loadCorpus(nameType, flags.rulesDir), options);

    List<String> names = flags.names;
    if (names.isEmpty()) {
      BufferedReader reader = new BufferedReader(in);
      names = reader.lines().filter(s -> !s.trim().isEmpty()).collect(Collectors.toList());
    }
    PrintWriter writer = new PrintWriter(out);
    int failures = 0;
    for (String name : names) {
      try {
        writer.println(name + "\t" + encode(engine, name, flags.alternatives));
      } catch (UncoveredInputException e) {
        logger.atWarning().withCause(e).log("cannot encode name: %s", name);
        failures++;
      }
    }
    writer.flush();
    return failures;
  }

  private static RuleCorpus loadCorpus(NameType nameType, String rulesDir) throws IOException {
    if (rulesDir.isEmpty()) {
      return CorpusLoader.load(nameType);
    }
    return CorpusReader.of(RuleSource.fromDirectory(Paths.get(rulesDir))).read(nameType);
  }

  private static String encode(PhoneticEngine engine, String name, boolean alternatives) {
    if (!alternatives) {
      return engine.encode(name);
    }
    return engine.encodeToPhonemes(name).stream()
        .map(PhonemeExpr::toString)
        .collect(Collectors.joining(engine.getOptions().wordSeparator()));
  }
}
