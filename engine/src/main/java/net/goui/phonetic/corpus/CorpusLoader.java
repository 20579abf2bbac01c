/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.corpus;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.flogger.FluentLogger;
import java.util.ServiceLoader;
import java.util.function.Predicate;
import net.goui.phonetic.EncoderOptions;
import net.goui.phonetic.NameType;
import net.goui.phonetic.PhoneticEngine;
import net.goui.phonetic.RuleCorpus;

/** Loads rule corpora from the {@link RuleCorpusService} implementations on the class path. */
public final class CorpusLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * Loads the corpora of all services whose name type matches the given predicate.
   *
   * @throws IllegalStateException if any matched service fails to load (individual failures are
   *     attached as suppressed exceptions).
   */
  public static ImmutableList<RuleCorpus> loadMatching(Predicate<NameType> predicate) {
    return loadMatching(ServiceLoader.load(RuleCorpusService.class), predicate);
  }

  static ImmutableList<RuleCorpus> loadMatching(
      Iterable<RuleCorpusService> services, Predicate<NameType> predicate) {
    ImmutableList<LoadResult> loaded =
        ImmutableList.copyOf(services).stream()
            .filter(s -> predicate.test(s.getNameType()))
            .parallel()
            .map(RuleCorpusService::loadChecked)
            .collect(toImmutableList());

    if (!loaded.stream().allMatch(LoadResult::isLoaded)) {
      IllegalStateException e = new IllegalStateException("Error(s) loading rule corpora.");
      loaded.stream()
          .filter(r -> !r.isLoaded())
          .map(LoadResult::error)
          .forEach(e::addSuppressed);
      throw e;
    }
    return loaded.stream().map(LoadResult::corpus).collect(toImmutableList());
  }

  /**
   * Loads the corpus for a name type.
   *
   * @throws IllegalStateException if no service, or more than one, provides the name type.
   */
  public static RuleCorpus load(NameType nameType) {
    ImmutableList<RuleCorpus> corpora = loadMatching(nameType::equals);
    if (corpora.size() != 1) {
      throw new IllegalStateException(
          String.format(
              "expected exactly one rule corpus for name type '%s', but found %d",
              nameType.id(), corpora.size()));
    }
    RuleCorpus corpus = Iterables.getOnlyElement(corpora);
    logger.atFine().log("loaded rule corpus: %s", corpus);
    return corpus;
  }

  /** Creates an engine with the given options, using the corpus of its name type. */
  public static PhoneticEngine createEngine(EncoderOptions options) {
    return PhoneticEngine.create(load(options.nameType()), options);
  }

  private CorpusLoader() {}
}
