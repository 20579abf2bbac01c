/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.corpus;

import static com.google.common.base.Preconditions.checkState;

import net.goui.phonetic.NameType;
import net.goui.phonetic.RuleCorpus;
import org.checkerframework.checker.nullness.qual.Nullable;

/** The outcome of asking one service for its corpus; either the loaded corpus or the failure. */
final class LoadResult {

  static LoadResult loaded(RuleCorpusService service, RuleCorpus corpus) {
    return new LoadResult(service, corpus, null);
  }

  static LoadResult failed(RuleCorpusService service, Throwable error) {
    return new LoadResult(service, null, error);
  }

  private final String serviceName;
  private final NameType nameType;
  @Nullable private final RuleCorpus corpus;
  @Nullable private final Throwable error;

  private LoadResult(
      RuleCorpusService service, @Nullable RuleCorpus corpus, @Nullable Throwable error) {
    this.serviceName = service.getClass().getName();
    this.nameType = service.getNameType();
    this.corpus = corpus;
    this.error = error;
  }

  NameType nameType() {
    return nameType;
  }

  boolean isLoaded() {
    return corpus != null;
  }

  RuleCorpus corpus() {
    checkState(corpus != null, "no '%s' corpus was loaded by %s", nameType.id(), serviceName);
    return corpus;
  }

  Throwable error() {
    checkState(error != null, "'%s' corpus was loaded by %s", nameType.id(), serviceName);
    return error;
  }

  @Override
  public String toString() {
    return isLoaded()
        ? String.format("LoadResult{%s from %s}", nameType.id(), serviceName)
        : String.format(
            "LoadResult{%s from %s, error='%s'}", nameType.id(), serviceName, error.getMessage());
  }
}
