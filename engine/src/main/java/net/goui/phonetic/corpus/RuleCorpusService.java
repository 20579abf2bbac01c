/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.corpus;

import net.goui.phonetic.NameType;
import net.goui.phonetic.RuleCorpus;

/**
 * A provider of a rule corpus, discovered via {@link java.util.ServiceLoader}.
 *
 * <p>Implementations are expected to be cheap to construct and should defer loading of rule data
 * until {@link #load()} is invoked.
 */
public abstract class RuleCorpusService {
  private final NameType nameType;

  protected RuleCorpusService(NameType nameType) {
    this.nameType = nameType;
  }

  /** Returns the name type of the corpus provided by this service. */
  public final NameType getNameType() {
    return nameType;
  }

  final LoadResult loadChecked() {
    RuleCorpus corpus;
    try {
      corpus = load();
    } catch (Exception e) {
      return LoadResult.failed(this, e);
    }
    if (corpus.nameType() == nameType) {
      return LoadResult.loaded(this, corpus);
    } else {
      return LoadResult.failed(
          this,
          new IllegalStateException(
              String.format(
                  "Loaded corpus name type '%s' does not match stated name type '%s'.",
                  corpus.nameType().id(), nameType.id())));
    }
  }

  /** A subclass should defer loading of rule data until this method is invoked. */
  protected abstract RuleCorpus load() throws Exception;
}
