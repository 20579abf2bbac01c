/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An ordered set of alternative phonemes, representing the possible encodings of some text.
 *
 * <p>A phoneme expression is either a {@link Single single} phoneme or an {@link Alternation} of
 * two or more phonemes. The common unambiguous case is handled without allocating lists, and all
 * operations accept either form.
 *
 * <p>No expression contains two alternatives with identical text and overlapping language sets;
 * such alternatives are merged when the expression is created, by taking the union of their
 * languages. Alternatives with identical text but disjoint languages are kept apart until {@link
 * #dedupe()} is called.
 *
 * <p>Instances are immutable and the operations defined here have no side effects. Concatenation
 * is associative and preserves the order in which alternatives were generated, so results do not
 * depend on how a sequence of concatenations is grouped.
 */
public abstract class PhonemeExpr {

  /** Returns an expression for a single phoneme. */
  public static PhonemeExpr of(Phoneme phoneme) {
    return new Single(phoneme);
  }

  /** Returns an expression for the given alternatives, in order. */
  public static PhonemeExpr of(Phoneme first, Phoneme... rest) {
    List<Phoneme> alternatives = new ArrayList<>(rest.length + 1);
    alternatives.add(first);
    alternatives.addAll(Arrays.asList(rest));
    return copyOf(alternatives);
  }

  /**
   * Returns an expression for the given alternatives, in order, merging alternatives with the
   * same text and overlapping languages.
   *
   * @throws IllegalArgumentException if there are no alternatives.
   */
  public static PhonemeExpr copyOf(Iterable<Phoneme> alternatives) {
    Builder builder = new Builder();
    alternatives.forEach(builder::add);
    return builder.build();
  }

  /** Returns the empty expression which starts an encoding for the given languages. */
  public static PhonemeExpr empty(LanguageSet languages) {
    return new Single(Phoneme.empty(languages));
  }

  // Only subclassed here.
  private PhonemeExpr() {}

  /** Returns the alternatives of this expression, in order (never empty). */
  public abstract ImmutableList<Phoneme> phonemes();

  /** Returns the number of alternatives in this expression. */
  public abstract int size();

  /** Whether this expression has more than one alternative. */
  public final boolean isAlternation() {
    return size() > 1;
  }

  /**
   * Returns the cartesian join of this expression with a following one.
   *
   * <p>Each alternative of this expression is joined, in order, with each alternative of {@code
   * next}. The joined phoneme is valid for the intersection of the two language sets, and pairs
   * with no language in common are dropped. If every pair is dropped then the languages cannot be
   * reconciled, and rather than losing the encoding altogether, the unfiltered join (valid for
   * the union of the language sets) is returned instead.
   */
  public PhonemeExpr concat(PhonemeExpr next) {
    Builder filtered = new Builder();
    for (Phoneme lhs : phonemes()) {
      for (Phoneme rhs : next.phonemes()) {
        lhs.join(rhs).ifPresent(filtered::add);
      }
    }
    if (!filtered.isEmpty()) {
      return filtered.build();
    }
    Builder unfiltered = new Builder();
    for (Phoneme lhs : phonemes()) {
      for (Phoneme rhs : next.phonemes()) {
        unfiltered.add(lhs.joinUnfiltered(rhs));
      }
    }
    return unfiltered.build();
  }

  /**
   * Returns an expression in which alternatives with identical text are merged into the first of
   * them, with the union of their languages.
   */
  public PhonemeExpr dedupe() {
    if (!isAlternation()) {
      return this;
    }
    Map<String, Phoneme> merged = new LinkedHashMap<>();
    for (Phoneme p : phonemes()) {
      merged.merge(p.text(), p, (a, b) -> a.mergeLanguages(b.languages()));
    }
    return merged.size() == size() ? this : copyOf(merged.values());
  }

  /**
   * Returns an expression of at most {@code maxSize} alternatives, keeping the first alternatives
   * of this expression. This is a lossy bound on size and not a selection of the best encodings.
   */
  public PhonemeExpr truncate(int maxSize) {
    checkArgument(maxSize > 0, "maximum size must be positive: %s", maxSize);
    return size() <= maxSize ? this : copyOf(phonemes().subList(0, maxSize));
  }

  @Override
  public final boolean equals(Object obj) {
    return obj instanceof PhonemeExpr && phonemes().equals(((PhonemeExpr) obj).phonemes());
  }

  @Override
  public final int hashCode() {
    return phonemes().hashCode();
  }

  /** A phoneme expression with exactly one alternative. */
  public static final class Single extends PhonemeExpr {
    private final Phoneme phoneme;

    private Single(Phoneme phoneme) {
      this.phoneme = phoneme;
    }

    public Phoneme phoneme() {
      return phoneme;
    }

    @Override
    public ImmutableList<Phoneme> phonemes() {
      return ImmutableList.of(phoneme);
    }

    @Override
    public int size() {
      return 1;
    }

    @Override
    public PhonemeExpr concat(PhonemeExpr next) {
      if (next instanceof Single) {
        Phoneme rhs = ((Single) next).phoneme;
        Optional<Phoneme> joined = phoneme.join(rhs);
        return new Single(joined.orElseGet(() -> phoneme.joinUnfiltered(rhs)));
      }
      return super.concat(next);
    }

    @Override
    public String toString() {
      return phoneme.toString();
    }
  }

  /** A phoneme expression with two or more alternatives. */
  public static final class Alternation extends PhonemeExpr {
    private final ImmutableList<Phoneme> phonemes;

    private Alternation(ImmutableList<Phoneme> phonemes) {
      this.phonemes = phonemes;
    }

    @Override
    public ImmutableList<Phoneme> phonemes() {
      return phonemes;
    }

    @Override
    public int size() {
      return phonemes.size();
    }

    @Override
    public String toString() {
      StringBuilder out = new StringBuilder("(");
      for (int n = 0; n < phonemes.size(); n++) {
        out.append(n > 0 ? "|" : "").append(phonemes.get(n));
      }
      return out.append(')').toString();
    }
  }

  /** Accumulates alternatives while maintaining the merging invariant. */
  private static final class Builder {
    private final List<Phoneme> alternatives = new ArrayList<>();

    void add(Phoneme phoneme) {
      int insertAt = alternatives.size();
      Phoneme merged = phoneme;
      // Merging can widen the language set, so repeat until nothing else overlaps.
      for (int n = 0; n < alternatives.size(); ) {
        Phoneme existing = alternatives.get(n);
        if (existing.text().equals(merged.text())
            && existing.languages().intersects(merged.languages())) {
          merged = existing.mergeLanguages(merged.languages());
          alternatives.remove(n);
          insertAt = Math.min(insertAt, n);
          n = 0;
        } else {
          n++;
        }
      }
      alternatives.add(insertAt, merged);
    }

    boolean isEmpty() {
      return alternatives.isEmpty();
    }

    PhonemeExpr build() {
      checkArgument(!alternatives.isEmpty(), "phoneme expressions must not be empty");
      return alternatives.size() == 1
          ? new Single(alternatives.get(0))
          : new Alternation(ImmutableList.copyOf(alternatives));
    }
  }
}
