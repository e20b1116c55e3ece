/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libacm.api;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Capabilities the automaton needs from its alphabet: equality, copy and destroy.
 *
 * <p>The alphabet is never enumerated or hashed, so any type works as a symbol as long as it can be
 * compared for equality. Equality is always invoked as {@code equal(keywordSymbol, inputSymbol)}:
 * the first argument is a symbol stored in the automaton (a copy taken at registration), the
 * second is the candidate being matched. Policies may rely on that order, e.g. to normalize only
 * the input side.
 *
 * <p>{@link #copy} is applied to every symbol the automaton stores, {@link #destroy} to every
 * stored symbol it drops (on removal and on release). The defaults suit immutable value types.
 *
 * <p>Policies must be thread-safe: scanning threads call {@link #equal} concurrently.
 *
 * <pre>{@code
 * Automaton<Integer, Void> numbers = Automaton.create(SymbolPolicy.natural());
 * Automaton<Character, Void> text = Automaton.create(SymbolPolicy.caseInsensitive());
 * Automaton<Token, Void> tokens = Automaton.create(SymbolPolicy.of(Token::sameKind));
 * }</pre>
 *
 * @param <S> symbol type
 * @since 1.0.0
 */
@FunctionalInterface
public interface SymbolPolicy<S> {

  /**
   * Tests whether an input symbol matches a stored keyword symbol.
   *
   * @param keywordSymbol symbol stored in the automaton
   * @param inputSymbol symbol being registered, looked up or scanned
   * @return true if they match
   */
  boolean equal(S keywordSymbol, S inputSymbol);

  /**
   * Produces the copy the automaton keeps for a symbol taken from a caller's keyword.
   *
   * @param symbol caller's symbol
   * @return the symbol to store (the same instance by default)
   */
  default S copy(S symbol) {
    return symbol;
  }

  /**
   * Disposes of a stored symbol the automaton no longer references. No-op by default.
   *
   * @param symbol a symbol previously returned by {@link #copy}
   */
  default void destroy(S symbol) {
    // No-op
  }

  /**
   * Value equality via {@link Objects#equals}, identity copy, no-op destroy.
   *
   * @param <S> symbol type
   * @return the natural policy
   */
  static <S> SymbolPolicy<S> natural() {
    return Objects::equals;
  }

  /**
   * Policy with a custom equality and default copy/destroy.
   *
   * @param equality tested as {@code equality.test(keywordSymbol, inputSymbol)}
   * @param <S> symbol type
   * @return new policy
   * @throws NullPointerException if equality is null
   */
  static <S> SymbolPolicy<S> of(BiPredicate<? super S, ? super S> equality) {
    Objects.requireNonNull(equality, "equality cannot be null");
    return equality::test;
  }

  /**
   * Policy with custom equality, copy and destroy.
   *
   * @param equality tested as {@code equality.test(keywordSymbol, inputSymbol)}
   * @param copier produces the stored copy of a symbol
   * @param destroyer disposes of a stored copy
   * @param <S> symbol type
   * @return new policy
   * @throws NullPointerException if any argument is null
   */
  static <S> SymbolPolicy<S> of(
      BiPredicate<? super S, ? super S> equality,
      UnaryOperator<S> copier,
      Consumer<? super S> destroyer) {
    Objects.requireNonNull(equality, "equality cannot be null");
    Objects.requireNonNull(copier, "copier cannot be null");
    Objects.requireNonNull(destroyer, "destroyer cannot be null");
    return new SymbolPolicy<>() {
      @Override
      public boolean equal(S keywordSymbol, S inputSymbol) {
        return equality.test(keywordSymbol, inputSymbol);
      }

      @Override
      public S copy(S symbol) {
        return copier.apply(symbol);
      }

      @Override
      public void destroy(S symbol) {
        destroyer.accept(symbol);
      }
    };
  }

  /**
   * Case-insensitive character equality, compared the way {@link String#equalsIgnoreCase} compares
   * individual characters.
   *
   * @return shared policy instance
   */
  static SymbolPolicy<Character> caseInsensitive() {
    return Policies.CASE_INSENSITIVE;
  }
}

/** Shared stateless policy instances. */
final class Policies {

  static final SymbolPolicy<Character> CASE_INSENSITIVE =
      (keywordSymbol, inputSymbol) -> {
        char k = keywordSymbol;
        char t = inputSymbol;
        if (k == t) {
          return true;
        }
        char ku = Character.toUpperCase(k);
        char tu = Character.toUpperCase(t);
        return ku == tu || Character.toLowerCase(ku) == Character.toLowerCase(tu);
      };

  private Policies() {
    // Holder
  }
}
