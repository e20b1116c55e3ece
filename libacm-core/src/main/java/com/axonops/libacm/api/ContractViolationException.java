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

/**
 * Thrown when a caller breaks the automaton's usage contract.
 *
 * <p>Examples: a match index beyond the current match count, any use of a released automaton, a
 * closed or stale cursor, a null symbol, or a missing symbol policy. These are programming errors;
 * the automaton's state is left unchanged.
 *
 * @since 1.0.0
 */
public final class ContractViolationException extends ACMException {

  public ContractViolationException(String message) {
    super("ACM: Contract violation: " + message);
  }
}
