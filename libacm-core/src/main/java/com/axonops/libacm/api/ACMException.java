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
 * Base exception for all automaton errors.
 *
 * <p>Sealed class ensuring exhaustive handling of all error types. Both subtypes signal problems
 * the caller has to fix; nothing here is transient, so nothing is worth retrying.
 *
 * @since 1.0.0
 */
public sealed class ACMException extends RuntimeException
    permits ContractViolationException, ResourceException {

  public ACMException(String message) {
    super(message);
  }

  public ACMException(String message, Throwable cause) {
    super(message, cause);
  }
}
