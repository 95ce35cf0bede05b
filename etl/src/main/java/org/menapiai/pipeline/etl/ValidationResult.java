/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.menapiai.pipeline.etl;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of a {@link RowValidator} or {@link DatasetValidator} check.
 *
 * <ul>
 *   <li>{@link Action#VALID} - keep the row</li>
 *   <li>{@link Action#DROP} - exclude the row, logged at debug</li>
 *   <li>{@link Action#FAIL} - abort the write</li>
 * </ul>
 */
public final class ValidationResult {

  /** What to do with the checked row or dataset. */
  public enum Action {
    VALID,
    DROP,
    FAIL
  }

  private static final ValidationResult VALID_RESULT =
      new ValidationResult(Action.VALID, null);

  private final Action action;
  private final @Nullable String message;

  private ValidationResult(Action action, @Nullable String message) {
    this.action = action;
    this.message = message;
  }

  public static ValidationResult valid() {
    return VALID_RESULT;
  }

  public static ValidationResult drop(String message) {
    return new ValidationResult(Action.DROP, message);
  }

  public static ValidationResult fail(String message) {
    return new ValidationResult(Action.FAIL, message);
  }

  public Action getAction() {
    return action;
  }

  /**
   * Returns the validation message, or null for valid results.
   */
  public @Nullable String getMessage() {
    return message;
  }

  public boolean isValid() {
    return action == Action.VALID;
  }

  @Override public String toString() {
    if (action == Action.VALID) {
      return "ValidationResult{VALID}";
    }
    return "ValidationResult{" + action + ", message='" + message + "'}";
  }
}
