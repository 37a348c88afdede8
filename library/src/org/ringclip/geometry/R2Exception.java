/*
 * Copyright 2026 Google Inc.
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
package org.ringclip.geometry;

/**
 * An unchecked exception wrapping an {@link R2Error}. Methods that report failures through an
 * R2Error parameter have an alternate form that throws R2Exception instead; those are named with
 * an "Unsafe" suffix, for example {@link R2BooleanOperation#buildUnsafe(R2Polygon, R2Polygon)}.
 */
public class R2Exception extends RuntimeException {

  private final R2Error error;

  /** Creates a new R2Exception wrapping the given R2Error. */
  public R2Exception(R2Error error) {
    this.error = error;
  }

  /** Returns the code of the wrapped R2Error. */
  public R2Error.Code code() {
    return error.code();
  }

  @Override
  public String getMessage() {
    return error.text();
  }
}
