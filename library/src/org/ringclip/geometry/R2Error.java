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

import com.google.common.base.Strings;
import jsinterop.annotations.JsType;

/**
 * An R2Error describes why a boolean operation or validation failed: an error {@link Code} and a
 * human-readable text. Methods that can fail take an R2Error parameter, and leave it {@link #ok()}
 * when they succeed.
 */
@JsType
public class R2Error {
  /** Error codes, grouped by the kind of object they apply to. */
  @JsType
  public enum Code {
    NO_ERROR(0),

    // Generic errors.
    INVALID_ARGUMENT(1003),

    // Errors that apply to the vertices of any ring.
    INVALID_VERTEX(5),

    // R2Loop errors.
    LOOP_NOT_ENOUGH_VERTICES(100);

    private final int code;

    private Code(int code) {
      this.code = code;
    }

    /** Returns the numeric value of this code. */
    public int code() {
      return code;
    }
  }

  private Code code = Code.NO_ERROR;
  private String text = "";

  /** Resets this error to {@link Code#NO_ERROR} with empty text. */
  public void clear() {
    code = Code.NO_ERROR;
    text = "";
  }

  /**
   * Sets the error code and text. The text is formatted with {@link Strings#lenientFormat}, which
   * only understands "%s"; "%d" is accepted as a synonym.
   */
  public void init(Code code, String format, Object... args) {
    this.code = code;
    format = format.replace("%d", "%s");
    this.text = Strings.lenientFormat(format, args);
  }

  public Code code() {
    return code;
  }

  public boolean ok() {
    return code == Code.NO_ERROR;
  }

  public String text() {
    return text;
  }

  @Override
  public String toString() {
    if (code == Code.NO_ERROR) {
      return "OK";
    }
    return Strings.lenientFormat("%s: %s", code, text);
  }
}
