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

import java.util.Locale;
import java.util.logging.Logger;

/** Contains utility methods shared by the geometry classes that depend on the runtime platform. */
final class Platform {

  private Platform() {}

  /**
   * Returns the {@link Logger} for the class.
   *
   * @see Logger#getLogger(String)
   */
  static Logger getLoggerForClass(Class<?> clazz) {
    return Logger.getLogger(clazz.getCanonicalName());
  }

  /**
   * Returns {@code String.format} with the arguments, using the root locale so that decimal
   * separators do not depend on the default locale.
   */
  static String formatString(String format, Object... params) {
    return String.format(Locale.ROOT, format, params);
  }

  /**
   * Formats the double as a string and removes unneeded trailing zeros, to behave the same as
   * printf("%.15g",d) in C++.
   */
  static String formatDouble(double d) {
    if (d == 0d) {
      return "0";
    }
    String s = String.format(Locale.ROOT, "%.15g", d);
    int exponent = s.indexOf('e');
    String mantissa = exponent < 0 ? s : s.substring(0, exponent);
    String suffix = exponent < 0 ? "" : s.substring(exponent);
    if (mantissa.indexOf('.') >= 0) {
      int end = mantissa.length();
      while (mantissa.charAt(end - 1) == '0') {
        end--;
      }
      if (mantissa.charAt(end - 1) == '.') {
        end--;
      }
      mantissa = mantissa.substring(0, end);
    }
    return mantissa + suffix;
  }
}
