/*
 * Copyright 2026 The Closure Compiler Authors.
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
package com.google.phpanalyzer.types;

import java.util.logging.Logger;

/**
 * Receives the segments of a type string that could not be parsed. The segment itself is still
 * turned into the unknown type so the rest of the union survives.
 */
@FunctionalInterface
public interface TypeParseErrorReporter {
  /** Logs every failure at WARNING. */
  TypeParseErrorReporter LOGGING =
      new TypeParseErrorReporter() {
        private final Logger logger = Logger.getLogger(TypeParseErrorReporter.class.getName());

        @Override
        public void unparsableType(String typeString, String segment, String reason) {
          logger.warning("Unparsable type '" + segment + "' in '" + typeString + "': " + reason);
        }
      };

  /**
   * @param typeString the complete string being parsed
   * @param segment the offending member of the union
   * @param reason what is wrong with it
   */
  void unparsableType(String typeString, String segment, String reason);
}
