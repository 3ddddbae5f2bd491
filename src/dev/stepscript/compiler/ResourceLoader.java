/*
 * Copyright 2026 The StepScript Authors.
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
package dev.stepscript.compiler;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;

/** Loads text resources that ship with the converter, such as the instruction templates. */
final class ResourceLoader {
  private ResourceLoader() {}

  static String loadTextResource(Class<?> clazz, String path) {
    InputStream stream = clazz.getResourceAsStream(path);
    if (stream == null) {
      throw new IllegalStateException("No such resource: " + path);
    }
    try (Reader reader = new InputStreamReader(stream, UTF_8)) {
      return CharStreams.toString(reader);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read resource " + path, e);
    }
  }
}
