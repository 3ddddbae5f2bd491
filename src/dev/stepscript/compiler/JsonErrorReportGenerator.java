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

import com.google.gson.stream.JsonWriter;
import dev.stepscript.compiler.SortingErrorManager.ErrorReportGenerator;
import dev.stepscript.compiler.SortingErrorManager.ErrorWithLevel;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * An error report generator that prints error and warning data to the print stream as an array of
 * JSON objects.
 */
public class JsonErrorReportGenerator implements ErrorReportGenerator {
  private final PrintStream stream;

  /**
   * @param stream the stream on which the errors and warnings should be printed. This class does
   *     not close the stream
   */
  public JsonErrorReportGenerator(PrintStream stream) {
    this.stream = stream;
  }

  @Override
  public void generateReport(SortingErrorManager manager) {
    StringWriter buffer = new StringWriter();
    try (JsonWriter jsonWriter = new JsonWriter(buffer)) {
      jsonWriter.beginArray();
      for (ErrorWithLevel message : manager.getSortedDiagnostics()) {
        jsonWriter.beginObject();
        jsonWriter.name("level").value(message.level == CheckLevel.ERROR ? "error" : "warning");
        jsonWriter.name("description").value(message.error.description());
        jsonWriter.name("key").value(message.error.type().key);
        if (message.error.hasLocation()) {
          jsonWriter.name("line").value(message.error.lineno());
          jsonWriter.name("column").value(message.error.charno());
        }
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    stream.println(buffer);
  }
}
