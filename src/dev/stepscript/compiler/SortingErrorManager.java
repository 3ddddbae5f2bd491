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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;

/**
 * An error manager that sorts all errors and warnings reported to it by source position, and has
 * customizable output through the {@link ErrorReportGenerator} interface.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  /** Responsible for generating the report of the diagnostics at the end of a conversion. */
  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager() {
    this(ImmutableSet.of());
  }

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  @Override
  public void report(CheckLevel level, ConversionError error) {
    if (!level.isOn()) {
      return;
    }
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else {
        warningCount++;
      }
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<ConversionError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<ConversionError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  ImmutableList<ErrorWithLevel> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private ImmutableList<ConversionError> toList(CheckLevel level) {
    ImmutableList.Builder<ConversionError> errors = ImmutableList.builder();
    for (ErrorWithLevel message : messages) {
      if (message.level == level) {
        errors.add(message.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorReportGenerator generator : errorReportGenerators) {
      generator.generateReport(this);
    }
  }

  /** Strategy for customizing the output format of the report. */
  public interface ErrorReportGenerator {
    void generateReport(SortingErrorManager manager);
  }

  /**
   * Orders diagnostics by level (errors first), line, column and description. Diagnostics without
   * a location come first within their level.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }
      int lineno = Integer.compare(p1.error.lineno(), p2.error.lineno());
      if (lineno != 0) {
        return lineno;
      }
      int charno = Integer.compare(p1.error.charno(), p2.error.charno());
      if (charno != 0) {
        return charno;
      }
      int type = p1.error.type().compareTo(p2.error.type());
      if (type != 0) {
        return type;
      }
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  static final class ErrorWithLevel {
    final ConversionError error;
    final CheckLevel level;

    ErrorWithLevel(ConversionError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }
}
