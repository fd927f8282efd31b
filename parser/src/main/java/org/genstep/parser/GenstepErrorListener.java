// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.parser;

import java.util.List;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/** Turns the first lexer or parser error into a {@link ParseException}. */
public class GenstepErrorListener extends BaseErrorListener {
  private final String filename;
  private final List<String> sourceLines;

  public GenstepErrorListener(String filename, String sourceCode) {
    this.filename = filename;
    this.sourceLines = sourceCode.lines().toList();
  }

  @Override
  public void syntaxError(
      Recognizer<?, ?> recognizer,
      Object offendingSymbol,
      int line,
      int column,
      String msg,
      RecognitionException e) {
    String sourceLine =
        (line > 0 && line <= sourceLines.size()) ? sourceLines.get(line - 1) : "<unknown>";
    throw new ParseException(
        "Syntax error at %s line %d column %d: %s".formatted(filename, line, column, msg),
        filename,
        line,
        column,
        sourceLine);
  }
}
