// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.parser;

/** Syntax error in Genstep source, reported with the offending line marked by {@code >>>}. */
public class ParseException extends RuntimeException {
  public final String filename;
  public final int errorLine;
  public final int errorColumn;
  public final String sourceLine;

  public ParseException(
      String message, String filename, int errorLine, int errorColumn, String sourceLine) {
    super(buildMessage(message, errorColumn, sourceLine));
    this.filename = filename;
    this.errorLine = errorLine;
    this.errorColumn = errorColumn;
    this.sourceLine = sourceLine;
  }

  private static String buildMessage(String message, int column, String sourceLine) {
    var out = new StringBuilder(message).append("\n");
    if (column >= 0 && column <= sourceLine.length()) {
      out.append(sourceLine, 0, column).append(">>>").append(sourceLine.substring(column));
    } else {
      out.append("ERROR >>> ").append(sourceLine);
    }
    return out.toString();
  }
}
