// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public record VersionInfo(
    String genstepVersion, String buildTimestamp, String javaVendor, String javaVersion) {

  static VersionInfo load() throws IOException {
    Properties prop = new Properties();
    try (InputStream input =
        VersionInfo.class.getClassLoader().getResourceAsStream("build.properties")) {
      if (input == null) {
        return new VersionInfo("?", "?", "?", "?");
      }
      prop.load(input);
      return new VersionInfo(
          prop.getProperty("genstep.version"),
          prop.getProperty("build.timestamp"),
          prop.getProperty("java.vendor"),
          prop.getProperty("java.version"));
    }
  }

  @Override
  public String toString() {
    return "Genstep %s (%s) [%s Java %s]"
        .formatted(genstepVersion, buildTimestamp, javaVendor, javaVersion);
  }
}
