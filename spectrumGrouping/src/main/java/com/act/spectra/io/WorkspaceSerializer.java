/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.act.spectra.io;

import com.act.spectra.model.GroupingWorkspace;
import com.act.spectra.model.Workspace;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads and writes workspaces as JSON.
 */
public class WorkspaceSerializer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(WorkspaceSerializer.class);

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public static Workspace readWorkspace(InputStream is) throws IOException {
    return OBJECT_MAPPER.readValue(is, Workspace.class);
  }

  public static Workspace readWorkspace(File file) throws IOException {
    try (InputStream is = new FileInputStream(file)) {
      Workspace workspace = readWorkspace(is);
      LOGGER.debug("Read %s workspace with %d spectra from %s",
          workspace.getKind(), workspace.getNumberOfSpectra(), file.getAbsolutePath());
      return workspace;
    }
  }

  /**
   * Reads a workspace that assigns a group id to each of its rows.
   */
  public static GroupingWorkspace readGroupingWorkspace(File file) throws IOException {
    Workspace workspace = readWorkspace(file);
    try {
      return GroupingWorkspace.fromWorkspace(workspace);
    } catch (IllegalArgumentException e) {
      throw new IOException(String.format("%s is not a grouping workspace: %s", file.getAbsolutePath(),
          e.getMessage()), e);
    }
  }

  public static void writeWorkspace(Workspace workspace, File file) throws IOException {
    try (FileOutputStream fos = new FileOutputStream(file)) {
      OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(fos, workspace);
    }
    LOGGER.debug("Wrote %d spectra to %s", workspace.getNumberOfSpectra(), file.getAbsolutePath());
  }

  public static String toJson(Workspace workspace) throws IOException {
    return OBJECT_MAPPER.writeValueAsString(workspace);
  }

  public static Workspace fromJson(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, Workspace.class);
  }
}
