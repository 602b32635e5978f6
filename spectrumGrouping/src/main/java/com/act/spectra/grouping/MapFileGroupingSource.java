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

package com.act.spectra.grouping;

import com.act.spectra.index.IdentifierMaps;
import com.act.spectra.io.GroupFileLoader;
import com.act.spectra.model.Workspace;
import com.act.spectra.progress.GroupingProgress;
import com.act.spectra.progress.Outcome;
import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Reads groups from a file: XML grouping files are recognized by their extension, anything else is read as a flat
 * group file.
 */
public class MapFileGroupingSource implements GroupingSource {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MapFileGroupingSource.class);

  public static final String XML_EXTENSION = "xml";

  private final File file;
  private final GroupFileLoader loader;
  private final boolean ignoreGroupNumber;
  private final Set<Integer> excludedGroupIds;

  public MapFileGroupingSource(File file, GroupFileLoader loader, boolean ignoreGroupNumber,
                               Set<Integer> excludedGroupIds) {
    this.file = file;
    this.loader = loader;
    this.ignoreGroupNumber = ignoreGroupNumber;
    this.excludedGroupIds = excludedGroupIds;
  }

  public static boolean isXmlFile(File file) {
    return FilenameUtils.isExtension(file.getName().toLowerCase(), XML_EXTENSION);
  }

  @Override
  public Outcome<GroupMap> read(Workspace workspace, IdentifierMaps identifierMaps, GroupingProgress progress)
      throws IOException {
    Outcome<GroupMap> outcome;
    if (isXmlFile(file)) {
      Document doc = loader.readXml(file);
      if (progress.advanceBy(GroupingProgress.OPENINGFILE).isCancelled()) {
        return Outcome.cancelled();
      }
      outcome = new XmlGroupingFileReader(file.getPath(), identifierMaps, excludedGroupIds, progress).read(doc);
    } else {
      List<String> lines = loader.readLines(file);
      if (progress.advanceBy(GroupingProgress.OPENINGFILE).isCancelled()) {
        return Outcome.cancelled();
      }
      if (!excludedGroupIds.isEmpty()) {
        LOGGER.warn("Excluded group ids only apply to XML grouping files, ignoring them for %s", file.getPath());
      }
      MapFileReader reader = new MapFileReader(file.getPath(), identifierMaps.getSpectrumNumberToIndexMap(),
          workspace.getNumberOfSpectra(), progress);
      outcome = reader.read(lines, ignoreGroupNumber);
    }

    if (outcome.isCancelled()) {
      return outcome;
    }
    // Commit the estimated share of the file reading phase.
    double fileRead = progress.estimateFileRead(outcome.get().size(), workspace.getNumberOfSpectra());
    if (progress.advanceBy(fileRead).isCancelled()) {
      return Outcome.cancelled();
    }
    LOGGER.debug("Closed input file %s", file.getPath());
    return outcome;
  }

  @Override
  public String describe() {
    return String.format("%s file %s", isXmlFile(file) ? "XML grouping" : "map", file.getPath());
  }
}
