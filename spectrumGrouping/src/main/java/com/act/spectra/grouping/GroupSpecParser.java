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
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the grouping source configured in a set of {@link GroupingParameters} and reads a {@link GroupMap} from it.
 * Sources are tried in the order: template workspace, map file, grouping pattern, explicit lists.
 */
public class GroupSpecParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GroupSpecParser.class);

  private final GroupingParameters parameters;
  private final GroupFileLoader loader;

  public GroupSpecParser(GroupingParameters parameters, GroupFileLoader loader) {
    this.parameters = parameters;
    this.loader = loader;
  }

  /**
   * @return The source that will be used.
   * @throws GroupingConfigurationException If no source was configured.
   */
  public GroupingSource selectSource() {
    List<GroupingSource> configured = new ArrayList<>();
    if (parameters.getTemplateWorkspace() != null) {
      configured.add(new TemplateGroupingSource(parameters.getTemplateWorkspace()));
    }
    if (parameters.getMapFile() != null) {
      configured.add(new MapFileGroupingSource(parameters.getMapFile(), loader, parameters.isIgnoreGroupNumber(),
          parameters.getExcludedGroupIds()));
    }
    if (StringUtils.isNotBlank(parameters.getGroupingPattern())) {
      configured.add(new PatternGroupingSource(parameters.getGroupingPattern()));
    }
    if (ExplicitListGroupingSource.hasAnyList(
        parameters.getSpectrumNumbers(), parameters.getDetectorIds(), parameters.getRowIndices())) {
      configured.add(new ExplicitListGroupingSource(
          parameters.getSpectrumNumbers(), parameters.getDetectorIds(), parameters.getRowIndices()));
    }

    if (configured.isEmpty()) {
      String msg = "No grouping source was given (template workspace, map file, grouping pattern or list), " +
          "nothing to group";
      LOGGER.error(msg);
      throw new GroupingConfigurationException(msg);
    }
    GroupingSource source = configured.get(0);
    if (configured.size() > 1) {
      LOGGER.warn("%d grouping sources were given, using the %s and ignoring the rest",
          configured.size(), source.describe());
    }
    return source;
  }

  /**
   * Reads the configured grouping.
   * @param workspace The workspace being grouped.
   * @param identifierMaps Lookups for workspace.
   * @param progress Progress for this job.
   * @return The groups, or a cancelled outcome.
   * @throws IOException If a group file can't be read.
   */
  public Outcome<GroupMap> parse(Workspace workspace, IdentifierMaps identifierMaps, GroupingProgress progress)
      throws IOException {
    GroupingSource source = selectSource();
    LOGGER.info("Reading grouping from the %s", source.describe());
    Outcome<GroupMap> groups = source.read(workspace, identifierMaps, progress);
    if (!groups.isCancelled()) {
      LOGGER.debug("Read %d groups from the %s", groups.get().size(), source.describe());
    }
    return groups;
  }
}
