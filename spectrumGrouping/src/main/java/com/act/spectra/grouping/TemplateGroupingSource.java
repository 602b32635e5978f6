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
import com.act.spectra.model.GroupingWorkspace;
import com.act.spectra.model.Spectrum;
import com.act.spectra.model.Workspace;
import com.act.spectra.progress.GroupingProgress;
import com.act.spectra.progress.Outcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Takes the grouping from another workspace of the same instrument, matching rows through their detector ids.
 *
 * A {@link GroupingWorkspace} assigns each of its rows a group id (0 or less meaning "not grouped"); all rows of the
 * workspace being grouped that share a detector with a template row are pooled into that row's group, and groups
 * come out in ascending id order.  Any other workspace is treated as a set of detector groups: template row i
 * becomes group i, and template rows with fewer than two detectors are ignored.
 *
 * Pooling means one source row can end up in several groups.
 */
public class TemplateGroupingSource implements GroupingSource {
  private static final Logger LOGGER = LogManager.getFormatterLogger(TemplateGroupingSource.class);

  private final Workspace template;

  public TemplateGroupingSource(Workspace template) {
    this.template = template;
  }

  @Override
  public Outcome<GroupMap> read(Workspace workspace, IdentifierMaps identifierMaps, GroupingProgress progress) {
    Map<Integer, Integer> detectorToIndex = identifierMaps.getDetectorIdToIndexMap();
    TreeMap<Integer, SortedSet<Integer>> pooled = new TreeMap<>();
    boolean isGroupingWorkspace = template instanceof GroupingWorkspace;
    int skipped = 0;

    for (int i = 0; i < template.getNumberOfSpectra(); i++) {
      if (progress.checkpoint().isCancelled()) {
        return Outcome.cancelled();
      }
      Spectrum templateRow = template.getSpectrum(i);

      int groupId;
      if (isGroupingWorkspace) {
        groupId = ((GroupingWorkspace) template).getGroupId(i);
        if (groupId <= 0) {
          continue;
        }
      } else {
        // A group of one detector is not a group.
        if (templateRow.getDetectorIds().size() <= 1) {
          continue;
        }
        groupId = i;
      }

      SortedSet<Integer> rows = pooled.computeIfAbsent(groupId, k -> new TreeSet<>());
      for (Integer detectorId : templateRow.getDetectorIds()) {
        Integer index = detectorToIndex.get(detectorId);
        if (index == null) {
          LOGGER.debug("Detector id %d from template row %d is not in the input workspace, skipping", detectorId, i);
          skipped++;
          continue;
        }
        rows.add(index);
      }
    }

    if (skipped > 0) {
      LOGGER.warn("%d detector ids in the template workspace were not found in the input workspace and were skipped",
          skipped);
    }

    List<SpectrumGroup> groups = new ArrayList<>(pooled.size());
    for (Map.Entry<Integer, SortedSet<Integer>> entry : pooled.entrySet()) {
      if (entry.getValue().isEmpty()) {
        LOGGER.debug("Template group %d matched no rows of the input workspace", entry.getKey());
        continue;
      }
      SpectrumGroup group = new SpectrumGroup(entry.getKey());
      for (Integer row : entry.getValue()) {
        group.add(row);
      }
      groups.add(group);
    }
    LOGGER.debug("Template workspace gave %d groups", groups.size());
    return Outcome.of(new GroupMap(groups));
  }

  @Override
  public String describe() {
    return template instanceof GroupingWorkspace ? "grouping workspace" : "template workspace";
  }
}
