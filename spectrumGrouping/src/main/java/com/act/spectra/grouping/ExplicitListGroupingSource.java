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
import com.act.spectra.model.Workspace;
import com.act.spectra.progress.GroupingProgress;
import com.act.spectra.progress.Outcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * Puts the rows named by one list of spectrum numbers, detector ids or row indices into a single group with key 0.
 * If more than one list is given, spectrum numbers are used first, then detector ids, then row indices.  Every
 * listed value must exist in the workspace.
 */
public class ExplicitListGroupingSource implements GroupingSource {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ExplicitListGroupingSource.class);

  public static final int GROUP_KEY = 0;

  private final List<Integer> spectrumNumbers;
  private final List<Integer> detectorIds;
  private final List<Integer> rowIndices;

  public ExplicitListGroupingSource(List<Integer> spectrumNumbers, List<Integer> detectorIds,
                                    List<Integer> rowIndices) {
    this.spectrumNumbers = spectrumNumbers;
    this.detectorIds = detectorIds;
    this.rowIndices = rowIndices;
  }

  public static boolean hasAnyList(List<Integer> spectrumNumbers, List<Integer> detectorIds,
                                   List<Integer> rowIndices) {
    return !spectrumNumbers.isEmpty() || !detectorIds.isEmpty() || !rowIndices.isEmpty();
  }

  @Override
  public Outcome<GroupMap> read(Workspace workspace, IdentifierMaps identifierMaps, GroupingProgress progress) {
    GroupMap groups = new GroupMap();
    SpectrumGroup group = groups.addGroup(GROUP_KEY);

    if (!spectrumNumbers.isEmpty()) {
      warnIfIgnored(!detectorIds.isEmpty() || !rowIndices.isEmpty());
      LOGGER.debug("Converting %d spectrum numbers to row indices", spectrumNumbers.size());
      addTranslated(group, spectrumNumbers, identifierMaps.getSpectrumNumberToIndexMap(), "Spectrum number");
    } else if (!detectorIds.isEmpty()) {
      warnIfIgnored(!rowIndices.isEmpty());
      LOGGER.debug("Converting %d detector ids to row indices", detectorIds.size());
      addTranslated(group, detectorIds, identifierMaps.getDetectorIdToIndexMap(), "Detector id");
    } else if (!rowIndices.isEmpty()) {
      int numberOfSpectra = workspace.getNumberOfSpectra();
      for (Integer index : rowIndices) {
        if (index < 0 || index >= numberOfSpectra) {
          String msg = String.format("Workspace index %d is out of range for a workspace with %d spectra",
              index, numberOfSpectra);
          LOGGER.error(msg);
          throw new SpectrumRangeException(msg, index);
        }
        group.add(index);
      }
    } else {
      String msg = "All list properties are empty, nothing to group";
      LOGGER.error(msg);
      throw new GroupingConfigurationException(msg);
    }

    if (progress.checkpoint().isCancelled()) {
      return Outcome.cancelled();
    }
    return Outcome.of(groups);
  }

  private void addTranslated(SpectrumGroup group, List<Integer> values, Map<Integer, Integer> toIndex, String what) {
    for (Integer value : values) {
      Integer index = toIndex.get(value);
      if (index == null) {
        String msg = String.format("%s %d is not in the input workspace", what, value);
        LOGGER.error(msg);
        throw new SpectrumRangeException(msg, value);
      }
      group.add(index);
    }
  }

  private static void warnIfIgnored(boolean othersGiven) {
    if (othersGiven) {
      LOGGER.warn("More than one list of spectra was given, only the first non-empty list will be used");
    }
  }

  @Override
  public String describe() {
    if (!spectrumNumbers.isEmpty()) {
      return "spectrum number list";
    }
    return detectorIds.isEmpty() ? "workspace index list" : "detector id list";
  }
}
