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

package com.act.spectra.index;

import com.act.spectra.model.Spectrum;
import com.act.spectra.model.Workspace;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds identifier maps by scanning a workspace's spectra.  The maps are computed on first use and cached, so the
 * workspace must not change while this object is in use.
 */
public class WorkspaceIdentifierMaps implements IdentifierMaps {
  private static final Logger LOGGER = LogManager.getFormatterLogger(WorkspaceIdentifierMaps.class);

  private final Workspace workspace;
  private Map<Integer, Integer> spectrumNumberToIndex;
  private Map<Integer, Integer> detectorIdToIndex;

  public WorkspaceIdentifierMaps(Workspace workspace) {
    this.workspace = workspace;
  }

  @Override
  public Map<Integer, Integer> getSpectrumNumberToIndexMap() {
    if (spectrumNumberToIndex == null) {
      Map<Integer, Integer> map = new HashMap<>(workspace.getNumberOfSpectra());
      for (int i = 0; i < workspace.getNumberOfSpectra(); i++) {
        Integer spectrumNumber = workspace.getSpectrum(i).getSpectrumNumber();
        if (spectrumNumber == null) {
          continue;
        }
        Integer previous = map.putIfAbsent(spectrumNumber, i);
        if (previous != null) {
          LOGGER.warn("Spectrum number %d is shared by rows %d and %d, using row %d",
              spectrumNumber, previous, i, previous);
        }
      }
      spectrumNumberToIndex = Collections.unmodifiableMap(map);
    }
    return spectrumNumberToIndex;
  }

  @Override
  public Map<Integer, Integer> getDetectorIdToIndexMap() {
    if (detectorIdToIndex == null) {
      Map<Integer, Integer> map = new HashMap<>(workspace.getNumberOfSpectra());
      for (int i = 0; i < workspace.getNumberOfSpectra(); i++) {
        Spectrum spectrum = workspace.getSpectrum(i);
        for (Integer detectorId : spectrum.getDetectorIds()) {
          Integer previous = map.putIfAbsent(detectorId, i);
          if (previous != null) {
            LOGGER.warn("Detector %d belongs to rows %d and %d, using row %d", detectorId, previous, i, previous);
          }
        }
      }
      detectorIdToIndex = Collections.unmodifiableMap(map);
    }
    return detectorIdToIndex;
  }
}
