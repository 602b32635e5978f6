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

package com.act.spectra.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A workspace whose only payload is a group number per row: row i's detectors belong to group
 * {@link #getGroupId(int)}, and group 0 means "not grouped".  Each row is stored as a single-bin histogram whose
 * count is the group id, so grouping workspaces share the regular workspace file format.
 */
public class GroupingWorkspace extends Workspace {
  private static final double[] SINGLE_BIN = new double[]{0.0, 1.0};

  public GroupingWorkspace(List<Integer> groupIds, List<? extends Collection<Integer>> detectorIds) {
    super(RepresentationKind.HISTOGRAM, toSpectra(groupIds, detectorIds));
  }

  private GroupingWorkspace(List<Spectrum> spectra) {
    super(RepresentationKind.HISTOGRAM, spectra);
  }

  /**
   * Reinterprets a regular histogram workspace as a grouping workspace, reading each row's group id from its first
   * bin.
   * @param workspace A histogram workspace with at least one bin per row.
   * @return A grouping workspace over the same rows.
   */
  public static GroupingWorkspace fromWorkspace(Workspace workspace) {
    if (workspace.getKind() != RepresentationKind.HISTOGRAM) {
      throw new IllegalArgumentException("Grouping workspaces must be stored as histograms");
    }
    List<Spectrum> spectra = new ArrayList<>(workspace.getNumberOfSpectra());
    for (Spectrum s : workspace.getSpectra()) {
      HistogramSpectrum h = (HistogramSpectrum) s;
      if (h.getNumberOfBins() < 1) {
        throw new IllegalArgumentException(
            String.format("Grouping workspace row with spectrum number %s has no group id", h.getSpectrumNumber()));
      }
      spectra.add(h);
    }
    return new GroupingWorkspace(spectra);
  }

  public int getGroupId(int index) {
    return (int) ((HistogramSpectrum) getSpectrum(index)).getY()[0];
  }

  private static List<Spectrum> toSpectra(List<Integer> groupIds, List<? extends Collection<Integer>> detectorIds) {
    if (groupIds.size() != detectorIds.size()) {
      throw new IllegalArgumentException(String.format("Mismatched group id and detector list sizes: %d vs %d",
          groupIds.size(), detectorIds.size()));
    }
    List<Spectrum> spectra = new ArrayList<>(groupIds.size());
    for (int i = 0; i < groupIds.size(); i++) {
      spectra.add(new HistogramSpectrum(i + 1, detectorIds.get(i), SINGLE_BIN.clone(),
          new double[]{groupIds.get(i)}, new double[]{0.0}));
    }
    return spectra;
  }
}
