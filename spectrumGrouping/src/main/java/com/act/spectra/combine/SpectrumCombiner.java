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

package com.act.spectra.combine;

import com.act.spectra.grouping.GroupingConfigurationException;
import com.act.spectra.model.HistogramSpectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

/**
 * Combines histogram rows bin by bin.  A row contributes to bin b only if its detector isn't masked and bin b isn't
 * one of its masked bins, so every bin keeps its own count of contributing rows.  Summed errors are added in
 * quadrature; averaging divides both the sum and the combined error by the bin's contributing row count, and a bin
 * with no contributions comes out as zero.
 */
public class SpectrumCombiner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumCombiner.class);

  private final GroupingBehaviour behaviour;

  public SpectrumCombiner(GroupingBehaviour behaviour) {
    this.behaviour = behaviour;
  }

  /**
   * @param rows The rows of one group, all with the binning of the first row.
   * @return A new spectrum with no spectrum number, the first row's bin edges and the union of the rows' detector
   * ids.  A group of one row is returned as an unchanged copy of that row.
   */
  public HistogramSpectrum combine(List<HistogramSpectrum> rows) {
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("Cannot combine an empty group");
    }
    if (rows.size() == 1) {
      return rows.get(0).copy();
    }

    HistogramSpectrum first = rows.get(0);
    int numberOfBins = first.getNumberOfBins();
    double[] sum = new double[numberOfBins];
    double[] errorSquaredSum = new double[numberOfBins];
    int[] count = new int[numberOfBins];
    TreeSet<Integer> detectorIds = new TreeSet<>();
    boolean allMasked = true;

    for (HistogramSpectrum row : rows) {
      if (row.getNumberOfBins() != numberOfBins) {
        String msg = "Can only group if the histograms have common bin boundaries";
        LOGGER.error("%s: found %d bins where %d were expected", msg, row.getNumberOfBins(), numberOfBins);
        throw new GroupingConfigurationException(msg);
      }
      detectorIds.addAll(row.getDetectorIds());
      if (row.isDetectorMasked()) {
        continue;
      }
      allMasked = false;

      double[] y = row.getY();
      double[] e = row.getE();
      for (int b = 0; b < numberOfBins; b++) {
        if (row.isBinMasked(b)) {
          continue;
        }
        sum[b] += y[b];
        errorSquaredSum[b] += e[b] * e[b];
        count[b]++;
      }
    }

    double[] yOut = new double[numberOfBins];
    double[] eOut = new double[numberOfBins];
    for (int b = 0; b < numberOfBins; b++) {
      double error = Math.sqrt(errorSquaredSum[b]);
      if (behaviour == GroupingBehaviour.AVERAGE) {
        if (count[b] > 0) {
          yOut[b] = sum[b] / count[b];
          eOut[b] = error / count[b];
        }
      } else {
        yOut[b] = sum[b];
        eOut[b] = error;
      }
    }

    HistogramSpectrum combined = new HistogramSpectrum(
        null, detectorIds, Arrays.copyOf(first.getX(), first.getX().length), yOut, eOut);
    combined.setDetectorMasked(allMasked);
    return combined;
  }

  public GroupingBehaviour getBehaviour() {
    return behaviour;
  }
}
