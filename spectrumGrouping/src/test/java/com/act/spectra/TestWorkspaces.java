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

package com.act.spectra;

import com.act.spectra.model.EventSpectrum;
import com.act.spectra.model.HistogramSpectrum;
import com.act.spectra.model.RepresentationKind;
import com.act.spectra.model.Spectrum;
import com.act.spectra.model.TofEvent;
import com.act.spectra.model.Workspace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Builders for small workspaces used across tests.
 */
public class TestWorkspaces {
  public static double[] binEdges(int numberOfBins) {
    double[] x = new double[numberOfBins + 1];
    for (int i = 0; i <= numberOfBins; i++) {
      x[i] = i;
    }
    return x;
  }

  public static double[] filled(int length, double value) {
    double[] values = new double[length];
    Arrays.fill(values, value);
    return values;
  }

  public static HistogramSpectrum histogram(Integer spectrumNumber, int detectorId, double[] y, double[] e) {
    return new HistogramSpectrum(spectrumNumber, Collections.singletonList(detectorId), binEdges(y.length), y, e);
  }

  /**
   * A histogram workspace whose row i has spectrum number firstSpectrumNumber + i, the single detector
   * firstDetectorId + i, and every count and error equal to 1.
   */
  public static Workspace unitHistograms(int rows, int bins, int firstSpectrumNumber, int firstDetectorId) {
    List<Spectrum> spectra = new ArrayList<>(rows);
    for (int i = 0; i < rows; i++) {
      spectra.add(histogram(firstSpectrumNumber + i, firstDetectorId + i, filled(bins, 1.0), filled(bins, 1.0)));
    }
    return new Workspace(RepresentationKind.HISTOGRAM, spectra);
  }

  /**
   * An event workspace whose row i has spectrum number i + 1, detector 100 + i and eventsPerRow unit weight events
   * with times of flight 0.5, 1.5, 2.5...
   */
  public static Workspace unitEvents(int rows, int eventsPerRow) {
    List<Spectrum> spectra = new ArrayList<>(rows);
    for (int i = 0; i < rows; i++) {
      List<TofEvent> events = new ArrayList<>(eventsPerRow);
      for (int j = 0; j < eventsPerRow; j++) {
        events.add(new TofEvent(j + 0.5));
      }
      spectra.add(new EventSpectrum(i + 1, Collections.singletonList(100 + i), events));
    }
    return new Workspace(RepresentationKind.EVENT, binEdges(eventsPerRow), spectra);
  }
}
