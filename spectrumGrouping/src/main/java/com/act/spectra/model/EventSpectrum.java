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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A sparse spectrum made of individual time-of-flight events.  Events are kept in the order they were added; sorting
 * them is left to whoever consumes the spectrum.
 */
public class EventSpectrum extends Spectrum {
  private static final long serialVersionUID = -6052452935566346017L;

  @JsonProperty("events")
  private List<TofEvent> events = new ArrayList<>();

  protected EventSpectrum() {
  }

  public EventSpectrum(Integer spectrumNumber, Collection<Integer> detectorIds) {
    super(spectrumNumber, detectorIds);
  }

  public EventSpectrum(Integer spectrumNumber, Collection<Integer> detectorIds, Collection<TofEvent> events) {
    super(spectrumNumber, detectorIds);
    this.events.addAll(events);
  }

  @Override
  @JsonIgnore
  public RepresentationKind getKind() {
    return RepresentationKind.EVENT;
  }

  @Override
  public EventSpectrum copy() {
    EventSpectrum copy = new EventSpectrum();
    copyIdentifiersTo(copy);
    copy.events = new ArrayList<>(events);
    return copy;
  }

  public List<TofEvent> getEvents() {
    return Collections.unmodifiableList(events);
  }

  @JsonIgnore
  public int getNumberOfEvents() {
    return events.size();
  }

  public void addEvents(Collection<TofEvent> newEvents) {
    events.addAll(newEvents);
  }

  /**
   * Multiplies every event weight by factor (and every squared error by factor^2).
   * @param factor The scale factor to apply.
   */
  public void scaleWeights(double factor) {
    List<TofEvent> scaled = new ArrayList<>(events.size());
    for (TofEvent event : events) {
      scaled.add(event.scale(factor));
    }
    events = scaled;
  }

  /**
   * Bins this spectrum's events into a histogram.  Bin b covers [binEdges[b], binEdges[b + 1]); the last bin also
   * includes its upper edge.  Events outside the binning range are dropped.
   * @param binEdges Monotonically increasing bin edges.
   * @return A histogram spectrum with the same identifiers as this one; counts are sums of weights and errors are
   * the square roots of the summed squared errors.
   */
  public HistogramSpectrum toHistogram(double[] binEdges) {
    if (binEdges.length < 2) {
      throw new IllegalArgumentException("At least two bin edges are needed to histogram events");
    }
    int nBins = binEdges.length - 1;
    double[] y = new double[nBins];
    double[] errorSquared = new double[nBins];
    double lowest = binEdges[0];
    double highest = binEdges[nBins];
    for (TofEvent event : events) {
      double tof = event.getTof();
      if (tof < lowest || tof > highest) {
        continue;
      }
      int bin = findBin(binEdges, tof);
      y[bin] += event.getWeight();
      errorSquared[bin] += event.getErrorSquared();
    }

    double[] e = new double[nBins];
    for (int i = 0; i < nBins; i++) {
      e[i] = Math.sqrt(errorSquared[i]);
    }

    HistogramSpectrum histogram =
        new HistogramSpectrum(getSpectrumNumber(), getDetectorIds(), binEdges.clone(), y, e);
    histogram.setDetectorMasked(isDetectorMasked());
    return histogram;
  }

  private static int findBin(double[] binEdges, double tof) {
    // Binary search for the last edge <= tof, clamped so the top edge falls into the last bin.
    int lo = 0;
    int hi = binEdges.length - 2;
    while (lo < hi) {
      int mid = (lo + hi + 1) >>> 1;
      if (binEdges[mid] <= tof) {
        lo = mid;
      } else {
        hi = mid - 1;
      }
    }
    return lo;
  }
}
