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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A dense spectrum: bin edges (X), counts (Y) and errors (E).  X has either one more element than Y (histogram
 * data) or the same number (point data).
 *
 * Individual bins can be masked; a masked bin keeps its value but is left out when this spectrum is combined with
 * others.
 */
public class HistogramSpectrum extends Spectrum {
  private static final long serialVersionUID = 7007512553601914265L;

  @JsonProperty("x")
  private double[] x;

  @JsonProperty("y")
  private double[] y;

  @JsonProperty("e")
  private double[] e;

  @JsonProperty("masked_bins")
  private SortedSet<Integer> maskedBins = new TreeSet<>();

  protected HistogramSpectrum() {
  }

  public HistogramSpectrum(Integer spectrumNumber, Collection<Integer> detectorIds, double[] x, double[] y,
                           double[] e) {
    super(spectrumNumber, detectorIds);
    if (y.length != e.length) {
      throw new IllegalArgumentException(
          String.format("Mismatched counts and error lengths: %d vs %d", y.length, e.length));
    }
    if (x.length != y.length + 1 && x.length != y.length) {
      throw new IllegalArgumentException(
          String.format("Expected %d or %d bin edges for %d bins, but found %d",
              y.length + 1, y.length, y.length, x.length));
    }
    this.x = x;
    this.y = y;
    this.e = e;
  }

  @Override
  @JsonIgnore
  public RepresentationKind getKind() {
    return RepresentationKind.HISTOGRAM;
  }

  @Override
  public HistogramSpectrum copy() {
    HistogramSpectrum copy = new HistogramSpectrum();
    copyIdentifiersTo(copy);
    copy.x = Arrays.copyOf(x, x.length);
    copy.y = Arrays.copyOf(y, y.length);
    copy.e = Arrays.copyOf(e, e.length);
    copy.maskedBins = new TreeSet<>(maskedBins);
    return copy;
  }

  public double[] getX() {
    return x;
  }

  public double[] getY() {
    return y;
  }

  public double[] getE() {
    return e;
  }

  @JsonIgnore
  public int getNumberOfBins() {
    return y.length;
  }

  public SortedSet<Integer> getMaskedBins() {
    return Collections.unmodifiableSortedSet(maskedBins);
  }

  @JsonIgnore
  public boolean isBinMasked(int bin) {
    return maskedBins.contains(bin);
  }

  public void maskBin(int bin) {
    if (bin < 0 || bin >= y.length) {
      throw new IndexOutOfBoundsException(
          String.format("Cannot mask bin %d of a spectrum with %d bins", bin, y.length));
    }
    maskedBins.add(bin);
  }
}
