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
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One row of a workspace.  Every spectrum owns a set of detector ids and (optionally) an externally visible
 * spectrum number, which is distinct from its position in the workspace (its row index).
 *
 * Concrete subclasses hold either dense histogram data ({@link HistogramSpectrum}) or a list of events
 * ({@link EventSpectrum}).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = HistogramSpectrum.class, name = "histogram"),
    @JsonSubTypes.Type(value = EventSpectrum.class, name = "event")
})
public abstract class Spectrum implements Serializable {
  private static final long serialVersionUID = -2272378154360922018L;

  // Null means the spectrum has no spectrum number.
  @JsonProperty("spectrum_number")
  private Integer spectrumNumber;

  @JsonProperty("detector_ids")
  private SortedSet<Integer> detectorIds = new TreeSet<>();

  /* Set when every detector feeding this spectrum has been masked out.  Masked spectra still appear in the output,
   * but they do not contribute to combined values. */
  @JsonProperty("detector_masked")
  private boolean detectorMasked = false;

  protected Spectrum() {
  }

  protected Spectrum(Integer spectrumNumber, Collection<Integer> detectorIds) {
    this.spectrumNumber = spectrumNumber;
    if (detectorIds != null) {
      this.detectorIds.addAll(detectorIds);
    }
  }

  @JsonIgnore
  public abstract RepresentationKind getKind();

  /**
   * Makes a deep copy of this spectrum, including its identifiers and masking flags.
   */
  public abstract Spectrum copy();

  public Integer getSpectrumNumber() {
    return spectrumNumber;
  }

  public void setSpectrumNumber(Integer spectrumNumber) {
    this.spectrumNumber = spectrumNumber;
  }

  public SortedSet<Integer> getDetectorIds() {
    return Collections.unmodifiableSortedSet(detectorIds);
  }

  public void addDetectorIds(Collection<Integer> ids) {
    this.detectorIds.addAll(ids);
  }

  public void clearDetectorIds() {
    this.detectorIds.clear();
  }

  public boolean isDetectorMasked() {
    return detectorMasked;
  }

  public void setDetectorMasked(boolean detectorMasked) {
    this.detectorMasked = detectorMasked;
  }

  protected void copyIdentifiersTo(Spectrum other) {
    other.spectrumNumber = this.spectrumNumber;
    other.detectorIds = new TreeSet<>(this.detectorIds);
    other.detectorMasked = this.detectorMasked;
  }
}
