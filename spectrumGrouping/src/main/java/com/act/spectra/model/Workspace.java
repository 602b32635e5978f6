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
import java.util.Collections;
import java.util.List;

/**
 * An ordered collection of spectra of one representation kind.  A spectrum's position in this list is its row
 * index, the fundamental (0-based, contiguous, stable) addressing scheme used throughout the grouping code.
 *
 * Event workspaces additionally carry the bin edges used when their events are histogrammed.
 */
public class Workspace {
  @JsonProperty("kind")
  private RepresentationKind kind;

  // Only meaningful for event workspaces; histogram spectra carry their own bin edges.
  @JsonProperty("bin_edges")
  private double[] binEdges;

  @JsonProperty("spectra")
  private List<Spectrum> spectra = new ArrayList<>();

  protected Workspace() {
  }

  public Workspace(RepresentationKind kind, List<? extends Spectrum> spectra) {
    this(kind, null, spectra);
  }

  public Workspace(RepresentationKind kind, double[] binEdges, List<? extends Spectrum> spectra) {
    this.kind = kind;
    this.binEdges = binEdges;
    this.spectra.addAll(spectra);
  }

  public RepresentationKind getKind() {
    return kind;
  }

  public double[] getBinEdges() {
    return binEdges;
  }

  public List<Spectrum> getSpectra() {
    return Collections.unmodifiableList(spectra);
  }

  public Spectrum getSpectrum(int index) {
    return spectra.get(index);
  }

  @JsonIgnore
  public int getNumberOfSpectra() {
    return spectra.size();
  }
}
