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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A single weighted neutron event: a time-of-flight, a weight and the square of the weight's error.  Unweighted
 * events carry a weight and squared error of 1.
 */
public class TofEvent implements Serializable {
  private static final long serialVersionUID = 4812209335517740513L;

  @JsonProperty("tof")
  private Double tof;

  @JsonProperty("weight")
  private Double weight;

  @JsonProperty("error_squared")
  private Double errorSquared;

  public TofEvent(Double tof) {
    this(tof, 1.0, 1.0);
  }

  public TofEvent(Double tof, Double weight, Double errorSquared) {
    this.tof = tof;
    this.weight = weight;
    this.errorSquared = errorSquared;
  }

  public TofEvent() {}

  public Double getTof() {
    return tof;
  }

  public Double getWeight() {
    return weight;
  }

  public Double getErrorSquared() {
    return errorSquared;
  }

  /**
   * Returns a copy of this event with its weight multiplied by factor and its squared error by factor^2.
   */
  public TofEvent scale(double factor) {
    return new TofEvent(tof, weight * factor, errorSquared * factor * factor);
  }
}
