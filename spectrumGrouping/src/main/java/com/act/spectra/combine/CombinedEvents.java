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

import com.act.spectra.model.EventSpectrum;

/**
 * The result of combining the event rows of one group: the merged row plus the number of unmasked rows that went
 * into it, which an averaging pass divides the event weights by.
 */
public class CombinedEvents {
  private final EventSpectrum spectrum;
  private final int nonMaskedRowCount;
  private final boolean scalingRequired;

  public CombinedEvents(EventSpectrum spectrum, int nonMaskedRowCount, boolean scalingRequired) {
    this.spectrum = spectrum;
    this.nonMaskedRowCount = nonMaskedRowCount;
    this.scalingRequired = scalingRequired;
  }

  public EventSpectrum getSpectrum() {
    return spectrum;
  }

  public int getNonMaskedRowCount() {
    return nonMaskedRowCount;
  }

  /**
   * @return True if the weights still need dividing by {@link #getNonMaskedRowCount()}.
   */
  public boolean isScalingRequired() {
    return scalingRequired;
  }
}
