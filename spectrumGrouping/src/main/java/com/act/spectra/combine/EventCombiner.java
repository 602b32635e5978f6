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

import java.util.List;
import java.util.TreeSet;

/**
 * Combines event rows by appending every row's events, in row order, to one output row.  Events are not re-sorted.
 * Masked rows still contribute their events but don't count towards the number of rows an average is taken over.
 */
public class EventCombiner {
  private final GroupingBehaviour behaviour;

  public EventCombiner(GroupingBehaviour behaviour) {
    this.behaviour = behaviour;
  }

  public CombinedEvents combine(List<EventSpectrum> rows) {
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("Cannot combine an empty group");
    }

    TreeSet<Integer> detectorIds = new TreeSet<>();
    for (EventSpectrum row : rows) {
      detectorIds.addAll(row.getDetectorIds());
    }
    EventSpectrum combined = new EventSpectrum(null, detectorIds);

    int nonMasked = 0;
    for (EventSpectrum row : rows) {
      combined.addEvents(row.getEvents());
      if (!row.isDetectorMasked()) {
        nonMasked++;
      }
    }
    combined.setDetectorMasked(nonMasked == 0);
    if (rows.size() == 1) {
      combined.setSpectrumNumber(rows.get(0).getSpectrumNumber());
    }

    // Never divide by zero.
    int count = Math.max(1, nonMasked);
    return new CombinedEvents(combined, count, behaviour == GroupingBehaviour.AVERAGE && count > 1);
  }

  public GroupingBehaviour getBehaviour() {
    return behaviour;
  }
}
