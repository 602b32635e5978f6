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
import com.act.spectra.model.TofEvent;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EventCombinerTest {

  private static EventSpectrum row(int spectrumNumber, int detectorId, double... tofs) {
    EventSpectrum spectrum = new EventSpectrum(spectrumNumber, Collections.singletonList(detectorId));
    for (double tof : tofs) {
      spectrum.addEvents(Collections.singletonList(new TofEvent(tof)));
    }
    return spectrum;
  }

  @Test
  public void testEventsAreAppendedInRowOrder() {
    CombinedEvents combined = new EventCombiner(GroupingBehaviour.SUM).combine(Arrays.asList(
        row(1, 10, 5.0, 1.0), row(2, 20, 3.0)));

    EventSpectrum spectrum = combined.getSpectrum();
    assertEquals(3, spectrum.getNumberOfEvents());
    assertEquals(5.0, spectrum.getEvents().get(0).getTof(), 0.0);
    assertEquals(1.0, spectrum.getEvents().get(1).getTof(), 0.0);
    assertEquals(3.0, spectrum.getEvents().get(2).getTof(), 0.0);
    assertEquals(Arrays.asList(10, 20), Arrays.asList(spectrum.getDetectorIds().toArray()));
    assertFalse(combined.isScalingRequired());
  }

  @Test
  public void testAverageRequestsScaling() {
    CombinedEvents combined = new EventCombiner(GroupingBehaviour.AVERAGE).combine(Arrays.asList(
        row(1, 10, 1.0), row(2, 20, 2.0), row(3, 30, 3.0)));

    assertEquals(3, combined.getNonMaskedRowCount());
    assertTrue(combined.isScalingRequired());
  }

  @Test
  public void testMaskedRowsContributeEventsButNotCount() {
    EventSpectrum masked = row(2, 20, 2.0);
    masked.setDetectorMasked(true);
    CombinedEvents combined = new EventCombiner(GroupingBehaviour.AVERAGE).combine(Arrays.asList(
        row(1, 10, 1.0), masked));

    assertEquals(2, combined.getSpectrum().getNumberOfEvents());
    assertEquals(1, combined.getNonMaskedRowCount());
    assertFalse(combined.isScalingRequired());
  }

  @Test
  public void testCountIsNeverZero() {
    EventSpectrum a = row(1, 10, 1.0);
    a.setDetectorMasked(true);
    EventSpectrum b = row(2, 20, 2.0);
    b.setDetectorMasked(true);
    CombinedEvents combined = new EventCombiner(GroupingBehaviour.AVERAGE).combine(Arrays.asList(a, b));

    assertEquals(1, combined.getNonMaskedRowCount());
    assertTrue(combined.getSpectrum().isDetectorMasked());
  }

  @Test
  public void testSourceRowsAreNotModified() {
    EventSpectrum a = row(1, 10, 1.0);
    new EventCombiner(GroupingBehaviour.SUM).combine(Arrays.asList(a, row(2, 20, 2.0)));
    assertEquals(1, a.getNumberOfEvents());
  }
}
