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

package com.act.spectra.io;

import com.act.spectra.TestWorkspaces;
import com.act.spectra.model.EventSpectrum;
import com.act.spectra.model.GroupingWorkspace;
import com.act.spectra.model.HistogramSpectrum;
import com.act.spectra.model.RepresentationKind;
import com.act.spectra.model.Workspace;
import org.junit.Test;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class WorkspaceSerializerTest {

  @Test
  public void testReadsHistogramFixture() throws Exception {
    Workspace workspace;
    try (InputStream is = WorkspaceSerializerTest.class.getResourceAsStream("/com/act/spectra/five_rows.json")) {
      workspace = WorkspaceSerializer.readWorkspace(is);
    }

    assertEquals(RepresentationKind.HISTOGRAM, workspace.getKind());
    assertEquals(5, workspace.getNumberOfSpectra());
    HistogramSpectrum row = (HistogramSpectrum) workspace.getSpectrum(3);
    assertEquals(Integer.valueOf(3), row.getSpectrumNumber());
    assertEquals(Arrays.asList(3), new ArrayList<>(row.getDetectorIds()));
    assertEquals(5, row.getNumberOfBins());
    assertArrayEquals(new double[]{0.0, 1.0, 2.0, 3.0, 4.0, 5.0}, row.getX(), 0.0);
  }

  @Test
  public void testEventWorkspaceKeepsEventsAndMasks() throws Exception {
    Workspace original = TestWorkspaces.unitEvents(2, 3);
    original.getSpectrum(1).setDetectorMasked(true);

    Workspace copy = WorkspaceSerializer.fromJson(WorkspaceSerializer.toJson(original));

    assertEquals(RepresentationKind.EVENT, copy.getKind());
    assertArrayEquals(original.getBinEdges(), copy.getBinEdges(), 0.0);
    EventSpectrum row = (EventSpectrum) copy.getSpectrum(1);
    assertTrue(row.isDetectorMasked());
    assertEquals(3, row.getNumberOfEvents());
    assertEquals(2.5, row.getEvents().get(2).getTof(), 0.0);
  }

  @Test
  public void testMaskedBinsSurvive() throws Exception {
    Workspace original = TestWorkspaces.unitHistograms(1, 4, 1, 1);
    ((HistogramSpectrum) original.getSpectrum(0)).maskBin(2);

    Workspace copy = WorkspaceSerializer.fromJson(WorkspaceSerializer.toJson(original));
    assertTrue(((HistogramSpectrum) copy.getSpectrum(0)).isBinMasked(2));
  }

  @Test
  public void testGroupingWorkspaceFromHistogramWorkspace() throws Exception {
    GroupingWorkspace original = new GroupingWorkspace(
        Arrays.asList(3, 0), Arrays.asList(Arrays.asList(10, 11), Arrays.asList(12)));

    GroupingWorkspace copy = GroupingWorkspace.fromWorkspace(
        WorkspaceSerializer.fromJson(WorkspaceSerializer.toJson(original)));
    assertEquals(3, copy.getGroupId(0));
    assertEquals(0, copy.getGroupId(1));
    assertEquals(Arrays.asList(10, 11), new ArrayList<>(copy.getSpectrum(0).getDetectorIds()));
  }
}
