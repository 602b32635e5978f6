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

package com.act.spectra.grouping;

import com.act.spectra.TestWorkspaces;
import com.act.spectra.index.WorkspaceIdentifierMaps;
import com.act.spectra.model.GroupingWorkspace;
import com.act.spectra.model.HistogramSpectrum;
import com.act.spectra.model.RepresentationKind;
import com.act.spectra.model.Spectrum;
import com.act.spectra.model.Workspace;
import com.act.spectra.progress.GroupingProgress;
import com.act.spectra.progress.ProgressReporter;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TemplateGroupingSourceTest {

  private Workspace workspace;

  @Before
  public void setUp() {
    // Detectors 100-105 in rows 0-5.
    workspace = TestWorkspaces.unitHistograms(6, 1, 1, 100);
  }

  private GroupMap read(Workspace template) {
    return new TemplateGroupingSource(template).read(workspace, new WorkspaceIdentifierMaps(workspace),
        new GroupingProgress(ProgressReporter.NONE)).get();
  }

  @Test
  public void testGroupingWorkspacePoolsRowsByGroupId() {
    GroupingWorkspace template = new GroupingWorkspace(
        Arrays.asList(2, 1, 0, 2),
        Arrays.asList(Arrays.asList(101, 100), Arrays.asList(103), Arrays.asList(104), Arrays.asList(105, 999)));
    GroupMap groups = read(template);

    // Ascending group ids; group 0 means ungrouped and detector 999 doesn't exist.
    assertEquals(Arrays.asList(1, 2), groups.getKeys());
    assertEquals(Arrays.asList(3), groups.getGroups().get(0).getRowIndices());
    assertEquals(Arrays.asList(0, 1, 5), groups.getGroups().get(1).getRowIndices());
  }

  @Test
  public void testGroupingWorkspaceMayReuseRows() {
    GroupingWorkspace template = new GroupingWorkspace(
        Arrays.asList(1, 2), Arrays.asList(Arrays.asList(100), Arrays.asList(100, 101)));
    GroupMap groups = read(template);

    assertTrue(groups.getGroups().get(0).contains(0));
    assertTrue(groups.getGroups().get(1).contains(0));
  }

  @Test
  public void testPlainTemplateUsesMultiDetectorRows() {
    List<Spectrum> rows = Arrays.asList(
        new HistogramSpectrum(1, Arrays.asList(100, 101, 102), new double[]{0, 1}, new double[]{0}, new double[]{0}),
        new HistogramSpectrum(2, Arrays.asList(103), new double[]{0, 1}, new double[]{0}, new double[]{0}),
        new HistogramSpectrum(3, Arrays.asList(104, 105), new double[]{0, 1}, new double[]{0}, new double[]{0}));
    GroupMap groups = read(new Workspace(RepresentationKind.HISTOGRAM, rows));

    // Template row 1 has a single detector, so it isn't a group.
    assertEquals(Arrays.asList(0, 2), groups.getKeys());
    assertEquals(Arrays.asList(0, 1, 2), groups.getGroups().get(0).getRowIndices());
    assertEquals(Arrays.asList(4, 5), groups.getGroups().get(1).getRowIndices());
  }

  @Test
  public void testCancellation() {
    ProgressReporter reporter = Mockito.mock(ProgressReporter.class);
    Mockito.when(reporter.isCancelled()).thenReturn(true);
    GroupingWorkspace template = new GroupingWorkspace(Arrays.asList(1), Arrays.asList(Arrays.asList(100)));

    assertTrue(new TemplateGroupingSource(template)
        .read(workspace, new WorkspaceIdentifierMaps(workspace), new GroupingProgress(reporter)).isCancelled());
  }
}
