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
import com.act.spectra.index.IdentifierMaps;
import com.act.spectra.index.WorkspaceIdentifierMaps;
import com.act.spectra.model.Workspace;
import com.act.spectra.progress.GroupingProgress;
import com.act.spectra.progress.ProgressReporter;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class ExplicitListGroupingSourceTest {

  private static final List<Integer> NONE = Collections.emptyList();

  private Workspace workspace;
  private IdentifierMaps identifierMaps;

  @Before
  public void setUp() {
    // Spectrum numbers 1-6 and detectors 100-105 in rows 0-5.
    workspace = TestWorkspaces.unitHistograms(6, 1, 1, 100);
    identifierMaps = new WorkspaceIdentifierMaps(workspace);
  }

  private GroupMap read(List<Integer> spectra, List<Integer> detectors, List<Integer> indices) {
    return new ExplicitListGroupingSource(spectra, detectors, indices)
        .read(workspace, identifierMaps, new GroupingProgress(ProgressReporter.NONE)).get();
  }

  @Test
  public void testSpectrumNumbers() {
    GroupMap groups = read(Arrays.asList(1, 3), NONE, NONE);
    assertEquals(Collections.singletonList(0), groups.getKeys());
    assertEquals(Arrays.asList(0, 2), groups.getGroups().get(0).getRowIndices());
  }

  @Test
  public void testDetectorIds() {
    GroupMap groups = read(NONE, Arrays.asList(104, 101), NONE);
    assertEquals(Arrays.asList(4, 1), groups.getGroups().get(0).getRowIndices());
  }

  @Test
  public void testRowIndices() {
    GroupMap groups = read(NONE, NONE, Arrays.asList(0, 2, 3));
    assertEquals(Arrays.asList(0, 2, 3), groups.getGroups().get(0).getRowIndices());
  }

  @Test
  public void testSpectrumNumbersWinOverOtherLists() {
    GroupMap groups = read(Arrays.asList(2), Arrays.asList(104), Arrays.asList(5));
    assertEquals(Arrays.asList(1), groups.getGroups().get(0).getRowIndices());
  }

  @Test
  public void testRepeatedValuesAreIgnored() {
    GroupMap groups = read(NONE, NONE, Arrays.asList(3, 3, 1));
    assertEquals(Arrays.asList(3, 1), groups.getGroups().get(0).getRowIndices());
  }

  @Test(expected = SpectrumRangeException.class)
  public void testRowIndexAtRowCount() {
    read(NONE, NONE, Arrays.asList(0, 6));
  }

  @Test(expected = SpectrumRangeException.class)
  public void testNegativeRowIndex() {
    read(NONE, NONE, Arrays.asList(-1));
  }

  @Test(expected = SpectrumRangeException.class)
  public void testUnknownSpectrumNumber() {
    read(Arrays.asList(1, 99), NONE, NONE);
  }

  @Test(expected = SpectrumRangeException.class)
  public void testUnknownDetectorId() {
    read(NONE, Arrays.asList(7), NONE);
  }

  @Test(expected = GroupingConfigurationException.class)
  public void testAllListsEmpty() {
    read(NONE, NONE, NONE);
  }
}
