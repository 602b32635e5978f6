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
import com.act.spectra.model.Workspace;
import com.act.spectra.progress.GroupingProgress;
import com.act.spectra.progress.ProgressReporter;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class GroupingPatternParserTest {

  private Workspace workspace;
  private GroupingPatternParser parser;

  @Before
  public void setUp() {
    // Spectrum numbers 101-110 in rows 0-9.
    workspace = TestWorkspaces.unitHistograms(10, 1, 101, 1);
    parser = new GroupingPatternParser(workspace);
  }

  @Test
  public void testPatternElements() {
    List<List<Integer>> groups = parser.parse("0, 1+3, 4-6, 7:9");

    assertEquals(6, groups.size());
    assertEquals(Arrays.asList(0), groups.get(0));
    assertEquals(Arrays.asList(1, 3), groups.get(1));
    assertEquals(Arrays.asList(4, 5, 6), groups.get(2));
    assertEquals(Arrays.asList(7), groups.get(3));
    assertEquals(Arrays.asList(8), groups.get(4));
    assertEquals(Arrays.asList(9), groups.get(5));
  }

  @Test
  public void testPlusTermsMayBeRanges() {
    List<List<Integer>> groups = parser.parse("1-3+7");
    assertEquals(1, groups.size());
    assertEquals(Arrays.asList(1, 2, 3, 7), groups.get(0));
  }

  @Test
  public void testConvertsToMapFileText() {
    List<String> lines = parser.toMapFileLines("2+0,5-6");
    // Groups are numbered with the spectrum number of their first row.
    assertEquals(Arrays.asList("2", "103", "2", "2 0", "106", "2", "5 6"), lines);
  }

  @Test
  public void testPatternSourceReadsThroughMapFileReader() {
    PatternGroupingSource source = new PatternGroupingSource("2+0, 3:4");
    GroupMap groups = source.read(workspace, new WorkspaceIdentifierMaps(workspace),
        new GroupingProgress(ProgressReporter.NONE)).get();

    assertEquals(Arrays.asList(103, 104, 105), groups.getKeys());
    assertEquals(Arrays.asList(2, 0), groups.getGroups().get(0).getRowIndices());
    assertEquals(Arrays.asList(3), groups.getGroups().get(1).getRowIndices());
    assertEquals(Arrays.asList(4), groups.getGroups().get(2).getRowIndices());
  }

  @Test(expected = SpectrumRangeException.class)
  public void testIndexBeyondWorkspace() {
    parser.parse("1,10");
  }

  @Test
  public void testHugeUpperBoundIsOutOfRange() {
    for (String pattern : Arrays.asList("0-2147483647", "0:2147483647", "0-1000000000", "1+3-2147483647")) {
      try {
        parser.parse(pattern);
      } catch (SpectrumRangeException e) {
        assertTrue(e.getMessage().contains("out of range"));
        continue;
      }
      throw new AssertionError("Expected a SpectrumRangeException for " + pattern);
    }
  }

  @Test(expected = SpectrumRangeException.class)
  public void testBackwardsRange() {
    parser.parse("5-3");
  }

  @Test(expected = GroupingConfigurationException.class)
  public void testEmptyElement() {
    parser.parse("1,,2");
  }

  @Test(expected = GroupingConfigurationException.class)
  public void testGarbage() {
    parser.parse("1+a");
  }

  @Test(expected = GroupingConfigurationException.class)
  public void testBlankPattern() {
    parser.parse("  ");
  }
}
