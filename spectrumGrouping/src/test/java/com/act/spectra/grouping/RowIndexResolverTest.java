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

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RowIndexResolverTest {

  private static GroupMap groupsOf(int[]... rows) {
    GroupMap groups = new GroupMap();
    for (int i = 0; i < rows.length; i++) {
      SpectrumGroup group = groups.addGroup(i + 1);
      for (int row : rows[i]) {
        group.add(row);
      }
    }
    return groups;
  }

  @Test
  public void testMarksUsedRows() {
    ResolvedGrouping resolved = new RowIndexResolver(5).resolve(groupsOf(new int[]{0, 2}, new int[]{3}));

    assertEquals(Arrays.asList(1, 2), resolved.getGroupMap().getKeys());
    assertEquals(3, resolved.getUsedRows().countUsed());
    assertEquals(Arrays.asList(1, 4), resolved.getUsedRows().getUnusedIndices());
  }

  @Test
  public void testRowsMayBeReusedAcrossGroups() {
    ResolvedGrouping resolved = new RowIndexResolver(5).resolve(groupsOf(new int[]{0, 1}, new int[]{1, 2}));

    assertEquals(2, resolved.getGroupMap().size());
    assertTrue(resolved.getGroupMap().getGroups().get(1).contains(1));
    assertEquals(3, resolved.getUsedRows().countUsed());
  }

  @Test
  public void testEmptyGroupsAreDropped() {
    ResolvedGrouping resolved = new RowIndexResolver(5).resolve(groupsOf(new int[]{}, new int[]{4}));
    assertEquals(Arrays.asList(2), resolved.getGroupMap().getKeys());
  }

  @Test(expected = SpectrumRangeException.class)
  public void testIndexAtRowCount() {
    new RowIndexResolver(5).resolve(groupsOf(new int[]{0, 5}));
  }

  @Test(expected = SpectrumRangeException.class)
  public void testNegativeIndex() {
    new RowIndexResolver(5).resolve(groupsOf(new int[]{-2}));
  }

  @Test(expected = GroupingConfigurationException.class)
  public void testNothingToGroup() {
    new RowIndexResolver(5).resolve(groupsOf(new int[]{}, new int[]{}));
  }
}
