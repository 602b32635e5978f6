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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a {@link GroupMap} against the workspace it will be applied to and records which rows it uses.  Groups
 * that ended up with no rows are dropped.  A row that appears in more than one group is allowed and logged.
 */
public class RowIndexResolver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RowIndexResolver.class);

  private final int numberOfRows;

  public RowIndexResolver(int numberOfRows) {
    this.numberOfRows = numberOfRows;
  }

  /**
   * @param groups The groups read from a grouping source.
   * @return The non-empty groups, in their original order, and the set of rows they use.
   * @throws SpectrumRangeException If any group names a row outside the workspace.
   * @throws GroupingConfigurationException If no group has any rows.
   */
  public ResolvedGrouping resolve(GroupMap groups) {
    UsedRowSet usedRows = new UsedRowSet(numberOfRows);
    List<SpectrumGroup> kept = new ArrayList<>(groups.size());
    int reused = 0;

    for (SpectrumGroup group : groups) {
      if (group.isEmpty()) {
        LOGGER.warn("Group %d contains no spectra and will not appear in the output", group.getKey());
        continue;
      }
      for (Integer row : group.getRowIndices()) {
        if (row < 0 || row >= numberOfRows) {
          String msg = String.format("Row index %d in group %d is out of range for a workspace with %d spectra",
              row, group.getKey(), numberOfRows);
          LOGGER.error(msg);
          throw new SpectrumRangeException(msg, row);
        }
        if (!usedRows.markUsed(row)) {
          LOGGER.warn("Row %d is included in more than one group, group %d uses it again", row, group.getKey());
          reused++;
        }
      }
      kept.add(group);
    }

    if (kept.isEmpty()) {
      String msg = "None of the groups contain any spectra, nothing to group";
      LOGGER.error(msg);
      throw new GroupingConfigurationException(msg);
    }
    if (reused > 0) {
      LOGGER.warn("%d rows were used by more than one group", reused);
    }
    LOGGER.debug("%d groups use %d of %d rows", kept.size(), usedRows.countUsed(), numberOfRows);
    return new ResolvedGrouping(new GroupMap(kept), usedRows);
  }
}
