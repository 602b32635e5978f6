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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A set of source row indices that will be combined into one output spectrum, identified by a group key.  Rows keep
 * the order in which they were added, and a row can only be added to a group once.
 */
public class SpectrumGroup {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumGroup.class);

  private final int key;
  private final LinkedHashSet<Integer> rowIndices = new LinkedHashSet<>();

  public SpectrumGroup(int key) {
    this.key = key;
  }

  public int getKey() {
    return key;
  }

  /**
   * Adds a row to this group.  Adding a row that is already a member is ignored with a warning.
   * @param rowIndex The source row index.
   * @return True if the row was added, false if it was already in the group.
   */
  public boolean add(int rowIndex) {
    if (!rowIndices.add(rowIndex)) {
      LOGGER.warn("Row %d is listed more than once in group %d, ignoring the repeat", rowIndex, key);
      return false;
    }
    return true;
  }

  public boolean contains(int rowIndex) {
    return rowIndices.contains(rowIndex);
  }

  public List<Integer> getRowIndices() {
    return Collections.unmodifiableList(new ArrayList<>(rowIndices));
  }

  public int size() {
    return rowIndices.size();
  }

  public boolean isEmpty() {
    return rowIndices.isEmpty();
  }
}
