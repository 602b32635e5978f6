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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Marks which rows of a source workspace have been claimed by at least one group.
 */
public class UsedRowSet {
  private final int numberOfRows;
  private final BitSet used;

  public UsedRowSet(int numberOfRows) {
    this.numberOfRows = numberOfRows;
    this.used = new BitSet(numberOfRows);
  }

  /**
   * @return True if the row was not already marked.
   */
  public boolean markUsed(int rowIndex) {
    checkIndex(rowIndex);
    if (used.get(rowIndex)) {
      return false;
    }
    used.set(rowIndex);
    return true;
  }

  public boolean isUsed(int rowIndex) {
    checkIndex(rowIndex);
    return used.get(rowIndex);
  }

  public int getNumberOfRows() {
    return numberOfRows;
  }

  public int countUsed() {
    return used.cardinality();
  }

  public int countUnused() {
    return numberOfRows - used.cardinality();
  }

  /**
   * @return Every row index not claimed by any group, in ascending order.
   */
  public List<Integer> getUnusedIndices() {
    List<Integer> unused = new ArrayList<>(countUnused());
    for (int i = used.nextClearBit(0); i < numberOfRows; i = used.nextClearBit(i + 1)) {
      unused.add(i);
    }
    return unused;
  }

  private void checkIndex(int rowIndex) {
    if (rowIndex < 0 || rowIndex >= numberOfRows) {
      throw new IndexOutOfBoundsException(
          String.format("Row index %d is outside a workspace of %d rows", rowIndex, numberOfRows));
    }
  }
}
