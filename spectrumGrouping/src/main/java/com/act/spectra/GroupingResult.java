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

package com.act.spectra;

import com.act.spectra.grouping.GroupMap;
import com.act.spectra.model.Workspace;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The outcome of one grouping job.  The output workspace is only present when the job finished in
 * {@link GroupingState#DONE}.
 */
public class GroupingResult {
  private final GroupingState state;
  private final Workspace output;
  private final GroupMap groupMap;
  private final List<List<Integer>> sourceRows;

  private GroupingResult(GroupingState state, Workspace output, GroupMap groupMap, List<List<Integer>> sourceRows) {
    this.state = state;
    this.output = output;
    this.groupMap = groupMap;
    this.sourceRows = sourceRows;
  }

  /**
   * @param sourceRows For every output row, the input rows it was made from.
   */
  public static GroupingResult done(Workspace output, GroupMap groupMap, List<List<Integer>> sourceRows) {
    return new GroupingResult(GroupingState.DONE, output, groupMap, Collections.unmodifiableList(sourceRows));
  }

  public static GroupingResult cancelled(GroupMap groupMap) {
    return new GroupingResult(GroupingState.CANCELLED, null, groupMap, Collections.emptyList());
  }

  public GroupingState getState() {
    return state;
  }

  public Optional<Workspace> getOutput() {
    return Optional.ofNullable(output);
  }

  /**
   * @return The validated groups, or null if cancelled before they were resolved.
   */
  public GroupMap getGroupMap() {
    return groupMap;
  }

  public List<List<Integer>> getSourceRows() {
    return sourceRows;
  }
}
