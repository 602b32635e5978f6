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

import com.act.spectra.index.IdentifierMaps;
import com.act.spectra.model.Workspace;
import com.act.spectra.progress.GroupingProgress;
import com.act.spectra.progress.Outcome;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads groups from a grouping pattern by converting it to the flat group file format and reading that with the
 * usual {@link MapFileReader}.
 */
public class PatternGroupingSource implements GroupingSource {
  private final String pattern;

  public PatternGroupingSource(String pattern) {
    this.pattern = pattern;
  }

  @Override
  public Outcome<GroupMap> read(Workspace workspace, IdentifierMaps identifierMaps, GroupingProgress progress) {
    List<String> lines = new GroupingPatternParser(workspace).toMapFileLines(pattern);

    // The converted text lists row indices, so members translate to themselves.
    Map<Integer, Integer> identity = new HashMap<>(workspace.getNumberOfSpectra());
    for (int i = 0; i < workspace.getNumberOfSpectra(); i++) {
      identity.put(i, i);
    }
    MapFileReader reader = new MapFileReader("grouping pattern", identity, workspace.getNumberOfSpectra(), progress);
    return reader.read(lines, false);
  }

  @Override
  public String describe() {
    return String.format("grouping pattern \"%s\"", pattern);
  }
}
