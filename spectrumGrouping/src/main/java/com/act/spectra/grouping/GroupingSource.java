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

import java.io.IOException;

/**
 * One of the ways a grouping can be described.  Every source produces the same {@link GroupMap} of source row
 * indices; validating those indices is left to {@link RowIndexResolver}.
 */
public interface GroupingSource {
  /**
   * @param workspace The workspace whose rows are being grouped.
   * @param identifierMaps Spectrum number and detector id lookups for workspace.
   * @param progress Progress for this job; implementations check it for cancellation as they go.
   * @return The groups in output order, or a cancelled outcome.
   * @throws IOException If a group file can't be read.
   */
  Outcome<GroupMap> read(Workspace workspace, IdentifierMaps identifierMaps, GroupingProgress progress)
      throws IOException;

  /**
   * @return A short human readable description, used in log messages.
   */
  String describe();
}
