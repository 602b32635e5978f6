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

package com.act.spectra.progress;

/**
 * Receives progress updates from a long running grouping job and tells it when to stop.
 */
public interface ProgressReporter {
  ProgressReporter NONE = new ProgressReporter() {
    @Override
    public void reportProgress(double fraction) {
    }

    @Override
    public boolean isCancelled() {
      return false;
    }
  };

  /**
   * @param fraction The fraction of the job completed so far, in [0, 1].  Never decreases over one job.
   */
  void reportProgress(double fraction);

  /**
   * Polled at every interruption point.
   * @return True if the job should abandon its work.
   */
  boolean isCancelled();
}
