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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks the overall completion fraction of one grouping job and forwards it to a {@link ProgressReporter}.
 *
 * Each phase owns a fixed share of the [0, 1] range: checking the input's binning gets {@link #CHECKBINS}, opening
 * a group file {@link #OPENINGFILE}, reading it at most {@link #READFILE}, and combining/copying spectra gets
 * whatever is left.  Reported values are clamped to [0, 1] and never go backwards.
 *
 * Every call that reports progress is also an interruption point and returns whether the job should carry on.
 */
public class GroupingProgress {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GroupingProgress.class);

  public static final double CHECKBINS = 0.10;
  public static final double OPENINGFILE = 0.03;
  // if CHECKBINS + OPENINGFILE + 2 * READFILE > 1 then reading a file could report progress > 100%
  public static final double READFILE = 0.15;

  private final ProgressReporter reporter;
  private double fractionComplete = 0.0;
  private double lastReported = 0.0;

  public GroupingProgress(ProgressReporter reporter) {
    this.reporter = reporter;
  }

  public double getFractionComplete() {
    return fractionComplete;
  }

  /**
   * Moves the committed completion fraction forward to fraction (never backwards) and reports it.
   */
  public Continuation advanceTo(double fraction) {
    fractionComplete = clamp(Math.max(fractionComplete, fraction));
    return report(fractionComplete);
  }

  /**
   * Moves the committed completion fraction forward by delta and reports it.
   */
  public Continuation advanceBy(double delta) {
    return advanceTo(fractionComplete + delta);
  }

  /**
   * Reports progress through a file being read without committing it.  We don't know how many groups a file holds
   * until we've read it, so guess half as many groups as spectra; when there are more, the estimate keeps growing
   * but ever more slowly and never passes {@link #READFILE}.
   * @param groupsRead The number of groups read so far.
   * @param numberOfSpectra The number of spectra in the workspace being grouped.
   * @return The estimated fraction attributable to reading the file so far.
   */
  public double estimateFileRead(int groupsRead, int numberOfSpectra) {
    double estimate = 2.0 * groupsRead / Math.max(1, numberOfSpectra);
    return READFILE * estimate / (1.0 + estimate);
  }

  /**
   * Reports fractionComplete + uncommitted without changing the committed fraction.
   */
  public Continuation reportUncommitted(double uncommitted) {
    return report(clamp(fractionComplete + uncommitted));
  }

  /**
   * An interruption point that reports nothing.
   */
  public Continuation checkpoint() {
    if (reporter.isCancelled()) {
      LOGGER.info("Cancellation requested at %.1f%% complete", lastReported * 100.0);
      return Continuation.CANCEL;
    }
    return Continuation.CONTINUE;
  }

  private Continuation report(double fraction) {
    if (fraction > lastReported) {
      lastReported = fraction;
    }
    reporter.reportProgress(lastReported);
    return checkpoint();
  }

  private static double clamp(double fraction) {
    if (fraction < 0.0) {
      return 0.0;
    }
    return fraction > 1.0 ? 1.0 : fraction;
  }
}
