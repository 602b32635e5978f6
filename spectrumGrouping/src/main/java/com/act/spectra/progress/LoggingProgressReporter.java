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
 * Writes progress to the log every time another step (by default 10%) of the job completes.  Never cancels.
 */
public class LoggingProgressReporter implements ProgressReporter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(LoggingProgressReporter.class);
  private static final double DEFAULT_STEP = 0.1;

  private final double step;
  private double nextThreshold;

  public LoggingProgressReporter() {
    this(DEFAULT_STEP);
  }

  public LoggingProgressReporter(double step) {
    this.step = step;
    this.nextThreshold = step;
  }

  @Override
  public void reportProgress(double fraction) {
    if (fraction >= nextThreshold) {
      LOGGER.info("Grouping %.0f%% complete", fraction * 100.0);
      while (nextThreshold <= fraction) {
        nextThreshold += step;
      }
    }
  }

  @Override
  public boolean isCancelled() {
    return false;
  }
}
