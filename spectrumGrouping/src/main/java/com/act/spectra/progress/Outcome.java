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

import java.util.NoSuchElementException;

/**
 * The result of a stage that may be cancelled part way through: either a value, or a marker saying the stage was
 * abandoned.  Cancelled stages never hand back partial results.
 * @param <T> The type of the value a completed stage produces.
 */
public final class Outcome<T> {
  private static final Outcome<?> CANCELLED = new Outcome<>(null, true);

  private final T value;
  private final boolean cancelled;

  private Outcome(T value, boolean cancelled) {
    this.value = value;
    this.cancelled = cancelled;
  }

  public static <T> Outcome<T> of(T value) {
    if (value == null) {
      throw new IllegalArgumentException("Completed outcomes must carry a value");
    }
    return new Outcome<>(value, false);
  }

  @SuppressWarnings("unchecked")
  public static <T> Outcome<T> cancelled() {
    return (Outcome<T>) CANCELLED;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public T get() {
    if (cancelled) {
      throw new NoSuchElementException("Stage was cancelled and produced no value");
    }
    return value;
  }
}
