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

package com.act.spectra.assembly;

import com.act.spectra.GroupingState;
import com.act.spectra.combine.CombinedEvents;
import com.act.spectra.combine.EventCombiner;
import com.act.spectra.combine.GroupingBehaviour;
import com.act.spectra.combine.SpectrumCombiner;
import com.act.spectra.grouping.ResolvedGrouping;
import com.act.spectra.grouping.SpectrumGroup;
import com.act.spectra.grouping.WorkspaceTypeMismatchException;
import com.act.spectra.model.EventSpectrum;
import com.act.spectra.model.HistogramSpectrum;
import com.act.spectra.model.RepresentationKind;
import com.act.spectra.model.Spectrum;
import com.act.spectra.model.Workspace;
import com.act.spectra.progress.GroupingProgress;
import com.act.spectra.progress.Outcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Builds the output workspace: one combined row per group, in group order, followed (if requested) by an unchanged
 * copy of every row no group used, in ascending row order.
 *
 * Combined rows are numbered with their group key, or 1, 2, 3... when sequential renumbering is on.  Copied rows
 * keep their own spectrum numbers.  Producing each output row is an interruption point; the progress left over
 * from earlier phases is shared evenly between output rows.
 */
public class OutputAssembler {
  private static final Logger LOGGER = LogManager.getFormatterLogger(OutputAssembler.class);

  private final GroupingBehaviour behaviour;
  private final boolean renumberSequentially;
  private final GroupingProgress progress;
  private final Consumer<GroupingState> stateListener;

  public OutputAssembler(GroupingBehaviour behaviour, boolean renumberSequentially, GroupingProgress progress) {
    this(behaviour, renumberSequentially, progress, null);
  }

  /**
   * @param stateListener Told when the job moves from combining groups to assembling the output.  May be null.
   */
  public OutputAssembler(GroupingBehaviour behaviour, boolean renumberSequentially, GroupingProgress progress,
                         Consumer<GroupingState> stateListener) {
    this.behaviour = behaviour;
    this.renumberSequentially = renumberSequentially;
    this.progress = progress;
    this.stateListener = stateListener == null ? s -> { } : stateListener;
  }

  /**
   * @param grouping Validated groups and the rows they use.
   * @param source The workspace being grouped.  It is not modified.
   * @param keepUngrouped True to copy rows that aren't in any group into the output.
   * @return The output workspace, or a cancelled outcome.
   * @throws WorkspaceTypeMismatchException If source isn't uniformly histogram or event data.
   */
  public Outcome<Workspace> assemble(ResolvedGrouping grouping, Workspace source, boolean keepUngrouped) {
    RepresentationKind kind = source.getKind();
    if (kind == null) {
      String msg = "The input workspace holds neither histogram nor event data";
      LOGGER.error(msg);
      throw new WorkspaceTypeMismatchException(msg);
    }

    List<Integer> passthroughRows = keepUngrouped ?
        grouping.getUsedRows().getUnusedIndices() : new ArrayList<>();
    int outputRows = grouping.getGroupMap().size() + passthroughRows.size();
    double step = (1.0 - progress.getFractionComplete()) / Math.max(1, outputRows);
    LOGGER.info("Creating %d output spectra from %d groups and %d ungrouped spectra",
        outputRows, grouping.getGroupMap().size(), passthroughRows.size());

    List<Spectrum> output = new ArrayList<>(outputRows);
    Outcome<List<CombinedEvents>> combined = kind == RepresentationKind.EVENT ?
        combineEventGroups(grouping, source, output, step) :
        combineHistogramGroups(grouping, source, output, step);
    if (combined.isCancelled()) {
      return Outcome.cancelled();
    }

    stateListener.accept(GroupingState.ASSEMBLING);
    int scaled = 0;
    for (CombinedEvents events : combined.get()) {
      if (events.isScalingRequired()) {
        events.getSpectrum().scaleWeights(1.0 / events.getNonMaskedRowCount());
        scaled++;
      }
    }
    if (scaled > 0) {
      LOGGER.debug("Divided the event weights of %d groups by their number of unmasked spectra", scaled);
    }

    for (Integer row : passthroughRows) {
      Spectrum original = checkKind(source, row, kind);
      output.add(original.copy());
      if (progress.advanceBy(step).isCancelled()) {
        return Outcome.cancelled();
      }
    }

    LOGGER.info("Output workspace has %d spectra", output.size());
    if (kind == RepresentationKind.EVENT) {
      return Outcome.of(new Workspace(kind, source.getBinEdges(), output));
    }
    return Outcome.of(new Workspace(kind, output));
  }

  private Outcome<List<CombinedEvents>> combineHistogramGroups(ResolvedGrouping grouping, Workspace source,
                                                               List<Spectrum> output, double step) {
    SpectrumCombiner combiner = new SpectrumCombiner(behaviour);
    int sequentialNumber = 1;
    for (SpectrumGroup group : grouping.getGroupMap()) {
      List<HistogramSpectrum> rows = new ArrayList<>(group.size());
      for (Integer row : group.getRowIndices()) {
        rows.add((HistogramSpectrum) checkKind(source, row, RepresentationKind.HISTOGRAM));
      }
      HistogramSpectrum spectrum = combiner.combine(rows);
      spectrum.setSpectrumNumber(renumberSequentially ? sequentialNumber++ : group.getKey());
      output.add(spectrum);
      if (progress.advanceBy(step).isCancelled()) {
        return Outcome.cancelled();
      }
    }
    return Outcome.of(new ArrayList<>());
  }

  private Outcome<List<CombinedEvents>> combineEventGroups(ResolvedGrouping grouping, Workspace source,
                                                           List<Spectrum> output, double step) {
    EventCombiner combiner = new EventCombiner(behaviour);
    List<CombinedEvents> combined = new ArrayList<>(grouping.getGroupMap().size());
    int sequentialNumber = 1;
    for (SpectrumGroup group : grouping.getGroupMap()) {
      List<EventSpectrum> rows = new ArrayList<>(group.size());
      for (Integer row : group.getRowIndices()) {
        rows.add((EventSpectrum) checkKind(source, row, RepresentationKind.EVENT));
      }
      CombinedEvents events = combiner.combine(rows);
      events.getSpectrum().setSpectrumNumber(renumberSequentially ? sequentialNumber++ : group.getKey());
      combined.add(events);
      output.add(events.getSpectrum());
      if (progress.advanceBy(step).isCancelled()) {
        return Outcome.cancelled();
      }
    }
    return Outcome.of(combined);
  }

  private static Spectrum checkKind(Workspace source, int row, RepresentationKind expected) {
    Spectrum spectrum = source.getSpectrum(row);
    if (spectrum.getKind() != expected) {
      LOGGER.error("Row %d of a %s workspace holds %s data", row, expected, spectrum.getKind());
      throw new WorkspaceTypeMismatchException(expected, spectrum.getKind(), row);
    }
    return spectrum;
  }
}
