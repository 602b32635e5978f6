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

import com.act.spectra.assembly.OutputAssembler;
import com.act.spectra.combine.GroupingBehaviour;
import com.act.spectra.grouping.GroupMap;
import com.act.spectra.grouping.GroupSpecParser;
import com.act.spectra.grouping.GroupingConfigurationException;
import com.act.spectra.grouping.GroupingParameters;
import com.act.spectra.grouping.ResolvedGrouping;
import com.act.spectra.grouping.RowIndexResolver;
import com.act.spectra.grouping.SpectrumGroup;
import com.act.spectra.grouping.SpectrumRangeParser;
import com.act.spectra.grouping.WorkspaceTypeMismatchException;
import com.act.spectra.index.IdentifierMaps;
import com.act.spectra.index.WorkspaceIdentifierMaps;
import com.act.spectra.io.FileSystemGroupFileLoader;
import com.act.spectra.io.GroupFileLoader;
import com.act.spectra.io.GroupingReportWriter;
import com.act.spectra.io.WorkspaceSerializer;
import com.act.spectra.model.EventSpectrum;
import com.act.spectra.model.HistogramSpectrum;
import com.act.spectra.model.RepresentationKind;
import com.act.spectra.model.Spectrum;
import com.act.spectra.model.Workspace;
import com.act.spectra.progress.GroupingProgress;
import com.act.spectra.progress.LoggingProgressReporter;
import com.act.spectra.progress.Outcome;
import com.act.spectra.progress.ProgressReporter;
import com.act.spectra.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Combines groups of spectra in a workspace into single spectra.  The grouping can come from a template workspace,
 * a group file (flat or XML), a grouping pattern or an explicit list; see {@link GroupingParameters}.
 *
 * One instance runs one job, moving through the states of {@link GroupingState}.  Parsing and resolving errors stop
 * the job before any output is built, and cancellation (polled through the {@link ProgressReporter}) discards
 * whatever output was in progress.
 */
public class GroupDetectors {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GroupDetectors.class);

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_OUTPUT = "o";
  public static final String OPTION_REPORT = "r";
  public static final String OPTION_MAP_FILE = "m";
  public static final String OPTION_PATTERN = "p";
  public static final String OPTION_SPECTRA_LIST = "s";
  public static final String OPTION_DETECTOR_LIST = "d";
  public static final String OPTION_INDEX_LIST = "w";
  public static final String OPTION_GROUPING_WORKSPACE = "g";
  public static final String OPTION_TEMPLATE_WORKSPACE = "t";
  public static final String OPTION_KEEP_UNGROUPED = "k";
  public static final String OPTION_BEHAVIOUR = "b";
  public static final String OPTION_USE_GROUP_NUMBERS = "n";
  public static final String OPTION_HISTOGRAM_EVENTS = "e";
  public static final String OPTION_RENUMBER = "q";
  public static final String OPTION_EXCLUDE_GROUPS = "x";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class combines groups of spectra in a JSON workspace into single spectra and writes the result as a ",
      "new JSON workspace.  Groups are read from exactly one of: a grouping or template workspace, a map file ",
      "(flat or .xml), a grouping pattern, or a list of spectrum numbers, detector ids or workspace indices."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("input workspace")
        .desc("A JSON workspace to group")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("output workspace")
        .desc("Where to write the grouped JSON workspace")
        .hasArg().required()
        .longOpt("output")
    );
    add(Option.builder(OPTION_REPORT)
        .argName("report file")
        .desc("Write a TSV summary of the output spectra and the input rows they came from")
        .hasArg()
        .longOpt("report")
    );
    add(Option.builder(OPTION_MAP_FILE)
        .argName("map file")
        .desc("A group file; files ending in .xml are read as XML grouping files")
        .hasArg()
        .longOpt("map-file")
    );
    add(Option.builder(OPTION_PATTERN)
        .argName("pattern")
        .desc("A grouping pattern over workspace indices, like 0+1,2-5,6:9")
        .hasArg()
        .longOpt("pattern")
    );
    add(Option.builder(OPTION_SPECTRA_LIST)
        .argName("spectrum numbers")
        .desc("Spectrum numbers to combine into one group, like 1,3-5")
        .hasArg()
        .longOpt("spectra")
    );
    add(Option.builder(OPTION_DETECTOR_LIST)
        .argName("detector ids")
        .desc("Detector ids whose spectra should be combined into one group, like 101-140")
        .hasArg()
        .longOpt("detectors")
    );
    add(Option.builder(OPTION_INDEX_LIST)
        .argName("workspace indices")
        .desc("Workspace indices to combine into one group, like 0,2,3")
        .hasArg()
        .longOpt("indices")
    );
    add(Option.builder(OPTION_GROUPING_WORKSPACE)
        .argName("grouping workspace")
        .desc("A JSON grouping workspace holding one group id per row (0 for ungrouped)")
        .hasArg()
        .longOpt("grouping-workspace")
    );
    add(Option.builder(OPTION_TEMPLATE_WORKSPACE)
        .argName("template workspace")
        .desc("A JSON workspace whose multi-detector rows define the groups")
        .hasArg()
        .longOpt("template-workspace")
    );
    add(Option.builder(OPTION_KEEP_UNGROUPED)
        .desc("Copy spectra that aren't in any group to the output")
        .longOpt("keep-ungrouped")
    );
    add(Option.builder(OPTION_BEHAVIOUR)
        .argName("behaviour")
        .desc("How to combine the spectra of a group: Sum (default) or Average")
        .hasArg()
        .longOpt("behaviour")
    );
    add(Option.builder(OPTION_USE_GROUP_NUMBERS)
        .desc("Use the group numbers in a flat map file instead of numbering groups 1, 2, 3...")
        .longOpt("use-group-numbers")
    );
    add(Option.builder(OPTION_HISTOGRAM_EVENTS)
        .desc("Histogram event data before grouping instead of keeping the events")
        .longOpt("histogram-events")
    );
    add(Option.builder(OPTION_RENUMBER)
        .desc("Number grouped spectra 1, 2, 3... instead of using their group numbers")
        .longOpt("renumber")
    );
    add(Option.builder(OPTION_EXCLUDE_GROUPS)
        .argName("group ids")
        .desc("Ids of groups in an XML grouping file to leave out, like 3,5-7")
        .hasArg()
        .longOpt("exclude-groups")
    );
  }};

  private final GroupingParameters parameters;
  private final GroupFileLoader loader;
  private final ProgressReporter reporter;
  private GroupingState state = GroupingState.IDLE;

  public GroupDetectors(GroupingParameters parameters) {
    this(parameters, new FileSystemGroupFileLoader(), new LoggingProgressReporter());
  }

  public GroupDetectors(GroupingParameters parameters, GroupFileLoader loader, ProgressReporter reporter) {
    this.parameters = parameters;
    this.loader = loader;
    this.reporter = reporter;
  }

  public GroupingState getState() {
    return state;
  }

  private void setState(GroupingState newState) {
    LOGGER.debug("Grouping job moving from %s to %s", state, newState);
    state = newState;
  }

  /**
   * Runs the grouping job.  The input workspace is only read.
   * @param input The workspace to group.
   * @return The result; its state is either DONE or CANCELLED.
   * @throws IOException If a group file can't be read.
   * @throws com.act.spectra.grouping.GroupingException On any grouping problem, after moving to FAILED.
   */
  public GroupingResult run(Workspace input) throws IOException {
    if (state != GroupingState.IDLE) {
      throw new IllegalStateException(String.format("A grouping job can only be run once, this one is %s", state));
    }
    GroupingProgress progress = new GroupingProgress(reporter);

    try {
      Workspace workspace = prepareInput(input);
      if (progress.advanceTo(GroupingProgress.CHECKBINS).isCancelled()) {
        return cancel(null);
      }

      setState(GroupingState.PARSING);
      IdentifierMaps identifierMaps = new WorkspaceIdentifierMaps(workspace);
      Outcome<GroupMap> groups = new GroupSpecParser(parameters, loader).parse(workspace, identifierMaps, progress);
      if (groups.isCancelled()) {
        return cancel(null);
      }

      setState(GroupingState.RESOLVING);
      ResolvedGrouping resolved = new RowIndexResolver(workspace.getNumberOfSpectra()).resolve(groups.get());

      setState(GroupingState.COMBINING);
      OutputAssembler assembler = new OutputAssembler(
          parameters.getBehaviour(), parameters.isRenumberSequentially(), progress, this::setState);
      Outcome<Workspace> output = assembler.assemble(resolved, workspace, parameters.isKeepUngrouped());
      if (output.isCancelled()) {
        return cancel(resolved.getGroupMap());
      }

      progress.advanceTo(1.0);
      setState(GroupingState.DONE);
      LOGGER.info("Grouped %d input spectra into %d output spectra",
          input.getNumberOfSpectra(), output.get().getNumberOfSpectra());
      return GroupingResult.done(output.get(), resolved.getGroupMap(), sourceRows(resolved));
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Grouping failed while %s: %s", state, e.getMessage());
      setState(GroupingState.FAILED);
      throw e;
    }
  }

  private GroupingResult cancel(GroupMap groups) {
    LOGGER.info("Grouping cancelled while %s, discarding partial output", state);
    setState(GroupingState.CANCELLED);
    return GroupingResult.cancelled(groups);
  }

  private List<List<Integer>> sourceRows(ResolvedGrouping resolved) {
    List<List<Integer>> rows = new ArrayList<>();
    for (SpectrumGroup group : resolved.getGroupMap()) {
      rows.add(new ArrayList<>(group.getRowIndices()));
    }
    if (parameters.isKeepUngrouped()) {
      for (Integer row : resolved.getUsedRows().getUnusedIndices()) {
        rows.add(Collections.singletonList(row));
      }
    }
    return rows;
  }

  /**
   * Checks the input can be grouped, histogramming event data first if events aren't to be preserved.
   */
  private Workspace prepareInput(Workspace input) {
    RepresentationKind kind = input.getKind();
    if (kind == null) {
      throw new WorkspaceTypeMismatchException("The input workspace holds neither histogram nor event data");
    }
    if (input.getNumberOfSpectra() == 0) {
      throw new GroupingConfigurationException("The input workspace contains no spectra, nothing to group");
    }

    if (kind == RepresentationKind.EVENT) {
      if (parameters.isPreserveEvents()) {
        return input;
      }
      double[] binEdges = input.getBinEdges();
      if (binEdges == null || binEdges.length < 2) {
        throw new GroupingConfigurationException(
            "Event data can only be histogrammed when the workspace has bin edges");
      }
      List<Spectrum> histograms = new ArrayList<>(input.getNumberOfSpectra());
      for (int i = 0; i < input.getNumberOfSpectra(); i++) {
        Spectrum s = input.getSpectrum(i);
        if (s.getKind() != RepresentationKind.EVENT) {
          throw new WorkspaceTypeMismatchException(RepresentationKind.EVENT, s.getKind(), i);
        }
        histograms.add(((EventSpectrum) s).toHistogram(binEdges));
      }
      LOGGER.info("Histogrammed %d event spectra into %d bins", histograms.size(), binEdges.length - 1);
      return new Workspace(RepresentationKind.HISTOGRAM, histograms);
    }

    checkCommonBins(input);
    return input;
  }

  private static void checkCommonBins(Workspace workspace) {
    double[] first = null;
    for (int i = 0; i < workspace.getNumberOfSpectra(); i++) {
      Spectrum s = workspace.getSpectrum(i);
      if (s.getKind() != RepresentationKind.HISTOGRAM) {
        throw new WorkspaceTypeMismatchException(RepresentationKind.HISTOGRAM, s.getKind(), i);
      }
      double[] x = ((HistogramSpectrum) s).getX();
      if (first == null) {
        first = x;
      } else if (x != first && !Arrays.equals(x, first)) {
        String msg = "Can only group if the histograms have common bin boundaries";
        LOGGER.error("%s: row %d differs from row 0", msg, i);
        throw new GroupingConfigurationException(msg);
      }
    }
  }

  /**
   * Translates parsed command line options into grouping parameters, loading any workspaces they name.
   */
  public static GroupingParameters parametersFromCommandLine(CommandLine cl) throws IOException {
    GroupingParameters.Builder builder = GroupingParameters.builder();

    if (cl.hasOption(OPTION_GROUPING_WORKSPACE)) {
      builder.setTemplateWorkspace(
          WorkspaceSerializer.readGroupingWorkspace(new File(cl.getOptionValue(OPTION_GROUPING_WORKSPACE))));
    } else if (cl.hasOption(OPTION_TEMPLATE_WORKSPACE)) {
      builder.setTemplateWorkspace(
          WorkspaceSerializer.readWorkspace(new File(cl.getOptionValue(OPTION_TEMPLATE_WORKSPACE))));
    }
    if (cl.hasOption(OPTION_MAP_FILE)) {
      builder.setMapFile(new File(cl.getOptionValue(OPTION_MAP_FILE)));
    }
    if (cl.hasOption(OPTION_PATTERN)) {
      builder.setGroupingPattern(cl.getOptionValue(OPTION_PATTERN));
    }
    if (cl.hasOption(OPTION_SPECTRA_LIST)) {
      builder.setSpectrumNumbers(SpectrumRangeParser.expand(cl.getOptionValue(OPTION_SPECTRA_LIST)));
    }
    if (cl.hasOption(OPTION_DETECTOR_LIST)) {
      builder.setDetectorIds(SpectrumRangeParser.expand(cl.getOptionValue(OPTION_DETECTOR_LIST)));
    }
    if (cl.hasOption(OPTION_INDEX_LIST)) {
      builder.setRowIndices(SpectrumRangeParser.expand(cl.getOptionValue(OPTION_INDEX_LIST)));
    }
    if (cl.hasOption(OPTION_EXCLUDE_GROUPS)) {
      builder.setExcludedGroupIds(SpectrumRangeParser.expand(cl.getOptionValue(OPTION_EXCLUDE_GROUPS)));
    }
    if (cl.hasOption(OPTION_BEHAVIOUR)) {
      try {
        builder.setBehaviour(GroupingBehaviour.fromName(cl.getOptionValue(OPTION_BEHAVIOUR)));
      } catch (IllegalArgumentException e) {
        throw new GroupingConfigurationException(e.getMessage(), e);
      }
    }

    return builder
        .setKeepUngrouped(cl.hasOption(OPTION_KEEP_UNGROUPED))
        .setIgnoreGroupNumber(!cl.hasOption(OPTION_USE_GROUP_NUMBERS))
        .setPreserveEvents(!cl.hasOption(OPTION_HISTOGRAM_EVENTS))
        .setRenumberSequentially(cl.hasOption(OPTION_RENUMBER))
        .build();
  }

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(GroupDetectors.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    File inputFile = new File(cl.getOptionValue(OPTION_INPUT));
    if (!inputFile.exists()) {
      cliUtil.failWithMessage("Input workspace at %s does not exist", inputFile.getAbsolutePath());
    }

    GroupingParameters parameters = parametersFromCommandLine(cl);
    Workspace input = WorkspaceSerializer.readWorkspace(inputFile);

    GroupDetectors groupDetectors = new GroupDetectors(parameters);
    GroupingResult result = groupDetectors.run(input);
    if (result.getState() != GroupingState.DONE) {
      LOGGER.warn("Grouping finished in state %s, no output written", result.getState());
      return;
    }

    File outputFile = new File(cl.getOptionValue(OPTION_OUTPUT));
    LOGGER.info("Writing output workspace to %s", outputFile.getAbsolutePath());
    WorkspaceSerializer.writeWorkspace(result.getOutput().get(), outputFile);

    if (cl.hasOption(OPTION_REPORT)) {
      File reportFile = new File(cl.getOptionValue(OPTION_REPORT));
      LOGGER.info("Writing grouping report to %s", reportFile.getAbsolutePath());
      try (GroupingReportWriter writer = new GroupingReportWriter()) {
        writer.open(reportFile);
        writer.write(result);
      }
    }
  }
}
