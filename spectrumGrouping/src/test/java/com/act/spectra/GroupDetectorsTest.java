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

import com.act.spectra.combine.GroupingBehaviour;
import com.act.spectra.grouping.GroupingConfigurationException;
import com.act.spectra.grouping.GroupingParameters;
import com.act.spectra.grouping.SpectrumRangeException;
import com.act.spectra.grouping.WorkspaceTypeMismatchException;
import com.act.spectra.io.GroupFileLoader;
import com.act.spectra.model.EventSpectrum;
import com.act.spectra.model.HistogramSpectrum;
import com.act.spectra.model.RepresentationKind;
import com.act.spectra.model.Spectrum;
import com.act.spectra.model.Workspace;
import com.act.spectra.progress.ProgressReporter;
import com.act.spectra.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.act.spectra.TestWorkspaces.filled;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class GroupDetectorsTest {

  private static final double DELTA = 1e-9;

  private GroupFileLoader loader;

  @Before
  public void setUp() {
    loader = Mockito.mock(GroupFileLoader.class);
  }

  private GroupDetectors engine(GroupingParameters parameters) {
    return new GroupDetectors(parameters, loader, ProgressReporter.NONE);
  }

  @Test
  public void testRoundTrip() throws Exception {
    Workspace input = TestWorkspaces.unitHistograms(5, 5, 0, 0);
    GroupDetectors groupDetectors = engine(GroupingParameters.builder()
        .setRowIndices(Arrays.asList(0, 2, 3))
        .setKeepUngrouped(true)
        .build());
    assertEquals(GroupingState.IDLE, groupDetectors.getState());

    GroupingResult result = groupDetectors.run(input);

    assertEquals(GroupingState.DONE, result.getState());
    assertEquals(GroupingState.DONE, groupDetectors.getState());
    Workspace output = result.getOutput().get();
    assertEquals(3, output.getNumberOfSpectra());
    HistogramSpectrum grouped = (HistogramSpectrum) output.getSpectrum(0);
    assertArrayEquals(filled(5, 3.0), grouped.getY(), DELTA);
    assertArrayEquals(filled(5, Math.sqrt(3.0)), grouped.getE(), DELTA);
    assertEquals(Arrays.asList(0, 2, 3), new ArrayList<>(grouped.getDetectorIds()));
    assertEquals(Integer.valueOf(1), output.getSpectrum(1).getSpectrumNumber());
    assertEquals(Integer.valueOf(4), output.getSpectrum(2).getSpectrumNumber());

    assertEquals(Arrays.asList(Arrays.asList(0, 2, 3), Collections.singletonList(1), Collections.singletonList(4)),
        result.getSourceRows());
  }

  @Test
  public void testMapFileWithDuplicateGroupNumbers() throws Exception {
    File mapFile = new File("dupes.map");
    Mockito.when(loader.readLines(mapFile)).thenReturn(Arrays.asList("2", "7", "2", "1 2", "7", "1", "3"));
    Workspace input = TestWorkspaces.unitHistograms(4, 2, 1, 1);

    GroupingResult result = engine(GroupingParameters.builder()
        .setMapFile(mapFile)
        .setIgnoreGroupNumber(false)
        .build()).run(input);

    Workspace output = result.getOutput().get();
    assertEquals(2, output.getNumberOfSpectra());
    assertEquals(Integer.valueOf(7), output.getSpectrum(0).getSpectrumNumber());
    assertEquals(Integer.valueOf(7), output.getSpectrum(1).getSpectrumNumber());
    assertArrayEquals(filled(2, 2.0), ((HistogramSpectrum) output.getSpectrum(0)).getY(), DELTA);
    assertArrayEquals(filled(2, 1.0), ((HistogramSpectrum) output.getSpectrum(1)).getY(), DELTA);
  }

  @Test
  public void testAverageBehaviour() throws Exception {
    Workspace input = TestWorkspaces.unitHistograms(4, 3, 1, 1);
    GroupingResult result = engine(GroupingParameters.builder()
        .setSpectrumNumbers(Arrays.asList(1, 2, 3, 4))
        .setBehaviour(GroupingBehaviour.AVERAGE)
        .build()).run(input);

    HistogramSpectrum grouped = (HistogramSpectrum) result.getOutput().get().getSpectrum(0);
    assertArrayEquals(filled(3, 1.0), grouped.getY(), DELTA);
    assertArrayEquals(filled(3, 0.5), grouped.getE(), DELTA);
  }

  @Test
  public void testNothingToGroupFails() throws Exception {
    GroupDetectors groupDetectors = engine(GroupingParameters.builder().build());
    try {
      groupDetectors.run(TestWorkspaces.unitHistograms(2, 1, 1, 1));
      fail("Expected a GroupingConfigurationException");
    } catch (GroupingConfigurationException e) {
      assertEquals(GroupingState.FAILED, groupDetectors.getState());
    }
  }

  @Test
  public void testOutOfRangeIndexFailsBeforeCombining() throws Exception {
    GroupDetectors groupDetectors = engine(GroupingParameters.builder().setRowIndices(Arrays.asList(0, 5)).build());
    try {
      groupDetectors.run(TestWorkspaces.unitHistograms(5, 1, 1, 1));
      fail("Expected a SpectrumRangeException");
    } catch (SpectrumRangeException e) {
      assertEquals(GroupingState.FAILED, groupDetectors.getState());
      assertEquals(5L, e.getValue());
    }
  }

  @Test
  public void testHistogramsMustShareBinBoundaries() throws Exception {
    List<Spectrum> rows = new ArrayList<>(TestWorkspaces.unitHistograms(2, 2, 1, 1).getSpectra());
    rows.add(new HistogramSpectrum(3, Collections.singletonList(3), new double[]{0.0, 1.0, 2.5}, filled(2, 1.0),
        filled(2, 1.0)));
    GroupDetectors groupDetectors = engine(GroupingParameters.builder().setRowIndices(Arrays.asList(0, 1)).build());
    try {
      groupDetectors.run(new Workspace(RepresentationKind.HISTOGRAM, rows));
      fail("Expected a GroupingConfigurationException");
    } catch (GroupingConfigurationException e) {
      assertTrue(e.getMessage().contains("common bin boundaries"));
      assertEquals(GroupingState.FAILED, groupDetectors.getState());
    }
  }

  @Test(expected = WorkspaceTypeMismatchException.class)
  public void testEventRowInHistogramWorkspace() throws Exception {
    List<Spectrum> rows = new ArrayList<>(TestWorkspaces.unitHistograms(2, 2, 1, 1).getSpectra());
    rows.add(new EventSpectrum(3, Collections.singletonList(3)));
    engine(GroupingParameters.builder().setRowIndices(Arrays.asList(0, 1)).build())
        .run(new Workspace(RepresentationKind.HISTOGRAM, rows));
  }

  @Test
  public void testEventsArePreservedByDefault() throws Exception {
    Workspace input = TestWorkspaces.unitEvents(2, 3);
    GroupingResult result = engine(GroupingParameters.builder().setRowIndices(Arrays.asList(0, 1)).build())
        .run(input);

    Workspace output = result.getOutput().get();
    assertEquals(RepresentationKind.EVENT, output.getKind());
    assertEquals(6, ((EventSpectrum) output.getSpectrum(0)).getNumberOfEvents());
  }

  @Test
  public void testEventsCanBeHistogrammedFirst() throws Exception {
    Workspace input = TestWorkspaces.unitEvents(2, 3);
    GroupingResult result = engine(GroupingParameters.builder()
        .setRowIndices(Arrays.asList(0, 1))
        .setPreserveEvents(false)
        .build()).run(input);

    Workspace output = result.getOutput().get();
    assertEquals(RepresentationKind.HISTOGRAM, output.getKind());
    HistogramSpectrum grouped = (HistogramSpectrum) output.getSpectrum(0);
    assertArrayEquals(filled(3, 2.0), grouped.getY(), DELTA);
    assertArrayEquals(filled(3, Math.sqrt(2.0)), grouped.getE(), DELTA);
  }

  @Test
  public void testCancellationLeavesNoOutput() throws Exception {
    ProgressReporter reporter = Mockito.mock(ProgressReporter.class);
    Mockito.when(reporter.isCancelled()).thenReturn(true);
    GroupDetectors groupDetectors = new GroupDetectors(
        GroupingParameters.builder().setRowIndices(Arrays.asList(0, 1)).build(), loader, reporter);

    GroupingResult result = groupDetectors.run(TestWorkspaces.unitHistograms(3, 1, 1, 1));
    assertEquals(GroupingState.CANCELLED, result.getState());
    assertEquals(GroupingState.CANCELLED, groupDetectors.getState());
    assertFalse(result.getOutput().isPresent());
    assertNull(result.getGroupMap());
  }

  @Test
  public void testProgressNeverGoesBackwards() throws Exception {
    ProgressReporter reporter = Mockito.mock(ProgressReporter.class);
    Mockito.when(reporter.isCancelled()).thenReturn(false);
    File mapFile = new File("groups.map");
    Mockito.when(loader.readLines(mapFile)).thenReturn(Arrays.asList("2", "1", "2", "1 2", "2", "2", "3-4"));

    new GroupDetectors(GroupingParameters.builder().setMapFile(mapFile).setKeepUngrouped(true).build(),
        loader, reporter).run(TestWorkspaces.unitHistograms(8, 2, 1, 1));

    ArgumentCaptor<Double> captor = ArgumentCaptor.forClass(Double.class);
    Mockito.verify(reporter, Mockito.atLeastOnce()).reportProgress(captor.capture());
    List<Double> reported = captor.getAllValues();
    for (int i = 1; i < reported.size(); i++) {
      assertTrue(reported.get(i) >= reported.get(i - 1));
      assertTrue(reported.get(i) <= 1.0);
    }
    assertEquals(1.0, reported.get(reported.size() - 1), 1e-6);
  }

  @Test(expected = IllegalStateException.class)
  public void testJobsRunOnce() throws Exception {
    GroupDetectors groupDetectors = engine(GroupingParameters.builder().setRowIndices(Arrays.asList(0)).build());
    Workspace input = TestWorkspaces.unitHistograms(2, 1, 1, 1);
    groupDetectors.run(input);
    groupDetectors.run(input);
  }

  @Test
  public void testParametersFromCommandLine() throws Exception {
    CommandLine cl = new DefaultParser().parse(CLIUtil.buildOptions(GroupDetectors.OPTION_BUILDERS), new String[]{
        "-i", "in.json", "-o", "out.json", "-s", "1-3,7", "-b", "average", "-k", "-n", "-q", "-x", "2"
    });
    GroupingParameters parameters = GroupDetectors.parametersFromCommandLine(cl);

    assertEquals(Arrays.asList(1, 2, 3, 7), parameters.getSpectrumNumbers());
    assertEquals(GroupingBehaviour.AVERAGE, parameters.getBehaviour());
    assertTrue(parameters.isKeepUngrouped());
    assertFalse(parameters.isIgnoreGroupNumber());
    assertTrue(parameters.isRenumberSequentially());
    assertTrue(parameters.isPreserveEvents());
    assertEquals(Collections.singleton(2), parameters.getExcludedGroupIds());
  }

  @Test(expected = GroupingConfigurationException.class)
  public void testUnknownBehaviourOnCommandLine() throws Exception {
    CommandLine cl = new DefaultParser().parse(CLIUtil.buildOptions(GroupDetectors.OPTION_BUILDERS), new String[]{
        "-i", "in.json", "-o", "out.json", "-w", "0", "-b", "median"
    });
    GroupDetectors.parametersFromCommandLine(cl);
  }
}
