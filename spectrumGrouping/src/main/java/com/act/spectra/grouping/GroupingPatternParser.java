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

import com.act.spectra.model.Workspace;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a compact grouping pattern into the text of a flat group file so it can be read by
 * {@link MapFileReader}.  Numbers in a pattern are row indices, and groups are separated by commas:
 * <ul>
 *   <li>{@code a} is a group holding row a,</li>
 *   <li>{@code a+b+c} is one group holding rows a, b and c (each term may be a range),</li>
 *   <li>{@code a-b} is one group holding rows a to b inclusive,</li>
 *   <li>{@code a:b} is one group per row from a to b inclusive.</li>
 * </ul>
 * The converted file lists row indices as members, and each group is numbered with the spectrum number of its first
 * row.
 */
public class GroupingPatternParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GroupingPatternParser.class);

  private static final Pattern SINGLE_OR_RANGE = Pattern.compile("^(\\d+)(?:-(\\d+))?$");
  private static final Pattern ONE_PER_ROW = Pattern.compile("^(\\d+):(\\d+)$");

  private final Workspace workspace;

  public GroupingPatternParser(Workspace workspace) {
    this.workspace = workspace;
  }

  /**
   * @param pattern The grouping pattern.
   * @return The groups the pattern describes, each as an ordered list of row indices.
   * @throws GroupingConfigurationException If the pattern is malformed.
   * @throws SpectrumRangeException If the pattern names a row the workspace doesn't have, or a backwards range.
   */
  public List<List<Integer>> parse(String pattern) {
    if (StringUtils.isBlank(pattern)) {
      throw new GroupingConfigurationException("The grouping pattern is empty");
    }

    List<List<Integer>> groups = new ArrayList<>();
    for (String rawElement : StringUtils.splitPreserveAllTokens(pattern, ',')) {
      String element = StringUtils.deleteWhitespace(rawElement);
      if (element.isEmpty()) {
        throw malformed(pattern, "empty group");
      }

      Matcher onePerRow = ONE_PER_ROW.matcher(element);
      if (onePerRow.matches()) {
        for (Integer row : expandRange(onePerRow.group(1), onePerRow.group(2))) {
          List<Integer> group = new ArrayList<>(1);
          group.add(row);
          groups.add(group);
        }
        continue;
      }

      List<Integer> group = new ArrayList<>();
      for (String term : StringUtils.splitPreserveAllTokens(element, '+')) {
        Matcher m = SINGLE_OR_RANGE.matcher(term);
        if (!m.matches()) {
          throw malformed(pattern, String.format("can't interpret \"%s\"", term));
        }
        group.addAll(expandRange(m.group(1), m.group(2) == null ? m.group(1) : m.group(2)));
      }
      groups.add(group);
    }

    LOGGER.debug("Grouping pattern \"%s\" describes %d groups", pattern, groups.size());
    return groups;
  }

  /**
   * Writes the groups of a pattern in the flat group file format.
   * @param pattern The grouping pattern.
   * @return The lines of an equivalent group file whose members are row indices.
   */
  public List<String> toMapFileLines(String pattern) {
    List<List<Integer>> groups = parse(pattern);
    List<String> lines = new ArrayList<>(1 + groups.size() * 3);
    lines.add(Integer.toString(groups.size()));
    for (List<Integer> group : groups) {
      int firstRow = group.get(0);
      Integer spectrumNumber = workspace.getSpectrum(firstRow).getSpectrumNumber();
      lines.add(Integer.toString(spectrumNumber == null ? firstRow : spectrumNumber));
      lines.add(Integer.toString(group.size()));
      lines.add(StringUtils.join(group, " "));
    }
    return lines;
  }

  private List<Integer> expandRange(String first, String last) {
    int start, end;
    try {
      start = Integer.parseInt(first);
      end = Integer.parseInt(last);
    } catch (NumberFormatException e) {
      throw new GroupingConfigurationException(
          String.format("Grouping pattern value is too large: %s-%s", first, last), e);
    }
    if (start > end) {
      String msg = String.format("A range where the first integer is larger than the second was found: %d-%d",
          start, end);
      LOGGER.error(msg);
      throw new SpectrumRangeException(msg, start);
    }
    // Checked before expanding, so a huge upper bound never allocates.
    if (end >= workspace.getNumberOfSpectra()) {
      String msg = String.format("Index %d in the grouping pattern is out of range for a workspace with %d spectra",
          end, workspace.getNumberOfSpectra());
      LOGGER.error(msg);
      throw new SpectrumRangeException(msg, end);
    }
    List<Integer> rows = new ArrayList<>(end - start + 1);
    for (int i = start; i <= end; i++) {
      rows.add(i);
    }
    return rows;
  }

  private GroupingConfigurationException malformed(String pattern, String problem) {
    String msg = String.format("Malformed grouping pattern \"%s\": %s", pattern, problem);
    LOGGER.error(msg);
    return new GroupingConfigurationException(msg);
  }
}
