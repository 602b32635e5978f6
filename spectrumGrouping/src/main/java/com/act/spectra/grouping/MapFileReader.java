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

import com.act.spectra.progress.GroupingProgress;
import com.act.spectra.progress.Outcome;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the flat text group file format.  Extra whitespace, blank lines and comments starting with '#' are allowed
 * anywhere.  The layout is:
 * <pre>
 *   number_of_groups
 *   group_number
 *   number_of_spectra_in_group
 *   spectrum_number spectrum_number ...   (one or more lines, ranges like 3-7 allowed)
 *   group_number
 *   ...
 * </pre>
 * The group count on the first line is only checked against what was read and a mismatch is logged.  Group numbers
 * can be ignored, in which case groups are numbered 1, 2, 3, ... in file order.
 *
 * Spectrum numbers that aren't in the workspace are skipped with a warning; every other problem is fatal and
 * reported with the offending line number.
 */
public class MapFileReader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MapFileReader.class);

  // Report progress once every INTERVAL groups.
  private static final int INTERVAL = 128;

  private final String sourceName;
  private final Map<Integer, Integer> memberToIndex;
  private final int numberOfSpectra;
  private final GroupingProgress progress;

  private Iterator<String> lines;
  private int lineNumber;
  private int skippedReferences;
  private boolean cancelled;

  /**
   * @param sourceName The file name, used in messages.
   * @param memberToIndex Translates the numbers listed in a group into source row indices (usually the spectrum
   *                      number to row index map of the workspace being grouped).
   * @param numberOfSpectra The number of rows in the workspace being grouped, used to estimate progress.
   * @param progress Where to report progress.  Every line read is an interruption point.
   */
  public MapFileReader(String sourceName, Map<Integer, Integer> memberToIndex, int numberOfSpectra,
                       GroupingProgress progress) {
    this.sourceName = sourceName;
    this.memberToIndex = memberToIndex;
    this.numberOfSpectra = numberOfSpectra;
    this.progress = progress;
  }

  /**
   * Parses a whole group file.
   * @param fileLines The file's lines in order.
   * @param ignoreGroupNumber True to number groups sequentially from 1 instead of using the file's group numbers.
   * @return The groups in file order, or a cancelled outcome.
   * @throws GroupFileFormatException If the file is malformed.
   * @throws SpectrumRangeException If the file contains a backwards range.
   */
  public Outcome<GroupMap> read(List<String> fileLines, boolean ignoreGroupNumber) {
    this.lines = fileLines.iterator();
    this.lineNumber = 0;
    this.skippedReferences = 0;
    this.cancelled = false;

    GroupMap groups = new GroupMap();
    try {
      // We don't use the total number of groups, but a wrong value is worth mentioning.
      Integer totalNumberOfGroups = nextInt();
      if (totalNumberOfGroups == null) {
        if (cancelled) {
          return Outcome.cancelled();
        }
        throw new GroupFileFormatException("The input file doesn't appear to contain any data");
      }

      if (readGroups(groups, ignoreGroupNumber).isCancelled()) {
        return Outcome.cancelled();
      }

      if (groups.size() != totalNumberOfGroups) {
        LOGGER.warn("The input file header states there are %d groups but the file contains %d groups",
            totalNumberOfGroups, groups.size());
      }
    } catch (GroupFileFormatException e) {
      LOGGER.error("Error reading group file %s: %s", sourceName, e.getMessage());
      throw e.atLocation(sourceName, lineNumber);
    } catch (SpectrumRangeException e) {
      LOGGER.error("Error reading group file %s: %s", sourceName, e.getMessage());
      throw new SpectrumRangeException(
          String.format("%s near line number %d in file %s", e.getMessage(), lineNumber, sourceName), e.getValue());
    }

    if (skippedReferences > 0) {
      LOGGER.warn("%d spectrum numbers referred to in %s were not found in the input workspace and were skipped",
          skippedReferences, sourceName);
    }
    LOGGER.debug("Read %d groups from %s", groups.size(), sourceName);
    return Outcome.of(groups);
  }

  private Outcome<GroupMap> readGroups(GroupMap groups, boolean ignoreGroupNumber) {
    int sequentialGroupNumber = 1;
    while (true) {
      Integer groupNumber = nextInt();
      if (groupNumber == null) {
        // We haven't started reading a new group, so if the file ends here it is OK.
        return cancelled ? Outcome.cancelled() : Outcome.of(groups);
      }
      int key = ignoreGroupNumber ? sequentialGroupNumber++ : groupNumber;

      Integer spectraInGroup = nextInt();
      if (spectraInGroup == null) {
        if (cancelled) {
          return Outcome.cancelled();
        }
        throw new GroupFileFormatException(
            "Premature end of file, expecting an integer with the number of spectra in the group");
      }
      if (spectraInGroup <= 0) {
        throw new GroupFileFormatException("The number of spectra is zero or negative");
      }

      SpectrumGroup group = groups.addGroup(key);
      int listed = 0;
      while (listed < spectraInGroup) {
        String line = nextLine();
        if (line == null) {
          if (cancelled) {
            return Outcome.cancelled();
          }
          throw new GroupFileFormatException(
              "Premature end of file, found number of spectra specification but no spectra list");
        }
        List<Integer> members = SpectrumRangeParser.expand(line);
        listed += members.size();
        for (Integer member : members) {
          addMember(group, member);
        }
      }
      if (listed != spectraInGroup) {
        // It makes no sense to continue reading the file.
        throw new GroupFileFormatException(String.format(
            "Bad number of spectra specification or spectra list: expected %d spectra in group %d but found %d",
            spectraInGroup, key, listed));
      }

      if (groups.size() % INTERVAL == 1) {
        double estimate = progress.estimateFileRead(groups.size(), numberOfSpectra);
        if (progress.reportUncommitted(estimate).isCancelled()) {
          return Outcome.cancelled();
        }
      }
    }
  }

  private void addMember(SpectrumGroup group, int member) {
    Integer index = memberToIndex.get(member);
    if (index == null) {
      LOGGER.debug("Spectrum number %d referred to in %s was not found in the input workspace, skipping",
          member, sourceName);
      skippedReferences++;
      return;
    }
    group.add(index);
  }

  /**
   * @return The next line holding an integer (blank and comment-only lines are skipped), or null at the end of the
   * file or on cancellation.
   */
  private Integer nextInt() {
    String line;
    while ((line = nextLine()) != null) {
      Integer value = readInt(line);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  private String nextLine() {
    if (progress.checkpoint().isCancelled()) {
      cancelled = true;
      return null;
    }
    if (!lines.hasNext()) {
      return null;
    }
    lineNumber++;
    return lines.next();
  }

  /**
   * Interprets a line that should hold a single integer.
   * @return The integer, or null if the line holds no data.
   * @throws GroupFileFormatException If the line holds anything but one integer.
   */
  static Integer readInt(String line) {
    String data = SpectrumRangeParser.stripComment(line);
    if (data.isEmpty()) {
      return null;
    }
    String[] tokens = StringUtils.split(data);
    if (tokens.length != 1) {
      throw new GroupFileFormatException(
          String.format("Problem reading file, a single integer expected but found %d values", tokens.length));
    }
    try {
      return Integer.parseInt(tokens[0]);
    } catch (NumberFormatException e) {
      throw new GroupFileFormatException(
          String.format("Problem reading integer value \"%s\", integer expected", tokens[0]));
    }
  }

  public int getSkippedReferences() {
    return skippedReferences;
  }
}
