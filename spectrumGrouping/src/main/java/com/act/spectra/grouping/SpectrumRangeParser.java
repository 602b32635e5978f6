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

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands lists of non-negative integers that may contain inclusive ranges, e.g. "1 3-5 4" -> [1, 3, 4, 5, 4].
 * Whitespace and commas both separate values; everything after a '#' is a comment.
 */
public class SpectrumRangeParser {
  public static final char COMMENT_CHAR = '#';
  private static final char RANGE_CHAR = '-';

  private SpectrumRangeParser() {
  }

  /**
   * Removes any comment and surrounding whitespace from a line.
   */
  public static String stripComment(String line) {
    int commentStart = line.indexOf(COMMENT_CHAR);
    String data = commentStart < 0 ? line : line.substring(0, commentStart);
    return data.trim();
  }

  /**
   * Expands the ranges in a list of integers, keeping values in the order they were written.  Repeats are kept.
   * @param line The text to interpret; comments are stripped first.
   * @return Every integer the text names.  Empty text yields an empty list.
   * @throws GroupFileFormatException If a '-' has no number on one of its sides or a value isn't an integer.
   * @throws SpectrumRangeException If a range's first integer is larger than its second.
   */
  public static List<Integer> expand(String line) {
    String data = stripComment(line).replace(',', ' ');
    List<Integer> values = new ArrayList<>();
    if (data.isEmpty()) {
      return values;
    }
    if (data.charAt(data.length() - 1) == RANGE_CHAR) {
      throw new GroupFileFormatException("'-' found at the end of a list, can't interpret range specification");
    }

    String[] segments = StringUtils.splitPreserveAllTokens(data, RANGE_CHAR);
    for (int i = 0; i < segments.length; i++) {
      String[] tokens = StringUtils.split(segments[i]);
      if (tokens.length == 0) {
        if (i == 0) {
          throw new GroupFileFormatException("'-' found at the start of a list, can't interpret range specification");
        }
        throw new GroupFileFormatException("A '-' follows straight after another '-', can't interpret range specification");
      }

      int firstToken = 0;
      if (i > 0) {
        // The last value read starts a range that ends with the first value of this segment.
        int rangeStart = values.get(values.size() - 1);
        int rangeEnd = parseValue(tokens[0]);
        if (rangeStart > rangeEnd) {
          throw new SpectrumRangeException(String.format(
              "A range where the first integer is larger than the second is not allowed: %d-%d", rangeStart, rangeEnd),
              rangeStart);
        }
        // A long counter so a range ending at Integer.MAX_VALUE terminates.
        for (long v = (long) rangeStart + 1; v <= rangeEnd; v++) {
          values.add((int) v);
        }
        firstToken = 1;
      }

      for (int t = firstToken; t < tokens.length; t++) {
        values.add(parseValue(tokens[t]));
      }
    }
    return values;
  }

  private static int parseValue(String token) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new GroupFileFormatException(String.format("Expected list of integers, found \"%s\"", token));
    }
  }
}
