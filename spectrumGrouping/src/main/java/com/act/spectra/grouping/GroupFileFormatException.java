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

/**
 * Thrown when a group file (or grouping text converted to the group file format) can't be parsed.  Carries the file
 * name and the 1-based line number of the problem when they are known.
 */
public class GroupFileFormatException extends GroupingException {
  private final String reason;
  private final String fileName;
  private final Integer lineNumber;

  public GroupFileFormatException(String reason) {
    super(reason);
    this.reason = reason;
    this.fileName = null;
    this.lineNumber = null;
  }

  public GroupFileFormatException(String reason, String fileName, Integer lineNumber) {
    super(formatMessage(reason, fileName, lineNumber));
    this.reason = reason;
    this.fileName = fileName;
    this.lineNumber = lineNumber;
  }

  public GroupFileFormatException(String reason, String fileName, Throwable cause) {
    super(formatMessage(reason, fileName, null), cause);
    this.reason = reason;
    this.fileName = fileName;
    this.lineNumber = null;
  }

  /**
   * @return A copy of this exception annotated with the file and line where the problem was found.
   */
  public GroupFileFormatException atLocation(String fileName, int lineNumber) {
    GroupFileFormatException e = new GroupFileFormatException(reason, fileName, lineNumber);
    e.setStackTrace(getStackTrace());
    return e;
  }

  public String getReason() {
    return reason;
  }

  public String getFileName() {
    return fileName;
  }

  public Integer getLineNumber() {
    return lineNumber;
  }

  private static String formatMessage(String reason, String fileName, Integer lineNumber) {
    if (lineNumber == null) {
      return String.format("%s in file %s", reason, fileName);
    }
    return String.format("%s near line number %d in file %s", reason, lineNumber, fileName);
  }
}
