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

package com.act.spectra.io;

import org.w3c.dom.Document;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * The only file access the grouping engine needs: loading a group file, either as text lines or as an XML document.
 */
public interface GroupFileLoader {
  /**
   * @param file A flat text group file.
   * @return The file's lines in order.
   * @throws IOException If the file can't be read.
   */
  List<String> readLines(File file) throws IOException;

  /**
   * @param file An XML grouping file.
   * @return The parsed document.
   * @throws IOException If the file can't be read.
   * @throws com.act.spectra.grouping.GroupFileFormatException If the file isn't well formed XML.
   */
  Document readXml(File file) throws IOException;
}
