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

import com.act.spectra.grouping.GroupFileFormatException;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class FileSystemGroupFileLoader implements GroupFileLoader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FileSystemGroupFileLoader.class);

  public static DocumentBuilderFactory mkDocBuilderFactory() throws ParserConfigurationException {
    /* Grouping files are tiny and never reference a DTD; don't let the parser go looking for one. */
    DocumentBuilderFactory docFactory = DocumentBuilderFactory.newInstance();
    docFactory.setValidating(false);
    docFactory.setNamespaceAware(true);
    docFactory.setFeature("http://xml.org/sax/features/namespaces", false);
    docFactory.setFeature("http://xml.org/sax/features/validation", false);
    docFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-dtd-grammar", false);
    docFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    // External entities are never resolved.
    docFactory.setFeature("http://xml.org/sax/features/external-general-entities", false);
    docFactory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
    docFactory.setExpandEntityReferences(false);
    return docFactory;
  }

  private static void checkReadable(File file) throws IOException {
    if (!file.exists()) {
      throw new FileNotFoundException(String.format("Unable to open group file %s", file.getAbsolutePath()));
    }
    if (!file.isFile()) {
      throw new IOException(String.format("Group file %s is not a regular file", file.getAbsolutePath()));
    }
  }

  @Override
  public List<String> readLines(File file) throws IOException {
    checkReadable(file);
    LOGGER.debug("Opened input file %s", file.getAbsolutePath());
    List<String> lines = FileUtils.readLines(file, StandardCharsets.UTF_8);
    LOGGER.debug("Read %d lines from %s", lines.size(), file.getAbsolutePath());
    return lines;
  }

  @Override
  public Document readXml(File file) throws IOException {
    checkReadable(file);
    LOGGER.debug("Parsing XML grouping file %s", file.getAbsolutePath());
    try {
      DocumentBuilder docBuilder = mkDocBuilderFactory().newDocumentBuilder();
      return docBuilder.parse(file);
    } catch (ParserConfigurationException e) {
      throw new IOException("Unable to configure XML parser", e);
    } catch (SAXParseException e) {
      LOGGER.error("Unable to parse XML grouping file %s: %s", file.getAbsolutePath(), e.getMessage());
      GroupFileFormatException ex = new GroupFileFormatException(
          "Malformed XML: " + e.getMessage(), file.getPath(), e.getLineNumber() > 0 ? e.getLineNumber() : null);
      ex.initCause(e);
      throw ex;
    } catch (SAXException e) {
      LOGGER.error("Unable to parse XML grouping file %s: %s", file.getAbsolutePath(), e.getMessage());
      throw new GroupFileFormatException("Malformed XML: " + e.getMessage(), file.getPath(), e);
    }
  }
}
