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

import com.act.spectra.GroupingResult;
import com.act.spectra.model.Spectrum;
import com.act.spectra.model.Workspace;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a tab separated summary of a grouping job with one line per output spectrum.
 */
public class GroupingReportWriter implements AutoCloseable {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  public enum REPORT_FIELD {
    OUTPUT_INDEX,
    SPECTRUM_NUMBER,
    GROUP_SIZE,
    SOURCE_ROWS,
    DETECTOR_IDS,
  }

  private CSVPrinter printer;

  public void open(File f) throws IOException {
    open(new FileWriter(f));
  }

  public void open(Writer w) throws IOException {
    List<String> header = new ArrayList<>(REPORT_FIELD.values().length);
    for (REPORT_FIELD field : REPORT_FIELD.values()) {
      header.add(field.name().toLowerCase());
    }
    printer = new CSVPrinter(w, TSV_FORMAT.withHeader(header.toArray(new String[header.size()])));
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }

  public void write(GroupingResult result) throws IOException {
    if (!result.getOutput().isPresent()) {
      throw new IllegalArgumentException(
          String.format("Can't write a report for a grouping job that finished in state %s", result.getState()));
    }
    Workspace output = result.getOutput().get();
    for (int i = 0; i < output.getNumberOfSpectra(); i++) {
      Spectrum spectrum = output.getSpectrum(i);
      List<Integer> sources = result.getSourceRows().get(i);
      List<Object> vals = new ArrayList<>(REPORT_FIELD.values().length);
      vals.add(i);
      vals.add(spectrum.getSpectrumNumber() == null ? "" : spectrum.getSpectrumNumber());
      vals.add(sources.size());
      vals.add(StringUtils.join(sources, ","));
      vals.add(StringUtils.join(spectrum.getDetectorIds(), ","));
      printer.printRecord(vals);
    }
    printer.flush();
  }
}
