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

import com.act.spectra.combine.GroupingBehaviour;
import com.act.spectra.model.Workspace;

import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything a grouping job needs besides the workspace being grouped.  Exactly one grouping source is used; when
 * several are set the template workspace wins, then the map file, then the grouping pattern, then the lists.
 */
public class GroupingParameters {
  private final Workspace templateWorkspace;
  private final File mapFile;
  private final String groupingPattern;
  private final List<Integer> spectrumNumbers;
  private final List<Integer> detectorIds;
  private final List<Integer> rowIndices;

  private final boolean keepUngrouped;
  private final GroupingBehaviour behaviour;
  private final boolean ignoreGroupNumber;
  private final boolean preserveEvents;
  private final boolean renumberSequentially;
  private final Set<Integer> excludedGroupIds;

  private GroupingParameters(Builder b) {
    this.templateWorkspace = b.templateWorkspace;
    this.mapFile = b.mapFile;
    this.groupingPattern = b.groupingPattern;
    this.spectrumNumbers = Collections.unmodifiableList(new ArrayList<>(b.spectrumNumbers));
    this.detectorIds = Collections.unmodifiableList(new ArrayList<>(b.detectorIds));
    this.rowIndices = Collections.unmodifiableList(new ArrayList<>(b.rowIndices));
    this.keepUngrouped = b.keepUngrouped;
    this.behaviour = b.behaviour;
    this.ignoreGroupNumber = b.ignoreGroupNumber;
    this.preserveEvents = b.preserveEvents;
    this.renumberSequentially = b.renumberSequentially;
    this.excludedGroupIds = Collections.unmodifiableSet(new HashSet<>(b.excludedGroupIds));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Workspace getTemplateWorkspace() {
    return templateWorkspace;
  }

  public File getMapFile() {
    return mapFile;
  }

  public String getGroupingPattern() {
    return groupingPattern;
  }

  public List<Integer> getSpectrumNumbers() {
    return spectrumNumbers;
  }

  public List<Integer> getDetectorIds() {
    return detectorIds;
  }

  public List<Integer> getRowIndices() {
    return rowIndices;
  }

  public boolean isKeepUngrouped() {
    return keepUngrouped;
  }

  public GroupingBehaviour getBehaviour() {
    return behaviour;
  }

  public boolean isIgnoreGroupNumber() {
    return ignoreGroupNumber;
  }

  public boolean isPreserveEvents() {
    return preserveEvents;
  }

  public boolean isRenumberSequentially() {
    return renumberSequentially;
  }

  public Set<Integer> getExcludedGroupIds() {
    return excludedGroupIds;
  }

  public static class Builder {
    private Workspace templateWorkspace;
    private File mapFile;
    private String groupingPattern;
    private List<Integer> spectrumNumbers = new ArrayList<>();
    private List<Integer> detectorIds = new ArrayList<>();
    private List<Integer> rowIndices = new ArrayList<>();

    private boolean keepUngrouped = false;
    private GroupingBehaviour behaviour = GroupingBehaviour.SUM;
    private boolean ignoreGroupNumber = true;
    private boolean preserveEvents = true;
    private boolean renumberSequentially = false;
    private Set<Integer> excludedGroupIds = new HashSet<>();

    private Builder() {
    }

    public Builder setTemplateWorkspace(Workspace templateWorkspace) {
      this.templateWorkspace = templateWorkspace;
      return this;
    }

    public Builder setMapFile(File mapFile) {
      this.mapFile = mapFile;
      return this;
    }

    public Builder setGroupingPattern(String groupingPattern) {
      this.groupingPattern = groupingPattern;
      return this;
    }

    public Builder setSpectrumNumbers(Collection<Integer> spectrumNumbers) {
      this.spectrumNumbers = new ArrayList<>(spectrumNumbers);
      return this;
    }

    public Builder setDetectorIds(Collection<Integer> detectorIds) {
      this.detectorIds = new ArrayList<>(detectorIds);
      return this;
    }

    public Builder setRowIndices(Collection<Integer> rowIndices) {
      this.rowIndices = new ArrayList<>(rowIndices);
      return this;
    }

    public Builder setKeepUngrouped(boolean keepUngrouped) {
      this.keepUngrouped = keepUngrouped;
      return this;
    }

    public Builder setBehaviour(GroupingBehaviour behaviour) {
      this.behaviour = behaviour;
      return this;
    }

    public Builder setIgnoreGroupNumber(boolean ignoreGroupNumber) {
      this.ignoreGroupNumber = ignoreGroupNumber;
      return this;
    }

    public Builder setPreserveEvents(boolean preserveEvents) {
      this.preserveEvents = preserveEvents;
      return this;
    }

    public Builder setRenumberSequentially(boolean renumberSequentially) {
      this.renumberSequentially = renumberSequentially;
      return this;
    }

    public Builder setExcludedGroupIds(Collection<Integer> excludedGroupIds) {
      this.excludedGroupIds = new HashSet<>(excludedGroupIds);
      return this;
    }

    public GroupingParameters build() {
      if (behaviour == null) {
        throw new GroupingConfigurationException("A grouping behaviour (Sum or Average) must be specified");
      }
      return new GroupingParameters(this);
    }
  }
}
