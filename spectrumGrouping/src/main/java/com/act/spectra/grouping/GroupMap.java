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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An insertion-ordered sequence of groups.  Group keys are labels, not a deduplicating index: adding two groups with
 * the same key yields two separate groups, and so two output spectra.  Sources that want same-key groups pooled
 * together (XML files, grouping workspaces) ask for {@link #getOrAddGroup(int)} instead.
 */
public class GroupMap implements Iterable<SpectrumGroup> {
  private final List<SpectrumGroup> groups = new ArrayList<>();

  public GroupMap() {
  }

  public GroupMap(List<SpectrumGroup> groups) {
    this.groups.addAll(groups);
  }

  /**
   * Appends a new, empty group.
   */
  public SpectrumGroup addGroup(int key) {
    SpectrumGroup group = new SpectrumGroup(key);
    groups.add(group);
    return group;
  }

  /**
   * Returns the first group with this key, appending a new one if none exists yet.
   */
  public SpectrumGroup getOrAddGroup(int key) {
    for (SpectrumGroup group : groups) {
      if (group.getKey() == key) {
        return group;
      }
    }
    return addGroup(key);
  }

  public List<SpectrumGroup> getGroups() {
    return Collections.unmodifiableList(groups);
  }

  public List<Integer> getKeys() {
    List<Integer> keys = new ArrayList<>(groups.size());
    for (SpectrumGroup group : groups) {
      keys.add(group.getKey());
    }
    return keys;
  }

  public int size() {
    return groups.size();
  }

  public boolean isEmpty() {
    return groups.isEmpty();
  }

  @Override
  public Iterator<SpectrumGroup> iterator() {
    return getGroups().iterator();
  }
}
