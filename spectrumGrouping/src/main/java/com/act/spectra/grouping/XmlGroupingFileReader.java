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

import com.act.spectra.index.IdentifierMaps;
import com.act.spectra.progress.GroupingProgress;
import com.act.spectra.progress.Outcome;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads XML grouping files of the form:
 * <pre>
 *   &lt;detector-grouping&gt;
 *     &lt;group name="fwd1" ID="3"&gt; &lt;ids val="1-32"/&gt; &lt;/group&gt;
 *     &lt;group name="bwd1"&gt; &lt;detids val="33,36,38,60-64"/&gt; &lt;/group&gt;
 *   &lt;/detector-grouping&gt;
 * </pre>
 * ids hold spectrum numbers and detids hold detector ids.  Groups without an ID are given the lowest id not used
 * elsewhere in the file, starting from 0.  Groups sharing an id are merged.
 */
public class XmlGroupingFileReader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(XmlGroupingFileReader.class);

  public static final String ROOT_TAG = "detector-grouping";
  public static final String GROUP_PATH = "/detector-grouping/group";
  public static final String DETECTOR_IDS_PATH = "detids/@val";
  public static final String SPECTRUM_NUMBERS_PATH = "ids/@val";
  public static final String ID_ATTRIBUTE = "ID";
  public static final String ALT_ID_ATTRIBUTE = "id";
  public static final String NAME_ATTRIBUTE = "name";

  // XPathFactory is known to be non-thread-safe.
  private static final ThreadLocal<XPathFactory> XPATH_FACTORY = new ThreadLocal<XPathFactory>() {
    @Override
    protected XPathFactory initialValue() {
      return XPathFactory.newInstance();
    }
  };

  private final String sourceName;
  private final IdentifierMaps identifierMaps;
  private final Set<Integer> excludedGroupIds;
  private final GroupingProgress progress;

  private int skippedReferences;

  public XmlGroupingFileReader(String sourceName, IdentifierMaps identifierMaps, Set<Integer> excludedGroupIds,
                               GroupingProgress progress) {
    this.sourceName = sourceName;
    this.identifierMaps = identifierMaps;
    this.excludedGroupIds = excludedGroupIds == null ? Collections.emptySet() : excludedGroupIds;
    this.progress = progress;
  }

  public Outcome<GroupMap> read(Document doc) {
    skippedReferences = 0;

    Element root = doc.getDocumentElement();
    if (root == null || !ROOT_TAG.equals(root.getNodeName())) {
      String msg = String.format("Expected root element <%s> but found <%s>",
          ROOT_TAG, root == null ? "" : root.getNodeName());
      LOGGER.error("Error reading grouping file %s: %s", sourceName, msg);
      throw new GroupFileFormatException(msg, sourceName, (Integer) null);
    }

    XPath xpath = XPATH_FACTORY.get().newXPath();
    List<Element> groupElements = new ArrayList<>();
    try {
      NodeList nodes = (NodeList) xpath.evaluate(GROUP_PATH, doc, XPathConstants.NODESET);
      for (int i = 0; i < nodes.getLength(); i++) {
        groupElements.add((Element) nodes.item(i));
      }
    } catch (XPathExpressionException e) {
      throw new GroupFileFormatException("Unable to find group elements", sourceName, e);
    }

    // Explicit ids come first so that unnumbered groups don't steal them.
    List<Integer> explicitIds = new ArrayList<>(groupElements.size());
    Set<Integer> usedIds = new HashSet<>();
    for (Element group : groupElements) {
      Integer id = readGroupId(group);
      explicitIds.add(id);
      if (id != null) {
        usedIds.add(id);
      }
    }

    GroupMap groups = new GroupMap();
    int nextId = 0;
    for (int i = 0; i < groupElements.size(); i++) {
      if (progress.checkpoint().isCancelled()) {
        return Outcome.cancelled();
      }

      Element element = groupElements.get(i);
      Integer id = explicitIds.get(i);
      if (id == null) {
        while (usedIds.contains(nextId)) {
          nextId++;
        }
        id = nextId;
        usedIds.add(id);
      }

      if (excludedGroupIds.contains(id)) {
        LOGGER.debug("Dropping excluded group %d (%s)", id, element.getAttribute(NAME_ATTRIBUTE));
        continue;
      }

      SpectrumGroup group = groups.getOrAddGroup(id);
      addMembers(group, readValues(xpath, element, DETECTOR_IDS_PATH), identifierMaps.getDetectorIdToIndexMap(),
          "Detector id");
      addMembers(group, readValues(xpath, element, SPECTRUM_NUMBERS_PATH),
          identifierMaps.getSpectrumNumberToIndexMap(), "Spectrum number");
    }

    if (skippedReferences > 0) {
      LOGGER.warn("%d detector ids or spectrum numbers referred to in %s were not found in the input workspace " +
          "and were skipped", skippedReferences, sourceName);
    }
    LOGGER.debug("Read %d groups from %s", groups.size(), sourceName);
    return Outcome.of(groups);
  }

  private Integer readGroupId(Element group) {
    String value = group.getAttribute(ID_ATTRIBUTE);
    if (StringUtils.isBlank(value)) {
      value = group.getAttribute(ALT_ID_ATTRIBUTE);
    }
    if (StringUtils.isBlank(value)) {
      return null;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      String msg = String.format("Group id \"%s\" is not an integer", value);
      LOGGER.error("Error reading grouping file %s: %s", sourceName, msg);
      throw new GroupFileFormatException(msg, sourceName, e);
    }
  }

  private List<Integer> readValues(XPath xpath, Element group, String path) {
    List<Integer> values = new ArrayList<>();
    try {
      NodeList nodes = (NodeList) xpath.evaluate(path, group, XPathConstants.NODESET);
      for (int i = 0; i < nodes.getLength(); i++) {
        values.addAll(SpectrumRangeParser.expand(nodes.item(i).getNodeValue()));
      }
    } catch (XPathExpressionException e) {
      throw new GroupFileFormatException(String.format("Unable to evaluate %s", path), sourceName, e);
    } catch (GroupFileFormatException e) {
      LOGGER.error("Error reading grouping file %s: %s", sourceName, e.getReason());
      throw new GroupFileFormatException(e.getReason(), sourceName, e);
    } catch (SpectrumRangeException e) {
      LOGGER.error("Error reading grouping file %s: %s", sourceName, e.getMessage());
      throw new SpectrumRangeException(String.format("%s in file %s", e.getMessage(), sourceName), e.getValue());
    }
    return values;
  }

  private void addMembers(SpectrumGroup group, List<Integer> members, Map<Integer, Integer> toIndex, String what) {
    for (Integer member : members) {
      Integer index = toIndex.get(member);
      if (index == null) {
        LOGGER.debug("%s %d in group %d was not found in the input workspace, skipping", what, member, group.getKey());
        skippedReferences++;
        continue;
      }
      group.add(index);
    }
  }

  public int getSkippedReferences() {
    return skippedReferences;
  }
}
