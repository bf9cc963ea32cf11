/*
 * Copyright 2018 University of California, Riverside
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package cn.edu.pku.asic.h3columnar.indexing;

import cn.edu.pku.asic.h3columnar.common.utils.BitArray;
import cn.edu.pku.asic.h3columnar.common.utils.IntArray;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.IntToDoubleFunction;

/**
 * An in-memory implementation of the original Antonin Guttman R-tree as described
 * in the following paper.
 * Antonin Guttman: R-Trees: A Dynamic Index Structure for Spatial Searching.
 * SIGMOD Conference 1984: 47-57
 *
 * Entries are inserted one by one and nodes are split with the linear split. All ties are resolved
 * deterministically so that building the tree twice from the same boxes gives the same tree.
 * The delete operation is not implemented as the tree is rebuilt whenever its data changes.
 * Data entries have the IDs [0, numEntries) and nodes have the IDs [numEntries, numEntries + numNodes).
 */
public class RTreeGuttman {
  private static final Log LOG = LogFactory.getLog(RTreeGuttman.class);

  /** Maximum capacity of a node (M) */
  protected final int maxCapacity;

  /** Minimum capacity of a node (m) */
  protected final int minCapacity;

  /**
   * The minimum coordinates of all the objects (nodes and entries). First index is for the dimensions and second
   * dimension is for the object number.
   */
  protected double[][] minCoord;

  /**
   * The maximum coordinates of all the objects (nodes and entries). First index is for the dimensions and second
   * dimension is for the object number.
   */
  protected double[][] maxCoord;

  /**A bit vector that stores which nodes are leaves*/
  protected BitArray isLeaf;

  /**A list of int[] that stores the children of each node*/
  protected List<IntArray> children;

  /**Total number of data entries*/
  protected int numEntries;

  /**Total number of nodes*/
  protected int numNodes;

  /**The index of the root in the list of nodes, -1 for an empty tree*/
  protected int root = -1;

  /**
   * Construct a new empty R-tree with the given parameters.
   * @param minCapacity - Minimum capacity of a node
   * @param maxCapacity - Maximum capacity of a node
   */
  public RTreeGuttman(int minCapacity, int maxCapacity) {
    if (minCapacity > maxCapacity / 2)
      throw new IllegalArgumentException(String.format("Invalid minCapacity=%d and maxCapacity=%d. " +
          "minCapacity should be at most maxCapacity/2", minCapacity, maxCapacity));
    if (minCapacity <= 0)
      throw new IllegalArgumentException("minCapacity must be positive");
    this.minCapacity = minCapacity;
    this.maxCapacity = maxCapacity;
  }

  /**
   * Retrieves the number of dimensions of the tree
   * @return the number of dimensions for data entries.
   */
  public int getNumDimensions() {
    return minCoord.length;
  }

  /**
   * Retrieves the maximum number of objects that can be currently stored in the tree without expansion
   * @return the maximum number of objects that the tree can hold (nodes + data entries).
   */
  protected int getCurrentCapacity() {
    return minCoord[0].length;
  }

  /**
   * Make a room in the data structures to accommodate a new object whether it is a node or a data entry.
   */
  protected void makeRoomForOneMoreObject() {
    int currentSize = numEntries + numNodes;
    if (getCurrentCapacity() <= currentSize) {
      // Expand the coordinate arrays in big chunks to avoid memory copy
      int numDimensions = getNumDimensions();
      int newCapacity = Math.max(16, getCurrentCapacity() * 2);
      for (int d = 0; d < numDimensions; d++) {
        double[] newCoords = new double[newCapacity];
        System.arraycopy(minCoord[d], 0, newCoords, 0, currentSize);
        minCoord[d] = newCoords;

        newCoords = new double[newCapacity];
        System.arraycopy(maxCoord[d], 0, newCoords, 0, currentSize);
        maxCoord[d] = newCoords;
      }
      this.isLeaf.resize(newCapacity);
    }
  }

  /**
   * Creates a new node that contains the given object and returns the ID of that node.
   * @param leaf set to true to create a leaf node
   * @param iChildren the indexes of all children in this node
   * @return the id of the new node created.
   */
  protected int Node_createNodeWithChildren(boolean leaf, int ... iChildren) {
    makeRoomForOneMoreObject();
    int iNewNode = numEntries + numNodes;
    this.isLeaf.set(iNewNode, leaf);
    this.children.add(iNewNode, new IntArray());
    this.numNodes++;
    Node_reset(iNewNode, iChildren);
    return iNewNode;
  }

  /**
   * Reset a node to contain a new set of children wiping away the current children.
   * @param iNode the index of the node to reset
   * @param newChildren the new list of child node ids.
   */
  protected void Node_reset(int iNode, int ... newChildren) {
    children.get(iNode).clear();
    children.get(iNode).append(newChildren, 0, newChildren.length);
    Node_recalculateMBR(iNode);
  }

  protected void Node_recalculateMBR(int iNode) {
    for (int d = 0; d < getNumDimensions(); d++) {
      minCoord[d][iNode] = Double.POSITIVE_INFINITY;
      maxCoord[d][iNode] = Double.NEGATIVE_INFINITY;
    }
    for (int iChild : children.get(iNode)) {
      for (int d = 0; d < getNumDimensions(); d++) {
        minCoord[d][iNode] = Math.min(minCoord[d][iNode], minCoord[d][iChild]);
        maxCoord[d][iNode] = Math.max(maxCoord[d][iNode], maxCoord[d][iChild]);
      }
    }
  }

  protected int Node_size(int iNode) {
    return children.get(iNode).size();
  }

  /**
   * Calculates the volume of the node
   * @param iNode the ID of the node
   * @return the volume of the given node (e.g., area for two dimensions).
   */
  protected double Node_volume(int iNode) {
    double vol = 1.0;
    for (int d = 0; d < getNumDimensions(); d++)
      vol *= maxCoord[d][iNode] - minCoord[d][iNode];
    return vol;
  }

  /**
   * Calculates the volume (area) expansion that will happen if the given object is added to a given node.
   * @param iNode the ID of the node that would be expanded
   * @param iNewChild the ID of the object that would be added to the node
   * @return the expansion of the volume of the given child is added to the given node.
   */
  protected double Node_volumeExpansion(int iNode, int iNewChild) {
    double volBefore = 1.0, volAfter = 1.0;
    for (int d = 0; d < getNumDimensions(); d++) {
      volBefore *= maxCoord[d][iNode] - minCoord[d][iNode];
      volAfter *= Math.max(maxCoord[d][iNode], maxCoord[d][iNewChild]) -
          Math.min(minCoord[d][iNode], minCoord[d][iNewChild]);
    }
    return volAfter - volBefore;
  }

  protected void Node_addChild(int iNode, int iNewChild) {
    this.children.get(iNode).add(iNewChild);
  }

  /**
   * Expand the MBR of the given node to enclose the given new object
   * @param node the node number
   * @param newObject the index of the object to expand to
   */
  protected void Node_expand(int node, int newObject) {
    for (int d = 0; d < getNumDimensions(); d++) {
      minCoord[d][node] = Math.min(minCoord[d][node], minCoord[d][newObject]);
      maxCoord[d][node] = Math.max(maxCoord[d][node], maxCoord[d][newObject]);
    }
  }

  /**
   * Initialize the current R-tree from given data entries
   * @param x1 array of lower coordinates on the x-dimension
   * @param y1 array of lower coordinates on the y-dimension
   * @param x2 array of upper coordinates on the x-dimension
   * @param y2 array of upper coordinates on the y-dimension
   */
  public void initializeFromRects(double[] x1, double[] y1, double[] x2, double[] y2) {
    this.initializeDataEntries(new double[][] {x1, y1}, new double[][] {x2, y2});
    this.insertAllDataEntries();
    if (LOG.isDebugEnabled())
      LOG.debug(String.format("Built an R-tree with %d entries in %d nodes of height %d", numEntries, numNodes,
          getHeight()));
  }

  protected void insertAllDataEntries() {
    if (numEntries == 0) {
      root = -1;
      return;
    }
    root = Node_createNodeWithChildren(true, 0);
    // Insert one by one
    for (int i = 1; i < numEntries; i++)
      insertAnExistingDataEntry(i);
  }

  /**
   * Initialize data entries from a list of minimum bounding boxes MBBs.
   * @param minCoords the minimum coordinates of the MBBs where the first index is the dimension and the second index
   *                  is the object number
   * @param maxCoords the maximum coordinates of the MBBs where the first index is the dimension and the second index
   *                  is the object number
   */
  protected void initializeDataEntries(double[][] minCoords, double[][] maxCoords) {
    this.numEntries = minCoords[0].length;
    this.numNodes = 0; // Initially, no nodes are there
    int capacity = Math.max(16, numEntries);
    this.isLeaf = new BitArray(capacity);
    children = new ArrayList<IntArray>(capacity);
    this.minCoord = new double[minCoords.length][capacity];
    this.maxCoord = new double[maxCoords.length][capacity];
    for (int d = 0; d < getNumDimensions(); d++) {
      System.arraycopy(minCoords[d], 0, this.minCoord[d], 0, numEntries);
      System.arraycopy(maxCoords[d], 0, this.maxCoord[d], 0, numEntries);
      // Handle empty boxes (with NaN coordinates) as an empty box with inverted infinite coordinates
      for (int $i = 0; $i < numEntries; $i++) {
        if (Double.isNaN(minCoords[d][$i]) || Double.isNaN(maxCoords[d][$i])) {
          this.minCoord[d][$i] = Double.POSITIVE_INFINITY;
          this.maxCoord[d][$i] = Double.NEGATIVE_INFINITY;
        }
      }
    }
    for (int i = 0; i < numEntries; i++)
      children.add(null);
  }

  /**
   * Inserts the given data entry into the tree. We assume that the coordinates
   * of this data entry are already stored in the coordinates arrays.
   * @param iEntry - The index of the entry in the array of entries
   */
  protected void insertAnExistingDataEntry(int iEntry) {
    // The path from the root to the newly inserted record. Used for splitting.
    IntArray path = new IntArray();
    int iCurrentVisitedNode = root;
    path.add(iCurrentVisitedNode);
    // Descend in the tree until we find a leaf node to add the object to
    while (!isLeaf.get(iCurrentVisitedNode)) {
      iCurrentVisitedNode = chooseSubtree(iEntry, iCurrentVisitedNode);
      path.add(iCurrentVisitedNode);
    }
    Node_addChild(iCurrentVisitedNode, iEntry);
    adjustTree(iCurrentVisitedNode, path);
  }

  /**
   * Choose the best subtree to add a data entry to.
   * According to the original R-tree paper, this function chooses the node with
   * the minimum volume expansion, then the one with the smallest volume,
   * then the one with the least number of records, then the first one.
   * @param iEntry the index of the entry to choose a subtree for
   * @param iNode the index of the node to choose from its children
   * @return the index of the child of the given node that the entry would be added to.
   */
  protected int chooseSubtree(int iEntry, int iNode) {
    if (minCoord[0][iEntry] > maxCoord[0][iEntry]) {
      // An empty box can go anywhere
      return children.get(iNode).get(0);
    }
    double minExpansion = Double.POSITIVE_INFINITY;
    int iBestChild = -1;
    for (int iCandidateChild : children.get(iNode)) {
      double expansion = Node_volumeExpansion(iCandidateChild, iEntry);
      if (iBestChild == -1 || expansion < minExpansion) {
        minExpansion = expansion;
        iBestChild = iCandidateChild;
      } else if (expansion == minExpansion) {
        double volumeDiff = Node_volume(iCandidateChild) - Node_volume(iBestChild);
        if (volumeDiff < 0 || (volumeDiff == 0 && Node_size(iCandidateChild) < Node_size(iBestChild)))
          iBestChild = iCandidateChild;
      }
    }
    return iBestChild;
  }

  /**
   * Adjust the tree after an insertion by making the necessary splits up to the root.
   * @param leafNode the index of the leaf node where the insertion happened
   * @param path the path that lead to the leafNode from the root. The last element is {@code leafNode}
   */
  protected void adjustTree(int leafNode, IntArray path) {
    int newNode = -1;
    if (Node_size(leafNode) > maxCapacity) {
      // Node full. Split into two
      newNode = split(leafNode, minCapacity);
    }
    // AdjustTree. Ascend from the leaf node L
    for (int $i = path.size() - 1; $i >= 0; $i--) {
      int iNode = path.get($i);
      // Adjust covering rectangle in the node
      Node_expand(iNode, ($i == path.size() - 1) ? children.get(iNode).peek() : path.get($i+1));
      if ($i == 0) {
        // The node is the root (no parent)
        if (newNode != -1) {
          // If the root is split, create a new root
          root = Node_createNodeWithChildren(false, iNode, newNode);
        }
      } else {
        int parent = path.get($i - 1);
        if (newNode != -1) {
          // If N has a partner NN resulting from an earlier split,
          // add it to the parent and split the parent if it overflows
          Node_addChild(parent, newNode);
          Node_expand(parent, newNode);
          newNode = -1;
          if (Node_size(parent) > maxCapacity)
            newNode = split(parent, minCapacity);
        }
      }
    }
  }

  /**
   * Linear splitting algorithm as described on Page 52 of the paper.
   * This function updates the MBR of the given node and the newly created node. It does not
   * update the MBR of the parent node or add the new node to the parent.
   * @param iNode the index of the node to split
   * @param minSplitSize the minimum split size
   * @return the ID of the newly created node after split
   */
  protected int split(int iNode, int minSplitSize) {
    IntArray nodeChildren = children.get(iNode).clone();
    int[] highestLowSide = new int[getNumDimensions()];
    int[] lowestHighSide = new int[getNumDimensions()];
    for (int d = 0; d < getNumDimensions(); d++)
      highestLowSide[d] = lowestHighSide[d] = nodeChildren.get(0);
    for (int iChild = 1; iChild < nodeChildren.size(); iChild++) {
      int child = nodeChildren.get(iChild);
      for (int d = 0; d < getNumDimensions(); d++) {
        if (minCoord[d][child] > minCoord[d][highestLowSide[d]])
          highestLowSide[d] = child;
        if (maxCoord[d][child] < maxCoord[d][lowestHighSide[d]])
          lowestHighSide[d] = child;
      }
    }
    // Normalize the separation by the width of the node being split
    double maxSeparation = Double.NEGATIVE_INFINITY;
    int maxSeparationD = 0;
    for (int d = 0; d < getNumDimensions(); d++) {
      double width = maxCoord[d][iNode] - minCoord[d][iNode];
      double separation = minCoord[d][highestLowSide[d]] - maxCoord[d][lowestHighSide[d]];
      if (width > 0)
        separation /= width;
      if (separation > maxSeparation) {
        maxSeparation = separation;
        maxSeparationD = d;
      }
    }
    // The seed points for the two splits resulting from the split
    int seed1 = highestLowSide[maxSeparationD];
    int seed2 = lowestHighSide[maxSeparationD];
    if (seed1 == seed2)
      seed2 = nodeChildren.get(0) == seed1 ? nodeChildren.get(1) : nodeChildren.get(0);

    // After picking the seeds, we will start picking next elements one-by-one
    IntArray nonAssignedNodes = nodeChildren;
    Node_reset(iNode, seed1);
    int iNewNode = Node_createNodeWithChildren(isLeaf.get(iNode), seed2);
    nonAssignedNodes.remove(seed1);
    nonAssignedNodes.remove(seed2);
    int group1 = iNode;
    int group2 = iNewNode;
    for (int $i = 0; $i < nonAssignedNodes.size(); $i++) {
      int child = nonAssignedNodes.get($i);
      int numRemaining = nonAssignedNodes.size() - $i;
      // If one group has so few entries that all the rest must be assigned to it
      // in order to have the minimum number minSplitSize, assign them and stop
      int targetGroup;
      if (numRemaining + Node_size(group1) <= minSplitSize) {
        targetGroup = group1;
      } else if (numRemaining + Node_size(group2) <= minSplitSize) {
        targetGroup = group2;
      } else {
        double d1 = Node_volumeExpansion(group1, child);
        double d2 = Node_volumeExpansion(group2, child);
        if (d1 == d2) {
          // Resolve ties by adding the entry to the group with smaller area
          d1 = Node_volume(group1);
          d2 = Node_volume(group2);
          if (d1 == d2) {
            // then to the one with fewer entries, then to the first group
            d1 = Node_size(group1);
            d2 = Node_size(group2);
          }
        }
        targetGroup = d2 < d1 ? group2 : group1;
      }
      Node_addChild(targetGroup, child);
      Node_expand(targetGroup, child);
    }
    return iNewNode;
  }

  /**
   * Search for all the entries that overlap a given query rectangle. Boxes that only touch the query
   * on their boundary are included.
   * @param min the coordinate of the minimum corner
   * @param max the coordinate of the maximum corner
   * @param results the results as a list of entry IDs as given in the construction function
   */
  public void search(double[] min, double[] max, IntArray results) {
    results.clear();
    if (root == -1)
      return;
    IntArray nodesToSearch = new IntArray();
    nodesToSearch.add(root);
    while (!nodesToSearch.isEmpty()) {
      int nodeToSearch = nodesToSearch.pop();
      boolean leaf = isLeaf.get(nodeToSearch);
      for (int iChild : children.get(nodeToSearch)) {
        if (Object_overlaps(iChild, min, max)) {
          if (leaf)
            results.add(iChild);
          else
            nodesToSearch.add(iChild);
        }
      }
    }
  }

  /**
   * Tests if an object (entry or node) overlaps with a rectangle. Touching counts as overlapping.
   * @param iEntry the index of the entry
   * @param min the coordinates of the minimum corner of the search box
   * @param max the coordinates of the maximum corner of the search box
   * @return {@code true} if the entry overlaps the given rectangle
   */
  protected boolean Object_overlaps(int iEntry, double[] min, double[] max) {
    for (int d = 0; d < getNumDimensions(); d++) {
      if (min[d] > maxCoord[d][iEntry] || minCoord[d][iEntry] > max[d])
        return false;
    }
    return true;
  }

  /**
   * The minimum distance between a point and the box of an object, zero if the point is inside the box
   */
  protected double Object_minDistance(int iObject, double[] point) {
    double sum = 0;
    for (int d = 0; d < getNumDimensions(); d++) {
      double diff = 0;
      if (point[d] < minCoord[d][iObject])
        diff = minCoord[d][iObject] - point[d];
      else if (point[d] > maxCoord[d][iObject])
        diff = point[d] - maxCoord[d][iObject];
      sum += diff * diff;
    }
    return Math.sqrt(sum);
  }

  /**
   * An item in the best-first search queue. Items are ordered by distance. At the same distance, nodes
   * and entries with a box distance come before entries with an exact distance so that every entry that
   * could tie is resolved before an exact entry is reported. Exact entries at the same distance are
   * ordered by their ID.
   */
  private static final class SearchItem implements Comparable<SearchItem> {
    static final int NODE = 0, BOX_ENTRY = 1, EXACT_ENTRY = 2;
    final double distance;
    final int type;
    final int id;

    SearchItem(double distance, int type, int id) {
      this.distance = distance;
      this.type = type;
      this.id = id;
    }

    @Override
    public int compareTo(SearchItem other) {
      int diff = Double.compare(distance, other.distance);
      if (diff == 0)
        diff = Integer.compare(type, other.type);
      if (diff == 0)
        diff = Integer.compare(id, other.id);
      return diff;
    }
  }

  /**
   * Finds the k entries nearest to a point with a best-first traversal. The box distance is used as
   * a lower bound of the exact distance of each entry.
   * @param point the query point
   * @param k the maximum number of entries to return
   * @param exactDistance computes the exact distance from the query point to an entry. Must not be smaller
   *                      than the distance to the box of the entry.
   * @param results the entry IDs ordered by (exact distance, ID)
   */
  public void nearest(double[] point, int k, IntToDoubleFunction exactDistance, IntArray results) {
    results.clear();
    if (root == -1 || k <= 0)
      return;
    PriorityQueue<SearchItem> queue = new PriorityQueue<>();
    queue.add(new SearchItem(Object_minDistance(root, point), SearchItem.NODE, root));
    while (!queue.isEmpty() && results.size() < k) {
      SearchItem item = queue.poll();
      switch (item.type) {
        case SearchItem.NODE:
          boolean leaf = isLeaf.get(item.id);
          for (int iChild : children.get(item.id)) {
            if (leaf && minCoord[0][iChild] > maxCoord[0][iChild])
              continue; // Empty box
            queue.add(new SearchItem(Object_minDistance(iChild, point),
                leaf ? SearchItem.BOX_ENTRY : SearchItem.NODE, iChild));
          }
          break;
        case SearchItem.BOX_ENTRY:
          queue.add(new SearchItem(exactDistance.applyAsDouble(item.id), SearchItem.EXACT_ENTRY, item.id));
          break;
        default:
          results.add(item.id);
      }
    }
  }

  /**
   * Total number of objects in the tree.
   * @return the number of data entries in the tree
   */
  public int numOfDataEntries() {
    return numEntries;
  }

  public int numOfNodes() {
    return numNodes;
  }

  /**
   * Computes the height of the tree which is defined as the number of edges
   * on the path from the root to the deepest node. Since the R-tree is perfectly
   * balanced, it is enough to measure the length of the path from the root to
   * any node, e.g., the left-most node.
   * @return the height of the tree (number of levels - 1)
   */
  public int getHeight() {
    if (numNodes == 0)
      return 0;
    int height = 0;
    int iNode = root;
    while (!isLeaf.get(iNode)) {
      height++;
      iNode = children.get(iNode).get(0);
    }
    return height;
  }

  /**
   * Checks the structural invariants of the tree: every node other than the root has between
   * {@link #minCapacity} and {@link #maxCapacity} children, every node box encloses the boxes of its
   * children, and every entry appears exactly once.
   * @return {@code true} if the tree is well formed
   */
  boolean isWellFormed() {
    if (root == -1)
      return numEntries == 0;
    BitArray seen = new BitArray(numEntries);
    IntArray nodesToVisit = new IntArray();
    nodesToVisit.add(root);
    int numSeen = 0;
    while (!nodesToVisit.isEmpty()) {
      int iNode = nodesToVisit.pop();
      int size = Node_size(iNode);
      if (size > maxCapacity || (iNode != root && size < minCapacity))
        return false;
      for (int iChild : children.get(iNode)) {
        for (int d = 0; d < getNumDimensions(); d++) {
          if (minCoord[d][iChild] <= maxCoord[d][iChild] &&
              (minCoord[d][iChild] < minCoord[d][iNode] || maxCoord[d][iChild] > maxCoord[d][iNode]))
            return false;
        }
        if (isLeaf.get(iNode)) {
          if (seen.get(iChild))
            return false;
          seen.set(iChild, true);
          numSeen++;
        } else {
          nodesToVisit.add(iChild);
        }
      }
    }
    return numSeen == numEntries;
  }
}
