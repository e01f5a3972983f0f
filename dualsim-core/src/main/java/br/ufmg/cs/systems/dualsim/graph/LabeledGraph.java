package br.ufmg.cs.systems.dualsim.graph;

import com.koloboke.collect.map.IntObjCursor;
import com.koloboke.collect.map.IntObjMap;
import com.koloboke.collect.map.LongObjCursor;
import com.koloboke.collect.map.LongObjMap;
import com.koloboke.collect.map.hash.HashIntObjMaps;
import com.koloboke.collect.map.hash.HashLongObjMaps;
import com.koloboke.collect.set.IntSet;
import com.koloboke.collect.set.hash.HashIntSet;
import com.koloboke.collect.set.hash.HashIntSets;
import org.apache.log4j.Logger;

import java.util.Collections;
import java.util.Optional;

/**
 * Immutable vertex and edge labeled directed graph. Adjacency is kept as one
 * hash set of children per vertex, edge labels in a map keyed by the packed
 * (src,dst) pair and vertices are indexed by label at construction.
 */
public class LabeledGraph implements GraphView {
   private static final Logger LOG = Logger.getLogger(LabeledGraph.class);

   private static final IntSet EMPTY =
           HashIntSets.newImmutableSet(Collections.<Integer>emptyList());

   private final int numVertices;
   private final int numEdges;
   private final int[] vertexLabels;
   private final IntSet[] adjLists;
   private final LongObjMap<String> edgeToEdgeLabel;
   private final IntObjMap<IntSet> labelIndex;

   /**
    * @param vertexLabels label of each vertex, indexed by vertex id
    * @param children children of each vertex, indexed by vertex id
    * @param edgeLabels edge labels keyed by {@link #edgeKey(int, int)}, may
    *                   be null when no edge is labeled
    * @throws InvalidGraphException if the arrays disagree in length or
    * reference vertices out of range
    */
   public LabeledGraph(int[] vertexLabels, int[][] children,
                       LongObjMap<String> edgeLabels) {
      if (vertexLabels == null || children == null) {
         throw new InvalidGraphException(
                 "Vertex labels and children must be given");
      }

      if (vertexLabels.length != children.length) {
         throw new InvalidGraphException("Found " + vertexLabels.length +
                 " vertex labels but " + children.length +
                 " adjacency lists");
      }

      this.numVertices = vertexLabels.length;
      this.vertexLabels = vertexLabels.clone();
      this.adjLists = new IntSet[numVertices];

      int edges = 0;
      for (int u = 0; u < numVertices; ++u) {
         int[] uChildren = children[u];
         if (uChildren == null) {
            throw new InvalidGraphException(
                    "Missing adjacency list for vertex " + u);
         }

         HashIntSet adjList = HashIntSets.newMutableSet(uChildren.length);
         for (int v : uChildren) {
            checkVertex(v, "Edge (" + u + "," + v + ")");
            adjList.add(v);
         }

         edges += adjList.size();
         adjLists[u] = HashIntSets.newImmutableSet(adjList);
      }

      this.numEdges = edges;
      this.edgeToEdgeLabel = buildEdgeLabels(edgeLabels);
      this.labelIndex = buildLabelIndex();
   }

   /**
    * Packs an edge into the key used by the edge label map
    * @param src edge source
    * @param dst edge destination
    * @return packed key
    */
   public static long edgeKey(int src, int dst) {
      return ((long) src << 32) | (dst & 0xFFFFFFFFL);
   }

   static int edgeKeySrc(long key) {
      return (int) (key >>> 32);
   }

   static int edgeKeyDst(long key) {
      return (int) key;
   }

   private void checkVertex(int u, String context) {
      if (u < 0 || u >= numVertices) {
         throw new InvalidGraphException(context + " references vertex " +
                 u + " outside [0," + numVertices + ")");
      }
   }

   private LongObjMap<String> buildEdgeLabels(LongObjMap<String> edgeLabels) {
      if (edgeLabels == null || edgeLabels.isEmpty()) {
         return HashLongObjMaps.newImmutableMap(
                 Collections.<Long, String>emptyMap());
      }

      LongObjMap<String> labels =
              HashLongObjMaps.newMutableMap(edgeLabels.size());
      LongObjCursor<String> cur = edgeLabels.cursor();
      while (cur.moveNext()) {
         int src = edgeKeySrc(cur.key());
         int dst = edgeKeyDst(cur.key());
         String label = cur.value();
         checkVertex(src, "Edge label (" + src + "," + dst + ")");
         checkVertex(dst, "Edge label (" + src + "," + dst + ")");

         if (label == null) continue;

         if (!adjLists[src].contains(dst)) {
            LOG.warn("Dropping label " + label + " of (" + src + "," + dst +
                    "): not an edge");
            continue;
         }

         labels.put(cur.key(), label);
      }

      return HashLongObjMaps.newImmutableMap(labels);
   }

   private IntObjMap<IntSet> buildLabelIndex() {
      IntObjMap<HashIntSet> index = HashIntObjMaps.newMutableMap();
      for (int u = 0; u < numVertices; ++u) {
         HashIntSet vertices = index.get(vertexLabels[u]);
         if (vertices == null) {
            vertices = HashIntSets.newMutableSet();
            index.put(vertexLabels[u], vertices);
         }
         vertices.add(u);
      }

      IntObjMap<IntSet> immutableIndex =
              HashIntObjMaps.newUpdatableMap(index.size());
      IntObjCursor<HashIntSet> cur = index.cursor();
      while (cur.moveNext()) {
         immutableIndex.put(cur.key(), HashIntSets.newImmutableSet(cur.value()));
      }

      return HashIntObjMaps.newImmutableMap(immutableIndex);
   }

   @Override
   public int numVertices() {
      return numVertices;
   }

   public int numEdges() {
      return numEdges;
   }

   public int numLabeledEdges() {
      return edgeToEdgeLabel.size();
   }

   @Override
   public int label(int u) {
      return vertexLabels[u];
   }

   @Override
   public IntSet children(int u) {
      return adjLists[u];
   }

   @Override
   public Optional<String> edgeLabel(int src, int dst) {
      return Optional.ofNullable(edgeToEdgeLabel.get(edgeKey(src, dst)));
   }

   @Override
   public IntSet verticesWithLabel(int label) {
      IntSet vertices = labelIndex.get(label);
      return vertices != null ? vertices : EMPTY;
   }

   @Override
   public String toString() {
      return "LabeledGraph(numVertices=" + numVertices +
              ", numEdges=" + numEdges +
              ", numLabeledEdges=" + edgeToEdgeLabel.size() +
              ", numVertexLabels=" + labelIndex.size() + ")";
   }
}
