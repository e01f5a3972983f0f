package br.ufmg.cs.systems.dualsim.graph;

import com.koloboke.collect.IntCursor;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.IntObjMap;
import com.koloboke.collect.map.LongObjMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import com.koloboke.collect.map.hash.HashIntObjMaps;
import com.koloboke.collect.map.hash.HashLongObjMaps;
import com.koloboke.collect.set.hash.HashIntSet;
import com.koloboke.collect.set.hash.HashIntSets;

/**
 * Mutable accumulator of vertices and edges producing a {@link LabeledGraph}.
 * Vertices and edges may be added in any order; the ids used must form the
 * range [0, n) by the time {@link #build()} is called.
 */
public class GraphBuilder {
   private final IntIntMap vertexToVertexLabel;
   private final IntObjMap<HashIntSet> adjLists;
   private final LongObjMap<String> edgeToEdgeLabel;
   private int maxVertexId = -1;

   public GraphBuilder() {
      this.vertexToVertexLabel = HashIntIntMaps.newUpdatableMap();
      this.adjLists = HashIntObjMaps.newUpdatableMap();
      this.edgeToEdgeLabel = HashLongObjMaps.newUpdatableMap();
   }

   public GraphBuilder addVertex(int u, int label) {
      checkId(u);
      if (vertexToVertexLabel.containsKey(u) &&
              vertexToVertexLabel.get(u) != label) {
         throw new InvalidGraphException("Vertex " + u + " relabeled from " +
                 vertexToVertexLabel.get(u) + " to " + label);
      }
      vertexToVertexLabel.put(u, label);
      maxVertexId = Math.max(maxVertexId, u);
      return this;
   }

   public GraphBuilder addEdge(int src, int dst) {
      checkId(src);
      checkId(dst);
      HashIntSet adjList = adjLists.get(src);
      if (adjList == null) {
         adjList = HashIntSets.newMutableSet();
         adjLists.put(src, adjList);
      }
      adjList.add(dst);
      maxVertexId = Math.max(maxVertexId, Math.max(src, dst));
      return this;
   }

   public GraphBuilder addEdge(int src, int dst, String label) {
      addEdge(src, dst);
      if (label != null) {
         edgeToEdgeLabel.put(LabeledGraph.edgeKey(src, dst), label);
      }
      return this;
   }

   /**
    * @return one past the largest id seen, which may exceed
    * {@link Integer#MAX_VALUE}
    */
   public long numVertices() {
      return maxVertexId + 1L;
   }

   private void checkId(int u) {
      if (u < 0) {
         throw new InvalidGraphException("Negative vertex id " + u);
      }
   }

   /**
    * @return immutable graph holding every vertex and edge added so far
    * @throws InvalidGraphException if some id in [0, n) has no label
    */
   public LabeledGraph build() {
      // labeled ids are non-negative and at most maxVertexId, so equal counts
      // mean the range is dense
      if (vertexToVertexLabel.size() != numVertices()) {
         throw new InvalidGraphException("Found " +
                 vertexToVertexLabel.size() + " labeled vertices but ids " +
                 "range over [0, " + numVertices() + ")");
      }

      int numVertices = vertexToVertexLabel.size();
      int[] vertexLabels = new int[numVertices];
      int[][] children = new int[numVertices][];

      for (int u = 0; u < numVertices; ++u) {
         if (!vertexToVertexLabel.containsKey(u)) {
            throw new InvalidGraphException("Vertex " + u + " has no label");
         }
         vertexLabels[u] = vertexToVertexLabel.get(u);

         HashIntSet adjList = adjLists.get(u);
         if (adjList == null) {
            children[u] = new int[0];
         } else {
            int[] uChildren = new int[adjList.size()];
            int i = 0;
            IntCursor cur = adjList.cursor();
            while (cur.moveNext()) {
               uChildren[i++] = cur.elem();
            }
            children[u] = uChildren;
         }
      }

      return new LabeledGraph(vertexLabels, children, edgeToEdgeLabel);
   }
}
