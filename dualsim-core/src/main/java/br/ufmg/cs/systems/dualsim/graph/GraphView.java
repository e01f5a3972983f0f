package br.ufmg.cs.systems.dualsim.graph;

import com.koloboke.collect.set.IntSet;

import java.util.Optional;

/**
 * Read-only view over an immutable directed graph whose vertices carry a
 * label and whose edges may carry one. Vertices are identified by their
 * position in [0, numVertices).
 */
public interface GraphView {
   int numVertices();

   int label(int u);

   /**
    * @param u source vertex
    * @return read-only set of vertices v such that (u,v) is an edge
    */
   IntSet children(int u);

   /**
    * @param src edge source
    * @param dst edge destination
    * @return the label of edge (src,dst), empty if the edge carries no label
    * or does not exist
    */
   Optional<String> edgeLabel(int src, int dst);

   /**
    * @param label vertex label
    * @return read-only set of vertices with this label, empty if none
    */
   IntSet verticesWithLabel(int label);
}
