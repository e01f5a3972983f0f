package br.ufmg.cs.systems.dualsim.sim;

import br.ufmg.cs.systems.dualsim.graph.GraphView;
import br.ufmg.cs.systems.dualsim.util.IntSetUtils;

/**
 * Initial candidates: each query vertex is mapped to every data vertex
 * sharing its label. No structural check is done here.
 */
public class FeasibleMates {

   public static CandidateArray compute(GraphView query, GraphView data) {
      int numQueryVertices = query.numVertices();
      CandidateArray phi = new CandidateArray(numQueryVertices);
      for (int u = 0; u < numQueryVertices; ++u) {
         phi.set(u, IntSetUtils.copy(data.verticesWithLabel(query.label(u))));
      }
      return phi;
   }
}
