package br.ufmg.cs.systems.dualsim;

import br.ufmg.cs.systems.dualsim.conf.Configuration;
import br.ufmg.cs.systems.dualsim.graph.GraphView;
import br.ufmg.cs.systems.dualsim.sim.CandidateArray;
import br.ufmg.cs.systems.dualsim.sim.FeasibleMates;
import br.ufmg.cs.systems.dualsim.sim.MatchResult;
import br.ufmg.cs.systems.dualsim.sim.RefinementListener;
import br.ufmg.cs.systems.dualsim.sim.SimulationRefiner;
import org.apache.log4j.Logger;

/**
 * Dual graph simulation pattern matcher for vertex and edge labeled graphs.
 * Maps every vertex u of a query graph Q to the set of vertices of a data
 * graph G that share u's label and whose children recursively match u's
 * children. Both graphs are only read, so one instance may serve concurrent
 * {@link #match()} calls.
 */
public class DualSimulation {
   private static final Logger LOG = Logger.getLogger(DualSimulation.class);

   private final GraphView query;
   private final GraphView data;
   private final boolean selfLoops;

   public DualSimulation(GraphView query, GraphView data) {
      this(query, data, new Configuration());
   }

   /**
    * @param query query graph Q
    * @param data data graph G
    * @param configuration options, see {@link Configuration#CONF_SELF_LOOPS}
    */
   public DualSimulation(GraphView query, GraphView data,
                         Configuration configuration) {
      if (query == null || data == null) {
         throw new IllegalArgumentException("Query and data graphs required");
      }
      if (configuration == null) {
         throw new IllegalArgumentException("Configuration required");
      }
      this.query = query;
      this.data = data;
      this.selfLoops = configuration.isSelfLoopsEnabled();
   }

   /**
    * @return fresh initial candidates, one set per query vertex holding the
    * data vertices with the same label
    */
   public CandidateArray feasibleMates() {
      return FeasibleMates.compute(query, data);
   }

   public MatchResult match() {
      return match(RefinementListener.NONE);
   }

   /**
    * @param listener notified after each refinement pass
    * @return success with the converged candidates or no match
    */
   public MatchResult match(RefinementListener listener) {
      CandidateArray phi = feasibleMates();
      if (phi.hasEmptyEntry()) {
         LOG.info("Some query vertex label is absent from the data graph");
         return MatchResult.noMatch();
      }

      SimulationRefiner refiner = new SimulationRefiner(query, data, selfLoops);
      refiner.setListener(listener);
      return refiner.refine(phi);
   }
}
