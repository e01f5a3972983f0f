package br.ufmg.cs.systems.dualsim.sim;

import br.ufmg.cs.systems.dualsim.graph.GraphView;
import br.ufmg.cs.systems.dualsim.util.IntSetUtils;
import com.koloboke.collect.IntCursor;
import com.koloboke.collect.set.IntSet;
import com.koloboke.collect.set.hash.HashIntSet;
import com.koloboke.collect.set.hash.HashIntSets;
import org.apache.log4j.Logger;

import java.util.Optional;

/**
 * Refines a candidate array to the dual simulation fixpoint. A data vertex v
 * survives as a candidate of query vertex u only while, for every child u_c
 * of u, some child of v is a candidate of u_c reached through an edge whose
 * label does not conflict with the label of (u,u_c). Candidate sets only
 * shrink, so the loop stops after at most sum(|phi0[u]|) changing passes.
 */
public class SimulationRefiner {
   private static final Logger LOG = Logger.getLogger(SimulationRefiner.class);

   enum PassOutcome {
      CHANGED, STABLE, NO_MATCH
   }

   private final GraphView query;
   private final GraphView data;
   private final boolean selfLoops;
   private RefinementListener listener = RefinementListener.NONE;

   /**
    * @param query query graph Q
    * @param data data graph G
    * @param selfLoops whether a query self-loop (u,u) intersects phi(u) with
    *                  the new candidates instead of replacing it
    */
   public SimulationRefiner(GraphView query, GraphView data,
                            boolean selfLoops) {
      if (query == null || data == null) {
         throw new IllegalArgumentException("Query and data graphs required");
      }
      this.query = query;
      this.data = data;
      this.selfLoops = selfLoops;
   }

   public void setListener(RefinementListener listener) {
      this.listener = listener != null ? listener : RefinementListener.NONE;
   }

   /**
    * Refines phi in place until no pass changes it.
    * @param phi candidate array with one entry per query vertex
    * @return success holding phi, or no match if some entry became empty
    */
   public MatchResult refine(CandidateArray phi) {
      if (phi.size() != query.numVertices()) {
         throw new IllegalArgumentException("Candidate array of size " +
                 phi.size() + " for query with " + query.numVertices() +
                 " vertices");
      }

      if (phi.hasEmptyEntry()) {
         LOG.info("Query vertex without feasible mates, no match");
         return MatchResult.noMatch();
      }

      int pass = 0;
      long total = phi.totalCandidates();
      PassOutcome outcome;
      do {
         ++pass;
         outcome = refinePass(phi);

         if (outcome == PassOutcome.NO_MATCH) {
            LOG.info("No match found at pass " + pass);
            return MatchResult.noMatch();
         }

         boolean changed = outcome == PassOutcome.CHANGED;
         long previousTotal = total;
         total = phi.totalCandidates();
         if (LOG.isDebugEnabled()) {
            LOG.debug("Pass " + pass + " changed=" + changed +
                    " candidates=" + total);
         }
         listener.passCompleted(pass, changed, phi);

         // entries only shrink, so an equal total means phi is unchanged and
         // every later pass would repeat this one
         if (changed && total == previousTotal) {
            LOG.warn("Pass " + pass + " pruned candidates that a query " +
                    "self-loop restored, stopping (self-loop policy is " +
                    "disabled)");
            break;
         }
      } while (outcome == PassOutcome.CHANGED);

      LOG.info("Converged after " + pass + " passes, candidates=" +
              phi.totalCandidates());

      return MatchResult.success(phi, pass);
   }

   /**
    * One full pass over every query edge (u,u_c).
    */
   PassOutcome refinePass(CandidateArray phi) {
      boolean changed = false;

      for (int u = 0; u < query.numVertices(); ++u) {
         IntCursor queryChildren = query.children(u).cursor();
         while (queryChildren.moveNext()) {
            int uc = queryChildren.elem();
            Optional<String> queryEdgeLabel = query.edgeLabel(u, uc);

            HashIntSet ucMates = phi.get(uc);
            HashIntSet retained = HashIntSets.newMutableSet(phi.get(u).size());
            HashIntSet newCandidates = HashIntSets.newMutableSet();

            IntCursor mates = phi.get(u).cursor();
            while (mates.moveNext()) {
               int v = mates.elem();
               HashIntSet localMatch = IntSetUtils.intersect(
                       data.children(v), ucMates);
               filterEdgeLabels(v, queryEdgeLabel, localMatch);

               if (localMatch.isEmpty()) {
                  // v has no witness for (u,uc)
                  changed = true;
               } else {
                  retained.add(v);
                  newCandidates.addAll(localMatch);
               }
            }

            if (retained.isEmpty()) return PassOutcome.NO_MATCH;
            phi.set(u, retained);

            if (newCandidates.isEmpty()) return PassOutcome.NO_MATCH;
            if (newCandidates.size() < phi.get(uc).size()) changed = true;

            if (selfLoops && uc == u) {
               phi.set(uc, IntSetUtils.intersect(phi.get(uc), newCandidates));
            } else {
               phi.set(uc, newCandidates);
            }
         }
      }

      return changed ? PassOutcome.CHANGED : PassOutcome.STABLE;
   }

   /**
    * Drops from localMatch every child vc of v whose edge (v,vc) is labeled
    * differently from the query edge. Unlabeled edges on either side pass.
    */
   private void filterEdgeLabels(int v, Optional<String> queryEdgeLabel,
                                 IntSet localMatch) {
      if (!queryEdgeLabel.isPresent() || localMatch.isEmpty()) return;

      String expected = queryEdgeLabel.get();
      localMatch.removeIf((int vc) -> {
         Optional<String> dataEdgeLabel = data.edgeLabel(v, vc);
         return dataEdgeLabel.isPresent() &&
                 !dataEdgeLabel.get().equals(expected);
      });
   }
}
