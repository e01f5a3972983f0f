package br.ufmg.cs.systems.dualsim.sim;

import br.ufmg.cs.systems.dualsim.TestGraphs;
import br.ufmg.cs.systems.dualsim.graph.GraphBuilder;
import br.ufmg.cs.systems.dualsim.graph.LabeledGraph;
import br.ufmg.cs.systems.dualsim.util.IntSetUtils;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static br.ufmg.cs.systems.dualsim.TestGraphs.setOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SimulationRefinerTest {
   private static final String[] EDGE_LABELS = {"a", "b", "c"};

   private static LabeledGraph selfLoopQuery() {
      return new GraphBuilder().addVertex(0, 5).addEdge(0, 0).build();
   }

   private static int numPasses(MatchResult result) {
      return ((MatchResult.Success) result).getNumPasses();
   }

   @Test
   public void candidateSetsOnlyShrinkBetweenPasses() {
      for (long seed = 0; seed < 20; ++seed) {
         LabeledGraph data = TestGraphs.random(seed, 40, 3, 0.1, EDGE_LABELS);
         LabeledGraph query = TestGraphs.random(seed + 100, 4, 3, 0.4,
                 EDGE_LABELS);
         SimulationRefiner refiner =
                 new SimulationRefiner(query, data, false);
         CandidateArray phi = FeasibleMates.compute(query, data);

         List<CandidateArray> snapshots = new ArrayList<>();
         snapshots.add(phi.copy());
         refiner.setListener((pass, changed, candidates) ->
                 snapshots.add(candidates.copy()));
         refiner.refine(phi);

         for (int i = 1; i < snapshots.size(); ++i) {
            CandidateArray before = snapshots.get(i - 1);
            CandidateArray after = snapshots.get(i);
            for (int u = 0; u < query.numVertices(); ++u) {
               assertTrue("seed " + seed + " pass " + i + " vertex " + u,
                       IntSetUtils.isSubset(after.get(u), before.get(u)));
            }
         }
      }
   }

   @Test
   public void successfulResultsAreSound() {
      int matches = 0;
      for (long seed = 0; seed < 30; ++seed) {
         LabeledGraph data = TestGraphs.random(seed, 50, 2, 0.12, EDGE_LABELS);
         LabeledGraph query = TestGraphs.random(seed + 1000, 3, 2, 0.5,
                 EDGE_LABELS);

         MatchResult result = new SimulationRefiner(query, data, false)
                 .refine(FeasibleMates.compute(query, data));

         if (result.isMatch()) {
            ++matches;
            assertTrue("seed " + seed,
                    TestGraphs.isSound(query, data, result.mappings()));
         }
      }
      assertTrue("expected some seeds to match", matches > 0);
   }

   @Test
   public void refiningConvergedCandidatesChangesNothing() {
      LabeledGraph query = TestGraphs.sampleQuery();
      LabeledGraph data = TestGraphs.sampleData();
      SimulationRefiner refiner = new SimulationRefiner(query, data, false);
      MatchResult first = refiner.refine(FeasibleMates.compute(query, data));
      CandidateArray converged = first.mappings().copy();

      MatchResult second = refiner.refine(first.mappings().copy());

      assertTrue(second.isMatch());
      assertThat(second.mappings(), equalTo(converged));
      assertEquals(1, numPasses(second));
   }

   @Test
   public void emptyInitialEntryIsNoMatch() {
      LabeledGraph query = TestGraphs.sampleQuery();
      LabeledGraph data = TestGraphs.sampleData();
      CandidateArray phi = FeasibleMates.compute(query, data);
      phi.set(3, setOf());

      MatchResult result = new SimulationRefiner(query, data, false)
              .refine(phi);

      assertFalse(result.isMatch());
   }

   @Test(expected = IllegalArgumentException.class)
   public void candidateArrayOfWrongSizeIsRejected() {
      new SimulationRefiner(TestGraphs.sampleQuery(), TestGraphs.sampleData(),
              false).refine(new CandidateArray(2));
   }

   @Test(expected = IllegalArgumentException.class)
   public void unsetCandidateEntryIsRejected() {
      LabeledGraph query = TestGraphs.sampleQuery();
      LabeledGraph data = TestGraphs.sampleData();
      CandidateArray phi = FeasibleMates.compute(query, data);
      phi.set(2, null);

      new SimulationRefiner(query, data, false).refine(phi);
   }

   @Test
   public void selfLoopDisabledReplacesCandidates() {
      LabeledGraph data = TestGraphs.path(3, 5);
      CandidateArray phi = FeasibleMates.compute(selfLoopQuery(), data);

      SimulationRefiner.PassOutcome outcome =
              new SimulationRefiner(selfLoopQuery(), data, false)
                      .refinePass(phi);

      assertEquals(SimulationRefiner.PassOutcome.CHANGED, outcome);
      assertThat(phi.get(0), equalTo(setOf(1, 2)));
   }

   @Test
   public void selfLoopEnabledIntersectsCandidates() {
      LabeledGraph data = TestGraphs.path(3, 5);
      CandidateArray phi = FeasibleMates.compute(selfLoopQuery(), data);

      SimulationRefiner.PassOutcome outcome =
              new SimulationRefiner(selfLoopQuery(), data, true)
                      .refinePass(phi);

      // pruned {0,1} intersected with new candidates {1,2}
      assertEquals(SimulationRefiner.PassOutcome.CHANGED, outcome);
      assertThat(phi.get(0), equalTo(setOf(1)));
   }

   @Test
   public void restoredSelfLoopCandidatesStopRefinement() {
      // 2 has no child but is a child of 1, so replacing phi(0) restores it
      LabeledGraph data = new GraphBuilder()
              .addVertex(0, 5).addVertex(1, 5).addVertex(2, 5)
              .addEdge(0, 1).addEdge(1, 0).addEdge(1, 2)
              .build();
      LabeledGraph query = selfLoopQuery();

      MatchResult disabled = new SimulationRefiner(query, data, false)
              .refine(FeasibleMates.compute(query, data));
      MatchResult enabled = new SimulationRefiner(query, data, true)
              .refine(FeasibleMates.compute(query, data));

      assertTrue(disabled.isMatch());
      assertEquals(1, numPasses(disabled));
      assertThat(disabled.mappings().get(0), equalTo(setOf(0, 1, 2)));
      assertTrue(enabled.isMatch());
      assertThat(enabled.mappings().get(0), equalTo(setOf(0, 1)));
   }

   @Test
   public void changingPassesAreBoundedByInitialCandidates() {
      int n = 12;
      LabeledGraph data = TestGraphs.path(n, 5);
      LabeledGraph query = selfLoopQuery();
      CandidateArray phi = FeasibleMates.compute(query, data);
      long initialTotal = phi.totalCandidates();

      List<Long> totals = new ArrayList<>();
      int[] changingPasses = {0};
      SimulationRefiner refiner = new SimulationRefiner(query, data, false);
      refiner.setListener((pass, changed, candidates) -> {
         if (changed) ++changingPasses[0];
         totals.add(candidates.totalCandidates());
      });

      MatchResult result = refiner.refine(phi);

      // the path loses its first vertex on every pass until nothing is left
      assertFalse(result.isMatch());
      assertEquals(n - 1, changingPasses[0]);
      assertThat((long) changingPasses[0], lessThanOrEqualTo(initialTotal));
      long previous = initialTotal;
      for (long total : totals) {
         assertEquals(previous - 1, total);
         previous = total;
      }
   }

   @Test
   public void smallerChildCandidatesAloneMarkPassChanged() {
      LabeledGraph query = new GraphBuilder()
              .addVertex(0, 1).addVertex(1, 2).addEdge(0, 1).build();
      LabeledGraph data = new GraphBuilder()
              .addVertex(0, 1).addVertex(1, 2).addVertex(2, 2)
              .addEdge(0, 2).build();
      List<Boolean> changes = new ArrayList<>();
      SimulationRefiner refiner = new SimulationRefiner(query, data, false);
      refiner.setListener((pass, changed, candidates) -> changes.add(changed));

      MatchResult result = refiner.refine(FeasibleMates.compute(query, data));

      assertThat(changes, equalTo(Arrays.asList(true, false)));
      assertThat(result.mappings().get(0), equalTo(setOf(0)));
      assertThat(result.mappings().get(1), equalTo(setOf(2)));
   }

   @Test
   public void prunedParentCandidateAloneMarksPassChanged() {
      LabeledGraph query = new GraphBuilder()
              .addVertex(0, 1).addVertex(1, 2).addEdge(0, 1).build();
      LabeledGraph data = new GraphBuilder()
              .addVertex(0, 1).addVertex(1, 1).addVertex(2, 2)
              .addEdge(0, 2).build();
      List<Boolean> changes = new ArrayList<>();
      SimulationRefiner refiner = new SimulationRefiner(query, data, false);
      refiner.setListener((pass, changed, candidates) -> changes.add(changed));

      MatchResult result = refiner.refine(FeasibleMates.compute(query, data));

      assertThat(changes, equalTo(Arrays.asList(true, false)));
      assertThat(result.mappings().get(0), equalTo(setOf(0)));
      assertThat(result.mappings().get(1), equalTo(setOf(2)));
   }

   @Test(expected = IllegalStateException.class)
   public void listenerCanAbortRefinement() {
      LabeledGraph data = TestGraphs.path(20, 5);
      LabeledGraph query = selfLoopQuery();
      SimulationRefiner refiner = new SimulationRefiner(query, data, false);
      refiner.setListener((pass, changed, candidates) -> {
         if (pass >= 3) throw new IllegalStateException("budget exceeded");
      });

      refiner.refine(FeasibleMates.compute(query, data));
   }
}
