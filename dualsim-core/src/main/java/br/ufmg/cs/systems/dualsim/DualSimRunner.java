package br.ufmg.cs.systems.dualsim;

import br.ufmg.cs.systems.dualsim.conf.Configuration;
import br.ufmg.cs.systems.dualsim.graph.InvalidGraphException;
import br.ufmg.cs.systems.dualsim.graph.LabeledGraph;
import br.ufmg.cs.systems.dualsim.io.GraphReader;
import br.ufmg.cs.systems.dualsim.sim.CandidateArray;
import br.ufmg.cs.systems.dualsim.sim.MatchResult;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Command line entry point: {@code DualSimRunner <queryGraph> <dataGraph>}.
 * Options are read from system properties, e.g.
 * {@code -Ddualsim.selfloops=true}.
 */
public class DualSimRunner {
   private static final Logger LOG = Logger.getLogger(DualSimRunner.class);

   public static void main(String[] args) {
      System.exit(run(args, System.out));
   }

   static int run(String[] args, PrintStream out) {
      if (args.length != 2) {
         out.println("usage: DualSimRunner <queryGraph> <dataGraph>");
         return 1;
      }

      DualSimulation simulation;
      try {
         Configuration configuration = Configuration.fromSystemProperties();
         configuration.applyLogLevel();

         GraphReader reader = new GraphReader();
         LabeledGraph query = reader.read(Paths.get(args[0]));
         LabeledGraph data = reader.read(Paths.get(args[1]));
         simulation = new DualSimulation(query, data, configuration);
      } catch (IOException | InvalidGraphException |
               IllegalArgumentException e) {
         LOG.error("Could not set up matching: " + e.getMessage(), e);
         return 1;
      }

      MatchResult result = simulation.match();
      print(result, out);
      return 0;
   }

   static void print(MatchResult result, PrintStream out) {
      if (!result.isMatch()) {
         out.println("no match");
         return;
      }

      CandidateArray phi = result.mappings();
      for (int u = 0; u < phi.size(); ++u) {
         out.println("u_" + u + ": " + Arrays.toString(phi.sortedCandidates(u)));
      }
   }
}
