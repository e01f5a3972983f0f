package br.ufmg.cs.systems.dualsim.io;

import br.ufmg.cs.systems.dualsim.graph.GraphBuilder;
import br.ufmg.cs.systems.dualsim.graph.InvalidGraphException;
import br.ufmg.cs.systems.dualsim.graph.LabeledGraph;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.StringTokenizer;

/**
 * Reads labeled graphs from adjacency list text files. Each line describes
 * one vertex as {@code <id> <label> [<child>[:<edgeLabel>]]*}. An optional
 * first line {@code # <numVertices> <numEdges>} gives size hints; blank lines
 * are ignored.
 */
public class GraphReader {
   private static final Logger LOG = Logger.getLogger(GraphReader.class);

   private static final char EDGE_LABEL_SEPARATOR = ':';

   public LabeledGraph read(Path path) throws IOException {
      LOG.info("Reading graph from " + path);
      try (InputStream is = Files.newInputStream(path)) {
         return read(is);
      }
   }

   public LabeledGraph read(InputStream is) throws IOException {
      BufferedReader reader = new BufferedReader(new InputStreamReader(
              new BOMInputStream(is), StandardCharsets.UTF_8));

      GraphBuilder builder = new GraphBuilder();
      int lineNumber = 0;
      String line = reader.readLine();

      while (line != null) {
         ++lineNumber;
         StringTokenizer tokenizer = new StringTokenizer(line);

         if (!tokenizer.hasMoreTokens()) {
            line = reader.readLine();
            continue;
         }

         if (lineNumber == 1 && line.startsWith("#")) {
            tokenizer.nextToken();
            LOG.info("Hinted numVertices=" + parseInt(tokenizer, lineNumber) +
                    " numEdges=" + parseInt(tokenizer, lineNumber));
            line = reader.readLine();
            continue;
         }

         int u = parseInt(tokenizer, lineNumber);
         builder.addVertex(u, parseInt(tokenizer, lineNumber));

         while (tokenizer.hasMoreTokens()) {
            parseEdge(builder, u, tokenizer.nextToken(), lineNumber);
         }

         line = reader.readLine();
      }

      LabeledGraph graph = builder.build();
      LOG.info("Read " + graph);
      return graph;
   }

   private void parseEdge(GraphBuilder builder, int u, String token,
                          int lineNumber) {
      int sepIdx = token.indexOf(EDGE_LABEL_SEPARATOR);
      if (sepIdx < 0) {
         builder.addEdge(u, parseInt(token, lineNumber));
      } else if (sepIdx == token.length() - 1) {
         throw new InvalidGraphException("Line " + lineNumber +
                 ": empty edge label in " + token);
      } else {
         int v = parseInt(token.substring(0, sepIdx), lineNumber);
         builder.addEdge(u, v, token.substring(sepIdx + 1));
      }
   }

   private int parseInt(StringTokenizer tokenizer, int lineNumber) {
      if (!tokenizer.hasMoreTokens()) {
         throw new InvalidGraphException("Line " + lineNumber +
                 ": missing field");
      }
      return parseInt(tokenizer.nextToken(), lineNumber);
   }

   private int parseInt(String token, int lineNumber) {
      try {
         return Integer.parseInt(token);
      } catch (NumberFormatException e) {
         throw new InvalidGraphException("Line " + lineNumber +
                 ": not an integer: " + token, e);
      }
   }
}
