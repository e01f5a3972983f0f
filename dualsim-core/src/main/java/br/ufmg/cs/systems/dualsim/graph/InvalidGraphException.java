package br.ufmg.cs.systems.dualsim.graph;

/**
 * Raised when a graph is assembled from inconsistent parts: label and
 * adjacency arrays of different lengths, vertex ids out of range or vertices
 * without a label.
 */
public class InvalidGraphException extends RuntimeException {
   public InvalidGraphException(String message) {
      super(message);
   }

   public InvalidGraphException(String message, Throwable cause) {
      super(message, cause);
   }
}
