package br.ufmg.cs.systems.dualsim.sim;

/**
 * Outcome of a dual simulation run: either {@link Success} holding the
 * converged candidate array or {@link NoMatch} when some query vertex has no
 * candidate left.
 */
public abstract class MatchResult {

   private MatchResult() {
   }

   public static MatchResult success(CandidateArray mappings, int numPasses) {
      return new Success(mappings, numPasses);
   }

   public static MatchResult noMatch() {
      return NoMatch.INSTANCE;
   }

   public abstract boolean isMatch();

   /**
    * @return converged candidate array
    * @throws IllegalStateException if this result is a {@link NoMatch}
    */
   public abstract CandidateArray mappings();

   public static final class Success extends MatchResult {
      private final CandidateArray mappings;
      private final int numPasses;

      private Success(CandidateArray mappings, int numPasses) {
         this.mappings = mappings;
         this.numPasses = numPasses;
      }

      @Override
      public boolean isMatch() {
         return true;
      }

      @Override
      public CandidateArray mappings() {
         return mappings;
      }

      /**
       * @return refinement passes performed, including the final pass that
       * observed no change
       */
      public int getNumPasses() {
         return numPasses;
      }

      @Override
      public String toString() {
         return "Success(" + mappings + ")";
      }
   }

   public static final class NoMatch extends MatchResult {
      private static final NoMatch INSTANCE = new NoMatch();

      private NoMatch() {
      }

      @Override
      public boolean isMatch() {
         return false;
      }

      @Override
      public CandidateArray mappings() {
         throw new IllegalStateException("No match has no mappings");
      }

      @Override
      public String toString() {
         return "NoMatch";
      }
   }
}
