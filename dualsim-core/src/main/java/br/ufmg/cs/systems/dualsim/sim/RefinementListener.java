package br.ufmg.cs.systems.dualsim.sim;

/**
 * Observer of the refinement loop, called after every completed pass. An
 * implementation may throw to abort a run that exceeds a budget of its own.
 */
public interface RefinementListener {
   RefinementListener NONE = (pass, changed, candidates) -> {};

   /**
    * @param pass 1-based number of the pass just completed
    * @param changed whether the pass changed some candidate set
    * @param candidates current candidate array, must not be modified
    */
   void passCompleted(int pass, boolean changed, CandidateArray candidates);
}
