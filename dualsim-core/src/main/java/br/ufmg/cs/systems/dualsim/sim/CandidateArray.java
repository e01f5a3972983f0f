package br.ufmg.cs.systems.dualsim.sim;

import br.ufmg.cs.systems.dualsim.util.IntSetUtils;
import com.koloboke.collect.set.hash.HashIntSet;

import java.util.Arrays;

/**
 * Candidate mapping phi from each query vertex u to the set of data vertices
 * that may still match u. Owned by a single match invocation.
 */
public class CandidateArray {
   private final HashIntSet[] candidates;

   public CandidateArray(int numQueryVertices) {
      this.candidates = new HashIntSet[numQueryVertices];
   }

   public int size() {
      return candidates.length;
   }

   public HashIntSet get(int u) {
      return candidates[u];
   }

   public void set(int u, HashIntSet mates) {
      candidates[u] = mates;
   }

   /**
    * @throws IllegalArgumentException if some entry was never set
    */
   public boolean hasEmptyEntry() {
      for (int u = 0; u < candidates.length; ++u) {
         if (candidates[u] == null) {
            throw new IllegalArgumentException("No candidate set for query " +
                    "vertex " + u);
         }
         if (candidates[u].isEmpty()) return true;
      }
      return false;
   }

   public long totalCandidates() {
      long total = 0;
      for (HashIntSet mates : candidates) {
         if (mates != null) total += mates.size();
      }
      return total;
   }

   /**
    * @return deep copy, sharing no set with this array
    */
   public CandidateArray copy() {
      CandidateArray copy = new CandidateArray(candidates.length);
      for (int u = 0; u < candidates.length; ++u) {
         copy.candidates[u] = IntSetUtils.copy(candidates[u]);
      }
      return copy;
   }

   /**
    * @param u query vertex
    * @return candidates of u in ascending order
    */
   public int[] sortedCandidates(int u) {
      return IntSetUtils.sorted(candidates[u]);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      CandidateArray other = (CandidateArray) o;
      return Arrays.equals(candidates, other.candidates);
   }

   @Override
   public int hashCode() {
      return Arrays.hashCode(candidates);
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder("[");
      for (int u = 0; u < candidates.length; ++u) {
         if (u > 0) sb.append(", ");
         sb.append(Arrays.toString(sortedCandidates(u)));
      }
      return sb.append("]").toString();
   }
}
