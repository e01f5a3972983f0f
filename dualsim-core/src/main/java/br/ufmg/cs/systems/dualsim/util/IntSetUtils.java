package br.ufmg.cs.systems.dualsim.util;

import com.koloboke.collect.IntCursor;
import com.koloboke.collect.set.IntSet;
import com.koloboke.collect.set.hash.HashIntSet;
import com.koloboke.collect.set.hash.HashIntSets;

import java.util.Arrays;

public class IntSetUtils {

   /**
    * Non-destructive intersection. Iterates over the smaller set and probes
    * the larger one.
    * @param a first set
    * @param b second set
    * @return new mutable set with the elements common to a and b
    */
   public static HashIntSet intersect(IntSet a, IntSet b) {
      IntSet smaller = a.size() <= b.size() ? a : b;
      IntSet larger = smaller == a ? b : a;

      HashIntSet target = HashIntSets.newMutableSet(smaller.size());
      IntCursor cur = smaller.cursor();
      while (cur.moveNext()) {
         int v = cur.elem();
         if (larger.contains(v)) {
            target.add(v);
         }
      }

      return target;
   }

   public static HashIntSet copy(IntSet a) {
      HashIntSet target = HashIntSets.newMutableSet(a.size());
      target.addAll(a);
      return target;
   }

   public static boolean isSubset(IntSet a, IntSet b) {
      if (a.size() > b.size()) return false;
      IntCursor cur = a.cursor();
      while (cur.moveNext()) {
         if (!b.contains(cur.elem())) return false;
      }
      return true;
   }

   /**
    * @param set set of ints
    * @return elements of set in ascending order
    */
   public static int[] sorted(IntSet set) {
      int[] elements = set.toIntArray();
      Arrays.sort(elements);
      return elements;
   }
}
