package pl.poznan.put.conformer.fragment;

import java.util.List;

/** Supplier of candidate fragments for a secondary-structure pattern. */
@FunctionalInterface
public interface FragmentPool {
  /**
   * @param pattern Regular expression over per-residue secondary-structure labels, e.g. {@code
   *     (?=(L{2,6}))} for overlapping runs of 2 to 6 loop residues.
   * @return Matching fragments, possibly empty.
   */
  List<AngleFragment> fragmentsMatching(String pattern);
}
