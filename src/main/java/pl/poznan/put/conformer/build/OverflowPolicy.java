package pl.poznan.put.conformer.build;

/** What happens to a fragment longer than the residues still missing from the chain. */
public enum OverflowPolicy {
  /** Keep the leading part of the fragment which fits, filling the chain exactly. */
  TRUNCATE,
  /** Remove the whole fragment and stop growth with a partial chain. */
  ROLL_BACK
}
