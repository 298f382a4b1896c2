package pl.poznan.put.conformer.build;

public enum BuildState {
  SEEDED,
  GROWING,
  /** Every residue of the sequence has been placed. */
  COMPLETED,
  /** A fragment did not fit the remaining residues and was rolled back. */
  EXHAUSTED,
  /** Reference atoms were collinear or coincident. */
  DEGENERATE,
  /** Every fragment drawn for one growth step clashed with the chain. */
  STUCK;

  public boolean isTerminal() {
    return this != SEEDED && this != GROWING;
  }
}
