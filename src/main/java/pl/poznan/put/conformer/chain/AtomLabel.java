package pl.poznan.put.conformer.chain;

public enum AtomLabel {
  N("N"),
  CA("C"),
  C("C"),
  O("O");

  private final String element;

  AtomLabel(String element) {
    this.element = element;
  }

  public String element() {
    return element;
  }

  /** Four-column atom name as used in PDB records, e.g. {@code " CA "}. */
  public String pdbName() {
    return String.format(" %-3s", name());
  }

  public boolean isBackbone() {
    return this != O;
  }

  /** Label expected after this one in the canonical N, CA, C, O residue order. */
  public AtomLabel next() {
    var labels = values();
    return labels[(ordinal() + 1) % labels.length];
  }
}
