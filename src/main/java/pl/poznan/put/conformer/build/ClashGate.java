package pl.poznan.put.conformer.build;

import pl.poznan.put.conformer.chain.BackboneChain;
import pl.poznan.put.conformer.clash.ClashStrategy;
import pl.poznan.put.conformer.clash.ClashValidator;

/**
 * Decides whether residues appended in the last growth step clash with the rest of the chain.
 * Residues around the junction are left out of the comparison: the last {@value
 * #SETTLED_EXCLUSION} residues before it and the first {@value #NEW_EXCLUSION} after it, so that
 * covalently bonded atoms are never compared.
 */
public class ClashGate {
  static final int SETTLED_EXCLUSION = 2;
  static final int NEW_EXCLUSION = 1;

  private final ClashValidator validator;
  private final ClashStrategy strategy;

  public ClashGate(ClashValidator validator, ClashStrategy strategy) {
    this.validator = validator;
    this.strategy = strategy;
  }

  /**
   * @param chain Chain after the growth step.
   * @param firstNewResidue Index of the first residue appended in the growth step.
   */
  public boolean clashes(BackboneChain chain, int firstNewResidue) {
    var settled = chain.residueCoordinates(0, firstNewResidue - SETTLED_EXCLUSION);
    var added = chain.residueCoordinates(firstNewResidue + NEW_EXCLUSION, chain.residueCount());
    return strategy.hasClash(validator, settled, added);
  }
}
