package pl.poznan.put.conformer.fragment;

import org.immutables.value.Value;
import pl.poznan.put.conformer.geometry.TorsionTriple;

import java.util.List;

@Value.Immutable
public interface AngleFragment {
  String label();

  String source();

  List<TorsionTriple> torsions();

  default int size() {
    return torsions().size();
  }

  /**
   * Flattens the torsions to phi, psi, omega order and drops the first phi and the last psi and
   * omega: those need atoms outside of the fragment. Each remaining value places exactly one
   * backbone atom, starting with N of the residue that follows the fragment's first one.
   */
  default double[] interiorTorsions() {
    var size = size();
    var interior = new double[3 * size - 3];
    var index = 0;
    for (var i = 0; i < size; i++) {
      var triple = torsions().get(i);
      if (i > 0) {
        interior[index++] = triple.phi();
      }
      if (i < size - 1) {
        interior[index++] = triple.psi();
        interior[index++] = triple.omega();
      }
    }
    return interior;
  }

  @Value.Check
  default void check() {
    if (torsions().isEmpty()) {
      throw new IllegalStateException("Fragment " + source() + " has no residues");
    }
  }
}
