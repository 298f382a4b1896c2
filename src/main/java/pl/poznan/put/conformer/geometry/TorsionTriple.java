package pl.poznan.put.conformer.geometry;

import org.immutables.value.Value;

/** Backbone torsions of one residue, in radians. Undefined torsions are {@link Double#NaN}. */
@Value.Immutable
public interface TorsionTriple {
  static TorsionTriple ofDegrees(double phi, double psi, double omega) {
    return ImmutableTorsionTriple.of(
        Math.toRadians(phi), Math.toRadians(psi), Math.toRadians(omega));
  }

  @Value.Parameter
  double phi();

  @Value.Parameter
  double psi();

  @Value.Parameter
  double omega();
}
