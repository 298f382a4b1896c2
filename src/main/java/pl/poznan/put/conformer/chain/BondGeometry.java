package pl.poznan.put.conformer.chain;

import org.immutables.value.Value;

/**
 * Ideal backbone bond lengths (in angstroms) and bend angles (in radians). One instance is created
 * at startup and shared read-only by every builder.
 */
@Value.Immutable
public interface BondGeometry {
  static BondGeometry standard() {
    return ImmutableBondGeometry.builder().build();
  }

  @Value.Default
  default double distanceNCa() {
    return 1.458;
  }

  @Value.Default
  default double distanceCaC() {
    return 1.525;
  }

  /** Peptide bond between C of residue i and N of residue i+1. */
  @Value.Default
  default double distanceCN() {
    return 1.329;
  }

  @Value.Default
  default double distanceCO() {
    return 1.231;
  }

  @Value.Default
  default double angleNCaC() {
    return Math.toRadians(111.2);
  }

  @Value.Default
  default double angleCaCN() {
    return Math.toRadians(116.2);
  }

  @Value.Default
  default double angleCNCa() {
    return Math.toRadians(121.7);
  }

  @Value.Default
  default double angleCaCO() {
    return Math.toRadians(120.1);
  }

  @Value.Check
  default void check() {
    for (var distance : new double[] {distanceNCa(), distanceCaC(), distanceCN(), distanceCO()}) {
      if (distance <= 0.0) {
        throw new IllegalStateException("Bond lengths must be positive, found: " + distance);
      }
    }
    for (var angle :
        new double[] {angleNCaC(), angleCaCN(), angleCNCa(), angleCaCO()}) {
      if (angle <= 0.0 || angle > Math.PI) {
        throw new IllegalStateException("Bend angles must lie in (0, pi], found: " + angle);
      }
    }
  }
}
