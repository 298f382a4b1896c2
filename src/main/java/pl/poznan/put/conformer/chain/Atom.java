package pl.poznan.put.conformer.chain;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.immutables.value.Value;

@Value.Immutable
public interface Atom {
  @Value.Parameter
  AtomLabel label();

  @Value.Parameter
  int residue();

  @Value.Parameter
  Vector3D coordinates();

  default String element() {
    return label().element();
  }
}
