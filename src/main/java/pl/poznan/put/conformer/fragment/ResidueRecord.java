package pl.poznan.put.conformer.fragment;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.immutables.value.Value;
import pl.poznan.put.conformer.geometry.TorsionTriple;

/** One residue of the fragment database: its CA position, backbone torsions and chi1. */
@Value.Immutable
public interface ResidueRecord {
  String residue();

  char label();

  Vector3D coordinates();

  TorsionTriple torsions();

  double chi1();

  /** Where the record comes from, e.g. {@code 1abc_A.data:12}. */
  String source();
}
