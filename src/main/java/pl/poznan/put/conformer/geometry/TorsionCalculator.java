package pl.poznan.put.conformer.geometry;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.util.FastMath;
import pl.poznan.put.conformer.chain.Atom;
import pl.poznan.put.conformer.chain.AtomLabel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public final class TorsionCalculator {
  private TorsionCalculator() {}

  /**
   * Computes the signed dihedral angle around every interior bond of a chain of points. For {@code
   * n} points there are {@code n - 3} angles; the i-th one places point {@code i + 3} relative to
   * the plane of points {@code i, i + 1, i + 2}.
   *
   * <p>For an N-CA-C backbone starting at N the result interleaves psi, omega and phi: psi at
   * indices {@code 0, 3, ...}, omega at {@code 1, 4, ...} and phi at {@code 2, 5, ...}.
   *
   * @return Torsion angles in radians, in the range {@code [-pi, pi]}.
   * @throws InvalidGeometryInputException When fewer than four points are given.
   */
  public static double[] torsionAngles(List<Vector3D> coordinates) {
    if (coordinates.size() < 4) {
      throw new InvalidGeometryInputException(
          "At least 4 points are required to compute a torsion angle, got: "
              + coordinates.size());
    }

    var bonds = new ArrayList<Vector3D>(coordinates.size() - 1);
    for (var i = 0; i < coordinates.size() - 1; i++) {
      bonds.add(coordinates.get(i + 1).subtract(coordinates.get(i)));
    }

    var normals = new ArrayList<Vector3D>(bonds.size() - 1);
    for (var i = 0; i < bonds.size() - 1; i++) {
      normals.add(unit(bonds.get(i).crossProduct(bonds.get(i + 1))));
    }

    var torsions = new double[normals.size() - 1];
    for (var i = 0; i < torsions.length; i++) {
      var u0 = normals.get(i);
      var u1 = normals.get(i + 1);
      var u2 = unit(bonds.get(i + 1)).crossProduct(u1);
      torsions[i] = -FastMath.atan2(u0.dotProduct(u2), u0.dotProduct(u1));
    }
    return torsions;
  }

  /**
   * Raw array variant of {@link #torsionAngles(List)}.
   *
   * @throws InvalidGeometryInputException When a row is not three-dimensional.
   */
  public static double[] torsionAngles(double[][] coordinates) {
    var points = new ArrayList<Vector3D>(coordinates.length);
    for (var i = 0; i < coordinates.length; i++) {
      if (coordinates[i] == null || coordinates[i].length != 3) {
        throw new InvalidGeometryInputException(
            String.format(
                "Point %d is not three-dimensional: %s", i, Arrays.toString(coordinates[i])));
      }
      points.add(new Vector3D(coordinates[i]));
    }
    return torsionAngles(points);
  }

  /**
   * Groups the torsions of an N-CA-C backbone by residue. Phi of the first residue and psi and
   * omega of the last one are undefined and set to {@link Double#NaN}.
   */
  public static List<TorsionTriple> residueTorsions(List<Vector3D> backbone) {
    if (backbone.size() % 3 != 0) {
      throw new InvalidGeometryInputException(
          "Backbone atom count is not a multiple of 3: " + backbone.size());
    }

    var torsions = torsionAngles(backbone);
    var residueCount = backbone.size() / 3;
    var result = new ArrayList<TorsionTriple>(residueCount);
    for (var residue = 0; residue < residueCount; residue++) {
      var phi = residue == 0 ? Double.NaN : torsions[3 * residue - 1];
      var psi = residue == residueCount - 1 ? Double.NaN : torsions[3 * residue];
      var omega = residue == residueCount - 1 ? Double.NaN : torsions[3 * residue + 1];
      result.add(ImmutableTorsionTriple.of(phi, psi, omega));
    }
    return result;
  }

  /**
   * Checks that labelled atoms are suitable for {@link #residueTorsions(List)}. Carbonyl oxygens
   * are not part of the torsion chain and are ignored.
   *
   * @return An empty string when the atoms are valid, a diagnostic message otherwise.
   */
  public static String validateBackboneForTorsion(List<? extends Atom> atoms) {
    var backbone =
        atoms.stream().filter(atom -> atom.label().isBackbone()).collect(Collectors.toList());
    if (backbone.isEmpty() || backbone.get(0).label() != AtomLabel.N) {
      return "The first atom is not N, it should be!";
    }
    if (backbone.size() % 3 != 0) {
      return String.format(
          "Number of backbone atoms is not a multiple of 3: %d (%s)",
          backbone.size(),
          backbone.stream().map(atom -> atom.label().name()).collect(Collectors.joining(",")));
    }
    return "";
  }

  private static Vector3D unit(Vector3D vector) {
    var norm = vector.getNorm();
    return norm > 0.0 ? vector.scalarMultiply(1.0 / norm) : vector;
  }
}
