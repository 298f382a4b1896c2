package pl.poznan.put.conformer.geometry;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Internal to Cartesian coordinate conversion based on the Natural Extension Reference Frame
 * (NeRF). All methods are pure.
 */
public final class GeometryKernel {
  private GeometryKernel() {}

  private static Vector3D normalizeOrKeep(Vector3D vector) {
    var norm = vector.getNorm();
    return norm > 0.0 ? vector.scalarMultiply(1.0 / norm) : vector;
  }

  /**
   * Builds the orthonormal frame of three ordered points. Axes that cannot be normalized are
   * returned as zero vectors, which makes the frame {@link LocalFrame#isDegenerate() degenerate}.
   *
   * @param a Frame origin.
   * @param b Point defining the x axis as {@code a - b}.
   * @param c Point spanning the {@code a-b-c} plane.
   */
  public static LocalFrame localFrame(Vector3D a, Vector3D b, Vector3D c) {
    var ab = a.subtract(b);
    var normal = ab.crossProduct(c.subtract(b));
    var perpendicular = ab.crossProduct(normal);
    return ImmutableLocalFrame.of(
        normalizeOrKeep(normal), normalizeOrKeep(ab), normalizeOrKeep(perpendicular));
  }

  /** Rotation whose columns are the x axis, the negated perpendicular and the plane normal. */
  public static RealMatrix rotationToFrame(Vector3D a, Vector3D b, Vector3D c) {
    return rotationOf(localFrame(a, b, c));
  }

  private static RealMatrix rotationOf(LocalFrame frame) {
    var rotation = MatrixUtils.createRealMatrix(3, 3);
    rotation.setColumn(0, frame.xAxis().toArray());
    rotation.setColumn(1, frame.perpendicular().negate().toArray());
    rotation.setColumn(2, frame.normal().toArray());
    return rotation;
  }

  /**
   * Places a new atom bonded to {@code parent}.
   *
   * @param bend Complement of the bond angle {@code xAxisPoint-parent-new}, i.e. {@code pi -
   *     angle}.
   * @param torsion Dihedral {@code yAxisPoint-xAxisPoint-parent-new}.
   * @param distance Bond length between {@code parent} and the new atom.
   * @throws DegenerateGeometryException When the reference points are collinear or coincident, or
   *     when any input is not finite.
   */
  public static Vector3D placeAtom(
      double bend,
      double torsion,
      double distance,
      Vector3D parent,
      Vector3D xAxisPoint,
      Vector3D yAxisPoint) {
    var frame = localFrame(parent, xAxisPoint, yAxisPoint);
    if (frame.isDegenerate()) {
      throw new DegenerateGeometryException(
          String.format(
              "Reference points %s, %s, %s do not define a plane", parent, xAxisPoint, yAxisPoint));
    }

    var sinBend = FastMath.sin(bend);
    var offset =
        new double[] {
          distance * FastMath.cos(bend),
          distance * sinBend * FastMath.cos(torsion),
          distance * sinBend * FastMath.sin(torsion)
        };
    var position = new Vector3D(rotationOf(frame).operate(offset)).add(parent);
    if (position.isNaN() || position.isInfinite()) {
      throw new DegenerateGeometryException(
          String.format(
              "Non-finite position %s from bend %f, torsion %f, distance %f",
              position, bend, torsion, distance));
    }
    return position;
  }

  /** Angle at {@code b} formed by {@code a-b-c}, in radians. */
  public static double bondAngle(Vector3D a, Vector3D b, Vector3D c) {
    return Vector3D.angle(a.subtract(b), c.subtract(b));
  }
}
