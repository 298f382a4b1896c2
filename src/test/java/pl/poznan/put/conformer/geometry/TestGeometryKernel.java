package pl.poznan.put.conformer.geometry;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

public class TestGeometryKernel {
  private static final double EPSILON = 1.0e-9;

  private static void assertVector(Vector3D actual, double x, double y, double z) {
    assertThat(actual.getX(), closeTo(x, EPSILON));
    assertThat(actual.getY(), closeTo(y, EPSILON));
    assertThat(actual.getZ(), closeTo(z, EPSILON));
  }

  @Test
  public void localFrameOfPlanarPoints() {
    var frame =
        GeometryKernel.localFrame(
            Vector3D.ZERO, new Vector3D(1.458, 0.0, 0.0), new Vector3D(2.009, 1.42, 0.0));

    assertVector(frame.normal(), 0.0, 0.0, -1.0);
    assertVector(frame.xAxis(), -1.0, 0.0, 0.0);
    assertVector(frame.perpendicular(), 0.0, -1.0, 0.0);
    assertThat(frame.isDegenerate(), is(false));
  }

  @Test
  public void collinearPointsGiveZeroNormal() {
    var frame =
        GeometryKernel.localFrame(
            Vector3D.ZERO, new Vector3D(1.0, 0.0, 0.0), new Vector3D(2.0, 0.0, 0.0));

    assertThat(frame.normal().getNorm(), is(0.0));
    assertThat(frame.isDegenerate(), is(true));
  }

  @Test
  public void coincidentPointsGiveDegenerateFrame() {
    var point = new Vector3D(1.0, 2.0, 3.0);
    var frame = GeometryKernel.localFrame(point, point, new Vector3D(0.0, 1.0, 0.0));

    assertThat(frame.xAxis().getNorm(), is(0.0));
    assertThat(frame.isDegenerate(), is(true));
  }

  @Test
  public void placeAtomRejectsCollinearReferences() {
    assertThrows(
        DegenerateGeometryException.class,
        () ->
            GeometryKernel.placeAtom(
                1.0,
                0.5,
                1.5,
                new Vector3D(2.0, 0.0, 0.0),
                new Vector3D(1.0, 0.0, 0.0),
                Vector3D.ZERO));
  }

  @Test
  public void rotationToFrameIsOrthogonal() {
    var rotation =
        GeometryKernel.rotationToFrame(
            new Vector3D(0.3, -1.2, 2.0),
            new Vector3D(1.1, 0.4, -0.7),
            new Vector3D(-2.0, 0.9, 1.3));
    var product = rotation.transpose().multiply(rotation);
    var identity = MatrixUtils.createRealIdentityMatrix(3);

    for (var i = 0; i < 3; i++) {
      for (var j = 0; j < 3; j++) {
        assertThat(product.getEntry(i, j), closeTo(identity.getEntry(i, j), EPSILON));
      }
    }
    assertThat(new LUDecomposition(rotation).getDeterminant(), closeTo(1.0, EPSILON));
  }

  @Test
  public void placeAtomHonoursDistanceAngleAndTorsion() {
    var a = new Vector3D(0.0, 1.2, 0.3);
    var b = Vector3D.ZERO;
    var c = new Vector3D(1.45, 0.0, 0.0);
    var bondAngle = Math.toRadians(111.2);

    for (var torsion : new double[] {-2.5, -1.2, 0.0, 0.5, 2.9}) {
      var d = GeometryKernel.placeAtom(Math.PI - bondAngle, torsion, 1.52, c, b, a);

      assertThat(d.distance(c), closeTo(1.52, EPSILON));
      assertThat(GeometryKernel.bondAngle(b, c, d), closeTo(bondAngle, 1.0e-6));
      assertThat(
          TorsionCalculator.torsionAngles(List.of(a, b, c, d))[0],
          closeTo(torsion, 1.0e-6));
    }
  }

  @Test
  public void placeAtomRejectsNonFiniteInput() {
    var a = new Vector3D(0.0, 1.2, 0.3);
    var b = Vector3D.ZERO;
    var c = new Vector3D(1.45, 0.0, 0.0);

    assertThrows(
        DegenerateGeometryException.class,
        () -> GeometryKernel.placeAtom(1.2, Double.NaN, 1.52, c, b, a));
    assertThrows(
        DegenerateGeometryException.class,
        () -> GeometryKernel.placeAtom(1.2, 0.5, Double.POSITIVE_INFINITY, c, b, a));
    assertThrows(
        DegenerateGeometryException.class,
        () -> GeometryKernel.placeAtom(1.2, 0.5, 1.52, c, b, new Vector3D(Double.NaN, 0.0, 0.0)));
    assertThat(GeometryKernel.localFrame(c, b, Vector3D.NaN).isDegenerate(), is(true));
  }
}
