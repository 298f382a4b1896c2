package pl.poznan.put.conformer.geometry;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.emptyString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;
import pl.poznan.put.conformer.chain.Atom;
import pl.poznan.put.conformer.chain.AtomLabel;
import pl.poznan.put.conformer.chain.ImmutableAtom;

import java.util.ArrayList;
import java.util.List;

public class TestTorsionCalculator {
  @Test
  public void planarTransChain() {
    var torsions =
        TorsionCalculator.torsionAngles(
            new double[][] {
              {0.0636, -0.79573, 1.21644},
              {-0.4737, -0.10913, 0.77737},
              {-1.75288, -0.51877, 1.33236},
              {-2.29018, 0.16783, 0.89329}
            });

    assertThat(torsions.length, is(1));
    assertThat(Math.abs(torsions[0]), closeTo(Math.PI, 1.0e-6));
  }

  @Test
  public void rightAngleFollowsIupacSign() {
    var torsions =
        TorsionCalculator.torsionAngles(
            List.of(
                new Vector3D(1.0, 0.0, 0.0),
                Vector3D.ZERO,
                new Vector3D(0.0, 1.0, 0.0),
                new Vector3D(0.0, 1.0, 1.0)));

    assertThat(torsions[0], closeTo(-Math.PI / 2.0, 1.0e-12));
  }

  @Test
  public void mirroredPointFlipsSign() {
    var torsions =
        TorsionCalculator.torsionAngles(
            List.of(
                new Vector3D(1.0, 0.0, 0.0),
                Vector3D.ZERO,
                new Vector3D(0.0, 1.0, 0.0),
                new Vector3D(0.0, 1.0, -1.0)));

    assertThat(torsions[0], closeTo(Math.PI / 2.0, 1.0e-12));
  }

  @Test
  public void recoversTorsionsOfPlacedChain() {
    var expected = new double[] {-2.1, 3.05, -1.05, 2.4, -3.1, -1.2, 0.7};
    var points = new ArrayList<Vector3D>();
    points.add(Vector3D.ZERO);
    points.add(new Vector3D(1.458, 0.0, 0.0));
    points.add(new Vector3D(2.009, 1.42, 0.0));

    for (var torsion : expected) {
      var size = points.size();
      points.add(
          GeometryKernel.placeAtom(
              Math.toRadians(70.0),
              torsion,
              1.5,
              points.get(size - 1),
              points.get(size - 2),
              points.get(size - 3)));
    }

    var torsions = TorsionCalculator.torsionAngles(points);
    assertThat(torsions.length, is(expected.length));
    for (var i = 0; i < expected.length; i++) {
      assertThat(torsions[i], closeTo(expected[i], 1.0e-9));
    }
  }

  @Test
  public void tooFewPoints() {
    assertThrows(
        InvalidGeometryInputException.class,
        () ->
            TorsionCalculator.torsionAngles(
                List.of(Vector3D.ZERO, Vector3D.PLUS_I, Vector3D.PLUS_J)));
  }

  @Test
  public void pointsMustBeThreeDimensional() {
    assertThrows(
        InvalidGeometryInputException.class,
        () ->
            TorsionCalculator.torsionAngles(
                new double[][] {{0.0, 0.0, 0.0}, {1.0, 0.0}, {1.0, 1.0, 0.0}, {1.0, 1.0, 1.0}}));
  }

  @Test
  public void residueTorsionsLeaveBoundariesUndefined() {
    var backbone = new ArrayList<Vector3D>();
    backbone.add(Vector3D.ZERO);
    backbone.add(new Vector3D(1.458, 0.0, 0.0));
    backbone.add(new Vector3D(2.009, 1.42, 0.0));
    var torsions = new double[] {2.3, 3.1, -1.1, 2.0, 3.0, -1.3};
    for (var torsion : torsions) {
      var size = backbone.size();
      backbone.add(
          GeometryKernel.placeAtom(
              Math.toRadians(65.0),
              torsion,
              1.45,
              backbone.get(size - 1),
              backbone.get(size - 2),
              backbone.get(size - 3)));
    }

    var residues = TorsionCalculator.residueTorsions(backbone);

    assertThat(residues.size(), is(3));
    assertThat(Double.isNaN(residues.get(0).phi()), is(true));
    assertThat(residues.get(0).psi(), closeTo(2.3, 1.0e-9));
    assertThat(residues.get(0).omega(), closeTo(3.1, 1.0e-9));
    assertThat(residues.get(1).phi(), closeTo(-1.1, 1.0e-9));
    assertThat(residues.get(1).psi(), closeTo(2.0, 1.0e-9));
    assertThat(residues.get(1).omega(), closeTo(3.0, 1.0e-9));
    assertThat(residues.get(2).phi(), closeTo(-1.3, 1.0e-9));
    assertThat(Double.isNaN(residues.get(2).psi()), is(true));
    assertThat(Double.isNaN(residues.get(2).omega()), is(true));
  }

  @Test
  public void residueTorsionsRequireWholeResidues() {
    var points =
        List.of(
            Vector3D.ZERO,
            Vector3D.PLUS_I,
            new Vector3D(1.0, 1.0, 0.0),
            new Vector3D(1.0, 1.0, 1.0));

    assertThrows(
        InvalidGeometryInputException.class, () -> TorsionCalculator.residueTorsions(points));
  }

  @Test
  public void validatesBackboneLabels() {
    List<Atom> valid = atoms(AtomLabel.N, AtomLabel.CA, AtomLabel.C);
    List<Atom> shifted = atoms(AtomLabel.CA, AtomLabel.C, AtomLabel.N);
    List<Atom> incomplete = atoms(AtomLabel.N, AtomLabel.CA, AtomLabel.C, AtomLabel.N);

    assertThat(TorsionCalculator.validateBackboneForTorsion(valid), is(emptyString()));
    assertThat(
        TorsionCalculator.validateBackboneForTorsion(shifted),
        is("The first atom is not N, it should be!"));
    assertThat(
        TorsionCalculator.validateBackboneForTorsion(incomplete),
        containsString("not a multiple of 3: 4"));
  }

  private static List<Atom> atoms(AtomLabel... labels) {
    var atoms = new ArrayList<Atom>();
    for (var i = 0; i < labels.length; i++) {
      atoms.add(ImmutableAtom.of(labels[i], 0, new Vector3D(i, 0.0, 0.0)));
    }
    return atoms;
  }

  @Test
  public void carbonylOxygensAreIgnoredInValidation() {
    List<Atom> withOxygens =
        atoms(
            AtomLabel.N,
            AtomLabel.CA,
            AtomLabel.C,
            AtomLabel.O,
            AtomLabel.N,
            AtomLabel.CA,
            AtomLabel.C,
            AtomLabel.O,
            AtomLabel.N,
            AtomLabel.CA,
            AtomLabel.C);

    assertThat(TorsionCalculator.validateBackboneForTorsion(withOxygens), is(emptyString()));
  }
}
