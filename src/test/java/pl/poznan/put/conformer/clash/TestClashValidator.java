package pl.poznan.put.conformer.clash;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.jupiter.api.Test;
import pl.poznan.put.conformer.chain.AtomLabel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class TestClashValidator {
  private final ClashValidator validator = new ClashValidator();

  private static List<Vector3D> randomGroup(RandomGenerator random, int size, double spread) {
    var offset = new Vector3D(random.nextDouble(), random.nextDouble(), random.nextDouble());
    var group = new ArrayList<Vector3D>(size);
    for (var i = 0; i < size; i++) {
      group.add(
          new Vector3D(
                  spread * random.nextDouble(),
                  spread * random.nextDouble(),
                  spread * random.nextDouble())
              .add(offset));
    }
    return group;
  }

  @Test
  public void radiiSums() {
    var table = ClashTable.vanDerWaals();

    assertThat(table.allowedDistance(AtomLabel.N, AtomLabel.N), closeTo(3.10, 1.0e-12));
    assertThat(table.allowedDistance(AtomLabel.CA, AtomLabel.O), closeTo(3.22, 1.0e-12));
    assertThat(table.allowedDistance(AtomLabel.C, AtomLabel.CA), closeTo(3.40, 1.0e-12));
    assertThat(table.allowedDistance(5, 7), is(table.allowedDistance(AtomLabel.CA, AtomLabel.O)));
  }

  @Test
  public void exactlyAllowedDistanceIsNotAClash() {
    var limit = ClashTable.vanDerWaals().allowedDistance(AtomLabel.N, AtomLabel.N);
    var settled = List.of(Vector3D.ZERO);

    for (var strategy : ClashStrategy.values()) {
      assertThat(
          strategy.hasClash(validator, settled, List.of(new Vector3D(limit, 0.0, 0.0))),
          is(false));
      assertThat(
          strategy.hasClash(validator, settled, List.of(new Vector3D(limit - 1.0, 0.0, 0.0))),
          is(true));
    }
  }

  @Test
  public void emptyGroupsNeverClash() {
    var group = List.of(Vector3D.ZERO, Vector3D.PLUS_I);

    for (var strategy : ClashStrategy.values()) {
      assertThat(strategy.hasClash(validator, List.of(), group), is(false));
      assertThat(strategy.hasClash(validator, group, List.of()), is(false));
    }
  }

  @Test
  public void allowedDistanceDependsOnAtomPosition() {
    // O of the settled residue against N of the new one: 1.52 + 1.55
    var settled =
        List.of(
            new Vector3D(-20.0, 0.0, 0.0),
            new Vector3D(-20.0, 5.0, 0.0),
            new Vector3D(-20.0, 10.0, 0.0),
            Vector3D.ZERO);
    var clashing = List.of(new Vector3D(3.0, 0.0, 0.0));
    var separated = List.of(new Vector3D(3.1, 0.0, 0.0));

    for (var strategy : ClashStrategy.values()) {
      assertThat(strategy.hasClash(validator, settled, clashing), is(true));
      assertThat(strategy.hasClash(validator, settled, separated), is(false));
    }
  }

  @Test
  public void strategiesAgreeOnRandomGroups() {
    var random = new MersenneTwister(20240607L);

    for (var i = 0; i < 500; i++) {
      // sizes not divisible by 4 cover a terminal residue without O
      var settled = randomGroup(random, 1 + random.nextInt(15), 3.0 + 20.0 * random.nextDouble());
      var added = randomGroup(random, 1 + random.nextInt(15), 3.0 + 20.0 * random.nextDouble());
      if (random.nextBoolean()) {
        var shift = new Vector3D(25.0, 0.0, 0.0);
        added.replaceAll(point -> point.add(shift));
      }

      assertThat(
          validator.hasClashIncremental(settled, added),
          is(validator.hasClashBatched(settled, added)));
    }
  }

  @Test
  public void largerRadiiWidenTheTable() {
    var table =
        ClashTable.withRadii(
            Map.of(AtomLabel.N, 2.0, AtomLabel.CA, 2.0, AtomLabel.C, 2.0, AtomLabel.O, 2.0));
    var custom = new ClashValidator(table);
    var settled = List.of(Vector3D.ZERO);
    var added = List.of(new Vector3D(3.5, 0.0, 0.0));

    assertThat(validator.hasClashBatched(settled, added), is(false));
    assertThat(custom.hasClashBatched(settled, added), is(true));
    assertThat(custom.hasClashIncremental(settled, added), is(true));
  }

  @Test
  public void everyLabelNeedsARadius() {
    assertThrows(
        IllegalArgumentException.class, () -> ClashTable.withRadii(Map.of(AtomLabel.N, 1.0)));
  }
}
