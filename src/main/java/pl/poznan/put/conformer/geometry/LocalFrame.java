package pl.poznan.put.conformer.geometry;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.immutables.value.Value;

import java.util.stream.Stream;

@Value.Immutable
public interface LocalFrame {
  @Value.Parameter
  Vector3D normal();

  @Value.Parameter
  Vector3D xAxis();

  @Value.Parameter
  Vector3D perpendicular();

  /** A frame is degenerate when one of its axes could not be normalized or is not finite. */
  default boolean isDegenerate() {
    return Stream.of(normal(), xAxis(), perpendicular())
        .anyMatch(axis -> axis.isNaN() || axis.isInfinite() || axis.getNorm() == 0.0);
  }
}
