package pl.poznan.put.conformer.clash;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import pl.poznan.put.conformer.chain.AtomLabel;

import java.util.Map;

/**
 * Minimum allowed distances between backbone atoms, i.e. sums of their van der Waals radii, indexed
 * in the canonical N, CA, C, O order.
 */
public final class ClashTable {
  private static final Map<AtomLabel, Double> VAN_DER_WAALS_RADII =
      ImmutableMap.of(AtomLabel.N, 1.55, AtomLabel.CA, 1.70, AtomLabel.C, 1.70, AtomLabel.O, 1.52);
  private static final ClashTable VAN_DER_WAALS = new ClashTable(VAN_DER_WAALS_RADII);

  private final RealMatrix allowed;

  private ClashTable(Map<AtomLabel, Double> radii) {
    var labels = AtomLabel.values();
    allowed = MatrixUtils.createRealMatrix(labels.length, labels.length);
    for (var first : labels) {
      for (var second : labels) {
        allowed.setEntry(
            first.ordinal(), second.ordinal(), radii.get(first) + radii.get(second));
      }
    }
  }

  public static ClashTable vanDerWaals() {
    return VAN_DER_WAALS;
  }

  public static ClashTable withRadii(Map<AtomLabel, Double> radii) {
    Preconditions.checkArgument(
        radii.keySet().containsAll(VAN_DER_WAALS_RADII.keySet()),
        "A radius is required for every atom label, got: %s",
        radii);
    return new ClashTable(radii);
  }

  public double allowedDistance(AtomLabel first, AtomLabel second) {
    return allowed.getEntry(first.ordinal(), second.ordinal());
  }

  /** Allowed distance between the i-th and j-th atoms of two groups laid out in residue order. */
  public double allowedDistance(int i, int j) {
    var size = allowed.getRowDimension();
    return allowed.getEntry(i % size, j % size);
  }

  public int size() {
    return allowed.getRowDimension();
  }

  /**
   * Tiles the table to cover {@code rows x columns} atoms and truncates the result, so that groups
   * ending with an incomplete residue are handled without a special case.
   */
  public RealMatrix tile(int rows, int columns) {
    var size = size();
    var tiled = MatrixUtils.createRealMatrix(rows, columns);
    for (var i = 0; i < rows; i++) {
      for (var j = 0; j < columns; j++) {
        tiled.setEntry(i, j, allowed.getEntry(i % size, j % size));
      }
    }
    return tiled;
  }
}
