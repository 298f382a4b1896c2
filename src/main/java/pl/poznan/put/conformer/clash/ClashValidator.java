package pl.poznan.put.conformer.clash;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealMatrixPreservingVisitor;

import java.util.List;

/**
 * Hard-sphere overlap test between two groups of backbone atoms. Both groups must start at an N
 * atom and follow the N, CA, C, O order; only their last residue may be incomplete.
 *
 * <p>The caller is responsible for not comparing atoms that are covalently bonded to each other or
 * belong to the same residue.
 */
public class ClashValidator {
  private final ClashTable table;

  public ClashValidator() {
    this(ClashTable.vanDerWaals());
  }

  public ClashValidator(ClashTable table) {
    this.table = table;
  }

  public boolean hasClashBatched(List<Vector3D> settled, List<Vector3D> added) {
    if (settled.isEmpty() || added.isEmpty()) {
      return false;
    }

    var distances = distanceMatrix(settled, added);
    var allowed = table.tile(settled.size(), added.size());
    var difference = distances.subtract(allowed);
    var closest =
        difference.walkInOptimizedOrder(
            new RealMatrixPreservingVisitor() {
              private double minimum = Double.POSITIVE_INFINITY;

              @Override
              public void start(
                  int rows,
                  int columns,
                  int startRow,
                  int endRow,
                  int startColumn,
                  int endColumn) {}

              @Override
              public void visit(int row, int column, double value) {
                minimum = Math.min(minimum, value);
              }

              @Override
              public double end() {
                return minimum;
              }
            });
    return closest < 0.0;
  }

  public boolean hasClashIncremental(List<Vector3D> settled, List<Vector3D> added) {
    var residueSize = table.size();

    for (var settledStart = 0; settledStart < settled.size(); settledStart += residueSize) {
      var settledResidue =
          settled.subList(settledStart, Math.min(settledStart + residueSize, settled.size()));

      for (var addedStart = 0; addedStart < added.size(); addedStart += residueSize) {
        var addedResidue =
            added.subList(addedStart, Math.min(addedStart + residueSize, added.size()));

        if (residuesClash(settledResidue, addedResidue)) {
          return true;
        }
      }
    }
    return false;
  }

  private boolean residuesClash(List<Vector3D> first, List<Vector3D> second) {
    for (var i = 0; i < first.size(); i++) {
      for (var j = 0; j < second.size(); j++) {
        if (first.get(i).distance(second.get(j)) < table.allowedDistance(i, j)) {
          return true;
        }
      }
    }
    return false;
  }

  private static RealMatrix distanceMatrix(List<Vector3D> rows, List<Vector3D> columns) {
    var matrix = MatrixUtils.createRealMatrix(rows.size(), columns.size());
    for (var i = 0; i < rows.size(); i++) {
      for (var j = 0; j < columns.size(); j++) {
        matrix.setEntry(i, j, rows.get(i).distance(columns.get(j)));
      }
    }
    return matrix;
  }
}
