package pl.poznan.put.conformer.clash;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.List;

public enum ClashStrategy {
  /** Whole distance matrix at once, suited for throughput. */
  BATCHED {
    @Override
    public boolean hasClash(
        ClashValidator validator, List<Vector3D> settled, List<Vector3D> added) {
      return validator.hasClashBatched(settled, added);
    }
  },
  /** Residue by residue with an early exit on the first overlap. */
  INCREMENTAL {
    @Override
    public boolean hasClash(
        ClashValidator validator, List<Vector3D> settled, List<Vector3D> added) {
      return validator.hasClashIncremental(settled, added);
    }
  };

  public abstract boolean hasClash(
      ClashValidator validator, List<Vector3D> settled, List<Vector3D> added);
}
