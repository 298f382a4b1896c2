package pl.poznan.put.conformer.chain;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Append-only chain of backbone atoms laid out residue by residue in N, CA, C, O order. The
 * carbonyl oxygen of a residue is appended just before the nitrogen of the following residue, so
 * the last residue of a chain holds only N, CA and C. Every residue {@code r} starts at atom index
 * {@code 4 * r}.
 */
public class BackboneChain {
  public static final int ATOMS_PER_RESIDUE = AtomLabel.values().length;

  private final List<Vector3D> coordinates = new ArrayList<>();
  private final List<AtomLabel> labels = new ArrayList<>();
  private final List<Integer> residues = new ArrayList<>();
  private final List<Vector3D> backbone = new ArrayList<>();
  private boolean frozen;

  public AtomLabel nextLabel() {
    return labels.isEmpty() ? AtomLabel.N : labels.get(labels.size() - 1).next();
  }

  public void append(AtomLabel label, Vector3D position) {
    Preconditions.checkState(!frozen, "Cannot append to a finished chain");
    Preconditions.checkArgument(
        label == nextLabel(), "Expected %s atom, but %s was appended", nextLabel(), label);
    var residue = label == AtomLabel.N ? residueCount() : residueCount() - 1;
    coordinates.add(position);
    labels.add(label);
    residues.add(residue);
    if (label.isBackbone()) {
      backbone.add(position);
    }
  }

  /** Rolls the chain back to its first {@code size} atoms. */
  public void truncate(int size) {
    Preconditions.checkState(!frozen, "Cannot truncate a finished chain");
    Preconditions.checkElementIndex(size, coordinates.size() + 1, "Truncation size");
    while (coordinates.size() > size) {
      var last = coordinates.size() - 1;
      if (labels.get(last).isBackbone()) {
        backbone.remove(backbone.size() - 1);
      }
      coordinates.remove(last);
      labels.remove(last);
      residues.remove(last);
    }
  }

  /** Makes the chain read-only; any later {@code append} or {@code truncate} fails. */
  public BackboneChain freeze() {
    frozen = true;
    return this;
  }

  public boolean isFrozen() {
    return frozen;
  }

  public int size() {
    return coordinates.size();
  }

  /** Number of residues whose nitrogen has been placed. */
  public int residueCount() {
    return (coordinates.size() + ATOMS_PER_RESIDUE - 1) / ATOMS_PER_RESIDUE;
  }

  public int backboneCount() {
    return backbone.size();
  }

  public Vector3D coordinate(int index) {
    return coordinates.get(index);
  }

  public AtomLabel label(int index) {
    return labels.get(index);
  }

  public int residue(int index) {
    return residues.get(index);
  }

  /** Backbone (N, CA or C) atom counted from the end, {@code 1} being the most recent one. */
  public Vector3D backboneFromEnd(int offset) {
    return backbone.get(backbone.size() - offset);
  }

  public List<Vector3D> coordinates() {
    return Collections.unmodifiableList(coordinates);
  }

  public List<Vector3D> backboneCoordinates() {
    return Collections.unmodifiableList(backbone);
  }

  /** Coordinates of residues {@code [from, to)}, clipped to the residues of the chain. */
  public List<Vector3D> residueCoordinates(int from, int to) {
    var start = Math.min(Math.max(from, 0) * ATOMS_PER_RESIDUE, coordinates.size());
    var end = Math.min(Math.max(to, 0) * ATOMS_PER_RESIDUE, coordinates.size());
    return start >= end
        ? Collections.emptyList()
        : Collections.unmodifiableList(coordinates.subList(start, end));
  }

  public List<Atom> atoms() {
    return IntStream.range(0, coordinates.size())
        .mapToObj(i -> ImmutableAtom.of(labels.get(i), residues.get(i), coordinates.get(i)))
        .collect(Collectors.toList());
  }

  public List<Atom> backboneAtoms() {
    return atoms().stream().filter(atom -> atom.label().isBackbone()).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return String.format("BackboneChain{residues=%d, atoms=%d}", residueCount(), size());
  }
}
