package pl.poznan.put.conformer.io;

import pl.poznan.put.conformer.chain.BackboneChain;

import java.io.IOException;
import java.nio.file.Path;

public interface StructureWriter {
  /** Occupancy and temperature factor of every written atom; conformers carry neither. */
  double OCCUPANCY = 0.0;

  double B_FACTOR = 0.0;

  String extension();

  void write(String sequence, BackboneChain chain, Path path) throws IOException;
}
