package pl.poznan.put.conformer.io;

import pl.poznan.put.conformer.chain.Atom;
import pl.poznan.put.conformer.chain.BackboneChain;
import pl.poznan.put.conformer.chain.ResidueNames;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Writes chains as fixed-column PDB {@code ATOM} records. */
public class PdbWriter implements StructureWriter {
  static final String CHAIN_ID = "A";
  private static final String ATOM_FORMAT =
      "%-6s%5d %s%-1s%-3s %-1s%4d%-1s   %8.3f%8.3f%8.3f%6.2f%6.2f      %-4s%2s%-2s";

  static String atomLine(int serial, Atom atom, String residueName) {
    return String.format(
        Locale.US,
        ATOM_FORMAT,
        "ATOM",
        serial,
        atom.label().pdbName(),
        "",
        residueName,
        CHAIN_ID,
        atom.residue() + 1,
        "",
        atom.coordinates().getX(),
        atom.coordinates().getY(),
        atom.coordinates().getZ(),
        OCCUPANCY,
        B_FACTOR,
        "",
        atom.element(),
        "");
  }

  public List<String> format(String sequence, BackboneChain chain) {
    var atoms = chain.atoms();
    var lines = new ArrayList<String>(atoms.size() + 1);
    for (var i = 0; i < atoms.size(); i++) {
      var atom = atoms.get(i);
      lines.add(
          atomLine(i + 1, atom, ResidueNames.threeLetterCode(sequence.charAt(atom.residue()))));
    }
    lines.add("END");
    return lines;
  }

  @Override
  public String extension() {
    return "pdb";
  }

  @Override
  public void write(String sequence, BackboneChain chain, Path path) throws IOException {
    Files.write(path, format(sequence, chain), StandardCharsets.UTF_8);
  }
}
