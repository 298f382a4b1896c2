package pl.poznan.put.conformer.io;

import org.rcsb.cif.CifBuilder;
import org.rcsb.cif.CifIO;
import org.rcsb.cif.schema.StandardSchemata;
import org.rcsb.cif.schema.mm.MmCifFile;
import pl.poznan.put.conformer.chain.Atom;
import pl.poznan.put.conformer.chain.BackboneChain;
import pl.poznan.put.conformer.chain.ResidueNames;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;
import java.util.stream.IntStream;

/** Writes chains as the {@code atom_site} category of an mmCIF file. */
public class MmCifWriter implements StructureWriter {
  private static final String BLOCK_HEADER = "conformer";

  public MmCifFile toCif(String sequence, BackboneChain chain) {
    var atoms = chain.atoms();
    Function<Atom, String> residueName =
        atom -> ResidueNames.threeLetterCode(sequence.charAt(atom.residue()));

    var fileBuilder = CifBuilder.enterFile(StandardSchemata.MMCIF);
    var blockBuilder = fileBuilder.enterBlock(BLOCK_HEADER);
    var categoryBuilder = blockBuilder.enterCategory("atom_site");

    categoryBuilder
        .enterStrColumn("group_PDB")
        .add(strings(atoms, atom -> "ATOM"))
        .leaveColumn();
    categoryBuilder
        .enterIntColumn("id")
        .add(IntStream.rangeClosed(1, atoms.size()).toArray())
        .leaveColumn();
    categoryBuilder.enterStrColumn("type_symbol").add(strings(atoms, Atom::element)).leaveColumn();
    categoryBuilder
        .enterStrColumn("label_atom_id")
        .add(strings(atoms, atom -> atom.label().name()))
        .leaveColumn();
    categoryBuilder.enterStrColumn("label_comp_id").add(strings(atoms, residueName)).leaveColumn();
    categoryBuilder
        .enterStrColumn("label_asym_id")
        .add(strings(atoms, atom -> PdbWriter.CHAIN_ID))
        .leaveColumn();
    categoryBuilder
        .enterIntColumn("label_seq_id")
        .add(ints(atoms, atom -> atom.residue() + 1))
        .leaveColumn();
    categoryBuilder
        .enterFloatColumn("Cartn_x")
        .add(doubles(atoms, atom -> atom.coordinates().getX()))
        .leaveColumn();
    categoryBuilder
        .enterFloatColumn("Cartn_y")
        .add(doubles(atoms, atom -> atom.coordinates().getY()))
        .leaveColumn();
    categoryBuilder
        .enterFloatColumn("Cartn_z")
        .add(doubles(atoms, atom -> atom.coordinates().getZ()))
        .leaveColumn();
    categoryBuilder
        .enterFloatColumn("occupancy")
        .add(doubles(atoms, atom -> OCCUPANCY))
        .leaveColumn();
    categoryBuilder
        .enterFloatColumn("B_iso_or_equiv")
        .add(doubles(atoms, atom -> B_FACTOR))
        .leaveColumn();
    categoryBuilder.leaveCategory();

    blockBuilder.leaveBlock();
    return fileBuilder.leaveFile();
  }

  private static String[] strings(List<Atom> atoms, Function<Atom, String> mapper) {
    return atoms.stream().map(mapper).toArray(String[]::new);
  }

  private static int[] ints(List<Atom> atoms, ToIntFunction<Atom> mapper) {
    return atoms.stream().mapToInt(mapper).toArray();
  }

  private static double[] doubles(List<Atom> atoms, ToDoubleFunction<Atom> mapper) {
    return atoms.stream().mapToDouble(mapper).toArray();
  }

  @Override
  public String extension() {
    return "cif";
  }

  @Override
  public void write(String sequence, BackboneChain chain, Path path) throws IOException {
    CifIO.writeText(toCif(sequence, chain), path);
  }
}
