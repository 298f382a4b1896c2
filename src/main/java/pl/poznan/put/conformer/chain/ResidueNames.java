package pl.poznan.put.conformer.chain;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

public final class ResidueNames {
  private static final Map<Character, String> ONE_TO_THREE =
      ImmutableMap.<Character, String>builder()
          .put('A', "ALA")
          .put('C', "CYS")
          .put('D', "ASP")
          .put('E', "GLU")
          .put('F', "PHE")
          .put('G', "GLY")
          .put('H', "HIS")
          .put('I', "ILE")
          .put('K', "LYS")
          .put('L', "LEU")
          .put('M', "MET")
          .put('N', "ASN")
          .put('P', "PRO")
          .put('Q', "GLN")
          .put('R', "ARG")
          .put('S', "SER")
          .put('T', "THR")
          .put('V', "VAL")
          .put('W', "TRP")
          .put('Y', "TYR")
          .build();

  private ResidueNames() {}

  public static boolean isKnown(char code) {
    return ONE_TO_THREE.containsKey(code);
  }

  public static String threeLetterCode(char code) {
    var name = ONE_TO_THREE.get(code);
    if (name == null) {
      throw new IllegalArgumentException("Unknown residue code: " + code);
    }
    return name;
  }
}
