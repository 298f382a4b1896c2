package pl.poznan.put.conformer.fragment;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.poznan.put.conformer.geometry.TorsionTriple;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reads {@code *.data} files with one residue per line: {@code
 * residue,label,x,y,z,phi,psi,omega,chi1}, angles in degrees. Contiguous residues with the same
 * secondary-structure label form one fragment.
 */
public final class FragmentDatabaseReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(FragmentDatabaseReader.class);
  private static final String EXTENSION = ".data";
  private static final int FIELD_COUNT = 9;

  private FragmentDatabaseReader() {}

  public static FragmentDatabase readDirectory(Path directory) {
    List<Path> files;
    try (var stream = Files.list(directory)) {
      files =
          stream
              .filter(Files::isRegularFile)
              .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
              .sorted()
              .collect(Collectors.toList());
    } catch (IOException e) {
      throw new FragmentDatabaseException("Failed to list fragment database: " + directory, e);
    }

    var fragments = new TreeMap<Character, Map<String, List<ResidueRecord>>>();
    for (var file : files) {
      for (var fragment : readFile(file)) {
        var first = fragment.get(0);
        var key =
            first.source()
                + ":"
                + fragment.stream().map(ResidueRecord::residue).collect(Collectors.joining());
        fragments.computeIfAbsent(first.label(), label -> new LinkedHashMap<>()).put(key, fragment);
      }
    }

    var database =
        ImmutableFragmentDatabase.builder()
            .fragments(
                fragments.entrySet().stream()
                    .collect(
                        ImmutableMap.toImmutableMap(
                            Map.Entry::getKey, entry -> ImmutableMap.copyOf(entry.getValue()))))
            .build();
    LOGGER.info(
        "Read {} fragments ({} residues) from {} files in {}",
        database.fragmentCount(),
        database.residueCount(),
        files.size(),
        directory);
    return database;
  }

  public static List<List<ResidueRecord>> readFile(Path file) {
    List<String> lines;
    try {
      lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new FragmentDatabaseException("Failed to read fragment file: " + file, e);
    }

    var name = file.getFileName().toString();
    var fragments = new ArrayList<List<ResidueRecord>>();
    var current = new ArrayList<ResidueRecord>();

    for (var i = 0; i < lines.size(); i++) {
      var line = lines.get(i).strip();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }

      var record = parseRecord(line, name + ":" + (i + 1));
      if (!current.isEmpty() && current.get(0).label() != record.label()) {
        fragments.add(ImmutableList.copyOf(current));
        current.clear();
      }
      current.add(record);
    }

    if (!current.isEmpty()) {
      fragments.add(ImmutableList.copyOf(current));
    }
    LOGGER.debug("{}: {} fragments", name, fragments.size());
    return fragments;
  }

  static ResidueRecord parseRecord(String line, String source) {
    var fields = StringUtils.split(line, ',');
    if (fields.length != FIELD_COUNT) {
      throw new FragmentDatabaseException(
          String.format("%s: expected %d fields, found %d", source, FIELD_COUNT, fields.length));
    }

    var label = fields[1].strip();
    if (label.length() != 1) {
      throw new FragmentDatabaseException(
          String.format("%s: secondary structure label must be one letter: %s", source, label));
    }

    try {
      var values = new double[FIELD_COUNT - 2];
      for (var j = 0; j < values.length; j++) {
        values[j] = Double.parseDouble(fields[j + 2].strip());
        if (!Double.isFinite(values[j])) {
          throw new FragmentDatabaseException(
              String.format("%s: field %d is not a finite number: %s", source, j + 3, line));
        }
      }
      return ImmutableResidueRecord.builder()
          .residue(fields[0].strip())
          .label(label.charAt(0))
          .coordinates(new Vector3D(values[0], values[1], values[2]))
          .torsions(TorsionTriple.ofDegrees(values[3], values[4], values[5]))
          .chi1(Math.toRadians(values[6]))
          .source(source)
          .build();
    } catch (NumberFormatException e) {
      throw new FragmentDatabaseException(source + ": invalid number in: " + line, e);
    }
  }
}
