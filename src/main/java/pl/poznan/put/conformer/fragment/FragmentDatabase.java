package pl.poznan.put.conformer.fragment;

import org.immutables.value.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/** Fragments grouped by secondary-structure label, each keyed by its source and residues. */
@Value.Immutable
public interface FragmentDatabase {
  Map<Character, Map<String, List<ResidueRecord>>> fragments();

  default Set<Character> labels() {
    return fragments().keySet();
  }

  default int fragmentCount() {
    return fragments().values().stream().mapToInt(Map::size).sum();
  }

  default int residueCount() {
    return fragments().values().stream()
        .flatMap(map -> map.values().stream())
        .mapToInt(List::size)
        .sum();
  }
}
