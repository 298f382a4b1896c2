package pl.poznan.put.conformer.fragment;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fragment pool backed by a {@link FragmentDatabase}. All fragments are laid out one after another
 * with their labels joined into a single string, separated by {@value #SEPARATOR}. A pattern is
 * searched in that string and every match becomes a window of residues. When the pattern has
 * capturing groups, the first group taking part in the match gives the window, which allows
 * overlapping windows via lookahead.
 */
public class IndexedFragmentPool implements FragmentPool {
  private static final Logger LOGGER = LoggerFactory.getLogger(IndexedFragmentPool.class);
  private static final char SEPARATOR = '|';
  private static final int MINIMUM_WINDOW = 2;

  private final List<ResidueRecord> records;
  private final String labels;
  private final int[] recordIndex;
  private final Map<String, List<AngleFragment>> cache = new ConcurrentHashMap<>();

  public IndexedFragmentPool(FragmentDatabase database) {
    var allRecords = new ArrayList<ResidueRecord>();
    var builder = new StringBuilder();
    var indices = new ArrayList<Integer>();

    for (var byKey : database.fragments().values()) {
      for (var fragment : byKey.values()) {
        for (var record : fragment) {
          indices.add(allRecords.size());
          allRecords.add(record);
          builder.append(record.label());
        }
        indices.add(-1);
        builder.append(SEPARATOR);
      }
    }

    records = ImmutableList.copyOf(allRecords);
    labels = builder.toString();
    recordIndex = indices.stream().mapToInt(Integer::intValue).toArray();
  }

  /** Label string searched by patterns, fragments separated by {@value #SEPARATOR}. */
  public String labels() {
    return labels;
  }

  /** Windows over {@link #labels()} matched by the pattern, as inclusive index ranges. */
  public List<Range<Integer>> windowsMatching(String pattern) {
    var matcher = Pattern.compile(pattern).matcher(labels);
    var windows = new ArrayList<Range<Integer>>();

    while (matcher.find()) {
      var group = firstMatchedGroup(matcher);
      var start = matcher.start(group);
      var end = matcher.end(group);
      if (end - start < MINIMUM_WINDOW) {
        continue;
      }
      if (labels.substring(start, end).indexOf(SEPARATOR) >= 0) {
        LOGGER.debug("Skipping window [{}, {}) spanning two fragments", start, end);
        continue;
      }
      windows.add(Range.between(start, end - 1));
    }
    return windows;
  }

  // alternatives such as "(?=(L{2,6}))|(?=(H{3}))" each capture in their own group
  private static int firstMatchedGroup(Matcher matcher) {
    for (var group = 1; group <= matcher.groupCount(); group++) {
      if (matcher.start(group) >= 0) {
        return group;
      }
    }
    return 0;
  }

  @Override
  public List<AngleFragment> fragmentsMatching(String pattern) {
    return cache.computeIfAbsent(pattern, this::collectFragments);
  }

  private List<AngleFragment> collectFragments(String pattern) {
    var fragments =
        windowsMatching(pattern).stream().map(this::toFragment).collect(Collectors.toList());
    LOGGER.info("Found {} fragments for {}", fragments.size(), pattern);
    return ImmutableList.copyOf(fragments);
  }

  private AngleFragment toFragment(Range<Integer> window) {
    var first = recordIndex[window.getMinimum()];
    var last = recordIndex[window.getMaximum()];
    var windowRecords = records.subList(first, last + 1);
    return ImmutableAngleFragment.builder()
        .label(labels.substring(window.getMinimum(), window.getMaximum() + 1))
        .source(windowRecords.get(0).source())
        .torsions(
            windowRecords.stream().map(ResidueRecord::torsions).collect(Collectors.toList()))
        .build();
  }
}
