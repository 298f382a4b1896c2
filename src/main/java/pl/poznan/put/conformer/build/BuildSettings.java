package pl.poznan.put.conformer.build;

import org.immutables.value.Value;
import pl.poznan.put.conformer.chain.ResidueNames;
import pl.poznan.put.conformer.clash.ClashStrategy;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Value.Immutable
public interface BuildSettings {
  String DEFAULT_PATTERN = "(?=(L{2,6}))";

  /** One-letter residue codes of the conformer. */
  String sequence();

  /**
   * Secondary-structure patterns of the fragments drawn during growth. Each one is searched on its
   * own and the candidates of all of them are pooled.
   */
  @Value.Default
  default List<String> patterns() {
    return List.of(DEFAULT_PATTERN);
  }

  /** Rejected fragments tolerated in a single growth step. */
  @Value.Default
  default int maxRetries() {
    return 100;
  }

  @Value.Default
  default ClashStrategy clashStrategy() {
    return ClashStrategy.BATCHED;
  }

  @Value.Default
  default OverflowPolicy overflowPolicy() {
    return OverflowPolicy.TRUNCATE;
  }

  default int residueCount() {
    return sequence().length();
  }

  @Value.Check
  default void check() {
    if (sequence().isEmpty()) {
      throw new IllegalStateException("Sequence must not be empty");
    }
    for (var code : sequence().toCharArray()) {
      if (!ResidueNames.isKnown(code)) {
        throw new IllegalStateException("Unknown residue code in sequence: " + code);
      }
    }
    if (patterns().isEmpty()) {
      throw new IllegalStateException("At least one secondary structure pattern is required");
    }
    for (var pattern : patterns()) {
      try {
        Pattern.compile(pattern);
      } catch (PatternSyntaxException e) {
        throw new IllegalStateException("Invalid secondary structure pattern: " + pattern, e);
      }
    }
    if (maxRetries() < 0) {
      throw new IllegalStateException("Retry limit must not be negative: " + maxRetries());
    }
  }
}
