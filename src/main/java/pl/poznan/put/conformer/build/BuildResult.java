package pl.poznan.put.conformer.build;

import org.immutables.value.Value;
import pl.poznan.put.conformer.chain.BackboneChain;

import java.util.Optional;

@Value.Immutable
public interface BuildResult {
  BuildState state();

  String sequence();

  /** The built chain, read-only; partial unless the state is {@link BuildState#COMPLETED}. */
  BackboneChain chain();

  int drawnFragments();

  int rejectedFragments();

  /** Why the build stopped early, absent for completed builds. */
  Optional<String> reason();

  default boolean isComplete() {
    return state() == BuildState.COMPLETED;
  }

  default int residueCount() {
    return chain().residueCount();
  }
}
