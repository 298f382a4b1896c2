package pl.poznan.put.conformer.build;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.poznan.put.conformer.chain.AtomLabel;
import pl.poznan.put.conformer.chain.BackboneChain;
import pl.poznan.put.conformer.chain.BondGeometry;
import pl.poznan.put.conformer.clash.ClashValidator;
import pl.poznan.put.conformer.fragment.AngleFragment;
import pl.poznan.put.conformer.fragment.EmptyFragmentPoolException;
import pl.poznan.put.conformer.fragment.FragmentPool;
import pl.poznan.put.conformer.fragment.FragmentSelector;
import pl.poznan.put.conformer.geometry.DegenerateGeometryException;
import pl.poznan.put.conformer.geometry.GeometryKernel;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * Grows a backbone from randomly drawn torsion angle fragments. The first residue is placed
 * deterministically; every growth step then appends one fragment, which is kept only if it does
 * not clash with the chain built so far.
 *
 * <p>An instance may run several builds one after another, but not concurrently.
 */
public class ChainBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(ChainBuilder.class);
  private static final int MINIMUM_FRAGMENT_SIZE = 2;

  private final BondGeometry geometry;
  private final FragmentPool pool;
  private final FragmentSelector selector;
  private final ClashValidator validator;
  // bond length and bend angle complement for N, CA and C respectively
  private final List<Pair<Double, Double>> placements;

  public ChainBuilder(
      BondGeometry geometry,
      FragmentPool pool,
      FragmentSelector selector,
      ClashValidator validator) {
    this.geometry = geometry;
    this.pool = pool;
    this.selector = selector;
    this.validator = validator;
    this.placements =
        ImmutableList.of(
            Pair.of(geometry.distanceCN(), Math.PI - geometry.angleCaCN()),
            Pair.of(geometry.distanceNCa(), Math.PI - geometry.angleCNCa()),
            Pair.of(geometry.distanceCaC(), Math.PI - geometry.angleNCaC()));
  }

  public BuildResult build(BuildSettings settings) {
    return new Growth(settings).run();
  }

  /** Places N, CA and C of the first residue without consulting any fragment. */
  BackboneChain seed() {
    var nitrogen = Vector3D.ZERO;
    var alpha = new Vector3D(geometry.distanceNCa(), 0.0, 0.0);
    var dummy = new Vector3D(0.0, geometry.distanceNCa(), 0.0);
    var carbon =
        GeometryKernel.placeAtom(
            Math.PI - geometry.angleNCaC(), 0.0, geometry.distanceCaC(), alpha, nitrogen, dummy);

    var chain = new BackboneChain();
    chain.append(AtomLabel.N, nitrogen);
    chain.append(AtomLabel.CA, alpha);
    chain.append(AtomLabel.C, carbon);
    return chain;
  }

  /**
   * Appends one backbone atom per torsion until the torsions run out or the chain holds {@code
   * budget} backbone atoms.
   *
   * @return True if some torsions did not fit in the budget.
   */
  boolean extend(BackboneChain chain, double[] torsions, int budget) {
    for (var torsion : torsions) {
      if (chain.backboneCount() >= budget) {
        return true;
      }
      placeNext(chain, torsion);
    }
    return false;
  }

  private void placeNext(BackboneChain chain, double torsion) {
    var placement = placements.get(chain.backboneCount() % placements.size());
    var parent = chain.backboneFromEnd(1);
    var xAxis = chain.backboneFromEnd(2);
    var position =
        GeometryKernel.placeAtom(
            placement.getRight(),
            torsion,
            placement.getLeft(),
            parent,
            xAxis,
            chain.backboneFromEnd(3));

    if (chain.nextLabel() == AtomLabel.O) {
      // carbonyl oxygen lies in the peptide plane, trans to the next nitrogen
      var oxygen =
          GeometryKernel.placeAtom(
              Math.PI - geometry.angleCaCO(),
              Math.PI,
              geometry.distanceCO(),
              parent,
              xAxis,
              position);
      chain.append(AtomLabel.O, oxygen);
    }
    chain.append(chain.nextLabel(), position);
  }

  private final class Growth {
    private final BuildSettings settings;
    private final ClashGate gate;
    private final int budget;
    private BackboneChain chain;
    private BuildState state;
    private int drawn;
    private int rejected;

    private Growth(BuildSettings settings) {
      this.settings = settings;
      this.gate = new ClashGate(validator, settings.clashStrategy());
      this.budget = 3 * settings.residueCount();
    }

    private BuildResult run() {
      chain = seed();
      transition(BuildState.SEEDED);
      if (chain.backboneCount() >= budget) {
        return finish(BuildState.COMPLETED, null);
      }

      var candidates = candidates();
      transition(BuildState.GROWING);

      while (chain.backboneCount() < budget) {
        if (Thread.currentThread().isInterrupted()) {
          throw new CancellationException("Build of " + settings.sequence() + " was interrupted");
        }

        var mark = chain.size();
        var firstNewResidue = chain.residueCount();
        var accepted = false;

        for (var attempt = 0; attempt <= settings.maxRetries() && !accepted; attempt++) {
          var fragment = selector.choose(candidates);
          drawn++;

          boolean overflow;
          try {
            overflow = extend(chain, fragment.interiorTorsions(), budget);
          } catch (DegenerateGeometryException e) {
            return finish(BuildState.DEGENERATE, e.getMessage());
          }

          if (overflow && settings.overflowPolicy() == OverflowPolicy.ROLL_BACK) {
            chain.truncate(mark);
            return finish(
                BuildState.EXHAUSTED,
                String.format(
                    "Fragment %s (%d residues) does not fit in the remaining %d residues",
                    fragment.source(),
                    fragment.size(),
                    settings.residueCount() - chain.residueCount()));
          }

          if (gate.clashes(chain, firstNewResidue)) {
            LOGGER.debug(
                "Fragment {} clashes at residue {}, attempt {}",
                fragment.source(),
                firstNewResidue,
                attempt + 1);
            chain.truncate(mark);
            rejected++;
          } else {
            accepted = true;
          }
        }

        if (!accepted) {
          return finish(
              BuildState.STUCK,
              String.format(
                  "%d fragments in a row clash at residue %d",
                  settings.maxRetries() + 1, firstNewResidue));
        }
        LOGGER.debug("Chain grown to {} residues", chain.residueCount());
      }
      return finish(BuildState.COMPLETED, null);
    }

    private List<AngleFragment> candidates() {
      var candidates =
          settings.patterns().stream()
              .flatMap(pattern -> pool.fragmentsMatching(pattern).stream())
              .filter(fragment -> fragment.size() >= MINIMUM_FRAGMENT_SIZE)
              .collect(Collectors.toList());
      if (candidates.isEmpty()) {
        throw new EmptyFragmentPoolException(String.join(", ", settings.patterns()));
      }
      return candidates;
    }

    private void transition(BuildState next) {
      LOGGER.trace("{} -> {}", state, next);
      state = next;
    }

    private BuildResult finish(BuildState terminal, String reason) {
      Preconditions.checkState(terminal.isTerminal(), "%s is not a terminal state", terminal);
      transition(terminal);
      if (terminal == BuildState.COMPLETED) {
        LOGGER.debug(
            "Built {} residues with {} fragments, {} rejected",
            chain.residueCount(),
            drawn,
            rejected);
      } else {
        LOGGER.warn("Build of {} ended as {}: {}", settings.sequence(), terminal, reason);
      }
      return ImmutableBuildResult.builder()
          .state(terminal)
          .sequence(settings.sequence())
          .chain(chain.freeze())
          .drawnFragments(drawn)
          .rejectedFragments(rejected)
          .reason(Optional.ofNullable(reason))
          .build();
    }
  }
}
