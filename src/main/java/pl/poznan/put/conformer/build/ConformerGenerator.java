package pl.poznan.put.conformer.build;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.math3.random.MersenneTwister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.poznan.put.conformer.chain.BondGeometry;
import pl.poznan.put.conformer.clash.ClashValidator;
import pl.poznan.put.conformer.fragment.FragmentPool;
import pl.poznan.put.conformer.fragment.FragmentSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds many conformers of one sequence in parallel. Conformer {@code i} draws its fragments from
 * a generator seeded with {@code seed + i}, so the output does not depend on thread scheduling.
 */
public class ConformerGenerator implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConformerGenerator.class);

  private final BondGeometry geometry;
  private final FragmentPool pool;
  private final ClashValidator validator;
  private final ExecutorService executor;

  public ConformerGenerator(
      BondGeometry geometry, FragmentPool pool, ClashValidator validator, int threads) {
    Preconditions.checkArgument(threads > 0, "Number of threads must be positive: %s", threads);
    this.geometry = geometry;
    this.pool = pool;
    this.validator = validator;
    this.executor =
        Executors.newFixedThreadPool(
            threads, new ThreadFactoryBuilder().setNameFormat("conformer-%d").build());
  }

  public List<BuildResult> generate(BuildSettings settings, int count, long seed)
      throws InterruptedException {
    Preconditions.checkArgument(count >= 0, "Number of conformers must not be negative: %s", count);
    List<Future<BuildResult>> futures =
        IntStream.range(0, count)
            .mapToObj(i -> executor.submit(() -> builder(seed + i).build(settings)))
            .collect(Collectors.toList());

    var results = new ArrayList<BuildResult>(count);
    try {
      for (var future : futures) {
        results.add(future.get());
      }
    } catch (ExecutionException e) {
      futures.forEach(future -> future.cancel(true));
      Throwables.throwIfUnchecked(e.getCause());
      throw new IllegalStateException("Conformer build failed", e.getCause());
    } catch (InterruptedException e) {
      futures.forEach(future -> future.cancel(true));
      throw e;
    }

    var completed = results.stream().filter(BuildResult::isComplete).count();
    LOGGER.info("Built {} of {} conformers of {}", completed, count, settings.sequence());
    return results;
  }

  private ChainBuilder builder(long seed) {
    return new ChainBuilder(
        geometry, pool, FragmentSelector.uniform(new MersenneTwister(seed)), validator);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
