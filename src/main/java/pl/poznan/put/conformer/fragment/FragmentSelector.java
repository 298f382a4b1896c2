package pl.poznan.put.conformer.fragment;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.List;

@FunctionalInterface
public interface FragmentSelector {
  static FragmentSelector uniform(RandomGenerator random) {
    return candidates -> candidates.get(random.nextInt(candidates.size()));
  }

  AngleFragment choose(List<AngleFragment> candidates);
}
