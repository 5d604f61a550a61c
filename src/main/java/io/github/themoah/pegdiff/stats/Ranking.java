package io.github.themoah.pegdiff.stats;

import java.util.Arrays;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

/**
 * Midrank assignment over the union of two samples.
 *
 * <p>Ranks run from 1 to n1 + n2. Tied values receive the average of the ranks they would
 * otherwise occupy, so the ranks always sum to n(n + 1) / 2.
 */
final class Ranking {

  private static final NaturalRanking MIDRANKS =
    new NaturalRanking(NaNStrategy.FAILED, TiesStrategy.AVERAGE);

  private Ranking() {}

  /**
   * Ranks the concatenation of two samples.
   *
   * @param sample1 first sample, occupying indices [0, n1) of the result
   * @param sample2 second sample, occupying indices [n1, n1 + n2)
   * @return ranks and tie information
   */
  static RankedSamples rank(double[] sample1, double[] sample2) {
    int n1 = sample1.length;
    int n = n1 + sample2.length;
    double[] combined = new double[n];
    System.arraycopy(sample1, 0, combined, 0, n1);
    System.arraycopy(sample2, 0, combined, n1, sample2.length);

    double[] ranks = MIDRANKS.rank(combined);

    // distinct tie groups carry distinct midranks, so equal ranks mark one group
    double[] sorted = ranks.clone();
    Arrays.sort(sorted);
    double tieTerm = 0.0;
    int tieGroups = 0;
    int start = 0;
    while (start < n) {
      int end = start + 1;
      while (end < n && sorted[end] == sorted[start]) {
        end++;
      }
      long t = end - start;
      if (t > 1) {
        tieTerm += (double) (t * t * t - t);
        tieGroups++;
      }
      start = end;
    }

    return new RankedSamples(ranks, n1, n - n1, tieTerm, tieGroups);
  }

  /**
   * Ranks of a two-sample union.
   *
   * @param ranks rank of each combined observation, sample1 first
   * @param n1 size of the first sample
   * @param n2 size of the second sample
   * @param tieTerm sum over tie groups of t^3 - t
   * @param tieGroups number of groups with more than one member
   */
  record RankedSamples(
    double[] ranks,
    int n1,
    int n2,
    double tieTerm,
    int tieGroups
  ) {

    RankedSamples {
      ranks = ranks.clone();
    }

    @Override
    public double[] ranks() {
      return ranks.clone();
    }

    /**
     * Sum of the ranks of the first sample.
     */
    double rankSum1() {
      double sum = 0.0;
      for (int i = 0; i < n1; i++) {
        sum += ranks[i];
      }
      return sum;
    }

    double totalRankSum() {
      double sum = 0.0;
      for (double rank : ranks) {
        sum += rank;
      }
      return sum;
    }

    boolean hasTies() {
      return tieGroups > 0;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof RankedSamples)) {
        return false;
      }
      RankedSamples that = (RankedSamples) other;
      return n1 == that.n1
        && n2 == that.n2
        && tieGroups == that.tieGroups
        && Double.compare(tieTerm, that.tieTerm) == 0
        && Arrays.equals(ranks, that.ranks);
    }

    @Override
    public int hashCode() {
      return 31 * Arrays.hashCode(ranks) + Double.hashCode(tieTerm) + n1 * 7 + n2;
    }

    @Override
    public String toString() {
      return "RankedSamples[ranks=" + Arrays.toString(ranks) + ", n1=" + n1 + ", n2=" + n2
        + ", tieTerm=" + tieTerm + ", tieGroups=" + tieGroups + "]";
    }
  }
}
