package com.quantori.mge.core.properties;

import java.util.Map;
import java.util.OptionalDouble;
import lombok.experimental.UtilityClass;

/**
 * Standard atomic weights and monoisotopic masses, in daltons, keyed by atomic number. Labelled
 * atoms use the mass of their isotope; isotopes missing from the table fall back to the mass
 * number.
 */
@UtilityClass
class AtomicMasses {

  private static final Map<Integer, double[]> MASSES = Map.ofEntries(
      Map.entry(1, new double[] {1.008, 1.00782503223}),
      Map.entry(2, new double[] {4.0026, 4.00260325413}),
      Map.entry(3, new double[] {6.94, 7.0160034366}),
      Map.entry(4, new double[] {9.0122, 9.012183065}),
      Map.entry(5, new double[] {10.81, 11.00930536}),
      Map.entry(6, new double[] {12.011, 12.0}),
      Map.entry(7, new double[] {14.007, 14.00307400443}),
      Map.entry(8, new double[] {15.999, 15.99491461957}),
      Map.entry(9, new double[] {18.998, 18.99840316273}),
      Map.entry(10, new double[] {20.180, 19.9924401762}),
      Map.entry(11, new double[] {22.990, 22.989769282}),
      Map.entry(12, new double[] {24.305, 23.985041697}),
      Map.entry(13, new double[] {26.982, 26.98153853}),
      Map.entry(14, new double[] {28.085, 27.97692653465}),
      Map.entry(15, new double[] {30.974, 30.97376199842}),
      Map.entry(16, new double[] {32.06, 31.9720711744}),
      Map.entry(17, new double[] {35.45, 34.968852682}),
      Map.entry(18, new double[] {39.95, 39.9623831237}),
      Map.entry(19, new double[] {39.098, 38.9637064864}),
      Map.entry(20, new double[] {40.078, 39.962590863}),
      Map.entry(25, new double[] {54.938, 54.93804391}),
      Map.entry(26, new double[] {55.845, 55.93493633}),
      Map.entry(27, new double[] {58.933, 58.93319429}),
      Map.entry(28, new double[] {58.693, 57.93534241}),
      Map.entry(29, new double[] {63.546, 62.92959772}),
      Map.entry(30, new double[] {65.38, 63.92914201}),
      Map.entry(31, new double[] {69.723, 68.9255735}),
      Map.entry(32, new double[] {72.630, 73.921177761}),
      Map.entry(33, new double[] {74.922, 74.92159457}),
      Map.entry(34, new double[] {78.971, 79.9165218}),
      Map.entry(35, new double[] {79.904, 78.9183376}),
      Map.entry(36, new double[] {83.798, 83.9114977282}),
      Map.entry(47, new double[] {107.87, 106.9050916}),
      Map.entry(50, new double[] {118.71, 119.90220163}),
      Map.entry(51, new double[] {121.76, 120.903812}),
      Map.entry(52, new double[] {127.60, 129.906222748}),
      Map.entry(53, new double[] {126.90, 126.9044719}),
      Map.entry(54, new double[] {131.29, 131.9041550856}),
      Map.entry(78, new double[] {195.08, 194.9647917}),
      Map.entry(79, new double[] {196.97, 196.96656879}),
      Map.entry(80, new double[] {200.59, 201.9706434}),
      Map.entry(82, new double[] {207.2, 207.9766525}),
      Map.entry(83, new double[] {208.98, 208.9803991}));

  /** Keyed by atomic number times 1000 plus mass number. */
  private static final Map<Integer, Double> ISOTOPES = Map.ofEntries(
      Map.entry(1002, 2.01410177812),
      Map.entry(1003, 3.0160492779),
      Map.entry(6013, 13.00335483507),
      Map.entry(6014, 14.0032419884),
      Map.entry(7015, 15.00010889888),
      Map.entry(8017, 16.99913175650),
      Map.entry(8018, 17.99915961286),
      Map.entry(9018, 18.0009380),
      Map.entry(16034, 33.967867004),
      Map.entry(17037, 36.965902602),
      Map.entry(35081, 80.9162897),
      Map.entry(53125, 124.9046294),
      Map.entry(53131, 130.9061245));

  OptionalDouble averageMass(int atomicNumber) {
    double[] masses = MASSES.get(atomicNumber);
    return masses == null ? OptionalDouble.empty() : OptionalDouble.of(masses[0]);
  }

  OptionalDouble monoisotopicMass(int atomicNumber) {
    double[] masses = MASSES.get(atomicNumber);
    return masses == null ? OptionalDouble.empty() : OptionalDouble.of(masses[1]);
  }

  double isotopeMass(int atomicNumber, int massNumber) {
    return ISOTOPES.getOrDefault(atomicNumber * 1000 + massNumber, (double) massNumber);
  }

  double hydrogenAverageMass() {
    return MASSES.get(1)[0];
  }

  double hydrogenMonoisotopicMass() {
    return MASSES.get(1)[1];
  }
}
