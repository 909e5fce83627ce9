package com.quantori.mge.api.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Chemical elements known to the notation.
 *
 * <p>Default valences drive implicit hydrogen calculation and valence checks; elements without
 * default valences never receive implicit hydrogens and are not valence checked.
 */
@Getter
public enum Element {
  H("H", 1, 1),
  HE("He", 2),
  LI("Li", 3, 1),
  BE("Be", 4),
  B("B", 5, 3),
  C("C", 6, 4),
  N("N", 7, 3, 5),
  O("O", 8, 2),
  F("F", 9, 1),
  NE("Ne", 10),
  NA("Na", 11, 1),
  MG("Mg", 12, 2),
  AL("Al", 13, 3),
  SI("Si", 14, 4),
  P("P", 15, 3, 5),
  S("S", 16, 2, 4, 6),
  CL("Cl", 17, 1),
  AR("Ar", 18),
  K("K", 19, 1),
  CA("Ca", 20, 2),
  SC("Sc", 21),
  TI("Ti", 22),
  V("V", 23),
  CR("Cr", 24),
  MN("Mn", 25),
  FE("Fe", 26),
  CO("Co", 27),
  NI("Ni", 28),
  CU("Cu", 29),
  ZN("Zn", 30),
  GA("Ga", 31),
  GE("Ge", 32, 4),
  AS("As", 33, 3, 5),
  SE("Se", 34, 2, 4, 6),
  BR("Br", 35, 1),
  KR("Kr", 36),
  RB("Rb", 37),
  SR("Sr", 38),
  Y("Y", 39),
  ZR("Zr", 40),
  NB("Nb", 41),
  MO("Mo", 42),
  TC("Tc", 43),
  RU("Ru", 44),
  RH("Rh", 45),
  PD("Pd", 46),
  AG("Ag", 47),
  CD("Cd", 48),
  IN("In", 49),
  SN("Sn", 50, 2, 4),
  SB("Sb", 51, 3, 5),
  TE("Te", 52, 2, 4, 6),
  I("I", 53, 1, 3, 5),
  XE("Xe", 54),
  CS("Cs", 55),
  BA("Ba", 56),
  LA("La", 57),
  CE("Ce", 58),
  PR("Pr", 59),
  ND("Nd", 60),
  PM("Pm", 61),
  SM("Sm", 62),
  EU("Eu", 63),
  GD("Gd", 64),
  TB("Tb", 65),
  DY("Dy", 66),
  HO("Ho", 67),
  ER("Er", 68),
  TM("Tm", 69),
  YB("Yb", 70),
  LU("Lu", 71),
  HF("Hf", 72),
  TA("Ta", 73),
  W("W", 74),
  RE("Re", 75),
  OS("Os", 76),
  IR("Ir", 77),
  PT("Pt", 78),
  AU("Au", 79),
  HG("Hg", 80),
  TL("Tl", 81),
  PB("Pb", 82),
  BI("Bi", 83),
  PO("Po", 84),
  AT("At", 85),
  RN("Rn", 86),
  FR("Fr", 87),
  RA("Ra", 88),
  AC("Ac", 89),
  TH("Th", 90),
  PA("Pa", 91),
  U("U", 92),
  NP("Np", 93),
  PU("Pu", 94),
  AM("Am", 95),
  CM("Cm", 96),
  BK("Bk", 97),
  CF("Cf", 98),
  ES("Es", 99),
  FM("Fm", 100),
  MD("Md", 101),
  NO("No", 102),
  LR("Lr", 103),
  RF("Rf", 104),
  DB("Db", 105),
  SG("Sg", 106),
  BH("Bh", 107),
  HS("Hs", 108),
  MT("Mt", 109),
  DS("Ds", 110),
  RG("Rg", 111),
  CN("Cn", 112),
  NH("Nh", 113),
  FL("Fl", 114),
  MC("Mc", 115),
  LV("Lv", 116),
  TS("Ts", 117),
  OG("Og", 118);

  /** Elements that may be written without brackets. */
  public static final Set<String> ORGANIC_SUBSET =
      Set.of("B", "C", "N", "O", "P", "S", "F", "Cl", "Br", "I");

  /** Symbols that may be written in lowercase to denote an aromatic atom. */
  public static final Set<String> AROMATIC_SYMBOLS =
      Set.of("b", "c", "n", "o", "p", "s", "se", "as", "te");

  private static final Map<String, Element> BY_SYMBOL = new HashMap<>();

  static {
    for (Element element : values()) {
      BY_SYMBOL.put(element.symbol, element);
    }
  }

  private final String symbol;
  private final int atomicNumber;
  private final int[] defaultValences;

  Element(String symbol, int atomicNumber, int... defaultValences) {
    this.symbol = symbol;
    this.atomicNumber = atomicNumber;
    this.defaultValences = defaultValences;
  }

  public int[] getDefaultValences() {
    return defaultValences.clone();
  }

  public boolean hasDefaultValences() {
    return defaultValences.length > 0;
  }

  public int getMaxDefaultValence() {
    return Arrays.stream(defaultValences).max().orElse(0);
  }

  public boolean isOrganicSubset() {
    return ORGANIC_SUBSET.contains(symbol);
  }

  /**
   * Finds an element by its capitalized symbol, e.g. {@code Cl}.
   *
   * @param symbol element symbol
   * @return the element or empty when the symbol is unknown
   */
  public static Optional<Element> ofSymbol(String symbol) {
    return Optional.ofNullable(BY_SYMBOL.get(symbol));
  }

  /**
   * Finds an element by atomic number.
   *
   * @param atomicNumber atomic number, 1 based
   * @return the element or empty when out of range
   */
  public static Optional<Element> ofAtomicNumber(int atomicNumber) {
    if (atomicNumber < 1 || atomicNumber > values().length) {
      return Optional.empty();
    }
    return Optional.of(values()[atomicNumber - 1]);
  }

  /**
   * Resolves an aromatic (lowercase) symbol to its element.
   *
   * @param symbol lowercase symbol such as {@code c} or {@code se}
   * @return the element or empty when the symbol cannot be aromatic
   */
  public static Optional<Element> ofAromaticSymbol(String symbol) {
    if (!AROMATIC_SYMBOLS.contains(symbol)) {
      return Optional.empty();
    }
    return ofSymbol(StringUtils.capitalize(symbol));
  }

  public static Set<String> symbols() {
    return Collections.unmodifiableSet(BY_SYMBOL.keySet());
  }
}
