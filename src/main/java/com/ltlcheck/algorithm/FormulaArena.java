package com.ltlcheck.algorithm;

import static com.google.common.base.Preconditions.checkElementIndex;

import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.model.Proposition;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.ArrayList;
import java.util.List;

/**
 * Interns formulas to dense integer ids. Ids are assigned in order of first interning and never
 * change, so sets of formulas can be stored as bit sets.
 */
public final class FormulaArena<P extends Proposition> {
  private final Object2IntMap<LtlFormula<P>> ids = new Object2IntOpenHashMap<>();
  private final List<LtlFormula<P>> formulas = new ArrayList<>();

  public FormulaArena() {
    ids.defaultReturnValue(-1);
  }

  public int intern(LtlFormula<P> formula) {
    int id = ids.getInt(formula);
    if (id == -1) {
      id = formulas.size();
      ids.put(formula, id);
      formulas.add(formula);
    }
    return id;
  }

  /**
   * Returns the id of the formula or {@code -1} if it has never been interned.
   */
  public int lookup(LtlFormula<P> formula) {
    return ids.getInt(formula);
  }

  public LtlFormula<P> formula(int id) {
    checkElementIndex(id, formulas.size());
    return formulas.get(id);
  }

  public int size() {
    return formulas.size();
  }
}
