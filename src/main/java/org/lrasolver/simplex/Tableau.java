package org.lrasolver.simplex;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.lrasolver.exceptions.InvariantViolationException;
import org.lrasolver.expressions.RelationType;
import org.lrasolver.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 带上下界的单纯形表格。
 * <p>
 * 每一行把一个基变量表示为非基变量的线性组合；每个变量可以有下界和上界 (都可缺省)。
 * 非基变量始终在自己的界内，有界的非基变量停在某个界上；可行时所有基变量也在界内。
 * 主元选择统一使用 Bland 规则 (取下标最小的合格变量)，保证终止且结果可复现。
 * <p>
 * 严格界通过 {@link Bound#isStrict()} 表示，取值使用 {@link DeltaRational}，不做数值扰动。
 */
public final class Tableau {

    private static final Logger logger = LoggerFactory.getLogger(Tableau.class);

    // 列属性，下标即列号
    private final List<String> labels;
    private final List<Bound> lowerBounds;
    private final List<Bound> upperBounds;
    private final List<DeltaRational> values;

    // 基变量 -> (非基变量 -> 系数)，按下标有序
    private final SortedMap<Integer, SortedMap<Integer, Rational>> rows;

    @Getter
    private long pivotCount;

    /** 最近一次 checkFeasibility 判定不可行时无法修复的行，-1 表示没有。 */
    @Getter
    private int conflictRow = -1;

    public Tableau() {
        this.labels = new ArrayList<>();
        this.lowerBounds = new ArrayList<>();
        this.upperBounds = new ArrayList<>();
        this.values = new ArrayList<>();
        this.rows = new TreeMap<>();
    }

    // ========== 构建 ==========

    /**
     * 新增一个非基列。初值取下界，没有下界时取上界，都没有时取 0。
     * @return 列号
     */
    public int addColumn(String label, Bound lower, Bound upper) {
        int index = values.size();
        labels.add(label);
        lowerBounds.add(lower);
        upperBounds.add(upper);
        DeltaRational initial = lower != null ? lower.asLower() : upper != null ? upper.asUpper() : DeltaRational.ZERO;
        values.add(initial);
        logger.debug("新增列 {} ({}), 界 [{}, {}], 初值 {}", index, label, lower, upper, initial);
        return index;
    }

    /**
     * 为约束 Σ coefficients[j] * x_j ~ rhs 新增一行。
     * 引入一个松弛变量 s = Σ coefficients[j] * x_j 作为新行的基变量，其界由关系给出：
     * ≤ 只有上界，≥ 只有下界，= 上下界相同，&lt; 和 &gt; 为严格界。
     *
     * @return 松弛变量的列号，作为这一行的句柄
     */
    public int addRow(Map<Integer, Rational> coefficients, RelationType relation, Rational rhs, String label) {
        Objects.requireNonNull(coefficients, "coefficients cannot be null");
        Objects.requireNonNull(relation, "relation cannot be null");
        Objects.requireNonNull(rhs, "rhs cannot be null");

        // 用当前的行代入已经是基变量的列
        SortedMap<Integer, Rational> row = new TreeMap<>();
        for (Map.Entry<Integer, Rational> entry : coefficients.entrySet()) {
            int column = entry.getKey();
            Rational coeff = entry.getValue();
            if (column < 0 || column >= values.size()) {
                throw new IllegalArgumentException("列 " + column + " 不存在，当前共有 " + values.size() + " 列");
            }
            if (coeff.isZero()) {
                continue;
            }
            SortedMap<Integer, Rational> basicRow = rows.get(column);
            if (basicRow == null) {
                addTo(row, column, coeff);
            } else {
                for (Map.Entry<Integer, Rational> term : basicRow.entrySet()) {
                    addTo(row, term.getKey(), coeff.multiply(term.getValue()));
                }
            }
        }

        Bound lower = relation.hasLowerBound() ? Bound.of(rhs, relation.isStrict()) : null;
        Bound upper = relation.hasUpperBound() ? Bound.of(rhs, relation.isStrict()) : null;

        int slack = values.size();
        labels.add(label);
        lowerBounds.add(lower);
        upperBounds.add(upper);
        values.add(evaluate(row));
        rows.put(slack, row);
        logger.debug("新增行 {} ({}): {} {} {}", slack, label, row, relation.getSymbol(), rhs);
        return slack;
    }

    // ========== 可行性 ==========

    /**
     * 寻找满足所有界的赋值。
     * 每一轮修复下标最小的越界基变量，入基变量取其所在行中下标最小、且能朝需要方向移动的非基变量；
     * 找不到这样的非基变量即说明该行无法回到界内，不可行。
     *
     * @param maxPivots 本次调用允许的最多主元次数
     */
    public FeasibilityResult checkFeasibility(int maxPivots) {
        int pivots = 0;
        while (true) {
            int violated = -1;
            boolean belowLower = false;
            for (Integer basic : rows.keySet()) {
                if (isBelowLower(basic)) {
                    violated = basic;
                    belowLower = true;
                    break;
                }
                if (isAboveUpper(basic)) {
                    violated = basic;
                    break;
                }
            }
            if (violated < 0) {
                conflictRow = -1;
                logger.debug("表格可行，本次主元 {} 次", pivots);
                return FeasibilityResult.FEASIBLE;
            }

            int entering = -1;
            for (Map.Entry<Integer, Rational> term : rows.get(violated).entrySet()) {
                int column = term.getKey();
                int sign = term.getValue().signum();
                boolean increaseColumn = belowLower ? sign > 0 : sign < 0;
                if (increaseColumn ? canIncrease(column) : canDecrease(column)) {
                    entering = column;
                    break;
                }
            }
            if (entering < 0) {
                conflictRow = violated;
                logger.debug("行 {} ({}) 无法回到界内，表格不可行", violated, labels.get(violated));
                return FeasibilityResult.INFEASIBLE;
            }
            if (pivots >= maxPivots) {
                logger.warn("可行性检查超出主元上限 {}", maxPivots);
                return FeasibilityResult.PIVOT_LIMIT;
            }

            DeltaRational target = belowLower ? lowerBounds.get(violated).asLower() : upperBounds.get(violated).asUpper();
            pivotAndUpdate(violated, entering, target);
            pivots++;
        }
    }

    /**
     * 在可行状态下最大化 Σ objective[j] * x_j，只用于在可行域中确定一个可复现的顶点。
     * 要求调用前表格可行。目标无界时停在当前可行顶点。
     */
    public OptimizationResult maximize(Map<Integer, Rational> objective, int maxPivots) {
        int pivots = 0;
        while (true) {
            SortedMap<Integer, Rational> reducedCosts = reducedCosts(objective);

            int entering = -1;
            int direction = 0;
            for (Map.Entry<Integer, Rational> entry : reducedCosts.entrySet()) {
                int column = entry.getKey();
                if (entry.getValue().isPositive() && canIncrease(column)) {
                    entering = column;
                    direction = 1;
                    break;
                }
                if (entry.getValue().isNegative() && canDecrease(column)) {
                    entering = column;
                    direction = -1;
                    break;
                }
            }
            if (entering < 0) {
                logger.debug("目标已最优，本次主元 {} 次", pivots);
                return OptimizationResult.OPTIMAL;
            }

            // 比值检验：取最先到达界的基变量，平局取下标最小者
            DeltaRational bestStep = null;
            int leaving = -1;
            DeltaRational leavingTarget = null;
            for (Map.Entry<Integer, SortedMap<Integer, Rational>> entry : rows.entrySet()) {
                Rational coeff = entry.getValue().get(entering);
                if (coeff == null) {
                    continue;
                }
                int basic = entry.getKey();
                Rational rate = direction > 0 ? coeff : coeff.negate();
                Bound limit = rate.isPositive() ? upperBounds.get(basic) : lowerBounds.get(basic);
                if (limit == null) {
                    continue;
                }
                DeltaRational target = rate.isPositive() ? limit.asUpper() : limit.asLower();
                DeltaRational step = target.subtract(values.get(basic)).divide(rate);
                if (bestStep == null || step.compareTo(bestStep) < 0) {
                    bestStep = step;
                    leaving = basic;
                    leavingTarget = target;
                }
            }

            // 入基变量自己的另一个界
            Bound own = direction > 0 ? upperBounds.get(entering) : lowerBounds.get(entering);
            boolean boundFlip = false;
            if (own != null) {
                DeltaRational span = direction > 0
                        ? own.asUpper().subtract(values.get(entering))
                        : values.get(entering).subtract(own.asLower());
                if (bestStep == null || span.compareTo(bestStep) < 0) {
                    bestStep = span;
                    boundFlip = true;
                }
            }

            if (bestStep == null) {
                logger.debug("列 {} ({}) 方向无界，停在当前顶点", entering, labels.get(entering));
                return OptimizationResult.UNBOUNDED;
            }
            if (pivots >= maxPivots) {
                logger.warn("顶点选择超出主元上限 {}", maxPivots);
                return OptimizationResult.PIVOT_LIMIT;
            }

            if (boundFlip) {
                updateNonbasic(entering, direction > 0 ? bestStep : bestStep.negate());
            } else {
                pivotAndUpdate(leaving, entering, leavingTarget);
            }
            pivots++;
        }
    }

    // ========== 主元 ==========

    /**
     * 把基变量 basic 调整到 target，非基变量 entering 相应移动，然后交换二者的基/非基身份。
     */
    void pivotAndUpdate(int basic, int entering, DeltaRational target) {
        Rational coeff = rows.get(basic).get(entering);
        DeltaRational theta = target.subtract(values.get(basic)).divide(coeff);
        values.set(basic, target);
        values.set(entering, values.get(entering).add(theta));
        for (Map.Entry<Integer, SortedMap<Integer, Rational>> entry : rows.entrySet()) {
            int other = entry.getKey();
            if (other == basic) {
                continue;
            }
            Rational c = entry.getValue().get(entering);
            if (c != null) {
                values.set(other, values.get(other).add(theta.multiply(c)));
            }
        }
        pivot(basic, entering);
    }

    /**
     * 对 basic 所在的行做高斯消元，使 entering 成为基变量，并在所有依赖它的行中代入。
     */
    public void pivot(int basic, int entering) {
        SortedMap<Integer, Rational> row = rows.remove(basic);
        if (row == null) {
            throw new InvariantViolationException("列 " + basic + " 不是基变量，无法作为主元行");
        }
        Rational coeff = row.remove(entering);
        if (coeff == null) {
            rows.put(basic, row);
            throw new InvariantViolationException("列 " + entering + " 不在行 " + basic + " 中，无法入基");
        }

        // entering = (1/a) * basic - Σ (a_k / a) * x_k
        Rational inverse = coeff.reciprocal();
        SortedMap<Integer, Rational> enteringRow = new TreeMap<>();
        enteringRow.put(basic, inverse);
        for (Map.Entry<Integer, Rational> term : row.entrySet()) {
            enteringRow.put(term.getKey(), term.getValue().negate().multiply(inverse));
        }

        for (SortedMap<Integer, Rational> other : rows.values()) {
            Rational c = other.remove(entering);
            if (c == null) {
                continue;
            }
            for (Map.Entry<Integer, Rational> term : enteringRow.entrySet()) {
                addTo(other, term.getKey(), c.multiply(term.getValue()));
            }
        }
        rows.put(entering, enteringRow);
        pivotCount++;
        logger.debug("主元: {} ({}) 出基, {} ({}) 入基", basic, labels.get(basic), entering, labels.get(entering));
    }

    private void updateNonbasic(int column, DeltaRational step) {
        values.set(column, values.get(column).add(step));
        for (Map.Entry<Integer, SortedMap<Integer, Rational>> entry : rows.entrySet()) {
            Rational c = entry.getValue().get(column);
            if (c != null) {
                values.set(entry.getKey(), values.get(entry.getKey()).add(step.multiply(c)));
            }
        }
    }

    private SortedMap<Integer, Rational> reducedCosts(Map<Integer, Rational> objective) {
        SortedMap<Integer, Rational> reduced = new TreeMap<>();
        for (Map.Entry<Integer, Rational> entry : objective.entrySet()) {
            SortedMap<Integer, Rational> row = rows.get(entry.getKey());
            if (row == null) {
                addTo(reduced, entry.getKey(), entry.getValue());
            } else {
                for (Map.Entry<Integer, Rational> term : row.entrySet()) {
                    addTo(reduced, term.getKey(), entry.getValue().multiply(term.getValue()));
                }
            }
        }
        return reduced;
    }

    // ========== 模型 ==========

    /**
     * 为 δ 选一个具体值，使所有变量在代入后仍满足各自的界。取值不超过 1。
     */
    public Rational concreteDelta() {
        Rational delta = Rational.ONE;
        for (int column = 0; column < values.size(); column++) {
            DeltaRational value = values.get(column);
            Bound lower = lowerBounds.get(column);
            if (lower != null) {
                delta = tighten(delta, value.subtract(lower.asLower()));
            }
            Bound upper = upperBounds.get(column);
            if (upper != null) {
                delta = tighten(delta, upper.asUpper().subtract(value));
            }
        }
        return delta;
    }

    // gap = r + kδ 已知字典序非负，要求代入后仍非负
    private static Rational tighten(Rational delta, DeltaRational gap) {
        if (gap.getReal().isPositive() && gap.getDelta().isNegative()) {
            return Rational.min(delta, gap.getReal().divide(gap.getDelta().negate()));
        }
        return delta;
    }

    // ========== 检查点 ==========

    /**
     * 保存完整的表格状态。
     */
    public Checkpoint snapshot() {
        return new Checkpoint(this);
    }

    /**
     * 恢复到检查点时的状态。同一个检查点可以被恢复多次。
     */
    public void restore(Checkpoint checkpoint) {
        copyState(checkpoint.state, this);
        logger.debug("表格恢复到检查点，共 {} 列 {} 行", values.size(), rows.size());
    }

    private static void copyState(Tableau from, Tableau to) {
        to.labels.clear();
        to.labels.addAll(from.labels);
        to.lowerBounds.clear();
        to.lowerBounds.addAll(from.lowerBounds);
        to.upperBounds.clear();
        to.upperBounds.addAll(from.upperBounds);
        to.values.clear();
        to.values.addAll(from.values);
        to.rows.clear();
        for (Map.Entry<Integer, SortedMap<Integer, Rational>> entry : from.rows.entrySet()) {
            to.rows.put(entry.getKey(), new TreeMap<>(entry.getValue()));
        }
        to.conflictRow = from.conflictRow;
    }

    /**
     * 表格状态的不可变副本。
     */
    public static final class Checkpoint {
        private final Tableau state;

        private Checkpoint(Tableau source) {
            this.state = new Tableau();
            copyState(source, this.state);
        }

        public int getColumnCount() {
            return state.values.size();
        }
    }

    // ========== 不变量 ==========

    /**
     * 校验表格一致性：行中不出现基变量、基变量取值等于其行的值、非基变量在界内；
     * requireFeasible 为 true 时还要求基变量在界内。
     * @throws InvariantViolationException 任何一项不满足
     */
    public void verifyInvariants(boolean requireFeasible) {
        for (Map.Entry<Integer, SortedMap<Integer, Rational>> entry : rows.entrySet()) {
            int basic = entry.getKey();
            for (Integer column : entry.getValue().keySet()) {
                if (rows.containsKey(column)) {
                    throw violation("行 " + basic + " 引用了基变量 " + column);
                }
            }
            DeltaRational expected = evaluate(entry.getValue());
            if (!expected.equals(values.get(basic))) {
                throw violation("基变量 " + basic + " 的值 " + values.get(basic) + " 与行的值 " + expected + " 不一致");
            }
            if (requireFeasible && (isBelowLower(basic) || isAboveUpper(basic))) {
                throw violation("可行状态下基变量 " + basic + " 越界: " + values.get(basic));
            }
        }
        for (int column = 0; column < values.size(); column++) {
            if (!rows.containsKey(column) && (isBelowLower(column) || isAboveUpper(column))) {
                throw violation("非基变量 " + column + " 越界: " + values.get(column));
            }
        }
    }

    private InvariantViolationException violation(String message) {
        logger.error("表格不变量被破坏: {}", message);
        return new InvariantViolationException(message);
    }

    // ========== 查询 ==========

    public int getColumnCount() {
        return values.size();
    }

    public int getRowCount() {
        return rows.size();
    }

    public boolean isBasic(int column) {
        return rows.containsKey(column);
    }

    public DeltaRational getValue(int column) {
        return values.get(column);
    }

    /**
     * (下界, 上界)，缺省的界为 null。
     */
    public Pair<Bound, Bound> getBounds(int column) {
        return Pair.of(lowerBounds.get(column), upperBounds.get(column));
    }

    /**
     * 基变量所在行的只读视图，非基变量返回 null。
     */
    public SortedMap<Integer, Rational> getRow(int basic) {
        SortedMap<Integer, Rational> row = rows.get(basic);
        return row == null ? null : Collections.unmodifiableSortedMap(row);
    }

    // ========== 工具方法 ==========

    private DeltaRational evaluate(Map<Integer, Rational> row) {
        DeltaRational result = DeltaRational.ZERO;
        for (Map.Entry<Integer, Rational> term : row.entrySet()) {
            result = result.add(values.get(term.getKey()).multiply(term.getValue()));
        }
        return result;
    }

    private boolean isBelowLower(int column) {
        Bound lower = lowerBounds.get(column);
        return lower != null && values.get(column).compareTo(lower.asLower()) < 0;
    }

    private boolean isAboveUpper(int column) {
        Bound upper = upperBounds.get(column);
        return upper != null && values.get(column).compareTo(upper.asUpper()) > 0;
    }

    private boolean canIncrease(int column) {
        Bound upper = upperBounds.get(column);
        return upper == null || values.get(column).compareTo(upper.asUpper()) < 0;
    }

    private boolean canDecrease(int column) {
        Bound lower = lowerBounds.get(column);
        return lower == null || values.get(column).compareTo(lower.asLower()) > 0;
    }

    private static void addTo(Map<Integer, Rational> target, int column, Rational value) {
        Rational sum = target.getOrDefault(column, Rational.ZERO).add(value);
        if (sum.isZero()) {
            target.remove(column);
        } else {
            target.put(column, sum);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, SortedMap<Integer, Rational>> entry : rows.entrySet()) {
            sb.append(labels.get(entry.getKey())).append(" = ").append(entry.getValue())
                    .append(" (").append(values.get(entry.getKey())).append(")\n");
        }
        return sb.toString();
    }
}
