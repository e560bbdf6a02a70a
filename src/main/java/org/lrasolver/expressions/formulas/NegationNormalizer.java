package org.lrasolver.expressions.formulas;

import org.lrasolver.expressions.RelationType;
import org.lrasolver.expressions.linear.Atom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 否定范式 (NNF) 变换。结果中 Not 只出现在布尔变量之上：
 * <ul>
 *     <li>¬(e ~ 0) 直接取反关系，¬(e = 0) 变为 (e &lt; 0) ∨ (e &gt; 0)</li>
 *     <li>De Morgan 下推 And / Or</li>
 *     <li>¬(w == φ) 变为 w == ¬φ，φ 本身留到 w 取值后再规范化</li>
 * </ul>
 */
public final class NegationNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(NegationNormalizer.class);

    private NegationNormalizer() {
    }

    public static Formula normalize(Formula formula) {
        return normalize(formula, true);
    }

    /**
     * 以给定极性规范化；positive 为 false 时得到 ¬formula 的 NNF。
     */
    public static Formula normalize(Formula formula, boolean positive) {
        return switch (formula.getKind()) {
            case ATOM -> normalizeAtom((Atom) formula, positive);
            case BOOLEAN_VAR -> positive ? formula : new Not(formula);
            case NOT -> normalize(((Not) formula).getOperand(), !positive);
            case AND -> {
                List<Formula> operands = normalizeAll(((And) formula).getOperands(), positive);
                yield positive ? new And(operands) : new Or(operands);
            }
            case OR -> {
                List<Formula> operands = normalizeAll(((Or) formula).getOperands(), positive);
                yield positive ? new Or(operands) : new And(operands);
            }
            case EQUIVALENCE -> {
                Equivalence equivalence = (Equivalence) formula;
                yield positive ? equivalence : new Equivalence(equivalence.getBooleanVar(), new Not(equivalence.getBody()));
            }
        };
    }

    private static Formula normalizeAtom(Atom atom, boolean positive) {
        if (positive) {
            return atom;
        }
        if (atom.getRelation() == RelationType.EQ) {
            logger.debug("否定等式 {}，拆分为两个严格不等式", atom);
            return new Or(List.of(atom.withRelation(RelationType.LT), atom.withRelation(RelationType.GT)));
        }
        return atom.negate();
    }

    private static List<Formula> normalizeAll(List<Formula> operands, boolean positive) {
        List<Formula> result = new ArrayList<>(operands.size());
        for (Formula operand : operands) {
            result.add(normalize(operand, positive));
        }
        return result;
    }
}
