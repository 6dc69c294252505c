package org.mathpy.expressions.assumptions;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.mathpy.expressions.ToZ3BoolExpr;
import org.mathpy.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 代表一组假设的集合，其语义为集合中所有假设的合取。
 * 空集合即哨兵 NONE ("没有假设")：根式合并此时走语法模式，不查询符号。
 * 此类是不可变的。
 */
@Getter
public final class AssumptionSet implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(AssumptionSet.class);

    // 内部存储 Assumption 的有序集合，确保规范化和比较的一致性
    private final SortedSet<Assumption> assumptions;

    // 预定义常量：没有任何假设
    public static final AssumptionSet NONE = new AssumptionSet(Collections.emptySet());

    private final int hashCode;

    private AssumptionSet(Collection<Assumption> assumptions) {
        Objects.requireNonNull(assumptions, "Assumptions cannot be null");
        this.assumptions = Collections.unmodifiableSortedSet(new TreeSet<>(assumptions));
        this.hashCode = Objects.hash(this.assumptions);
        logger.debug("创建 AssumptionSet: {}", this);
    }

    /**
     * 工厂方法：把一组假设合取成一个集合 (宿主中的列表形式 {a > 0, b > 0})。
     */
    public static AssumptionSet of(Collection<Assumption> assumptions) {
        if (assumptions.isEmpty()) {
            return NONE;
        }
        return new AssumptionSet(assumptions);
    }

    public static AssumptionSet of(Assumption... assumptions) {
        return of(Arrays.asList(assumptions));
    }

    public AssumptionSet and(Assumption other) {
        Set<Assumption> merged = new TreeSet<>(this.assumptions);
        merged.add(other);
        return new AssumptionSet(merged);
    }

    public AssumptionSet and(AssumptionSet other) {
        Set<Assumption> merged = new TreeSet<>(this.assumptions);
        merged.addAll(other.assumptions);
        return of(merged);
    }

    /**
     * 是否为哨兵 "没有假设"。
     */
    public boolean isNone() {
        return assumptions.isEmpty();
    }

    // --- Z3 转换 ---
    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        if (assumptions.isEmpty()) {
            return ctx.mkTrue();
        }
        BoolExpr[] z3Assumptions = assumptions.stream()
                .map(a -> a.toZ3BoolExpr(ctx, varManager))
                .toArray(BoolExpr[]::new);
        return ctx.mkAnd(z3Assumptions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return assumptions.equals(((AssumptionSet) o).assumptions);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (assumptions.isEmpty()) {
            return "True";
        }
        return assumptions.stream()
                .map(Assumption::toString)
                .collect(Collectors.joining(" && "));
    }
}
