package org.mathpy.rewrite;

import java.util.List;
import java.util.Optional;

/**
 * 负底数参与根式合并时的符号规则。
 * 参数为所有负底数的指数分子 n (底数^(n/2))，返回合并后的符号因子 ±1；为空表示不能合并。
 */
public enum SignPolicy {

    /**
     * 负底数 b^(n/2) 贡献 i^n。k = Σn 为偶数时符号因子为 (-1)^(k/2)；k 为奇数时留下虚数单位，放弃合并。
     */
    STRICT {
        @Override
        public Optional<Integer> signFactor(List<Integer> negativeNumerators) {
            int k = negativeNumerators.stream().mapToInt(Integer::intValue).sum();
            if (Math.floorMod(k, 2) != 0) {
                return Optional.empty();
            }
            return Optional.of(Math.floorMod(k / 2, 2) == 0 ? 1 : -1);
        }
    },

    /**
     * 按负底数的个数两两配对：(-1)^floor(负底数个数 / 2)。奇数个负底数时剩下的虚数单位被丢弃。
     */
    PAIRED_BASES {
        @Override
        public Optional<Integer> signFactor(List<Integer> negativeNumerators) {
            int pairs = negativeNumerators.size() / 2;
            return Optional.of(pairs % 2 == 0 ? 1 : -1);
        }
    };

    public abstract Optional<Integer> signFactor(List<Integer> negativeNumerators);
}
