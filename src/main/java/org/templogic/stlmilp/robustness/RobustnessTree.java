package org.templogic.stlmilp.robustness;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 与 STL 公式树形状一致的鲁棒度树，用于给增量求解提供初始解。
 * 每个节点带有一个已知的鲁棒度值，以及 min/max 编码中被选中分支的序号 (可选)。
 * children 中的元素可以为 null，表示对应子树没有提示。
 * <p>
 * 形状约定：NEXT 不占节点 (直接传给子公式)；NOT 一个子节点；AND、OR 每个子公式一个；
 * ALWAYS、EVENTUALLY 在窗口 [a, b] 内每个偏移一个；EXPR 没有子节点。
 * 此类是不可变的。
 */
@Getter
public final class RobustnessTree {

    private static final Logger logger = LoggerFactory.getLogger(RobustnessTree.class);

    private final double robustness;
    // null 表示没有序号
    private final Integer index;
    private final List<RobustnessTree> children;

    private RobustnessTree(double robustness, Integer index, List<RobustnessTree> children) {
        if (Double.isNaN(robustness)) {
            logger.error("RobustnessTree-构造函数: 鲁棒度为 NaN");
            throw new IllegalArgumentException("鲁棒度不能为 NaN");
        }
        if (index != null && index < 0) {
            logger.error("RobustnessTree-构造函数: 分支序号为负: {}", index);
            throw new IllegalArgumentException("分支序号不能为负: " + index);
        }
        this.robustness = robustness;
        this.index = index;
        // List.copyOf 不接受 null 元素
        this.children = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(children, "Children cannot be null")));
    }

    public static RobustnessTree leaf(double robustness) {
        return new RobustnessTree(robustness, null, List.of());
    }

    public static RobustnessTree of(double robustness, List<RobustnessTree> children) {
        return new RobustnessTree(robustness, null, children);
    }

    public static RobustnessTree of(double robustness, Integer index, List<RobustnessTree> children) {
        return new RobustnessTree(robustness, index, children);
    }

    /**
     * @return 本节点对应的初始解提示。
     */
    public StartHint toStartHint() {
        return index == null ? StartHint.of(robustness) : StartHint.of(robustness, index);
    }

    /**
     * 可为 null 的树对应的提示。
     */
    public static StartHint hintOf(RobustnessTree tree) {
        return tree == null ? StartHint.none() : tree.toStartHint();
    }

    public int size() {
        return children.size();
    }

    public RobustnessTree getChild(int i) {
        return children.get(i);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RobustnessTree that = (RobustnessTree) o;
        return Double.compare(robustness, that.robustness) == 0 && Objects.equals(index, that.index)
                && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(robustness, index, children);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(robustness);
        if (index != null) {
            sb.append('@').append(index);
        }
        if (!children.isEmpty()) {
            sb.append(children);
        }
        return sb.toString();
    }
}
