package org.templogic.stlmilp.encoding;

import lombok.Getter;
import org.templogic.stlmilp.core.Bounds;
import org.templogic.stlmilp.core.MilpVar;

import java.util.Objects;

/**
 * 一个子公式的编码结果：鲁棒度变量及其取值范围。
 */
@Getter
public final class StlEncoding {

    private final MilpVar var;
    private final Bounds bounds;

    private StlEncoding(MilpVar var, Bounds bounds) {
        this.var = Objects.requireNonNull(var, "Variable cannot be null");
        this.bounds = Objects.requireNonNull(bounds, "Bounds cannot be null");
    }

    public static StlEncoding of(MilpVar var, Bounds bounds) {
        return new StlEncoding(var, bounds);
    }

    @Override
    public String toString() {
        return var.getName() + " in " + bounds;
    }
}
