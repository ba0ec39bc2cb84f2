package org.templogic.stlmilp.formula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 记录的离散时间信号：信号变量前缀 -> 各时刻的取值。
 * 此类是不可变的。
 */
public final class Trace {

    private static final Logger logger = LoggerFactory.getLogger(Trace.class);

    private final SortedMap<String, double[]> values;

    private Trace(Map<String, double[]> values) {
        SortedMap<String, double[]> copy = new TreeMap<>();
        for (Map.Entry<String, double[]> entry : Objects.requireNonNull(values, "Values map cannot be null").entrySet()) {
            String name = Objects.requireNonNull(entry.getKey(), "Signal name cannot be null");
            double[] series = Objects.requireNonNull(entry.getValue(), "Signal values cannot be null");
            copy.put(name, series.clone());
        }
        this.values = Collections.unmodifiableSortedMap(copy);
        logger.debug("创建 Trace: {}", this);
    }

    public static Trace of(Map<String, double[]> values) {
        return new Trace(values);
    }

    public static Trace of(String name, double... series) {
        return new Trace(Map.of(name, series));
    }

    /**
     * 获取信号在时刻 t 的取值。
     * @return 若信号不存在或 t 超出记录范围则为空。
     */
    public OptionalDouble value(String name, int t) {
        double[] series = values.get(name);
        if (series == null || t < 0 || t >= series.length) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(series[t]);
    }

    /**
     * @return 信号记录的长度，不存在则为 0。
     */
    public int length(String name) {
        double[] series = values.get(name);
        return series == null ? 0 : series.length;
    }

    public Set<String> getNames() {
        return values.keySet();
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .map(e -> e.getKey() + "=" + Arrays.toString(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
