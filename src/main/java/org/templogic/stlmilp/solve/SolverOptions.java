package org.templogic.stlmilp.solve;

import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Properties;

/**
 * 一次构建与求解的配置。值为 null 的求解参数不会传给求解器。
 */
@Value
@Builder
public class SolverOptions {

    private static final Logger logger = LoggerFactory.getLogger(SolverOptions.class);

    public static final String OUTPUT_FLAG_KEY = "stlmilp.outputflag";
    public static final String NUMERIC_FOCUS_KEY = "stlmilp.numericfocus";
    public static final String THREADS_KEY = "stlmilp.threads";
    public static final String TIME_LIMIT_KEY = "stlmilp.timelimit";
    public static final String LOG_FILES_KEY = "stlmilp.logfiles";
    public static final String OUTPUT_DIR_KEY = "stlmilp.outputdir";

    /**
     * 求解器日志开关。
     */
    Integer outputFlag;

    /**
     * 数值稳定性等级。
     */
    Integer numericFocus;

    @Builder.Default
    Integer threads = 4;

    /**
     * 求解时间上限，单位秒。
     */
    Double timeLimitSeconds;

    /**
     * 是否输出 out.lp 与 out_vars.txt。
     */
    @Builder.Default
    boolean logFiles = false;

    @Builder.Default
    Path outputDirectory = Path.of(".");

    public static SolverOptions defaults() {
        return builder().build();
    }

    /**
     * 从 Properties 读取配置，缺失的键使用默认值。
     * @throws IllegalArgumentException 如果某个值无法解析。
     */
    public static SolverOptions fromProperties(Properties props) {
        SolverOptionsBuilder builder = builder();
        String outputFlag = props.getProperty(OUTPUT_FLAG_KEY);
        if (outputFlag != null) {
            builder.outputFlag(parseInt(OUTPUT_FLAG_KEY, outputFlag));
        }
        String numericFocus = props.getProperty(NUMERIC_FOCUS_KEY);
        if (numericFocus != null) {
            builder.numericFocus(parseInt(NUMERIC_FOCUS_KEY, numericFocus));
        }
        String threads = props.getProperty(THREADS_KEY);
        if (threads != null) {
            builder.threads(parseInt(THREADS_KEY, threads));
        }
        String timeLimit = props.getProperty(TIME_LIMIT_KEY);
        if (timeLimit != null) {
            try {
                builder.timeLimitSeconds(Double.parseDouble(timeLimit.trim()));
            } catch (NumberFormatException e) {
                logger.error("SolverOptions: 无法解析 {} = {}", TIME_LIMIT_KEY, timeLimit);
                throw new IllegalArgumentException("无法解析 " + TIME_LIMIT_KEY + " = " + timeLimit, e);
            }
        }
        String logFiles = props.getProperty(LOG_FILES_KEY);
        if (logFiles != null) {
            builder.logFiles(Boolean.parseBoolean(logFiles.trim()));
        }
        String outputDir = props.getProperty(OUTPUT_DIR_KEY);
        if (outputDir != null) {
            builder.outputDirectory(Path.of(outputDir.trim()));
        }
        SolverOptions options = builder.build();
        logger.info("读取求解配置: {}", options);
        return options;
    }

    /**
     * 从 classpath 上的 properties 文件读取配置。
     * @throws IllegalArgumentException 如果资源不存在。
     */
    public static SolverOptions load(String resource) {
        try (InputStream in = SolverOptions.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.error("SolverOptions.load: 找不到配置资源 {}", resource);
                throw new IllegalArgumentException("找不到配置资源 " + resource);
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("读取配置资源 " + resource + " 失败", e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.error("SolverOptions: 无法解析 {} = {}", key, value);
            throw new IllegalArgumentException("无法解析 " + key + " = " + value, e);
        }
    }
}
