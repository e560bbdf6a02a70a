package org.lrasolver.solver;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 求解器配置，不可变。
 * <ul>
 *     <li>maxPivots: 单次可行性检查或顶点选择允许的最多主元次数</li>
 *     <li>maxCaseSplits: 单次 check 允许的最多分支次数</li>
 *     <li>verifyInvariants: 每次修改表格后校验表格不变量</li>
 * </ul>
 */
@Getter
public final class SolverConfig {

    private static final Logger logger = LoggerFactory.getLogger(SolverConfig.class);

    public static final String RESOURCE = "lra-solver.properties";
    public static final String MAX_PIVOTS_KEY = "lra.maxPivots";
    public static final String MAX_CASE_SPLITS_KEY = "lra.maxCaseSplits";
    public static final String VERIFY_INVARIANTS_KEY = "lra.verifyInvariants";

    public static final int DEFAULT_MAX_PIVOTS = 10000;
    public static final int DEFAULT_MAX_CASE_SPLITS = 100000;

    private final int maxPivots;
    private final int maxCaseSplits;
    private final boolean verifyInvariants;

    private SolverConfig(Builder b) {
        this.maxPivots = b.maxPivots;
        this.maxCaseSplits = b.maxCaseSplits;
        this.verifyInvariants = b.verifyInvariants;
    }

    public static SolverConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 依次叠加：内置默认值，类路径上的 {@value #RESOURCE}，同名 JVM 系统属性。
     * @throws IllegalArgumentException 配置值不是合法的数字
     */
    public static SolverConfig load() {
        Properties properties = new Properties();
        try (InputStream in = SolverConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
                logger.debug("读取配置文件 {}", RESOURCE);
            } else {
                logger.debug("类路径上没有 {}，使用默认配置", RESOURCE);
            }
        } catch (IOException e) {
            logger.error("读取配置文件 {} 失败", RESOURCE, e);
            throw new UncheckedIOException("无法读取 " + RESOURCE, e);
        }

        Builder builder = builder();
        String maxPivots = lookup(properties, MAX_PIVOTS_KEY);
        if (maxPivots != null) {
            builder.maxPivots(parseInt(MAX_PIVOTS_KEY, maxPivots));
        }
        String maxCaseSplits = lookup(properties, MAX_CASE_SPLITS_KEY);
        if (maxCaseSplits != null) {
            builder.maxCaseSplits(parseInt(MAX_CASE_SPLITS_KEY, maxCaseSplits));
        }
        String verify = lookup(properties, VERIFY_INVARIANTS_KEY);
        if (verify != null) {
            builder.verifyInvariants(Boolean.parseBoolean(verify));
        }
        SolverConfig config = builder.build();
        logger.info("求解器配置: {}", config);
        return config;
    }

    private static String lookup(Properties properties, String key) {
        String fromSystem = StringUtils.trimToNull(System.getProperty(key));
        if (fromSystem != null) {
            return fromSystem;
        }
        return StringUtils.trimToNull(properties.getProperty(key));
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.error("配置项 {} 的值 '{}' 不是整数", key, value);
            throw new IllegalArgumentException("配置项 " + key + " 的值不是整数: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "SolverConfig{maxPivots=" + maxPivots + ", maxCaseSplits=" + maxCaseSplits
                + ", verifyInvariants=" + verifyInvariants + "}";
    }

    public static final class Builder {
        private int maxPivots = DEFAULT_MAX_PIVOTS;
        private int maxCaseSplits = DEFAULT_MAX_CASE_SPLITS;
        private boolean verifyInvariants;

        public Builder maxPivots(int v) {
            if (v < 0) {
                throw new IllegalArgumentException("maxPivots 不能为负数: " + v);
            }
            this.maxPivots = v;
            return this;
        }

        public Builder maxCaseSplits(int v) {
            if (v < 0) {
                throw new IllegalArgumentException("maxCaseSplits 不能为负数: " + v);
            }
            this.maxCaseSplits = v;
            return this;
        }

        public Builder verifyInvariants(boolean v) {
            this.verifyInvariants = v;
            return this;
        }

        public SolverConfig build() {
            return new SolverConfig(this);
        }
    }
}
