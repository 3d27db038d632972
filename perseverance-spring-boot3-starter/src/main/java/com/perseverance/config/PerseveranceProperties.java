package com.perseverance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 重试配置（绑定前缀：perseverance）
 *
 * YAML 示例：
 * perseverance:
 *   strategy: progressive        # constant | progressive | spi:{name}
 *   constant:
 *     delay: 1s
 *     max-count: 5
 *   progressive:
 *     initial-delay: 500ms
 *     stable-length: 3
 *     multiplier: 2
 *     max-delay: 60s
 *   log:
 *     style: SLF4J               # SLF4J | STDOUT
 *   metrics:
 *     enabled: true
 */
@ConfigurationProperties(prefix = "perseverance")
public class PerseveranceProperties {

    /** 默认策略名 */
    private String strategy = "progressive";

    private Constant constant = new Constant();

    private Progressive progressive = new Progressive();

    private Log log = new Log();

    private Metrics metrics = new Metrics();

    // ----------------- 嵌套配置对象 -----------------

    public static class Constant {
        /** 固定间隔 */
        private Duration delay = Duration.ofSeconds(1);

        /** 最大尝试次数, 不设置表示不限 */
        private Integer maxCount;

        public Duration getDelay() { return delay; }
        public void setDelay(Duration delay) { this.delay = delay; }
        public Integer getMaxCount() { return maxCount; }
        public void setMaxCount(Integer maxCount) { this.maxCount = maxCount; }
    }

    public static class Progressive {
        /** 初始间隔 */
        private Duration initialDelay = Duration.ofMillis(500);

        /** 保持初始间隔的尝试次数 */
        private int stableLength = 3;

        /** 之后每次的倍数 */
        private double multiplier = 2;

        /** 间隔上限 */
        private Duration maxDelay = Duration.ofSeconds(60);

        /** 最大尝试次数, 不设置表示不限 */
        private Integer maxCount;

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public int getStableLength() { return stableLength; }
        public void setStableLength(int stableLength) { this.stableLength = stableLength; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public Integer getMaxCount() { return maxCount; }
        public void setMaxCount(Integer maxCount) { this.maxCount = maxCount; }
    }

    public static class Log {
        private Style style = Style.SLF4J;

        public Style getStyle() { return style; }
        public void setStyle(Style style) { this.style = style; }
    }

    public static class Metrics {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public enum Style {
        /** 通过 slf4j 输出 WARN */
        SLF4J,
        /** 直接输出到 stdout */
        STDOUT
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public Constant getConstant() {
        return constant;
    }

    public void setConstant(Constant constant) {
        this.constant = constant;
    }

    public Progressive getProgressive() {
        return progressive;
    }

    public void setProgressive(Progressive progressive) {
        this.progressive = progressive;
    }

    public Log getLog() {
        return log;
    }

    public void setLog(Log log) {
        this.log = log;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }
}
