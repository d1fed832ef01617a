package com.devflow.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "devflow.analysis")
public class AnalysisProperties {
    public static final int DEFAULT_BOTTLENECK_LIMIT = 10;

    private int bottleneckLimit = DEFAULT_BOTTLENECK_LIMIT;
    private Parallel parallel = new Parallel();

    public int getBottleneckLimit() {
        return bottleneckLimit;
    }

    public void setBottleneckLimit(int bottleneckLimit) {
        this.bottleneckLimit = bottleneckLimit;
    }

    public Parallel getParallel() {
        return parallel;
    }

    public void setParallel(Parallel parallel) {
        this.parallel = parallel;
    }

    public static class Parallel {
        /** Worker threads used for case accumulation; 1 keeps the engine sequential. */
        private int workers = 1;

        /** Minimum number of cases before the log is split across workers. */
        private int threshold = 5000;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }
    }
}
