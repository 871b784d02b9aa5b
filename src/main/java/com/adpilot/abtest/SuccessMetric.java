package com.adpilot.abtest;

/**
 * The metric a test optimizes. Each metric maps its raw value onto a score in [0, 100].
 */
public enum SuccessMetric {
    CTR {
        @Override
        public double valueOf(VariantMetrics metrics) {
            return metrics.ctr();
        }

        @Override
        public double score(VariantMetrics metrics) {
            return metrics.ctr() * 25;
        }
    },
    CPC {
        @Override
        public double valueOf(VariantMetrics metrics) {
            return metrics.cpc();
        }

        @Override
        public double score(VariantMetrics metrics) {
            return 100 - metrics.cpc() * 20;
        }
    },
    CONVERSIONS {
        @Override
        public double valueOf(VariantMetrics metrics) {
            return metrics.conversions();
        }

        @Override
        public double score(VariantMetrics metrics) {
            return metrics.conversions() * 2.0;
        }
    },
    ROAS {
        @Override
        public double valueOf(VariantMetrics metrics) {
            return metrics.roas();
        }

        @Override
        public double score(VariantMetrics metrics) {
            return metrics.roas() * 25;
        }
    };

    public abstract double valueOf(VariantMetrics metrics);

    /**
     * Unclamped score; callers clamp to [0, 100].
     */
    public abstract double score(VariantMetrics metrics);
}
