package com.project.graph.digitizer.service;

import org.apache.commons.math3.stat.StatUtils;

/** How the rows matched in one column collapse to a single amplitude. */
public enum AggregationPolicy {
    MEAN {
        @Override
        double collapse(double[] ys) {
            return StatUtils.mean(ys);
        }
    },
    MEDIAN {
        @Override
        double collapse(double[] ys) {
            return StatUtils.percentile(ys, 50d);
        }
    };

    abstract double collapse(double[] ys);
}
