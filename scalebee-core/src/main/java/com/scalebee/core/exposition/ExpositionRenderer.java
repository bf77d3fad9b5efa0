package com.scalebee.core.exposition;

import com.scalebee.core.model.UtilizationSample;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders samples in the Prometheus text exposition format: a {@code # HELP} and {@code # TYPE}
 * header per metric followed by one line per task instance, values with two decimals.
 */
public class ExpositionRenderer {

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4";

    private static final Comparator<UtilizationSample> ORDER = Comparator.comparing(UtilizationSample::workloadName)
            .thenComparing(UtilizationSample::taskName)
            .thenComparing(UtilizationSample::instanceId);

    public String render(Collection<UtilizationSample> samples) {
        List<UtilizationSample> ordered = samples.stream().sorted(ORDER).collect(Collectors.toList());
        StringBuilder sb = new StringBuilder();
        ExposedMetric[] metrics = ExposedMetric.values();
        for (int i = 0; i < metrics.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            appendMetric(sb, metrics[i], ordered);
        }
        return sb.toString();
    }

    private static void appendMetric(StringBuilder sb, ExposedMetric metric, List<UtilizationSample> samples) {
        sb.append("# HELP ").append(metric.metricName()).append(' ').append(metric.help()).append('\n');
        sb.append("# TYPE ").append(metric.metricName()).append(" gauge\n");
        for (UtilizationSample sample : samples) {
            sb.append(metric.metricName())
                    .append('{')
                    .append(ExposedMetric.LABEL_WORKLOAD)
                    .append("=\"")
                    .append(escape(sample.workloadName()))
                    .append("\",")
                    .append(ExposedMetric.LABEL_TASK)
                    .append("=\"")
                    .append(escape(sample.taskName()))
                    .append("\",")
                    .append(ExposedMetric.LABEL_INSTANCE)
                    .append("=\"")
                    .append(escape(sample.instanceId()))
                    .append("\"} ")
                    .append(String.format(Locale.ROOT, "%.2f", metric.valueOf(sample)))
                    .append('\n');
        }
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
