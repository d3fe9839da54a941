package org.gdump.chart;

import javafx.geometry.Insets;
import javafx.scene.chart.BarChart;
import javafx.scene.chart.CategoryAxis;
import javafx.scene.chart.NumberAxis;
import javafx.scene.chart.XYChart;
import javafx.scene.control.Tooltip;
import org.gdump.model.DumpModel;
import org.gdump.model.StatusGroup;

/**
 * Builds the status histogram of a dump.
 */
public class ChartFactory {

    public BarChart<String, Number> createStatusChart(DumpModel model) {
        CategoryAxis xAxis = new CategoryAxis();
        xAxis.setLabel("Status");

        NumberAxis yAxis = new NumberAxis();
        yAxis.setLabel("Goroutines");
        yAxis.setMinorTickVisible(false);
        yAxis.setForceZeroInRange(true);

        BarChart<String, Number> chart = new BarChart<>(xAxis, yAxis);
        chart.setAnimated(false);
        chart.setLegendVisible(false);
        chart.setTitle("Goroutines by status");
        chart.setPadding(new Insets(10));

        XYChart.Series<String, Number> series = new XYChart.Series<>();
        for (StatusGroup group : model.getStatusGroups()) {
            XYChart.Data<String, Number> bar = new XYChart.Data<>(displayName(group), group.size());
            bar.setExtraValue(group);
            series.getData().add(bar);
        }

        chart.getData().add(series);
        attachTooltips(series);

        return chart;
    }

    private void attachTooltips(XYChart.Series<String, Number> series) {
        for (XYChart.Data<String, Number> data : series.getData()) {
            StatusGroup group = (StatusGroup) data.getExtraValue();
            if (group == null) {
                continue;
            }
            data.nodeProperty().addListener((obs, oldNode, newNode) -> {
                if (newNode != null) {
                    Tooltip.install(newNode, new Tooltip(buildTooltip(group)));
                }
            });
            if (data.getNode() != null) {
                Tooltip.install(data.getNode(), new Tooltip(buildTooltip(group)));
            }
        }
    }

    private static String displayName(StatusGroup group) {
        return group.getStatus().isEmpty() ? "(none)" : group.getStatus();
    }

    private static String buildTooltip(StatusGroup group) {
        StringBuilder builder = new StringBuilder();
        builder.append("Status: ").append(displayName(group)).append('\n');
        builder.append("Goroutines: ").append(group.size()).append('\n');
        builder.append("Locked to thread: ").append(group.getLockedCount()).append('\n');
        builder.append("Longest wait: ").append(group.getLongestWaitMinutes()).append(" min");
        return builder.toString();
    }
}
