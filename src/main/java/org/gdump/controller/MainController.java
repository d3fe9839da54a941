package org.gdump.controller;

import javafx.collections.FXCollections;
import javafx.concurrent.Task;
import javafx.embed.swing.SwingFXUtils;
import javafx.geometry.Insets;
import javafx.geometry.Orientation;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.chart.BarChart;
import javafx.scene.control.*;
import javafx.scene.input.KeyCode;
import javafx.scene.layout.*;
import javafx.stage.FileChooser;
import javafx.stage.Window;
import org.gdump.chart.ChartFactory;
import org.gdump.model.DumpModel;
import org.gdump.model.StatusGroup;
import org.gdump.parser.Goroutine;
import org.gdump.parser.StackFrame;
import org.gdump.service.DumpLoaderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Composes the user interface and orchestrates the interactions.
 */
public class MainController {

    private static final Logger LOG = LoggerFactory.getLogger(MainController.class);

    private static final String ALL_STATUSES = "All statuses";

    private final DumpLoaderService loaderService;
    private final ChartFactory chartFactory;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "dump-loader");
        thread.setDaemon(true);
        return thread;
    });

    private final BorderPane root = new BorderPane();
    private final StackPane chartContainer = new StackPane();
    private final ListView<Goroutine> goroutineList = new ListView<>();
    private final TextArea stackView = new TextArea();
    private final Label statusLabel = new Label("No dump loaded");
    private final Button loadButton = new Button("Open dump");
    private final Button applyFilterButton = new Button("Apply filter");
    private final Button resetFilterButton = new Button("Reset filter");
    private final Button exportButton = new Button("Export PNG");
    private final TextField searchField = new TextField();
    private final ComboBox<String> statusChoice = new ComboBox<>();
    private final TextField minWaitField = new TextField();
    private final ProgressIndicator progressIndicator = new ProgressIndicator();

    private BarChart<String, Number> statusChart;
    private DumpModel originalModel;
    private DumpModel filteredModel;

    public MainController(DumpLoaderService loaderService, ChartFactory chartFactory) {
        this.loaderService = loaderService;
        this.chartFactory = chartFactory;
        configureLayout();
        attachListeners();
    }

    public Pane getView() {
        return root;
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    private void configureLayout() {
        root.setPrefSize(1280, 800);
        root.setTop(buildToolbar());

        goroutineList.setCellFactory(list -> new GoroutineCell());
        goroutineList.setPlaceholder(new Label("No goroutines to show"));

        stackView.setEditable(false);
        stackView.setStyle("-fx-font-family: monospace;");

        chartContainer.setPadding(new Insets(8));
        chartContainer.setMinHeight(260);

        SplitPane detailPane = new SplitPane(chartContainer, stackView);
        detailPane.setOrientation(Orientation.VERTICAL);
        detailPane.setDividerPositions(0.4);

        SplitPane content = new SplitPane(goroutineList, detailPane);
        content.setDividerPositions(0.35);

        HBox statusBar = new HBox(statusLabel);
        statusBar.setAlignment(Pos.CENTER_LEFT);
        statusBar.setPadding(new Insets(6, 10, 6, 10));
        statusBar.setStyle("-fx-background-color: #f4f4f4; -fx-border-color: #dcdcdc; -fx-border-width: 1 0 0 0;");
        root.setBottom(statusBar);

        progressIndicator.setVisible(false);
        progressIndicator.setMaxSize(60, 60);
        StackPane overlay = new StackPane(content, progressIndicator);
        StackPane.setAlignment(progressIndicator, Pos.CENTER);
        root.setCenter(overlay);
    }

    private ToolBar buildToolbar() {
        loadButton.setDefaultButton(true);
        searchField.setPromptText("Search in stack");
        searchField.setPrefColumnCount(24);
        minWaitField.setPromptText("Min wait, min");
        minWaitField.setPrefColumnCount(6);
        statusChoice.setItems(FXCollections.observableArrayList(ALL_STATUSES));
        statusChoice.getSelectionModel().selectFirst();
        exportButton.setDisable(true);

        ToolBar toolBar = new ToolBar();
        toolBar.getItems().addAll(
                loadButton,
                new Separator(),
                new Label("Stack:"),
                searchField,
                new Label("Status:"),
                statusChoice,
                new Label("Wait:"),
                minWaitField,
                applyFilterButton,
                resetFilterButton,
                new Separator(),
                exportButton
        );
        toolBar.setPadding(new Insets(6));
        toolBar.setStyle("-fx-background-color: #fafafa;");
        return toolBar;
    }

    private void attachListeners() {
        loadButton.setOnAction(e -> chooseAndLoadFile());
        applyFilterButton.setOnAction(e -> applyFilters());
        resetFilterButton.setOnAction(e -> resetFilters());
        exportButton.setOnAction(e -> exportChart());

        searchField.setOnKeyPressed(event -> {
            if (event.getCode() == KeyCode.ENTER) {
                applyFilters();
            }
        });
        minWaitField.setOnKeyPressed(event -> {
            if (event.getCode() == KeyCode.ENTER) {
                applyFilters();
            }
        });

        goroutineList.getSelectionModel().selectedItemProperty()
                .addListener((obs, oldValue, newValue) -> showStack(newValue));
    }

    private void chooseAndLoadFile() {
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Open goroutine dump");
        chooser.getExtensionFilters().addAll(
                new FileChooser.ExtensionFilter("Dumps", "*.txt", "*.log", "*.dump"),
                new FileChooser.ExtensionFilter("All files", "*.*")
        );
        File file = chooser.showOpenDialog(getWindow());
        if (file != null) {
            loadData(file.toPath());
        }
    }

    private void loadData(Path file) {
        toggleLoading(true);
        Task<DumpModel> task = new Task<>() {
            @Override
            protected DumpModel call() throws Exception {
                updateMessage("Reading " + file.getFileName() + "...");
                DumpModel model = loaderService.load(file);
                updateMessage("Done");
                return model;
            }
        };

        statusLabel.textProperty().bind(task.messageProperty());
        task.setOnSucceeded(event -> {
            statusLabel.textProperty().unbind();
            originalModel = task.getValue();
            filteredModel = originalModel;
            clearFilterControls();
            fillStatusChoice(originalModel);
            updateView(filteredModel);
            updateStatusBar();
            toggleLoading(false);
        });
        task.setOnFailed(event -> {
            statusLabel.textProperty().unbind();
            toggleLoading(false);
            Throwable ex = task.getException();
            LOG.error("Failed to load dump {}", file, ex);
            statusLabel.setText("Load failed");
            showError("Could not load the dump", ex);
        });
        executor.submit(task);
    }

    private void updateView(DumpModel model) {
        goroutineList.setItems(FXCollections.observableArrayList(model.getGoroutines()));
        stackView.clear();

        chartContainer.getChildren().clear();
        if (model.getStatusGroups().isEmpty()) {
            statusChart = null;
            Label emptyLabel = new Label("No data to display");
            emptyLabel.setStyle("-fx-text-fill: #666666;");
            chartContainer.getChildren().add(emptyLabel);
        } else {
            statusChart = chartFactory.createStatusChart(model);
            chartContainer.getChildren().add(statusChart);
        }
        exportButton.setDisable(statusChart == null);
    }

    private void showStack(Goroutine goroutine) {
        if (goroutine == null) {
            stackView.clear();
            return;
        }
        StringBuilder builder = new StringBuilder();
        builder.append(goroutine).append("\n\n");
        for (StackFrame frame : goroutine.getStackTrace()) {
            builder.append(frame).append('\n');
        }
        if (goroutine.isFramesElided()) {
            builder.append("...additional frames elided...\n");
        }
        goroutine.getCreatedBy().ifPresent(frame -> {
            builder.append("\ncreated by ");
            goroutine.getCreatorId().ifPresent(id -> builder.append("goroutine ").append(id).append(" in "));
            builder.append(frame).append('\n');
        });
        stackView.setText(builder.toString());
    }

    private void applyFilters() {
        if (originalModel == null) {
            return;
        }
        try {
            String status = statusChoice.getValue();
            filteredModel = originalModel.filter(
                    searchField.getText(),
                    ALL_STATUSES.equals(status) ? null : status,
                    parseMinutes(minWaitField.getText()));
            updateView(filteredModel);
            updateStatusBar();
        } catch (IllegalArgumentException ex) {
            showError("Invalid filter", ex);
        }
    }

    private void resetFilters() {
        if (originalModel == null) {
            return;
        }
        clearFilterControls();
        filteredModel = originalModel;
        updateView(filteredModel);
        updateStatusBar();
    }

    private void exportChart() {
        if (statusChart == null) {
            return;
        }
        String defaultName = originalModel.getSource()
                .map(path -> path.getFileName() + "-status.png")
                .orElse("status.png");
        WritableImageSnapshot snapshot = new WritableImageSnapshot(statusChart);
        Optional<File> target = snapshot.promptForTarget(getWindow(), defaultName);
        target.ifPresent(file -> {
            try {
                snapshot.writePng(file.toPath());
                statusLabel.setText("Saved to " + file.getAbsolutePath());
            } catch (IOException ex) {
                LOG.error("Failed to export chart to {}", file, ex);
                showError("Could not save the image", ex);
            }
        });
    }

    private void toggleLoading(boolean loading) {
        progressIndicator.setVisible(loading);
        loadButton.setDisable(loading);
        applyFilterButton.setDisable(loading);
        resetFilterButton.setDisable(loading);
    }

    private void fillStatusChoice(DumpModel model) {
        statusChoice.getItems().setAll(ALL_STATUSES);
        for (StatusGroup group : model.getStatusGroups()) {
            statusChoice.getItems().add(group.getStatus());
        }
        statusChoice.getSelectionModel().selectFirst();
    }

    private void updateStatusBar() {
        if (filteredModel == null) {
            statusLabel.setText("No dump loaded");
            return;
        }
        StringBuilder builder = new StringBuilder();
        filteredModel.getSource().ifPresent(path -> builder.append(path.getFileName()).append(" "));
        builder.append("Goroutines: ").append(filteredModel.getGoroutineCount());
        if (originalModel != null && filteredModel != originalModel) {
            builder.append(" (of ").append(originalModel.getGoroutineCount()).append(")");
        }
        builder.append(", statuses: ").append(filteredModel.getStatusCount());
        builder.append(", locked: ").append(filteredModel.getLockedCount());
        if (!filteredModel.getIssues().isEmpty()) {
            builder.append(", skipped: ").append(filteredModel.getIssues().size());
        }
        statusLabel.setText(builder.toString());
    }

    private static Long parseMinutes(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(text.strip());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid wait in minutes: " + text, ex);
        }
    }

    private void showError(String message, Throwable ex) {
        Alert alert = new Alert(Alert.AlertType.ERROR);
        alert.setTitle("Error");
        alert.setHeaderText(message);
        alert.setContentText(ex.getMessage());
        alert.showAndWait();
    }

    private void clearFilterControls() {
        searchField.clear();
        minWaitField.clear();
        statusChoice.getSelectionModel().selectFirst();
    }

    private Window getWindow() {
        Scene scene = root.getScene();
        return scene == null ? null : scene.getWindow();
    }

    private static class GoroutineCell extends ListCell<Goroutine> {

        @Override
        protected void updateItem(Goroutine item, boolean empty) {
            super.updateItem(item, empty);
            if (empty || item == null) {
                setText(null);
                return;
            }
            StringBuilder builder = new StringBuilder();
            builder.append('#').append(item.getId()).append(" [").append(item.getStatus()).append(']');
            if (item.getWaitSinceMinutes() > 0) {
                builder.append(' ').append(item.getWaitSinceMinutes()).append(" min");
            }
            if (item.isLockedToThread()) {
                builder.append(" locked");
            }
            if (!item.getStackTrace().isEmpty()) {
                builder.append("  ").append(item.getStackTrace().get(0).getFunctionName());
            }
            setText(builder.toString());
        }
    }

    /**
     * Helper to snapshot and export charts to PNG.
     */
    private static class WritableImageSnapshot {
        private final BarChart<String, Number> chart;

        WritableImageSnapshot(BarChart<String, Number> chart) {
            this.chart = chart;
        }

        Optional<File> promptForTarget(Window window, String defaultName) {
            FileChooser chooser = new FileChooser();
            chooser.setTitle("Save chart");
            chooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("PNG", "*.png"));
            chooser.setInitialFileName(defaultName);
            return Optional.ofNullable(chooser.showSaveDialog(window));
        }

        void writePng(Path target) throws IOException {
            var image = chart.snapshot(null, null);
            ImageIO.write(SwingFXUtils.fromFXImage(image, null), "png", target.toFile());
        }
    }
}
