package org.gdump;

import javafx.application.Application;
import javafx.scene.Scene;
import javafx.stage.Stage;
import org.gdump.chart.ChartFactory;
import org.gdump.controller.MainController;
import org.gdump.service.DumpLoaderService;

public class FxStarter extends Application {

    private MainController controller;

    @Override
    public void start(Stage stage) {
        controller = new MainController(new DumpLoaderService(), new ChartFactory());
        Scene scene = new Scene(controller.getView());
        stage.setTitle("Goroutine Dump Viewer");
        stage.setScene(scene);
        stage.show();
    }

    @Override
    public void stop() {
        if (controller != null) {
            controller.shutdown();
        }
    }

    public static void main(String[] args) {
        launch(args);
    }
}
