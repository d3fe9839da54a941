package org.gdump.model;

import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import org.gdump.parser.Goroutine;

import java.util.Objects;

/**
 * Holds all goroutines of a dump that share the same status.
 */
public class StatusGroup {

    private final String status;
    private final ObservableList<Goroutine> goroutines = FXCollections.observableArrayList();

    public StatusGroup(String status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public String getStatus() {
        return status;
    }

    public ObservableList<Goroutine> getGoroutines() {
        return FXCollections.unmodifiableObservableList(goroutines);
    }

    public void addGoroutine(Goroutine goroutine) {
        goroutines.add(goroutine);
    }

    public int size() {
        return goroutines.size();
    }

    public long getLockedCount() {
        return goroutines.stream().filter(Goroutine::isLockedToThread).count();
    }

    public long getLongestWaitMinutes() {
        return goroutines.stream().mapToLong(Goroutine::getWaitSinceMinutes).max().orElse(0);
    }
}
