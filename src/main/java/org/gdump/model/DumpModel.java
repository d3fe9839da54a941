package org.gdump.model;

import org.gdump.parser.Goroutine;
import org.gdump.parser.ParseIssue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Aggregates the goroutines loaded from one dump and exposes convenience filtering.
 */
public class DumpModel {

    private final List<Goroutine> goroutines = new ArrayList<>();
    private final Map<String, StatusGroup> statusGroups = new LinkedHashMap<>();
    private final List<ParseIssue> issues = new ArrayList<>();
    private Path source;

    public void addGoroutine(Goroutine goroutine) {
        Objects.requireNonNull(goroutine, "goroutine");
        goroutines.add(goroutine);
        statusGroups.computeIfAbsent(goroutine.getStatus(), StatusGroup::new).addGoroutine(goroutine);
    }

    public void addIssues(List<ParseIssue> newIssues) {
        issues.addAll(newIssues);
    }

    public List<Goroutine> getGoroutines() {
        return Collections.unmodifiableList(goroutines);
    }

    public Collection<StatusGroup> getStatusGroups() {
        return Collections.unmodifiableCollection(statusGroups.values());
    }

    public Optional<StatusGroup> getStatusGroup(String status) {
        return Optional.ofNullable(statusGroups.get(status));
    }

    public Optional<Goroutine> getGoroutine(long id) {
        return goroutines.stream().filter(goroutine -> goroutine.getId() == id).findFirst();
    }

    public List<ParseIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public int getGoroutineCount() {
        return goroutines.size();
    }

    public int getStatusCount() {
        return statusGroups.size();
    }

    public long getLockedCount() {
        return goroutines.stream().filter(Goroutine::isLockedToThread).count();
    }

    public void setSource(Path source) {
        this.source = source;
    }

    public Optional<Path> getSource() {
        return Optional.ofNullable(source);
    }

    /**
     * Returns a model with the goroutines matching every given criterion. {@code null} or blank
     * criteria match everything.
     *
     * @param stackText      text that must occur in the stack, including the creating frame
     * @param status         exact status
     * @param minWaitMinutes minimal reported wait
     */
    public DumpModel filter(String stackText, String status, Long minWaitMinutes) {
        Predicate<Goroutine> predicate = goroutine -> {
            boolean stackOk = stackText == null || stackText.isBlank()
                    || goroutine.stackContains(stackText.strip());
            boolean statusOk = status == null || status.isBlank()
                    || status.equals(goroutine.getStatus());
            boolean waitOk = minWaitMinutes == null || goroutine.getWaitSinceMinutes() >= minWaitMinutes;
            return stackOk && statusOk && waitOk;
        };

        DumpModel filtered = new DumpModel();
        filtered.setSource(source);
        filtered.addIssues(issues);

        goroutines.stream()
                .filter(predicate)
                .forEach(filtered::addGoroutine);

        return filtered;
    }
}
