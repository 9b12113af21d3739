package com.tsa.core;

import com.tsa.exception.ErrorKind;
import com.tsa.exception.TsaException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Errors of one analysis object, collected instead of thrown so that one bad
 * row does not stop the rest of the analysis.
 * <p>
 * Similar errors are stored once with a counter of further occurrences.
 * Thread-safe.
 */
public class ErrorCollection {

    private final String context;
    private final List<Entry> entries = new ArrayList<>();

    public ErrorCollection(String context) {
        this.context = context;
    }

    public String getContext() {
        return context;
    }

    public synchronized void add(AnalysisError error) {
        for (Entry entry : entries) {
            if (entry.error.isSimilarTo(error)) {
                entry.moreCount++;
                return;
            }
        }
        entries.add(new Entry(error));
    }

    /**
     * Record an error in the context of this collection.
     */
    public void add(ErrorKind kind, String message) {
        add(AnalysisError.of(kind, context, -1, message));
    }

    /**
     * Record an error of one item, e.g. a condition, of this collection.
     *
     * @param kind      error category
     * @param item      item the error concerns, appended to the context
     * @param sourceRow input row, -1 if none
     * @param message   error message
     */
    public void add(ErrorKind kind, String item, int sourceRow, String message) {
        add(AnalysisError.of(kind, context + " / " + item, sourceRow, message));
    }

    public void add(TsaException e, String item, int sourceRow) {
        add(AnalysisError.of(e, context + " / " + item, sourceRow));
    }

    /**
     * Entries in time order.
     */
    public synchronized List<Entry> entries() {
        List<Entry> copy = new ArrayList<>(entries);
        copy.sort(Comparator.comparing(e -> e.error.timestamp()));
        return copy;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized boolean hasKind(ErrorKind kind) {
        return entries.stream().anyMatch(e -> e.error.kind() == kind);
    }

    /**
     * Error messages on one line in time order.
     */
    public String shortString() {
        return entries().stream()
                .map(e -> e.error.message())
                .collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        return entries().stream()
                .map(Entry::toString)
                .collect(Collectors.joining("\n"));
    }

    /**
     * An error and the number of similar errors recorded after it.
     */
    public static final class Entry {

        private final AnalysisError error;
        private int moreCount;

        private Entry(AnalysisError error) {
            this.error = error;
        }

        public AnalysisError getError() {
            return error;
        }

        public int getMoreCount() {
            return moreCount;
        }

        @Override
        public String toString() {
            String s = error.toString();
            if (moreCount > 0) {
                s += " (" + moreCount + " more similar errors)";
            }
            return s;
        }
    }
}
